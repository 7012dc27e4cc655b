package com.purchasingpower.designflow.service.classification;

import com.purchasingpower.designflow.model.design.SequentialPattern;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.util.NodeTrees;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects numbered sequences among siblings ("Step 1", "Step 2" or "01 Plan", "02 Build").
 *
 * <p>Layer names are checked first, then the first text inside each sibling. Either way the
 * numbers must form a consecutive run once sorted.
 */
@Component
public class SequentialPatternDetector {

    private static final Pattern NAME_NUMBER = Pattern.compile("(\\d+)");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^[0\\s]*(\\d+)");
    private static final int TEXT_SEARCH_DEPTH = 3;
    private static final int LABEL_LENGTH = 40;

    public Optional<SequentialPattern> detect(List<DesignNode> siblings) {
        if (siblings.size() < 2) {
            return Optional.empty();
        }

        List<Numbered> byName = new ArrayList<>();
        for (DesignNode sibling : siblings) {
            Matcher matcher = NAME_NUMBER.matcher(sibling.displayName());
            if (matcher.find()) {
                parse(matcher.group(1)).ifPresent(number -> byName.add(new Numbered(number, sibling.displayName())));
            }
        }
        Optional<List<Numbered>> names = consecutive(byName);
        if (names.isPresent()) {
            List<Numbered> sorted = names.get();
            return Optional.of(new SequentialPattern("numbered-steps",
                    sorted.size() + " ordered items (" + sorted.get(0).number() + "–"
                            + sorted.get(sorted.size() - 1).number() + ")",
                    sorted.stream().map(Numbered::label).toList()));
        }

        List<Numbered> byText = new ArrayList<>();
        for (DesignNode sibling : siblings) {
            Optional<String> text = NodeTrees.firstText(sibling, TEXT_SEARCH_DEPTH);
            if (text.isEmpty()) {
                continue;
            }
            Matcher matcher = LEADING_NUMBER.matcher(text.get());
            if (matcher.find()) {
                String preview = text.get().substring(0, Math.min(LABEL_LENGTH, text.get().length())).replace('\n', ' ');
                parse(matcher.group(1)).ifPresent(number -> byText.add(new Numbered(number, preview)));
            }
        }
        return consecutive(byText).map(sorted -> new SequentialPattern("numbered-content",
                sorted.size() + " sequentially numbered content blocks",
                sorted.stream().map(Numbered::label).toList()));
    }

    private static Optional<List<Numbered>> consecutive(List<Numbered> items) {
        if (items.size() < 2) {
            return Optional.empty();
        }
        List<Numbered> sorted = items.stream().sorted(Comparator.comparingLong(Numbered::number)).toList();
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).number() != sorted.get(i - 1).number() + 1) {
                return Optional.empty();
            }
        }
        return Optional.of(sorted);
    }

    private static Optional<Long> parse(String digits) {
        try {
            return Optional.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            // more digits than a long holds, not a step number
            return Optional.empty();
        }
    }

    private record Numbered(long number, String label) {
    }
}
