package com.purchasingpower.designflow.service.analysis;

import com.purchasingpower.designflow.config.HeuristicsConfig;
import com.purchasingpower.designflow.model.design.NotableComponent;
import com.purchasingpower.designflow.model.design.NotableComponent.Category;
import com.purchasingpower.designflow.model.figma.BoundingBox;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.util.CssValues;
import com.purchasingpower.designflow.util.NodeTrees;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Flags the regions of a section that an implementer tends to get wrong: indicators, sidebars,
 * navigation bars, footers, decorative layers, and anything floating over its siblings.
 *
 * <p>Only direct children and grandchildren of the section are considered.
 */
@Component
@RequiredArgsConstructor
public class NotableComponentDetector {

    static final int MAX_COMPONENTS = 8;
    static final int MAX_TEXTS = 5;
    private static final double CENTER_TOLERANCE_PX = 2;

    private static final Map<Category, Pattern> NAME_PATTERNS = new LinkedHashMap<>();

    static {
        NAME_PATTERNS.put(Category.INDICATOR,
                Pattern.compile("\\b(indicators?|dots?|pagination|pager|progress|badge|stepper)\\b"));
        NAME_PATTERNS.put(Category.SIDEBAR,
                Pattern.compile("\\b(sidebar|side[ -]?bar|aside|drawer|side[ -]?panel)\\b"));
        NAME_PATTERNS.put(Category.NAV,
                Pattern.compile("\\b(nav|navbar|navigation|menu|tabs?|breadcrumbs?)\\b"));
        NAME_PATTERNS.put(Category.FOOTER, Pattern.compile("\\bfooter\\b"));
        NAME_PATTERNS.put(Category.DECORATIVE,
                Pattern.compile("\\b(decor\\w*|ornament|blob|divider|pattern|shape|bg)\\b"));
    }

    private final HeuristicsConfig heuristics;

    public List<NotableComponent> detect(DesignNode section) {
        BoundingBox sectionBox = section.getAbsoluteBoundingBox();
        if (sectionBox == null) {
            return List.of();
        }
        List<NotableComponent> found = new ArrayList<>();
        List<DesignNode> children = section.visibleChildren();
        for (DesignNode child : children) {
            inspect(child, children, sectionBox).ifPresent(found::add);
            if (found.size() >= MAX_COMPONENTS) {
                return found;
            }
            if (child.getType() != null && child.getType().isContainer()) {
                List<DesignNode> grandchildren = child.visibleChildren();
                for (DesignNode grandchild : grandchildren) {
                    inspect(grandchild, grandchildren, sectionBox).ifPresent(found::add);
                    if (found.size() >= MAX_COMPONENTS) {
                        return found;
                    }
                }
            }
        }
        return found;
    }

    private Optional<NotableComponent> inspect(DesignNode node, List<DesignNode> siblings, BoundingBox sectionBox) {
        BoundingBox box = node.getAbsoluteBoundingBox();
        if (box == null || node.getType() == NodeType.TEXT) {
            return Optional.empty();
        }
        boolean overlapping = overlapsSibling(node, siblings);
        String scrollBehavior = scrollBehavior(node);
        Optional<Category> byName = categoryByName(node.displayName());
        boolean floating = "ABSOLUTE".equals(node.getLayoutPositioning()) || scrollBehavior != null || overlapping;
        if (byName.isEmpty() && !floating) {
            return Optional.empty();
        }
        return Optional.of(new NotableComponent(
                node.displayName(),
                byName.orElse(Category.OTHER),
                Math.round(box.x() - sectionBox.x()),
                Math.round(box.y() - sectionBox.y()),
                Math.round(box.width()),
                Math.round(box.height()),
                NodeTrees.texts(node, MAX_TEXTS),
                overlapping,
                positionHint(box, sectionBox),
                scrollBehavior));
    }

    Optional<Category> categoryByName(String name) {
        String lower = name.toLowerCase(Locale.ROOT).replace('_', ' ');
        return NAME_PATTERNS.entrySet().stream()
                .filter(entry -> entry.getValue().matcher(lower).find())
                .map(Map.Entry::getKey)
                .findFirst();
    }

    private boolean overlapsSibling(DesignNode node, List<DesignNode> siblings) {
        BoundingBox box = node.getAbsoluteBoundingBox();
        for (DesignNode sibling : siblings) {
            if (sibling == node || sibling.getAbsoluteBoundingBox() == null) {
                continue;
            }
            if (box.overlapRatio(sibling.getAbsoluteBoundingBox()) > heuristics.getOverlapThreshold()) {
                return true;
            }
        }
        return false;
    }

    private static String scrollBehavior(DesignNode node) {
        if ("FIXED".equals(node.getScrollBehavior())) {
            return "fixed";
        }
        if ("STICKY_SCROLLS".equals(node.getScrollBehavior())) {
            return "sticky";
        }
        return null;
    }

    /**
     * CSS offsets from the nearest horizontal and vertical section edges.
     */
    static String positionHint(BoundingBox box, BoundingBox sectionBox) {
        double left = box.x() - sectionBox.x();
        double right = sectionBox.right() - box.right();
        double top = box.y() - sectionBox.y();
        double bottom = sectionBox.bottom() - box.bottom();

        String horizontal;
        if (Math.abs(left - right) <= CENTER_TOLERANCE_PX && left > 0) {
            horizontal = "left: 50%; transform: translateX(-50%)";
        } else if (right < left) {
            horizontal = "right: " + CssValues.px(Math.round(right));
        } else {
            horizontal = "left: " + CssValues.px(Math.round(left));
        }
        String vertical = bottom < top
                ? "bottom: " + CssValues.px(Math.round(bottom))
                : "top: " + CssValues.px(Math.round(top));
        return horizontal + "; " + vertical;
    }
}
