package com.purchasingpower.designflow.service.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.designflow.model.content.ContentSection;
import com.purchasingpower.designflow.model.content.ExtractedContent;
import com.purchasingpower.designflow.model.content.ExtractedText;
import com.purchasingpower.designflow.model.content.PageContent;
import com.purchasingpower.designflow.model.content.SemanticRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@link ExtractedContent} as a markdown report with an embedded JSON content tree.
 */
@Component
@RequiredArgsConstructor
public class ContentFormatter {

    private static final int PREVIEW_LENGTH = 100;
    private static final Pattern WORD_BREAK = Pattern.compile("[^a-z0-9]+(.)");
    private static final List<String> SUMMARY_HEADINGS =
            List.of("## Navigation", "## Summary", "## Information Architecture");

    private final ObjectMapper objectMapper;

    public String toMarkdown(ExtractedContent content) {
        List<String> out = new ArrayList<>();
        out.add("# Extracted Content: " + content.fileName() + "\n");

        out.add("## Summary\n");
        out.add("- **Total Text Items:** " + content.stats().totalTextItems());
        out.add("- **Pages:** " + content.stats().totalPages());
        out.add("- **Sections:** " + content.stats().totalSections() + "\n");

        out.add("### Content by Role\n");
        for (Map.Entry<SemanticRole, Integer> entry : content.stats().roleBreakdown().entrySet()) {
            if (entry.getValue() > 0) {
                out.add("- **" + entry.getKey().label() + ":** " + entry.getValue());
            }
        }
        out.add("");

        List<String> primary = content.navigation().primary();
        List<String> footer = content.navigation().footer();
        if (!primary.isEmpty() || !footer.isEmpty()) {
            out.add("## Navigation\n");
            if (!primary.isEmpty()) {
                out.add("### Primary Navigation");
                primary.forEach(item -> out.add("- " + item));
                out.add("");
            }
            if (!footer.isEmpty()) {
                out.add("### Footer Navigation");
                footer.forEach(item -> out.add("- " + item));
                out.add("");
            }
        }

        out.add("## Content by Page\n");
        for (Map.Entry<String, PageContent> page : content.pages().entrySet()) {
            out.add("### " + page.getKey() + "\n");
            for (ContentSection section : page.getValue().sections()) {
                out.add(sectionMarkdown(section, 4));
            }
        }

        out.add("## Content Structure (JSON)\n");
        out.add("```json");
        out.add(toJson(content));
        out.add("```\n");
        return String.join("\n", out);
    }

    private static String sectionMarkdown(ContentSection section, int headingLevel) {
        List<String> lines = new ArrayList<>();
        lines.add("#".repeat(Math.min(headingLevel, 6)) + " " + section.name());
        if (section.semanticGroup() != null) {
            lines.add("*Semantic: " + section.semanticGroup() + "*\n");
        }
        if (!section.textItems().isEmpty()) {
            for (ExtractedText text : section.textItems()) {
                String preview = text.text().length() > PREVIEW_LENGTH
                        ? text.text().substring(0, PREVIEW_LENGTH) + "..."
                        : text.text();
                lines.add("- **[" + text.role().label() + "]** " + preview);
            }
            lines.add("");
        }
        for (ContentSection child : section.children()) {
            lines.add(sectionMarkdown(child, headingLevel + 1));
        }
        return String.join("\n", lines);
    }

    /**
     * Pages keyed by camelCase name, each section collapsed to the simplest JSON shape that holds
     * its texts, plus the global navigation.
     */
    public String toJson(ExtractedContent content) {
        Map<String, Object> pages = new LinkedHashMap<>();
        for (Map.Entry<String, PageContent> page : content.pages().entrySet()) {
            Map<String, Object> pageData = new LinkedHashMap<>();
            for (ContentSection section : page.getValue().sections()) {
                pageData.put(toCamelCase(section.name()), sectionJson(section));
            }
            pages.put(toCamelCase(page.getKey()), pageData);
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("pages", pages);
        root.put("navigation", content.navigation());
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Content tree could not be serialized", e);
        }
    }

    @SuppressWarnings("unchecked")
    static Object sectionJson(ContentSection section) {
        List<ExtractedText> texts = section.textItems();
        if (texts.size() > 1 && section.children().isEmpty()) {
            boolean singleRole = texts.stream().map(ExtractedText::role).distinct().count() == 1;
            if (singleRole) {
                return texts.stream().map(ExtractedText::text).toList();
            }
            return texts.stream().map(text -> Map.of(text.role().label(), text.text())).toList();
        }

        Map<String, Object> result = new LinkedHashMap<>();
        for (ExtractedText text : texts) {
            String key = toCamelCase(text.nodeName());
            result.put(key.isEmpty() ? text.role().label() : key, text.text());
        }
        for (ContentSection child : section.children()) {
            String key = toCamelCase(child.name());
            Object childData = sectionJson(child);
            Object existing = result.get(key);
            if (existing instanceof Map && childData instanceof Map) {
                Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) existing);
                merged.putAll((Map<String, Object>) childData);
                result.put(key, merged);
            } else {
                result.put(key, childData);
            }
        }
        return result;
    }

    static String toCamelCase(String value) {
        Matcher matcher = WORD_BREAK.matcher(value.toLowerCase(Locale.ROOT));
        String joined = matcher.replaceAll(match -> Matcher.quoteReplacement(match.group(1).toUpperCase(Locale.ROOT)));
        if (!joined.isEmpty()) {
            joined = joined.substring(0, 1).toLowerCase(Locale.ROOT) + joined.substring(1);
        }
        return joined.replaceAll("[^a-zA-Z0-9]", "");
    }

    /**
     * Keeps only the Summary, Navigation and Information Architecture parts of a content report,
     * the compact form embedded next to a design spec. Empty when none of them is present.
     */
    public String compactSummary(String markdown) {
        List<String> kept = new ArrayList<>();
        boolean inSection = false;
        for (String line : markdown.split("\n", -1)) {
            if (SUMMARY_HEADINGS.stream().anyMatch(line::startsWith)) {
                inSection = true;
                kept.add(line);
            } else if (line.startsWith("## ") && inSection) {
                inSection = false;
            } else if (inSection) {
                kept.add(line);
            }
        }
        return String.join("\n", kept);
    }
}
