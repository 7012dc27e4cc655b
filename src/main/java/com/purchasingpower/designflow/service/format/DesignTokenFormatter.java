package com.purchasingpower.designflow.service.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.designflow.model.tokens.DesignTokens;
import com.purchasingpower.designflow.model.tokens.DesignTokens.ShadowToken;
import com.purchasingpower.designflow.model.tokens.DesignTokens.TypographyToken;
import com.purchasingpower.designflow.model.tokens.TokenFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes {@link DesignTokens} as CSS custom properties, SCSS variables, JSON or a Tailwind
 * {@code theme.extend} block.
 */
@Component
@RequiredArgsConstructor
public class DesignTokenFormatter {

    private final ObjectMapper objectMapper;

    public String format(DesignTokens tokens, TokenFormat format) {
        return switch (format) {
            case CSS -> asCss(tokens);
            case SCSS -> asScss(tokens);
            case JSON -> asJson(tokens);
            case TAILWIND -> asTailwind(tokens);
        };
    }

    /**
     * Markdown document with token counts and the formatted tokens in a fenced block.
     */
    public String document(String fileName, DesignTokens tokens, TokenFormat format) {
        return "# Design Tokens: " + fileName + "\n\n"
                + "Extracted " + tokens.totalCount() + " tokens from Figma.\n\n"
                + "- Colors: " + tokens.getColors().size() + "\n"
                + "- Typography: " + tokens.getTypography().size() + "\n"
                + "- Shadows: " + tokens.getShadows().size() + "\n"
                + "- Border Radii: " + tokens.getRadii().size() + "\n"
                + "- Spacing: " + tokens.getSpacing().size() + "\n\n"
                + "```" + format.fenceLanguage() + "\n"
                + format(tokens, format) + "\n"
                + "```\n";
    }

    /**
     * Short CSS-only variant embedded in the design spec result.
     */
    public String cssSummary(String fileName, DesignTokens tokens) {
        return "# Design Tokens: " + fileName + "\n\n```css\n" + asCss(tokens) + "\n```\n";
    }

    private String asCss(DesignTokens tokens) {
        List<String> lines = new ArrayList<>();
        lines.add(":root {");
        variables(tokens, "  --", "  /* %s */").forEach(lines::add);
        lines.add("}");
        return String.join("\n", lines);
    }

    private String asScss(DesignTokens tokens) {
        List<String> lines = new ArrayList<>();
        lines.add("// Design Tokens extracted from Figma\n");
        lines.addAll(variables(tokens, "$", "// %s"));
        return String.join("\n", lines);
    }

    /**
     * Variable declarations grouped under a header comment, one blank line between groups.
     */
    private List<String> variables(DesignTokens tokens, String prefix, String headerFormat) {
        List<List<String>> groups = new ArrayList<>();

        if (!tokens.getColors().isEmpty()) {
            List<String> group = header(headerFormat, "Colors");
            tokens.getColors().forEach((name, token) -> group.add(prefix + "color-" + name + ": " + token.value() + ";"));
            groups.add(group);
        }
        if (!tokens.getTypography().isEmpty()) {
            List<String> group = header(headerFormat, "Typography");
            for (Map.Entry<String, TypographyToken> entry : tokens.getTypography().entrySet()) {
                String base = prefix + "font-" + entry.getKey();
                TypographyToken token = entry.getValue();
                group.add(base + "-family: " + token.fontFamily() + ";");
                group.add(base + "-size: " + token.fontSize() + ";");
                group.add(base + "-weight: " + token.fontWeight() + ";");
                group.add(base + "-line-height: " + token.lineHeight() + ";");
                group.add(base + "-letter-spacing: " + token.letterSpacing() + ";");
            }
            groups.add(group);
        }
        if (!tokens.getShadows().isEmpty()) {
            List<String> group = header(headerFormat, "Shadows");
            tokens.getShadows().forEach((name, token) -> group.add(prefix + "shadow-" + name + ": " + token.css() + ";"));
            groups.add(group);
        }
        if (!tokens.getRadii().isEmpty()) {
            List<String> group = header(headerFormat, "Border Radii");
            tokens.getRadii().forEach((name, value) -> group.add(prefix + "radius-" + name + ": " + value + ";"));
            groups.add(group);
        }
        if (!tokens.getSpacing().isEmpty()) {
            List<String> group = header(headerFormat, "Spacing");
            tokens.getSpacing().forEach((name, value) -> group.add(prefix + "spacing-" + name + ": " + value + ";"));
            groups.add(group);
        }

        List<String> lines = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            lines.addAll(groups.get(i));
            if (i < groups.size() - 1) {
                lines.add("");
            }
        }
        return lines;
    }

    private static List<String> header(String headerFormat, String title) {
        List<String> group = new ArrayList<>();
        group.add(String.format(headerFormat, title));
        return group;
    }

    private String asJson(DesignTokens tokens) {
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(tokens);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Design tokens could not be serialized", e);
        }
    }

    private String asTailwind(DesignTokens tokens) {
        Map<String, Map<String, String>> extend = new LinkedHashMap<>();
        if (!tokens.getColors().isEmpty()) {
            Map<String, String> colors = extend.computeIfAbsent("colors", key -> new LinkedHashMap<>());
            tokens.getColors().forEach((name, token) -> colors.put(name, token.value()));
        }
        if (!tokens.getTypography().isEmpty()) {
            Map<String, String> fontSize = extend.computeIfAbsent("fontSize", key -> new LinkedHashMap<>());
            Map<String, String> fontFamily = extend.computeIfAbsent("fontFamily", key -> new LinkedHashMap<>());
            tokens.getTypography().forEach((name, token) -> {
                fontSize.put(name, token.fontSize());
                fontFamily.put(name, token.fontFamily());
            });
        }
        if (!tokens.getRadii().isEmpty()) {
            extend.put("borderRadius", new LinkedHashMap<>(tokens.getRadii()));
        }
        if (!tokens.getSpacing().isEmpty()) {
            extend.put("spacing", new LinkedHashMap<>(tokens.getSpacing()));
        }
        if (!tokens.getShadows().isEmpty()) {
            Map<String, String> boxShadow = extend.computeIfAbsent("boxShadow", key -> new LinkedHashMap<>());
            for (Map.Entry<String, ShadowToken> entry : tokens.getShadows().entrySet()) {
                boxShadow.put(entry.getKey(), entry.getValue().css());
            }
        }

        List<String> lines = new ArrayList<>();
        lines.add("// tailwind.config.js");
        lines.add("module.exports = {");
        lines.add("  theme: {");
        lines.add("    extend: " + jsObject(extend));
        lines.add("  }");
        lines.add("}");
        return String.join("\n", lines);
    }

    private String jsObject(Map<String, Map<String, String>> extend) {
        if (extend.isEmpty()) {
            return "{}";
        }
        List<String> groups = new ArrayList<>();
        for (Map.Entry<String, Map<String, String>> group : extend.entrySet()) {
            List<String> entries = new ArrayList<>();
            group.getValue().forEach((key, value) -> entries.add("            " + quote(key) + ": " + quote(value)));
            groups.add("          " + quote(group.getKey()) + ": {\n" + String.join(",\n", entries) + "\n          }");
        }
        return "{\n" + String.join(",\n", groups) + "\n    }";
    }

    private String quote(String value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Token value could not be quoted: " + value, e);
        }
    }
}
