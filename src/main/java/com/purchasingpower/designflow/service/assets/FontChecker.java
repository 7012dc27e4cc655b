package com.purchasingpower.designflow.service.assets;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.purchasingpower.designflow.model.design.FontCheckResult;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.model.figma.TypeStyle;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks the fonts of a design against the bundled Google Fonts catalog
 * ({@code fonts/google-fonts.yaml}) and suggests look-alikes for commercial fonts.
 */
@Slf4j
@Component
public class FontChecker {

    static final String CATALOG = "fonts/google-fonts.yaml";

    private static final Pattern WEIGHT_SUFFIX = Pattern.compile(
            "\\s*(Regular|Bold|Light|Medium|Thin|Black|Heavy|Book|Demi|Semi|SemiBold|ExtraBold|ExtraLight"
                    + "|UltraLight|Italic)\\s*",
            Pattern.CASE_INSENSITIVE);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private Set<String> googleFonts = Set.of();
    private Map<String, String> substitutions = Map.of();

    @PostConstruct
    public void loadCatalog() {
        try (InputStream in = new ClassPathResource(CATALOG).getInputStream()) {
            FontCatalog catalog = yamlMapper.readValue(in, FontCatalog.class);
            googleFonts = new HashSet<>(catalog.getFamilies());
            substitutions = new HashMap<>(catalog.getSubstitutions());
            log.info("Loaded font catalog: {} Google families, {} substitutions",
                    googleFonts.size(), substitutions.size());
        } catch (IOException e) {
            throw new IllegalStateException("Font catalog " + CATALOG + " could not be loaded", e);
        }
    }

    /**
     * Font families of TEXT styles and style overrides, in first-seen order.
     */
    public Set<String> collectFontFamilies(List<DesignNode> roots) {
        Set<String> families = new LinkedHashSet<>();
        roots.forEach(root -> walk(root, families));
        return families;
    }

    private void walk(DesignNode node, Set<String> families) {
        if (!node.isVisible()) {
            return;
        }
        if (node.getType() == NodeType.TEXT && node.getStyle() != null && node.getStyle().getFontFamily() != null) {
            families.add(node.getStyle().getFontFamily());
        }
        if (node.getStyleOverrideTable() != null) {
            for (TypeStyle override : node.getStyleOverrideTable().values()) {
                if (override != null && override.getFontFamily() != null) {
                    families.add(override.getFontFamily());
                }
            }
        }
        if (node.getChildren() != null) {
            node.getChildren().forEach(child -> walk(child, families));
        }
    }

    public List<FontCheckResult> check(Set<String> families) {
        List<FontCheckResult> results = new ArrayList<>();
        for (String family : families) {
            boolean google = googleFonts.contains(family);
            results.add(new FontCheckResult(family, google, google ? null : findSubstitution(family)));
        }
        return results;
    }

    /**
     * Original family to Google substitute, for every non-Google font that has one.
     */
    public static Map<String, String> substitutionMap(List<FontCheckResult> checks) {
        Map<String, String> map = new LinkedHashMap<>();
        for (FontCheckResult check : checks) {
            if (!check.googleFont() && check.suggestedAlternative() != null) {
                map.put(check.fontFamily(), check.suggestedAlternative());
            }
        }
        return map;
    }

    String findSubstitution(String family) {
        String direct = substitutions.get(family);
        if (direct != null) {
            return direct;
        }
        String normalized = WEIGHT_SUFFIX.matcher(family).replaceAll(" ").trim();
        if (!normalized.equals(family)) {
            return substitutions.get(normalized);
        }
        return null;
    }

    /**
     * "Font Substitutions" markdown table, empty when every font is a Google font.
     */
    public String substitutionMarkdown(List<FontCheckResult> checks) {
        List<FontCheckResult> nonGoogle = checks.stream().filter(check -> !check.googleFont()).toList();
        if (nonGoogle.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        lines.add("## Font Substitutions\n");
        lines.add("The following fonts from the Figma design are not available on Google Fonts and have been substituted:\n");
        lines.add("| Original Font | Substitute (Google Fonts) |");
        lines.add("|--------------|--------------------------|");
        for (FontCheckResult font : nonGoogle) {
            String substitute = font.suggestedAlternative() != null
                    ? font.suggestedAlternative()
                    : "*(pick a similar Google Font)*";
            lines.add("| " + font.fontFamily() + " | " + substitute + " |");
        }
        lines.add("\nUse the substitute fonts in your implementation. Import them via Google Fonts `<link>` tag.\n");
        return String.join("\n", lines);
    }

    @Data
    static class FontCatalog {
        private List<String> families = new ArrayList<>();
        private Map<String, String> substitutions = new LinkedHashMap<>();
    }
}
