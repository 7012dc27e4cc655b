package com.purchasingpower.designflow.service.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.designflow.model.figma.DesignFile;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.model.figma.Paint;
import com.purchasingpower.designflow.model.figma.PaintType;
import com.purchasingpower.designflow.model.figma.Rgba;
import com.purchasingpower.designflow.model.figma.StyleMetadata;
import com.purchasingpower.designflow.model.tokens.DesignTokens;
import com.purchasingpower.designflow.util.CssValues;
import com.purchasingpower.designflow.model.tokens.TokenFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.purchasingpower.designflow.TestNodes.canvas;
import static com.purchasingpower.designflow.TestNodes.rectangle;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Design Token Formatter Tests")
class DesignTokenFormatterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DesignTokenFormatter formatter = new DesignTokenFormatter(objectMapper);

    private DesignTokens tokens;

    @BeforeEach
    void setUp() {
        tokens = new DesignTokenExtractor().extract(DesignTokenExtractorTest.sampleFile());
    }

    @Test
    @DisplayName("Should emit CSS custom properties grouped by kind")
    void format_css() {
        String css = formatter.format(tokens, TokenFormat.CSS);

        assertThat(css)
                .startsWith(":root {\n  /* Colors */\n  --color-brand-primary: #ff0000;\n\n  /* Typography */")
                .contains("  --font-heading-h1-size: 48px;")
                .contains("  --shadow-elevation-card-default: 0px 4px 8px 0px rgba(0, 0, 0, 0.25);")
                .contains("  --radius-card: 8px;")
                .endsWith("  --spacing-button-row: 16px;\n}");
    }

    @Test
    @DisplayName("Should emit color properties that parse back to the source channels and alpha")
    void format_css_colorsParseBack() {
        // Given
        Map<String, Rgba> expected = new LinkedHashMap<>();
        expected.put("palette-opaque", new Rgba(0.2, 0.4, 0.6, 1.0));
        expected.put("palette-translucent", new Rgba(0.1, 0.5, 0.9, 0.35));
        expected.put("palette-faded", new Rgba(1, 0.5, 0, 0.6));
        DesignFile file = paletteFile(
                swatch("4:1", "S:opaque", Paint.builder().type(PaintType.SOLID).color(new Rgba(0.2, 0.4, 0.6, 1.0)).build()),
                swatch("4:2", "S:translucent", Paint.builder().type(PaintType.SOLID).color(new Rgba(0.1, 0.5, 0.9, 0.35)).build()),
                swatch("4:3", "S:faded", Paint.builder().type(PaintType.SOLID).color(new Rgba(1, 0.5, 0, 1.0)).opacity(0.6).build()));

        // When
        String css = formatter.format(new DesignTokenExtractor().extract(file), TokenFormat.CSS);

        // Then
        Matcher property = Pattern.compile(
                "--color-([\\w-]+): (?:#([0-9a-f]{2})([0-9a-f]{2})([0-9a-f]{2})|rgba\\((\\d+), (\\d+), (\\d+), ([\\d.]+)\\));")
                .matcher(css);
        Map<String, String> parsed = new LinkedHashMap<>();
        while (property.find()) {
            String name = property.group(1);
            Rgba source = expected.get(name);
            boolean hex = property.group(2) != null;
            int r = hex ? Integer.parseInt(property.group(2), 16) : Integer.parseInt(property.group(5));
            int g = hex ? Integer.parseInt(property.group(3), 16) : Integer.parseInt(property.group(6));
            int b = hex ? Integer.parseInt(property.group(4), 16) : Integer.parseInt(property.group(7));

            assertThat(r).as(name + " red").isEqualTo((int) Math.round(source.r() * 255));
            assertThat(g).as(name + " green").isEqualTo((int) Math.round(source.g() * 255));
            assertThat(b).as(name + " blue").isEqualTo((int) Math.round(source.b() * 255));
            if (hex) {
                assertThat(source.alpha()).as(name + " alpha").isEqualTo(1.0);
            } else {
                assertThat(property.group(8)).as(name + " alpha").isEqualTo(CssValues.fixed2(source.alpha()));
            }
            parsed.put(name, property.group(0));
        }
        assertThat(parsed).containsOnlyKeys(expected.keySet());
        assertThat(parsed.get("palette-faded")).isEqualTo("--color-palette-faded: rgba(255, 128, 0, 0.60);");
    }

    @Test
    @DisplayName("Should emit SCSS variables")
    void format_scss() {
        assertThat(formatter.format(tokens, TokenFormat.SCSS))
                .startsWith("// Design Tokens extracted from Figma\n")
                .contains("// Colors\n$color-brand-primary: #ff0000;");
    }

    @Test
    @DisplayName("Should emit JSON that parses back to the token groups")
    void format_json() throws Exception {
        String json = formatter.format(tokens, TokenFormat.JSON);

        assertThat(objectMapper.readTree(json).path("colors").path("brand-primary").path("hex").asText())
                .isEqualTo("#ff0000");
        assertThat(objectMapper.readTree(json).path("shadows").path("elevation-card-default").path("type").asText())
                .isEqualTo("drop");
    }

    @Test
    @DisplayName("Should emit a Tailwind theme extension")
    void format_tailwind() {
        assertThat(formatter.format(tokens, TokenFormat.TAILWIND))
                .startsWith("// tailwind.config.js\nmodule.exports = {")
                .contains("\"colors\": {\n            \"brand-primary\": \"#ff0000\"")
                .contains("\"borderRadius\"")
                .contains("\"boxShadow\"");
    }

    @Test
    @DisplayName("Should wrap tokens in a markdown document with counts")
    void document_includesCounts() {
        assertThat(formatter.document("Landing", tokens, TokenFormat.SCSS))
                .startsWith("# Design Tokens: Landing\n\nExtracted 5 tokens from Figma.")
                .contains("- Colors: 1\n")
                .contains("```" + TokenFormat.SCSS.fenceLanguage() + "\n");
    }

    private static DesignNode swatch(String id, String styleId, Paint fill) {
        return rectangle(id, "Swatch " + id, 0, 0, 40, 40).toBuilder()
                .fills(new ArrayList<>(List.of(fill)))
                .styles(Map.of("fill", styleId))
                .build();
    }

    private static DesignFile paletteFile(DesignNode... swatches) {
        return DesignFile.builder()
                .name("Palette")
                .document(DesignNode.builder()
                        .id("0:0")
                        .name("Document")
                        .type(NodeType.DOCUMENT)
                        .children(new ArrayList<>(List.of(canvas("0:1", "Colors", swatches))))
                        .build())
                .styles(Map.of(
                        "S:opaque", new StyleMetadata("k1", "Palette/Opaque", "FILL", null),
                        "S:translucent", new StyleMetadata("k2", "Palette/Translucent", "FILL", null),
                        "S:faded", new StyleMetadata("k3", "Palette/Faded", "FILL", null)))
                .build();
    }
}
