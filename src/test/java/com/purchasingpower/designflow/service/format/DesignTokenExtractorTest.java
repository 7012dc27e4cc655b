package com.purchasingpower.designflow.service.format;

import com.purchasingpower.designflow.model.figma.DesignFile;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.Effect;
import com.purchasingpower.designflow.model.figma.EffectType;
import com.purchasingpower.designflow.model.figma.LayoutMode;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.model.figma.Rgba;
import com.purchasingpower.designflow.model.figma.StyleMetadata;
import com.purchasingpower.designflow.model.figma.Vector2;
import com.purchasingpower.designflow.model.tokens.DesignTokens;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.designflow.TestNodes.canvas;
import static com.purchasingpower.designflow.TestNodes.frame;
import static com.purchasingpower.designflow.TestNodes.rectangle;
import static com.purchasingpower.designflow.TestNodes.solid;
import static com.purchasingpower.designflow.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Design Token Extractor Tests")
class DesignTokenExtractorTest {

    private final DesignTokenExtractor extractor = new DesignTokenExtractor();

    @Test
    @DisplayName("Should resolve published styles through the nodes that use them")
    void extract_publishedStyles() {
        // When
        DesignTokens tokens = extractor.extract(sampleFile());

        // Then
        assertThat(tokens.getColors()).containsOnlyKeys("brand-primary");
        assertThat(tokens.getColors().get("brand-primary").value()).isEqualTo("#ff0000");
        assertThat(tokens.getTypography().get("heading-h1"))
                .isEqualTo(new DesignTokens.TypographyToken("Inter", "48px", 700, "72px", "0"));
        assertThat(tokens.getShadows().get("elevation-card-default").css())
                .isEqualTo("0px 4px 8px 0px rgba(0, 0, 0, 0.25)");
    }

    @Test
    @DisplayName("Should pick up radii and auto-layout spacing from the tree")
    void extract_treeTokens() {
        DesignTokens tokens = extractor.extract(sampleFile());

        assertThat(tokens.getRadii()).containsExactly(Map.entry("card", "8px"));
        assertThat(tokens.getSpacing()).containsExactly(Map.entry("button-row", "16px"));
        assertThat(tokens.totalCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should ignore hidden layers when collecting tree tokens and resolving styles")
    void extract_skipsHiddenLayers() {
        // Given
        DesignNode hiddenCard = rectangle("3:1", "Hidden Card", 0, 0, 200, 120).toBuilder()
                .visible(false)
                .cornerRadius(12.0)
                .fills(new ArrayList<>(List.of(solid(0, 1, 0))))
                .styles(Map.of("fill", "S:accent"))
                .build();
        DesignNode hiddenRow = frame("3:2", "Hidden Row", 0, 140, 320, 48).toBuilder()
                .visible(false)
                .layoutMode(LayoutMode.HORIZONTAL)
                .itemSpacing(24.0)
                .build();
        DesignNode roundedInsideHidden = rectangle("3:4", "Pill", 0, 220, 80, 32).toBuilder()
                .cornerRadius(16.0)
                .build();
        DesignNode hiddenGroup = frame("3:3", "Drafts", 0, 200, 320, 80, roundedInsideHidden).toBuilder()
                .visible(false)
                .build();
        DesignNode chip = rectangle("3:5", "Accent Chip", 0, 300, 40, 40).toBuilder()
                .fills(new ArrayList<>(List.of(solid(0, 0, 1))))
                .styles(Map.of("fill", "S:accent"))
                .build();
        DesignFile file = DesignFile.builder()
                .name("Hidden")
                .document(DesignNode.builder()
                        .id("0:0")
                        .name("Document")
                        .type(NodeType.DOCUMENT)
                        .children(new ArrayList<>(List.of(
                                canvas("0:1", "Page 1", hiddenCard, hiddenRow, hiddenGroup, chip))))
                        .build())
                .styles(Map.of("S:accent", new StyleMetadata("k4", "Brand/Accent", "FILL", null)))
                .build();

        // When
        DesignTokens tokens = extractor.extract(file);

        // Then
        assertThat(tokens.getRadii()).isEmpty();
        assertThat(tokens.getSpacing()).isEmpty();
        assertThat(tokens.getColors()).containsOnlyKeys("brand-accent");
        assertThat(tokens.getColors().get("brand-accent").value()).isEqualTo("#0000ff");
    }

    @Test
    @DisplayName("Should convert layer names to kebab-case token names")
    void tokenName_kebabCase() {
        assertThat(DesignTokenExtractor.tokenName("Brand/Primary Blue")).isEqualTo("brand-primary-blue");
        assertThat(DesignTokenExtractor.tokenName("textMuted_2")).isEqualTo("text-muted-2");
        assertThat(DesignTokenExtractor.tokenName("Card (hover)")).isEqualTo("card-hover");
    }

    @Test
    @DisplayName("Should use the paint opacity as the alpha of a color token")
    void colorToken_withOpacity_isRgba() {
        DesignTokens.ColorToken token = DesignTokenExtractor.colorToken(new Rgba(0, 0, 1, 1.0), 0.5);

        assertThat(token.value()).isEqualTo("rgba(0, 0, 255, 0.50)");
        assertThat(token.hex()).isEqualTo("#0000ff");
    }

    static DesignFile sampleFile() {
        DesignNode swatch = rectangle("2:1", "Swatch", 0, 0, 40, 40).toBuilder()
                .fills(new ArrayList<>(List.of(solid(1, 0, 0))))
                .styles(Map.of("fill", "S:fill"))
                .build();
        DesignNode headline = text("2:2", "Headline", "Ship it", 0, 60, 400, 72, 48, 700).toBuilder()
                .styles(Map.of("text", "S:text"))
                .build();
        DesignNode card = frame("2:3", "Card", 0, 200, 320, 200).toBuilder()
                .cornerRadius(8.0)
                .effects(new ArrayList<>(List.of(Effect.builder()
                        .type(EffectType.DROP_SHADOW)
                        .color(new Rgba(0, 0, 0, 0.25))
                        .offset(new Vector2(0, 4))
                        .radius(8)
                        .build())))
                .styles(Map.of("effect", "S:effect"))
                .build();
        DesignNode row = frame("2:4", "ButtonRow", 0, 420, 320, 48).toBuilder()
                .type(NodeType.FRAME)
                .layoutMode(LayoutMode.HORIZONTAL)
                .itemSpacing(16.0)
                .build();

        return DesignFile.builder()
                .name("Tokens")
                .document(DesignNode.builder()
                        .id("0:0")
                        .name("Document")
                        .type(NodeType.DOCUMENT)
                        .children(new ArrayList<>(List.of(canvas("0:1", "Page 1", swatch, headline, card, row))))
                        .build())
                .styles(Map.of(
                        "S:fill", new StyleMetadata("k1", "Brand/Primary", "FILL", null),
                        "S:text", new StyleMetadata("k2", "Heading/H1", "TEXT", null),
                        "S:effect", new StyleMetadata("k3", "Elevation/Card", "EFFECT", null)))
                .build();
    }
}
