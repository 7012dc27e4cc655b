package com.purchasingpower.designflow.service.format;

import com.purchasingpower.designflow.config.HeuristicsConfig;
import com.purchasingpower.designflow.model.design.ResolvedAssets;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.Effect;
import com.purchasingpower.designflow.model.figma.EffectType;
import com.purchasingpower.designflow.model.figma.ImageFilters;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.model.figma.Rgba;
import com.purchasingpower.designflow.model.figma.Vector2;
import com.purchasingpower.designflow.service.analysis.LayoutInferenceEngine;
import com.purchasingpower.designflow.service.analysis.PrimaryFrameSelector;
import com.purchasingpower.designflow.service.classification.ImageImportanceClassifier;
import com.purchasingpower.designflow.service.classification.SequentialPatternDetector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.purchasingpower.designflow.TestNodes.canvas;
import static com.purchasingpower.designflow.TestNodes.frame;
import static com.purchasingpower.designflow.TestNodes.group;
import static com.purchasingpower.designflow.TestNodes.image;
import static com.purchasingpower.designflow.TestNodes.rectangle;
import static com.purchasingpower.designflow.TestNodes.text;
import static com.purchasingpower.designflow.TestNodes.vector;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Design Spec Formatter Tests")
class DesignSpecFormatterTest {

    private final DesignSpecFormatter formatter = new DesignSpecFormatter(
            new PrimaryFrameSelector(),
            new LayoutInferenceEngine(HeuristicsConfig.defaults()),
            new ImageImportanceClassifier(),
            new SequentialPatternDetector());

    @Test
    @DisplayName("Should render pages, frames and texts as nested headings")
    void format_rendersHeadingsAndTypography() {
        // Given
        DesignNode page = canvas("0:1", "Home",
                frame("1:1", "Desktop", 0, 0, 1440, 900,
                        text("1:2", "Headline", "Build faster", 40, 40, 800, 72, 48, 700)));

        // When
        String spec = formatter.format(List.of(page), "Landing", ResolvedAssets.none());

        // Then
        assertThat(spec)
                .startsWith("# Design Specification: Landing\n")
                .contains("## Page: Home\n")
                .contains("### Desktop\n\n*Type: Frame*\n*Dimensions: 1440 x 900 px — Position: (0, 0)*")
                .contains("#### Headline")
                .contains("**Text content:**\n> Build faster")
                .contains("- Font: Inter\n- Size: 48px\n- Weight: 700\n- Line height: 72px");
    }

    @Test
    @DisplayName("Should produce identical output for identical input")
    void format_isDeterministic() {
        DesignNode page = canvas("0:1", "Home", heroWithComposite());
        ResolvedAssets assets = compositeAssets();

        assertThat(formatter.format(List.of(page), "Landing", assets))
                .isEqualTo(formatter.format(List.of(page), "Landing", assets));
    }

    @Test
    @DisplayName("Should show substitute fonts next to the original")
    void format_substitutesFonts() {
        ResolvedAssets assets = new ResolvedAssets(Map.of(), Map.of(), Map.of(), Set.of(), Map.of("Inter", "Roboto"));

        String spec = formatter.format(List.of(text("1:2", "Body", 0, 0, 100, 20)), "Landing", assets);

        assertThat(spec).contains("- Font: Roboto (original: Inter)");
    }

    @Test
    @DisplayName("Should replace a text-overlay composite with its image and keep only the text below it")
    void format_textOverlayComposite() {
        // When
        String spec = formatter.format(List.of(canvas("0:1", "Home", heroWithComposite())), "Landing",
                compositeAssets());

        // Then
        assertThat(spec)
                .contains("**Composite Background (visual layers only — text NOT included in this image):**")
                .contains("- Source: `/images/composite-hero-art.png` (1440x600)")
                .contains("- Implementation (HERO PARALLAX):")
                .contains("##### Welcome")
                .doesNotContain("Mountains");
    }

    @Test
    @DisplayName("Should point exported icons at their SVG files")
    void format_exportedIcon() {
        // Given
        ResolvedAssets assets = new ResolvedAssets(Map.of(), Map.of("2:5", "arrow.svg"), Map.of(), Set.of(), Map.of());

        // When
        String spec = formatter.format(List.of(vector("2:5", "Arrow", 0, 0, 24, 24)), "Landing", assets);

        // Then
        assertThat(spec).contains("**Icon (SVG):**\n- Source: `/images/icons/arrow.svg`\n- Element: \"Arrow\"");
    }

    @Test
    @DisplayName("Should stack text above visual layers in containers without auto-layout")
    void format_zIndexComments() {
        // Given
        DesignNode card = frame("1:1", "Card", 0, 0, 400, 300,
                rectangle("1:2", "Bg", 0, 0, 400, 300),
                text("1:3", "Title", 24, 24, 200, 32));

        // When
        String spec = formatter.format(List.of(card), "Landing", ResolvedAssets.none());

        // Then
        assertThat(spec)
                .contains("<!-- z-index: 0 (visual layer: back — behind text content) -->\n### Bg")
                .contains("<!-- z-index: 10 (text/content layer — MUST be above all visual layers: "
                        + "use position: relative; z-index: 10) -->\n### Title");
    }

    @Test
    @DisplayName("Should leave hidden layers out")
    void format_skipsHiddenLayers() {
        DesignNode hidden = text("1:3", "Secret", 0, 0, 100, 20).toBuilder().visible(false).build();

        String spec = formatter.format(List.of(frame("1:1", "Card", 0, 0, 400, 300, hidden)), "Landing",
                ResolvedAssets.none());

        assertThat(spec).doesNotContain("Secret");
    }

    @Test
    @DisplayName("Should render large image containers as hero backgrounds")
    void format_heroImage() {
        // Given
        DesignNode hero = image("1:1", "Hero Banner", "img-1", 0, 0, 1440, 600).toBuilder()
                .type(NodeType.FRAME)
                .children(new ArrayList<>(List.of(text("1:2", "Welcome", 40, 200, 600, 60))))
                .build();
        ResolvedAssets assets = new ResolvedAssets(Map.of("img-1", "https://cdn.example/img-1"),
                Map.of(), Map.of(), Set.of(), Map.of());

        // When
        String spec = formatter.format(List.of(hero), "Landing", assets);

        // Then
        assertThat(spec)
                .contains("**Image (Hero Background):**\n- Source: `/images/img-1.png` (1440x600)")
                .contains("- Scale mode: FILL → CSS: `background-size: cover; background-position: center`")
                .contains("min-height: 600px");
    }

    @Test
    @DisplayName("Should announce numbered sequences among children")
    void format_sequentialPattern() {
        DesignNode steps = frame("1:1", "How it works", 0, 0, 1200, 300,
                frame("1:2", "Step 1", 0, 0, 300, 300),
                frame("1:3", "Step 2", 400, 0, 300, 300),
                frame("1:4", "Step 3", 800, 0, 300, 300));

        String spec = formatter.format(List.of(steps), "Landing", ResolvedAssets.none());

        assertThat(spec)
                .contains("**Sequential Pattern Detected (numbered-steps):** 3 ordered items (1–3)")
                .contains("- Items: Step 1 → Step 2 → Step 3");
    }

    @Test
    @DisplayName("Should translate effects, crops and filters to CSS")
    void cssHelpers() {
        Effect shadow = Effect.builder()
                .type(EffectType.DROP_SHADOW)
                .offset(new Vector2(0, 4))
                .radius(12)
                .color(new Rgba(0, 0, 0, 0.5))
                .build();
        Effect backgroundBlur = Effect.builder().type(EffectType.BACKGROUND_BLUR).radius(8).build();

        assertThat(DesignSpecFormatter.effect(shadow)).isEqualTo("Drop shadow: 0px 4px 12px rgba(0, 0, 0, 0.50)");
        assertThat(DesignSpecFormatter.effect(backgroundBlur))
                .isEqualTo("Background blur: 8px → `backdrop-filter: blur(8px)`");
        assertThat(DesignSpecFormatter.cropPosition(List.of(List.of(0.5, 0.0, 0.5), List.of(0.0, 1.0, 0.0))))
                .isEqualTo("100% 50%");
        assertThat(DesignSpecFormatter.cropPosition(List.of(List.of(1.0, 0.0, 0.0), List.of(0.0, 1.0, 0.0))))
                .isNull();
        assertThat(DesignSpecFormatter.imageFilters(new ImageFilters(20.0, null, -50.0, null, null, null, null)))
                .isEqualTo("brightness(1.20) saturate(0.50)");
    }

    private static DesignNode heroWithComposite() {
        return frame("1:1", "Hero", 0, 0, 1440, 900,
                group("2:1", "Hero Art", 0, 0, 1440, 600,
                        rectangle("2:2", "Mountains", 0, 0, 1440, 600),
                        text("2:3", "Welcome", 40, 200, 600, 60)));
    }

    private static ResolvedAssets compositeAssets() {
        return new ResolvedAssets(Map.of(), Map.of(), Map.of("2:1", "/images/composite-hero-art.png"),
                Set.of("2:1"), Map.of());
    }
}
