package com.purchasingpower.designflow.service.format;

import com.purchasingpower.designflow.model.design.NotableComponent;
import com.purchasingpower.designflow.model.design.SectionSummary;
import com.purchasingpower.designflow.model.design.SectionSummary.CompositeImage;
import com.purchasingpower.designflow.model.design.SectionSummary.Dimensions;
import com.purchasingpower.designflow.model.design.SectionSummary.SectionImage;
import com.purchasingpower.designflow.model.design.SectionSummary.SectionLayout;
import com.purchasingpower.designflow.model.design.SectionSummary.TypographyUsage;
import com.purchasingpower.designflow.service.classification.ImageImportanceClassifier;
import com.purchasingpower.designflow.service.format.ImplementationPlanFormatter.PlanOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Implementation Plan Formatter Tests")
class ImplementationPlanFormatterTest {

    private ImplementationPlanFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new ImplementationPlanFormatter(new ImageImportanceClassifier());
        formatter.loadTemplate();
    }

    @Test
    @DisplayName("Should open with the setup task listing stack, fonts and downloaded assets")
    void render_setupTask() {
        // Given
        PlanOptions options = PlanOptions.builder()
                .fileName("Landing")
                .projectStack("Next.js + Tailwind")
                .hasDesignTokens(true)
                .fontNames(List.of("Inter", "Montserrat"))
                .imagesDownloaded(true)
                .iconCount(2)
                .build();

        // When
        String plan = formatter.render(List.of(teamSection()), options);

        // Then
        assertThat(plan)
                .startsWith("# Implementation Plan")
                .contains("*Auto-generated from Figma design: \"Landing\"*")
                .contains("## Universal Stacking & Layout Rules")
                .contains("### Task 1: Project setup and design tokens")
                .contains("- [ ] Verify Next.js + Tailwind project structure")
                .contains("- [ ] Configure design tokens in @theme (colors, fonts, spacing from spec)")
                .contains("- [ ] Import Google Fonts: Inter, Montserrat")
                .contains("- [ ] Verify downloaded assets: 1 image(s) in public/images/, 2 icon(s) in public/images/icons/");
    }

    @Test
    @DisplayName("Should turn a section summary into a checklist")
    void render_sectionTask() {
        // When
        String plan = formatter.render(List.of(teamSection()), PlanOptions.builder().fileName("Landing").build());

        // Then
        assertThat(plan)
                .contains("- [ ] Initialize project structure")
                .contains("### Task 2: Implement Team (1440 x 900px)")
                .contains("- [ ] Build layout: flex vertical, gap 24px, padding 40px 40px 40px 40px, main-axis center")
                .contains("- [ ] Background: #ffffff")
                .contains("- [ ] Add image: /images/team-photo.png (600x400, aspect-ratio: 1.50), fill")
                .contains("  * **CRITICAL**: Person image")
                .contains("- [ ] Add indicator \"Dots\"")
                .contains("  * Position: `left: 50%; transform: translateX(-50%); bottom: 32px`")
                .contains("- [ ] Headline: Inter 48px /72px weight 700 color #111111")
                .contains("- [ ] Add responsive breakpoints — ensure person images remain visible at all sizes")
                .contains("### Task 3: Polish and verification")
                .doesNotContain("Layout Pattern");
    }

    @Test
    @DisplayName("Should stack two or more full-width images as layers")
    void render_layeredImages() {
        // Given
        SectionSummary section = SectionSummary.builder()
                .name("Hero")
                .dimensions(new Dimensions(1440, 800))
                .images(List.of(
                        new SectionImage("/images/sky.png", "FILL", false, "1440x800"),
                        new SectionImage("/images/hills.png", "FIT", false, "1440x400")))
                .build();

        // When
        String plan = formatter.render(List.of(section), PlanOptions.builder().fileName("Landing").build());

        // Then
        assertThat(plan)
                .contains("- [ ] Layer 2 overlapping images to create depth/parallax effect")
                .contains("  * /images/hills.png (1440x400) (aspect-ratio: 3.60), fit")
                .doesNotContain("Add image:");
    }

    @Test
    @DisplayName("Should describe text-overlay composites as a parallax background")
    void render_compositeWithTextOverlay() {
        SectionSummary section = SectionSummary.builder()
                .name("Hero")
                .dimensions(new Dimensions(1440, 800))
                .compositeImage(new CompositeImage("/images/composite-hero.png", "1440x800", true))
                .build();

        String plan = formatter.render(List.of(section), PlanOptions.builder().fileName("Landing").build());

        assertThat(plan)
                .contains("- [ ] Add parallax hero background: /images/composite-hero.png (1440x800), full-bleed cover, "
                        + "min-height 800px")
                .contains("(text is NOT in the composite image)");
    }

    @Test
    @DisplayName("Should suggest alternating placement and a cross-section polish task for several image sections")
    void render_multipleSections() {
        List<SectionSummary> sections = List.of(teamSection(), teamSection(), teamSection());

        String plan = formatter.render(sections, PlanOptions.builder().fileName("Landing").build());

        assertThat(plan)
                .contains("**Layout Pattern:**")
                .contains("### Task 5: Polish and cross-section integration");
    }

    @Test
    @DisplayName("Should omit the polish task when there is nothing to implement")
    void render_noSections() {
        String plan = formatter.render(List.of(), PlanOptions.builder().fileName("Landing").build());

        assertThat(plan).contains("### Task 1: Project setup").doesNotContain("### Task 2");
    }

    @Test
    @DisplayName("Should format layout and typography hints")
    void helpers() {
        assertThat(ImplementationPlanFormatter.aspectRatio("1440x600")).isEqualTo("2.40");
        assertThat(ImplementationPlanFormatter.aspectRatio("bogus")).isNull();
        assertThat(ImplementationPlanFormatter.layout(
                new SectionLayout("horizontal", null, 16.0, null, null, "center", true)))
                .isEqualTo("flex horizontal, row-gap 16px, flex-wrap, cross-axis center");
        assertThat(ImplementationPlanFormatter.typography(
                new TypographyUsage("Roboto", 14, 400, null, null, "Caption")))
                .isEqualTo("Caption: Roboto 14px weight 400");
    }

    private static SectionSummary teamSection() {
        return SectionSummary.builder()
                .nodeId("1:1")
                .name("Team")
                .dimensions(new Dimensions(1440, 900))
                .layout(new SectionLayout("vertical", 24.0, null, "40px 40px 40px 40px", "center", null, false))
                .background("#ffffff")
                .images(List.of(new SectionImage("/images/team-photo.png", "FILL", false, "600x400")))
                .typography(List.of(new TypographyUsage("Inter", 48, 700, 72L, "#111111", "Headline")))
                .notableComponents(List.of(new NotableComponent("Dots", NotableComponent.Category.INDICATOR,
                        700, 860, 40, 8, List.of(), false,
                        "left: 50%; transform: translateX(-50%); bottom: 32px", null)))
                .childCount(3)
                .build();
    }
}
