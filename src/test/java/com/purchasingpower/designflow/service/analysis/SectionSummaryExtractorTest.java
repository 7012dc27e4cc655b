package com.purchasingpower.designflow.service.analysis;

import com.purchasingpower.designflow.config.HeuristicsConfig;
import com.purchasingpower.designflow.model.design.ResolvedAssets;
import com.purchasingpower.designflow.model.design.SectionSummary;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.LayoutMode;
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
import static com.purchasingpower.designflow.TestNodes.solid;
import static com.purchasingpower.designflow.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Section Summary Extractor Tests")
class SectionSummaryExtractorTest {

    private final SectionSummaryExtractor extractor = new SectionSummaryExtractor(
            new PrimaryFrameSelector(), new NotableComponentDetector(HeuristicsConfig.defaults()));

    @Test
    @DisplayName("Should summarise only the primary frame of a page")
    void extract_usesPrimaryFrame() {
        // Given
        DesignNode page = canvas("0:1", "Page 1", desktop(), frame("9:1", "Mobile", 1600, 0, 375, 800));

        // When
        List<SectionSummary> sections = extractor.extract(List.of(page), ResolvedAssets.none());

        // Then
        assertThat(sections).singleElement().satisfies(section -> {
            assertThat(section.getName()).isEqualTo("Desktop");
            assertThat(section.getDimensions()).isEqualTo(new SectionSummary.Dimensions(1440, 900));
            assertThat(section.getChildCount()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("Should describe layout, background, border and overflow")
    void summarize_styles() {
        SectionSummary section = extractor.summarize(desktop(), ResolvedAssets.none());

        assertThat(section.getLayout()).isEqualTo(
                new SectionSummary.SectionLayout("vertical", 24.0, null, "40px 40px 40px 40px", "center", null, false));
        assertThat(section.getBackground()).isEqualTo("#ffffff");
        assertThat(section.getBorder()).isEqualTo("2px solid #000000");
        assertThat(section.getOverflow()).isEqualTo("hidden");
    }

    @Test
    @DisplayName("Should point images at downloads when resolved and at placeholders otherwise")
    void summarize_images() {
        // Given
        ResolvedAssets downloaded = new ResolvedAssets(Map.of("img-1", "https://cdn.example/img-1"),
                Map.of(), Map.of(), Set.of(), Map.of());

        // When / Then
        assertThat(extractor.summarize(desktop(), downloaded).getImages())
                .containsExactly(new SectionSummary.SectionImage("/images/img-1.png", "FILL", false, "1440x600"));
        assertThat(extractor.summarize(desktop(), ResolvedAssets.none()).getImages())
                .extracting(SectionSummary.SectionImage::path)
                .containsExactly("placehold.co/1440x600");
    }

    @Test
    @DisplayName("Should list typography largest first with substituted fonts")
    void summarize_typography() {
        ResolvedAssets assets = new ResolvedAssets(Map.of(), Map.of(), Map.of(), Set.of(), Map.of("Inter", "Roboto"));

        List<SectionSummary.TypographyUsage> typography = extractor.summarize(desktop(), assets).getTypography();

        assertThat(typography).extracting(SectionSummary.TypographyUsage::size).containsExactly(48.0, 16.0);
        assertThat(typography.get(0).font()).isEqualTo("Roboto");
        assertThat(typography.get(0).usage()).isEqualTo("Headline");
        assertThat(typography.get(0).lineHeight()).isEqualTo(72L);
    }

    @Test
    @DisplayName("Should pick up a composite rendered for a direct child")
    void summarize_compositeChild() {
        // Given
        DesignNode section = frame("1:1", "Hero", 0, 0, 1440, 800,
                group("2:1", "Hero Art", 0, 0, 1440, 600));
        ResolvedAssets assets = new ResolvedAssets(Map.of(), Map.of(),
                Map.of("2:1", "/images/composite-hero-art.png"), Set.of("2:1"), Map.of());

        // When / Then
        assertThat(extractor.summarize(section, assets).getCompositeImage())
                .isEqualTo(new SectionSummary.CompositeImage("/images/composite-hero-art.png", "1440x600", true));
    }

    private static DesignNode desktop() {
        return frame("1:1", "Desktop", 0, 0, 1440, 900,
                image("2:1", "Hero Photo", "img-1", 0, 0, 1440, 600),
                text("2:2", "Headline", "Build faster", 40, 640, 800, 72, 48, 700),
                text("2:3", "Body", "Ship in days, not weeks.", 40, 740, 800, 24, 16, 400)).toBuilder()
                .layoutMode(LayoutMode.VERTICAL)
                .itemSpacing(24.0)
                .paddingTop(40.0)
                .paddingRight(40.0)
                .paddingBottom(40.0)
                .paddingLeft(40.0)
                .primaryAxisAlignItems("CENTER")
                .fills(new ArrayList<>(List.of(solid(1, 1, 1))))
                .strokes(new ArrayList<>(List.of(solid(0, 0, 0))))
                .strokeWeight(2.0)
                .clipsContent(true)
                .build();
    }
}
