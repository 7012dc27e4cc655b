package com.purchasingpower.designflow.service.analysis;

import com.purchasingpower.designflow.config.HeuristicsConfig;
import com.purchasingpower.designflow.model.design.InferredLayout;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.LayoutMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.purchasingpower.designflow.TestNodes.frame;
import static com.purchasingpower.designflow.TestNodes.rectangle;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Layout Inference Engine Tests")
class LayoutInferenceEngineTest {

    private final LayoutInferenceEngine engine = new LayoutInferenceEngine(HeuristicsConfig.defaults());

    @Test
    @DisplayName("Should infer a row from aligned top edges")
    void infer_alignedTops_returnsRowWithGapAndPadding() {
        // Given
        DesignNode parent = frame("1:1", "Toolbar", 100, 100, 600, 100,
                rectangle("1:2", "A", 124, 110, 100, 80),
                rectangle("1:3", "B", 248, 110, 100, 80),
                rectangle("1:4", "C", 372, 110, 100, 80));

        // When
        InferredLayout layout = engine.infer(parent).orElseThrow();

        // Then
        assertThat(layout.kind()).isEqualTo(InferredLayout.Kind.FLEX_ROW);
        assertThat(layout.kind().cssDirection()).isEqualTo("row");
        assertThat(layout.gap()).isEqualTo(24);
        assertThat(layout.padding()).isEqualTo(new InferredLayout.Padding(10, 228, 0, 24));
    }

    @Test
    @DisplayName("Should infer a column from aligned left edges")
    void infer_alignedLefts_returnsColumn() {
        // Given
        DesignNode parent = frame("1:1", "List", 0, 0, 300, 600,
                rectangle("1:2", "A", 20, 10, 200, 80),
                rectangle("1:3", "B", 20, 110, 200, 80),
                rectangle("1:4", "C", 20, 210, 200, 80));

        // When
        InferredLayout layout = engine.infer(parent).orElseThrow();

        // Then
        assertThat(layout.kind()).isEqualTo(InferredLayout.Kind.FLEX_COLUMN);
        assertThat(layout.gap()).isEqualTo(20);
        assertThat(layout.padding()).isEqualTo(new InferredLayout.Padding(10, 0, 0, 20));
        assertThat(layout.justify()).isEqualTo("flex-start");
    }

    @Test
    @DisplayName("Should fall back to absolute for scattered children")
    void infer_scatteredChildren_returnsAbsolute() {
        // Given
        DesignNode parent = frame("1:1", "Collage", 0, 0, 800, 800,
                rectangle("1:2", "A", 0, 0, 200, 200),
                rectangle("1:3", "B", 300, 250, 200, 200));

        // When
        Optional<InferredLayout> layout = engine.infer(parent);

        // Then
        assertThat(layout).hasValueSatisfying(found -> {
            assertThat(found.kind()).isEqualTo(InferredLayout.Kind.ABSOLUTE);
            assertThat(found.isFlex()).isFalse();
        });
    }

    @Test
    @DisplayName("Should detect space-between for two children pushed to the edges")
    void infer_twoChildrenAtEdges_returnsSpaceBetween() {
        // Given
        DesignNode parent = frame("1:1", "Header", 0, 0, 400, 60,
                rectangle("1:2", "Logo", 0, 10, 100, 40),
                rectangle("1:3", "Menu", 300, 10, 100, 40));

        // When
        InferredLayout layout = engine.infer(parent).orElseThrow();

        // Then
        assertThat(layout.kind()).isEqualTo(InferredLayout.Kind.FLEX_ROW);
        assertThat(layout.justify()).isEqualTo("space-between");
        assertThat(layout.gap()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should detect centered content")
    void infer_equalOuterSpace_returnsCenter() {
        // Given
        DesignNode parent = frame("1:1", "Buttons", 0, 0, 600, 60,
                rectangle("1:2", "Primary", 180, 10, 110, 40),
                rectangle("1:3", "Secondary", 310, 10, 110, 40));

        // When / Then
        assertThat(engine.infer(parent)).hasValueSatisfying(layout ->
                assertThat(layout.justify()).isEqualTo("center"));
    }

    @Test
    @DisplayName("Should not infer anything for auto-layout or single-child containers")
    void infer_autoLayoutOrSingleChild_returnsEmpty() {
        // Given
        DesignNode autoLayout = frame("1:1", "Stack", 0, 0, 400, 400,
                rectangle("1:2", "A", 0, 0, 100, 100),
                rectangle("1:3", "B", 0, 120, 100, 100)).toBuilder().layoutMode(LayoutMode.VERTICAL).build();
        DesignNode single = frame("2:1", "Wrapper", 0, 0, 400, 400,
                rectangle("2:2", "Only", 0, 0, 100, 100));

        // When / Then
        assertThat(engine.infer(autoLayout)).isEmpty();
        assertThat(engine.infer(single)).isEmpty();
    }
}
