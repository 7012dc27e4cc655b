package com.purchasingpower.designflow.service.analysis;

import com.purchasingpower.designflow.model.figma.DesignNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.designflow.TestNodes.frame;
import static com.purchasingpower.designflow.TestNodes.rectangle;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Primary Frame Selector Tests")
class PrimaryFrameSelectorTest {

    private final PrimaryFrameSelector selector = new PrimaryFrameSelector();

    @Test
    @DisplayName("Should keep only the largest of several artboards")
    void select_multipleFrames_returnsLargest() {
        // Given: desktop, tablet and mobile versions of one page
        DesignNode desktop = frame("1:1", "Desktop", 0, 0, 1440, 4000);
        DesignNode tablet = frame("1:2", "Tablet", 1600, 0, 768, 4200);
        DesignNode mobile = frame("1:3", "Mobile", 2500, 0, 375, 5000);

        // When
        List<DesignNode> selected = selector.select(List.of(tablet, desktop, mobile));

        // Then
        assertThat(selected).extracting(DesignNode::getId).containsExactly("1:1");
    }

    @Test
    @DisplayName("Should keep every visible child when there is at most one frame")
    void select_singleFrame_returnsAllVisibleChildren() {
        // Given
        DesignNode hidden = rectangle("1:3", "Hidden", 0, 0, 10, 10).toBuilder().visible(false).build();
        List<DesignNode> children = List.of(frame("1:1", "Page", 0, 0, 1440, 900),
                rectangle("1:2", "Note", 0, 0, 200, 100), hidden);

        // When / Then
        assertThat(selector.select(children)).extracting(DesignNode::getId).containsExactly("1:1", "1:2");
    }
}
