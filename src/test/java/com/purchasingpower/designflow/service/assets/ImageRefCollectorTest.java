package com.purchasingpower.designflow.service.assets;

import com.purchasingpower.designflow.model.design.ImageRefInfo;
import com.purchasingpower.designflow.model.figma.DesignNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.designflow.TestNodes.frame;
import static com.purchasingpower.designflow.TestNodes.image;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Image Ref Collector Tests")
class ImageRefCollectorTest {

    @Test
    @DisplayName("Should list each image fill once and skip hidden layers")
    void collect_distinctVisibleRefs() {
        // Given
        DesignNode hidden = image("2:3", "Old Hero", "ref-old", 0, 0, 100, 100).toBuilder().visible(false).build();
        DesignNode page = frame("1:1", "Page", 0, 0, 1440, 900,
                image("2:1", "Hero", "ref-hero", 0, 0, 1440, 600),
                image("2:2", "Hero Copy", "ref-hero", 0, 600, 720, 300),
                hidden);

        // When
        List<ImageRefInfo> refs = new ImageRefCollector().collect(List.of(page));

        // Then
        assertThat(refs).containsExactly(new ImageRefInfo("ref-hero", "2:1", "Hero", 1440, 600));
    }
}
