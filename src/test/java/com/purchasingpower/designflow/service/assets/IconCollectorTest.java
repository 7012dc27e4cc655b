package com.purchasingpower.designflow.service.assets;

import com.purchasingpower.designflow.model.design.IconInfo;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.designflow.TestNodes.frame;
import static com.purchasingpower.designflow.TestNodes.node;
import static com.purchasingpower.designflow.TestNodes.rectangle;
import static com.purchasingpower.designflow.TestNodes.vector;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Icon Collector Tests")
class IconCollectorTest {

    private final IconCollector collector = new IconCollector();

    @Test
    @DisplayName("Should collect small vectors and icon-named frames once per name")
    void collect_findsIconsAndDeduplicates() {
        // Given
        DesignNode page = frame("1:1", "Page", 0, 0, 1440, 900,
                vector("2:1", "Arrow Right", 0, 0, 24, 24),
                frame("2:2", "Search Icon", 40, 0, 32, 32, rectangle("2:3", "Bg", 40, 0, 32, 32)),
                vector("2:4", "Arrow Right", 80, 0, 24, 24),
                vector("2:5", "Divider", 0, 100, 1440, 2),
                node(NodeType.INSTANCE, "2:6", "Badge", 0, 200, 300, 300).build());

        // When
        List<IconInfo> icons = collector.collect(List.of(page), 30);

        // Then
        assertThat(icons).containsExactly(
                new IconInfo("2:1", "Arrow Right", 24, 24, "arrow-right.svg"),
                new IconInfo("2:2", "Search Icon", 32, 32, "search-icon.svg"));
    }

    @Test
    @DisplayName("Should stop at the limit")
    void collect_respectsLimit() {
        DesignNode page = frame("1:1", "Page", 0, 0, 1440, 900,
                vector("2:1", "One", 0, 0, 16, 16),
                vector("2:2", "Two", 0, 0, 16, 16),
                vector("2:3", "Three", 0, 0, 16, 16));

        assertThat(collector.collect(List.of(page), 2)).extracting(IconInfo::nodeId).containsExactly("2:1", "2:2");
    }

    @Test
    @DisplayName("Should sanitise names into file names")
    void sanitize_producesSafeNames() {
        assertThat(IconCollector.sanitize("  Close / X ")).isEqualTo("close-x");
        assertThat(IconCollector.sanitize("★★")).isEqualTo("icon");
    }
}
