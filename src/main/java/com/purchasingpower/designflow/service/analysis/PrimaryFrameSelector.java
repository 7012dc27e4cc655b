package com.purchasingpower.designflow.service.analysis;

import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.NodeType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the main artboard among a page's top-level frames.
 *
 * <p>Pages often hold a desktop frame next to mobile variants, copies and component sheets.
 * Compiling all of them would make the agent implement everything twice, so only the visible
 * FRAME with the largest bounding-box area is kept. The first one wins a tie.
 */
@Component
public class PrimaryFrameSelector {

    public List<DesignNode> select(List<DesignNode> pageChildren) {
        List<DesignNode> frames = pageChildren.stream()
                .filter(DesignNode::isVisible)
                .filter(child -> child.getType() == NodeType.FRAME && child.getAbsoluteBoundingBox() != null)
                .toList();

        if (frames.size() <= 1) {
            return pageChildren.stream().filter(DesignNode::isVisible).toList();
        }

        DesignNode largest = frames.get(0);
        double largestArea = largest.getAbsoluteBoundingBox().area();
        for (DesignNode frame : frames) {
            double area = frame.getAbsoluteBoundingBox().area();
            if (area > largestArea) {
                largestArea = area;
                largest = frame;
            }
        }
        return List.of(largest);
    }
}
