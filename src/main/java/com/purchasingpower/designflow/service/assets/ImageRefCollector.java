package com.purchasingpower.designflow.service.assets;

import com.purchasingpower.designflow.model.design.ImageRefInfo;
import com.purchasingpower.designflow.model.figma.BoundingBox;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.Paint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Lists every distinct image fill of the visible tree, for download under {@code /images/<ref>.png}.
 */
@Component
public class ImageRefCollector {

    public List<ImageRefInfo> collect(List<DesignNode> roots) {
        List<ImageRefInfo> refs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        roots.forEach(root -> walk(root, refs, seen));
        return refs;
    }

    private void walk(DesignNode node, List<ImageRefInfo> refs, Set<String> seen) {
        if (!node.isVisible()) {
            return;
        }
        for (Paint fill : node.imageFills()) {
            if (seen.add(fill.getImageRef())) {
                BoundingBox box = node.getAbsoluteBoundingBox();
                refs.add(new ImageRefInfo(fill.getImageRef(), node.getId(), node.displayName(),
                        box != null ? Math.round(box.width()) : 0,
                        box != null ? Math.round(box.height()) : 0));
            }
        }
        if (node.getChildren() != null) {
            node.getChildren().forEach(child -> walk(child, refs, seen));
        }
    }
}
