package com.purchasingpower.designflow.service.analysis;

import com.purchasingpower.designflow.config.HeuristicsConfig;
import com.purchasingpower.designflow.model.design.CompositeGroup;
import com.purchasingpower.designflow.model.figma.BoundingBox;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.util.NodeTrees;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds overlapping sibling layers that should ship as one rendered bitmap.
 *
 * <p>Layered hero backgrounds and photo collages are hard to rebuild layer by layer, so the
 * container is exported as a single image instead. The image endpoint bakes every visible layer
 * into the PNG, text included; containers with text therefore only render their visual layers
 * ({@link CompositeGroup#visualChildIds()}) and their text children keep being walked so they are
 * emitted as regular instructions on top.
 *
 * <p>A candidate container:
 * <ul>
 *   <li>is not a direct child of a page (those are page sections);</li>
 *   <li>has no auto-layout (overlap there is accidental);</li>
 *   <li>is at least {@code min-composite-size} in both dimensions;</li>
 *   <li>has two or more visible visual children whose boxes overlap by more than
 *       {@code overlap-threshold} of the smaller box.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompositeGroupDetector {

    private final HeuristicsConfig heuristics;

    public List<CompositeGroup> detect(List<DesignNode> roots) {
        Set<String> pageSectionIds = new HashSet<>();
        for (DesignNode root : roots) {
            if (root.getType() == NodeType.CANVAS && root.getChildren() != null) {
                root.getChildren().forEach(child -> pageSectionIds.add(child.getId()));
            }
        }

        List<CompositeGroup> groups = new ArrayList<>();
        for (DesignNode root : roots) {
            walk(root, pageSectionIds, groups);
        }
        log.debug("Detected {} composite group(s)", groups.size());
        return groups;
    }

    private void walk(DesignNode node, Set<String> pageSectionIds, List<CompositeGroup> groups) {
        if (!node.isVisible()) {
            return;
        }
        if (!isCandidate(node, pageSectionIds)) {
            walkChildren(node.getChildren(), pageSectionIds, groups);
            return;
        }

        List<DesignNode> visualLayers = new ArrayList<>();
        List<DesignNode> textLayers = new ArrayList<>();
        for (DesignNode child : node.visibleChildren()) {
            if (NodeTrees.containsText(child)) {
                textLayers.add(child);
            } else if (NodeTrees.hasVisualContent(child)) {
                visualLayers.add(child);
            }
        }

        if (visualLayers.size() < 2 || !hasSignificantOverlap(visualLayers)) {
            walkChildren(node.getChildren(), pageSectionIds, groups);
            return;
        }

        BoundingBox box = node.getAbsoluteBoundingBox();
        long width = Math.round(box.width());
        long height = Math.round(box.height());
        if (textLayers.isEmpty()) {
            // rendered as one unit, nothing below needs its own instructions
            groups.add(CompositeGroup.pure(node.getId(), node.displayName(), width, height));
            return;
        }
        groups.add(CompositeGroup.withTextOverlays(node.getId(), node.displayName(), width, height,
                visualLayers.stream().map(DesignNode::getId).toList()));
        walkChildren(textLayers, pageSectionIds, groups);
    }

    private void walkChildren(List<DesignNode> children, Set<String> pageSectionIds, List<CompositeGroup> groups) {
        if (children == null) {
            return;
        }
        for (DesignNode child : children) {
            walk(child, pageSectionIds, groups);
        }
    }

    private boolean isCandidate(DesignNode node, Set<String> pageSectionIds) {
        if (node.getChildren() == null || node.getChildren().size() < 2) {
            return false;
        }
        if (pageSectionIds.contains(node.getId())) {
            return false;
        }
        BoundingBox box = node.getAbsoluteBoundingBox();
        double minSize = heuristics.getMinCompositeSize();
        if (box == null || box.width() < minSize || box.height() < minSize) {
            return false;
        }
        if (node.hasAutoLayout()) {
            return false;
        }
        return node.visibleChildren().size() >= 2;
    }

    /**
     * True when any pair of boxes overlaps by more than the threshold share of the smaller box.
     */
    boolean hasSignificantOverlap(List<DesignNode> layers) {
        List<BoundingBox> boxes = layers.stream()
                .map(DesignNode::getAbsoluteBoundingBox)
                .filter(Objects::nonNull)
                .toList();
        for (int i = 0; i < boxes.size(); i++) {
            for (int j = i + 1; j < boxes.size(); j++) {
                if (boxes.get(i).overlapRatio(boxes.get(j)) > heuristics.getOverlapThreshold()) {
                    return true;
                }
            }
        }
        return false;
    }
}
