package com.purchasingpower.designflow.model.design;

import java.util.List;

/**
 * Overlapping visual layers that render as one bitmap.
 *
 * @param visualChildIds the visual-only children to render; {@code null} for a pure composite,
 *                       where the whole node renders as one image
 * @param hasTextOverlays whether text-bearing children were split out to be laid on top
 */
public record CompositeGroup(
        String nodeId,
        String name,
        long width,
        long height,
        List<String> visualChildIds,
        boolean hasTextOverlays
) {

    public static CompositeGroup pure(String nodeId, String name, long width, long height) {
        return new CompositeGroup(nodeId, name, width, height, null, false);
    }

    public static CompositeGroup withTextOverlays(String nodeId, String name, long width, long height,
                                                  List<String> visualChildIds) {
        return new CompositeGroup(nodeId, name, width, height, List.copyOf(visualChildIds), true);
    }
}
