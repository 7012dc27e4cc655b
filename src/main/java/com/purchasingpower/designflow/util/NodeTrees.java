package com.purchasingpower.designflow.util;

import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.model.figma.Paint;
import com.purchasingpower.designflow.model.figma.PaintType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Predicates over node subtrees. Invisible nodes never count.
 */
public final class NodeTrees {

    private NodeTrees() {
    }

    public static boolean containsText(DesignNode node) {
        if (node.getType() == NodeType.TEXT) {
            return true;
        }
        return node.visibleChildren().stream().anyMatch(NodeTrees::containsText);
    }

    /**
     * Paints pixels by itself: a visible image, solid or gradient fill, a primitive shape, or a
     * visible descendant that does.
     */
    public static boolean hasVisualContent(DesignNode node) {
        List<Paint> fills = node.getFills() != null ? node.getFills() : List.of();
        if (fills.stream().anyMatch(fill -> fill.isVisible() && fill.getType() != null
                && (fill.getType().isColor() || fill.getType() == PaintType.IMAGE))) {
            return true;
        }
        if (node.getType() != null && node.getType().isShape()) {
            return true;
        }
        return node.visibleChildren().stream().anyMatch(NodeTrees::hasVisualContent);
    }

    public static boolean hasImageFill(DesignNode node) {
        return node.getFills() != null && node.getFills().stream()
                .anyMatch(fill -> fill.is(PaintType.IMAGE));
    }

    /**
     * First TEXT content found depth-first, looking at most {@code maxDepth} levels down.
     */
    public static Optional<String> firstText(DesignNode node, int maxDepth) {
        return firstText(node, 0, maxDepth);
    }

    private static Optional<String> firstText(DesignNode node, int depth, int maxDepth) {
        if (depth > maxDepth) {
            return Optional.empty();
        }
        if (node.getType() == NodeType.TEXT && node.getCharacters() != null && !node.getCharacters().isEmpty()) {
            return Optional.of(node.getCharacters());
        }
        for (DesignNode child : node.visibleChildren()) {
            Optional<String> text = firstText(child, depth + 1, maxDepth);
            if (text.isPresent()) {
                return text;
            }
        }
        return Optional.empty();
    }

    /**
     * Visible TEXT contents of the subtree in document order, up to {@code limit}.
     */
    public static List<String> texts(DesignNode node, int limit) {
        List<String> result = new ArrayList<>();
        collectTexts(node, result, limit);
        return result;
    }

    private static void collectTexts(DesignNode node, List<String> result, int limit) {
        if (result.size() >= limit || !node.isVisible()) {
            return;
        }
        if (node.getType() == NodeType.TEXT && node.getCharacters() != null && !node.getCharacters().isBlank()) {
            result.add(node.getCharacters().trim());
            return;
        }
        for (DesignNode child : node.visibleChildren()) {
            collectTexts(child, result, limit);
        }
    }
}
