package com.purchasingpower.designflow.service.assets;

import com.purchasingpower.designflow.model.design.IconInfo;
import com.purchasingpower.designflow.model.figma.BoundingBox;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.NodeType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds small icon-like nodes to export as SVG.
 *
 * <p>Vectors, boolean operations and instances between 8 and 64px qualify, as do small frames
 * and groups with an icon-like name or vector children. The same icon used twice is exported
 * once (deduplicated by sanitised name).
 */
@Component
public class IconCollector {

    static final double MIN_ICON_SIZE = 8;
    static final double MAX_ICON_SIZE = 64;
    private static final List<String> ICON_NAME_HINTS = List.of(
            "icon", "logo", "arrow", "chevron", "close", "menu", "search", "cart", "account", "user", "check",
            "star", "heart", "social");

    public List<IconInfo> collect(List<DesignNode> roots, int limit) {
        List<IconInfo> icons = new ArrayList<>();
        Set<String> seenNames = new HashSet<>();
        for (DesignNode root : roots) {
            if (icons.size() >= limit) {
                break;
            }
            walk(root, icons, seenNames, limit);
        }
        return icons;
    }

    private void walk(DesignNode node, List<IconInfo> icons, Set<String> seenNames, int limit) {
        if (!node.isVisible() || icons.size() >= limit) {
            return;
        }
        BoundingBox box = node.getAbsoluteBoundingBox();
        if (box != null && isIcon(node, box)) {
            String name = sanitize(node.displayName());
            if (seenNames.add(name)) {
                icons.add(new IconInfo(node.getId(), node.displayName(), Math.round(box.width()),
                        Math.round(box.height()), name + ".svg"));
            }
        }
        if (node.getChildren() != null) {
            for (DesignNode child : node.getChildren()) {
                walk(child, icons, seenNames, limit);
            }
        }
    }

    boolean isIcon(DesignNode node, BoundingBox box) {
        if (box.width() < MIN_ICON_SIZE || box.height() < MIN_ICON_SIZE) {
            return false;
        }
        if (box.width() > MAX_ICON_SIZE || box.height() > MAX_ICON_SIZE) {
            return false;
        }
        NodeType type = node.getType();
        if (type == NodeType.VECTOR || type == NodeType.BOOLEAN_OPERATION || type == NodeType.INSTANCE) {
            return true;
        }
        if (type == NodeType.FRAME || type == NodeType.GROUP) {
            String name = node.displayName().toLowerCase(Locale.ROOT);
            if (ICON_NAME_HINTS.stream().anyMatch(name::contains)) {
                return true;
            }
            return node.getChildren() != null && node.getChildren().stream()
                    .anyMatch(child -> child.getType() == NodeType.VECTOR
                            || child.getType() == NodeType.BOOLEAN_OPERATION);
        }
        return false;
    }

    /**
     * File-name-safe form of a layer name, at most 60 chars, "icon" when nothing is left.
     */
    static String sanitize(String name) {
        String sanitized = name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (sanitized.length() > 60) {
            sanitized = sanitized.substring(0, 60);
        }
        return sanitized.isEmpty() ? "icon" : sanitized;
    }
}
