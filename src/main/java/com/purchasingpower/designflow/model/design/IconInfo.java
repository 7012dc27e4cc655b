package com.purchasingpower.designflow.model.design;

/**
 * Icon-like node to export as SVG under {@code /images/icons/<filename>}.
 */
public record IconInfo(String nodeId, String nodeName, long width, long height, String filename) {
}
