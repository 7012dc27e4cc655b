package com.purchasingpower.designflow.model.design;

/**
 * First node found using an image fill, keyed by the fill's {@code imageRef}.
 */
public record ImageRefInfo(String imageRef, String nodeId, String nodeName, long width, long height) {
}
