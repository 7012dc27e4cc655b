package com.purchasingpower.designflow.model.design;

import java.util.List;

/**
 * Ordered run of siblings whose order and spacing must be kept.
 *
 * @param type   {@code numbered-steps} (numbers in layer names) or {@code numbered-content}
 *               (numbers leading the first text)
 * @param labels item labels in ascending number order
 */
public record SequentialPattern(String type, String description, List<String> labels) {
}
