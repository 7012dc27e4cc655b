package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Resize constraints relative to the parent frame (LEFT, RIGHT, CENTER, LEFT_RIGHT, SCALE, ...).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LayoutConstraint(String vertical, String horizontal) {
}
