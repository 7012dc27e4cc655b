package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Color with channels in the 0-1 range.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Rgba(double r, double g, double b, Double a) {

    public double alpha() {
        return a != null ? a : 1.0;
    }
}
