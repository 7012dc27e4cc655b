package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Absolute position and size of a node in canvas coordinates.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BoundingBox(double x, double y, double width, double height) {

    public double area() {
        return width * height;
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    /**
     * Intersection area divided by the area of the smaller box, 0 when either box is empty.
     */
    public double overlapRatio(BoundingBox other) {
        double overlapX = Math.max(0, Math.min(right(), other.right()) - Math.max(x, other.x));
        double overlapY = Math.max(0, Math.min(bottom(), other.bottom()) - Math.max(y, other.y));
        double smaller = Math.min(area(), other.area());
        if (smaller <= 0) {
            return 0;
        }
        return (overlapX * overlapY) / smaller;
    }

    /**
     * "WxH" with both sides rounded.
     */
    public String sizeLabel() {
        return Math.round(width) + "x" + Math.round(height);
    }
}
