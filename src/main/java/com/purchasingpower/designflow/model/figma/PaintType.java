package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;

/**
 * Paint kinds used by fills and strokes.
 *
 * @since 1.0.0
 */
public enum PaintType {
    SOLID,
    GRADIENT_LINEAR,
    GRADIENT_RADIAL,
    GRADIENT_ANGULAR,
    GRADIENT_DIAMOND,
    IMAGE,
    EMOJI,
    VIDEO,
    OTHER;

    @JsonCreator
    public static PaintType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.name().equals(value))
                .findFirst()
                .orElse(OTHER);
    }

    public boolean isGradient() {
        return switch (this) {
            case GRADIENT_LINEAR, GRADIENT_RADIAL, GRADIENT_ANGULAR, GRADIENT_DIAMOND -> true;
            case SOLID, IMAGE, EMOJI, VIDEO, OTHER -> false;
        };
    }

    /**
     * Whether the paint can be expressed as a CSS color or gradient.
     */
    public boolean isColor() {
        return switch (this) {
            case SOLID, GRADIENT_LINEAR, GRADIENT_RADIAL, GRADIENT_ANGULAR, GRADIENT_DIAMOND -> true;
            case IMAGE, EMOJI, VIDEO, OTHER -> false;
        };
    }
}
