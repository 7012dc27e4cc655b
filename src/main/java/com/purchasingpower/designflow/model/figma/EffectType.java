package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;

/**
 * Visual effect kinds.
 *
 * @since 1.0.0
 */
public enum EffectType {
    DROP_SHADOW,
    INNER_SHADOW,
    LAYER_BLUR,
    BACKGROUND_BLUR,
    OTHER;

    @JsonCreator
    public static EffectType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.name().equals(value))
                .findFirst()
                .orElse(OTHER);
    }

    public boolean isShadow() {
        return switch (this) {
            case DROP_SHADOW, INNER_SHADOW -> true;
            case LAYER_BLUR, BACKGROUND_BLUR, OTHER -> false;
        };
    }
}
