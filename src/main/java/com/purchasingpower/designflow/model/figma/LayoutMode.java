package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;

/**
 * Auto-layout direction of a container.
 *
 * @since 1.0.0
 */
public enum LayoutMode {
    NONE,
    HORIZONTAL,
    VERTICAL,
    GRID;

    @JsonCreator
    public static LayoutMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.name().equals(value))
                .findFirst()
                .orElse(NONE);
    }
}
