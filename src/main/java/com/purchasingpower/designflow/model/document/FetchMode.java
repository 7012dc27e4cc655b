package com.purchasingpower.designflow.model.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Which artifact a fetch compiles the design into.
 */
public enum FetchMode {
    SPEC,
    TOKENS,
    CONTENT,
    PLAN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive; unknown or missing modes fall back to {@link #SPEC}.
     */
    @JsonCreator
    public static FetchMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.name().equalsIgnoreCase(value))
                .findFirst()
                .orElse(SPEC);
    }
}
