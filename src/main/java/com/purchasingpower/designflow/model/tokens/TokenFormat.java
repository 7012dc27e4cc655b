package com.purchasingpower.designflow.model.tokens;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Output syntax of a token document.
 */
public enum TokenFormat {
    CSS("css"),
    SCSS("scss"),
    JSON("json"),
    TAILWIND("js");

    private final String fenceLanguage;

    TokenFormat(String fenceLanguage) {
        this.fenceLanguage = fenceLanguage;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Language tag of the markdown code fence wrapping the tokens.
     */
    public String fenceLanguage() {
        return fenceLanguage;
    }

    /**
     * Case-insensitive lookup, CSS for {@code null} or unknown values.
     */
    @JsonCreator
    public static TokenFormat fromValue(String value) {
        if (value == null) {
            return CSS;
        }
        return Arrays.stream(values())
                .filter(format -> format.name().equals(value.toUpperCase(Locale.ROOT)))
                .findFirst()
                .orElse(CSS);
    }
}
