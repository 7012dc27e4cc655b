package com.purchasingpower.designflow.model.content;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a piece of text does on the page, as guessed from names, typography and wording.
 */
public enum SemanticRole {
    HEADING,
    SUBHEADING,
    BODY,
    BUTTON,
    LABEL,
    LINK,
    CAPTION,
    PLACEHOLDER,
    NAVIGATION,
    FOOTER,
    CTA,
    TITLE,
    DESCRIPTION,
    UNKNOWN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
