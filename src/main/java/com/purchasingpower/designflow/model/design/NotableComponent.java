package com.purchasingpower.designflow.model.design;

import java.util.List;
import java.util.Locale;

/**
 * Sub-region of a section that needs explicit implementation guidance: an indicator, a sidebar,
 * a floating or overlapping element.
 *
 * @param x            left edge relative to the section
 * @param y            top edge relative to the section
 * @param positionHint CSS edge offsets, e.g. {@code right: 24px; top: 16px}
 */
public record NotableComponent(
        String name,
        Category category,
        long x,
        long y,
        long width,
        long height,
        List<String> textContent,
        boolean overlapping,
        String positionHint,
        String scrollBehavior
) {

    public enum Category {
        INDICATOR,
        SIDEBAR,
        NAV,
        FOOTER,
        DECORATIVE,
        OTHER;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public String dimensions() {
        return width + "x" + height;
    }
}
