package com.purchasingpower.designflow.model.tokens;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.designflow.model.figma.Rgba;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Named design tokens of a file, grouped by kind. Every group keeps insertion order.
 */
@Data
public class DesignTokens {

    private final Map<String, ColorToken> colors = new LinkedHashMap<>();
    private final Map<String, TypographyToken> typography = new LinkedHashMap<>();
    private final Map<String, ShadowToken> shadows = new LinkedHashMap<>();
    private final Map<String, String> radii = new LinkedHashMap<>();
    private final Map<String, String> spacing = new LinkedHashMap<>();

    @JsonIgnore
    public int totalCount() {
        return colors.size() + typography.size() + shadows.size() + radii.size() + spacing.size();
    }

    /**
     * @param value CSS value: hex when opaque, {@code rgba(...)} otherwise
     */
    public record ColorToken(String value, String hex, Rgba rgba) {
    }

    public record TypographyToken(String fontFamily, String fontSize, int fontWeight, String lineHeight,
                                  String letterSpacing) {
    }

    public record ShadowToken(Kind type, String x, String y, String blur, String spread, String color) {

        /**
         * CSS {@code box-shadow} value.
         */
        public String css() {
            String inset = type == Kind.INNER ? "inset " : "";
            return inset + x + " " + y + " " + blur + " " + spread + " " + color;
        }

        public enum Kind {
            DROP,
            INNER;

            @JsonValue
            public String label() {
                return name().toLowerCase(Locale.ROOT);
            }
        }
    }
}
