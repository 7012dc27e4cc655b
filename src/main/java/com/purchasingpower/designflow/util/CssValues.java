package com.purchasingpower.designflow.util;

import com.purchasingpower.designflow.model.figma.GradientStop;
import com.purchasingpower.designflow.model.figma.Paint;
import com.purchasingpower.designflow.model.figma.Rgba;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Converts Figma paint values to CSS text.
 */
public final class CssValues {

    private CssValues() {
    }

    /**
     * Shortest decimal form: {@code 24.0} prints as {@code 24}, {@code 1.50} as {@code 1.5}.
     */
    public static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String fixed2(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    public static String px(double value) {
        return number(value) + "px";
    }

    public static int channel(double unit) {
        return (int) Math.round(unit * 255);
    }

    public static String rgbaToHex(Rgba color) {
        return String.format(Locale.ROOT, "#%02x%02x%02x",
                channel(color.r()), channel(color.g()), channel(color.b()));
    }

    /**
     * Hex when fully opaque, otherwise {@code rgba(r, g, b, a)} with the alpha multiplied by the
     * paint opacity.
     */
    public static String rgbaToCss(Rgba color, Double paintOpacity) {
        double alpha = color.alpha() * (paintOpacity != null ? paintOpacity : 1.0);
        if (alpha < 1) {
            return "rgba(" + channel(color.r()) + ", " + channel(color.g()) + ", " + channel(color.b()) + ", "
                    + fixed2(alpha) + ")";
        }
        return rgbaToHex(color);
    }

    public static String rgbaToCss(Rgba color) {
        return rgbaToCss(color, null);
    }

    /**
     * CSS gradient for a gradient paint. Diamond gradients have no CSS form and become radial.
     */
    public static String gradient(Paint paint) {
        List<GradientStop> stops = paint.getGradientStops() != null ? paint.getGradientStops() : List.of();
        String stopList = stops.stream()
                .map(stop -> rgbaToCss(stop.color()) + " " + Math.round(stop.position() * 100) + "%")
                .collect(Collectors.joining(", "));
        return switch (paint.getType()) {
            case GRADIENT_LINEAR -> "linear-gradient(" + stopList + ")";
            case GRADIENT_RADIAL, GRADIENT_DIAMOND -> "radial-gradient(" + stopList + ")";
            case GRADIENT_ANGULAR -> "conic-gradient(" + stopList + ")";
            case SOLID, IMAGE, EMOJI, VIDEO, OTHER -> "gradient(" + stopList + ")";
        };
    }

    /**
     * Lower-case, non-alphanumeric runs collapsed to a single dash.
     */
    public static String slug(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("-+", "-");
    }

    /**
     * Kebab-case token name: non-alphanumerics become dashes, trimmed at both ends.
     */
    public static String kebab(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
    }
}
