package com.purchasingpower.designflow.service.format;

import com.purchasingpower.designflow.model.figma.DesignFile;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.Effect;
import com.purchasingpower.designflow.model.figma.EffectType;
import com.purchasingpower.designflow.model.figma.PaintType;
import com.purchasingpower.designflow.model.figma.Rgba;
import com.purchasingpower.designflow.model.figma.StyleMetadata;
import com.purchasingpower.designflow.model.figma.TypeStyle;
import com.purchasingpower.designflow.model.tokens.DesignTokens;
import com.purchasingpower.designflow.model.tokens.DesignTokens.ColorToken;
import com.purchasingpower.designflow.model.tokens.DesignTokens.ShadowToken;
import com.purchasingpower.designflow.model.tokens.DesignTokens.TypographyToken;
import com.purchasingpower.designflow.util.CssValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Collects design tokens from a file.
 *
 * <p>Colors, typography and shadows come from the published styles, resolved through the first
 * node that applies each style. Corner radii and auto-layout spacing are picked up from the
 * document tree, first node name wins.
 */
@Slf4j
@Component
public class DesignTokenExtractor {

    private static final String DEFAULT_SHADOW_COLOR = "rgba(0, 0, 0, 0.25)";

    public DesignTokens extract(DesignFile file) {
        DesignTokens tokens = new DesignTokens();
        DesignNode document = file.getDocument();
        if (document == null) {
            return tokens;
        }

        if (file.getStyles() != null) {
            for (Map.Entry<String, StyleMetadata> entry : file.getStyles().entrySet()) {
                StyleMetadata style = entry.getValue();
                if (style == null || style.name() == null) {
                    continue;
                }
                Optional<DesignNode> styleNode = findNodeWithStyle(document, entry.getKey());
                if (styleNode.isEmpty()) {
                    continue;
                }
                String name = tokenName(style.name());
                switch (String.valueOf(style.styleType())) {
                    case "FILL" -> colorOf(styleNode.get()).ifPresent(color -> tokens.getColors().put(name, color));
                    case "TEXT" -> {
                        if (styleNode.get().getStyle() != null) {
                            tokens.getTypography().put(name, typographyOf(styleNode.get().getStyle()));
                        }
                    }
                    case "EFFECT" -> shadowsOf(styleNode.get())
                            .forEach((suffix, shadow) -> tokens.getShadows().put(name + "-" + suffix, shadow));
                    default -> log.trace("Ignoring {} style '{}'", style.styleType(), style.name());
                }
            }
        }

        traverse(document, tokens);
        log.debug("Extracted {} design tokens from '{}'", tokens.totalCount(), file.getName());
        return tokens;
    }

    private static Optional<DesignNode> findNodeWithStyle(DesignNode node, String styleId) {
        if (!node.isVisible()) {
            return Optional.empty();
        }
        if (node.getStyles() != null && node.getStyles().containsValue(styleId)) {
            return Optional.of(node);
        }
        if (node.getChildren() != null) {
            for (DesignNode child : node.getChildren()) {
                Optional<DesignNode> found = findNodeWithStyle(child, styleId);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<ColorToken> colorOf(DesignNode node) {
        if (node.getFills() == null) {
            return Optional.empty();
        }
        return node.getFills().stream()
                .filter(fill -> fill.is(PaintType.SOLID))
                .findFirst()
                .filter(fill -> fill.getColor() != null)
                .map(fill -> colorToken(fill.getColor(), fill.getOpacity()));
    }

    /**
     * Token for a color; a paint opacity replaces the color's own alpha.
     */
    static ColorToken colorToken(Rgba color, Double opacity) {
        double alpha = opacity != null ? opacity : color.alpha();
        int r = CssValues.channel(color.r());
        int g = CssValues.channel(color.g());
        int b = CssValues.channel(color.b());
        String hex = CssValues.rgbaToHex(color);
        String value = alpha < 1
                ? "rgba(" + r + ", " + g + ", " + b + ", " + CssValues.fixed2(alpha) + ")"
                : hex;
        return new ColorToken(value, hex, new Rgba(color.r(), color.g(), color.b(), alpha));
    }

    private static TypographyToken typographyOf(TypeStyle style) {
        Double lineHeight = style.getLineHeightPx();
        Double letterSpacing = style.getLetterSpacing();
        return new TypographyToken(
                style.getFontFamily(),
                CssValues.px(style.fontSizeOrZero()),
                (int) Math.round(style.fontWeightOrZero()),
                lineHeight != null && lineHeight > 0 ? Math.round(lineHeight) + "px" : "normal",
                letterSpacing != null && letterSpacing != 0 ? CssValues.fixed2(letterSpacing) + "px" : "0");
    }

    private static Map<String, ShadowToken> shadowsOf(DesignNode node) {
        Map<String, ShadowToken> shadows = new LinkedHashMap<>();
        if (node.getEffects() == null) {
            return shadows;
        }
        int index = 0;
        for (Effect effect : node.getEffects()) {
            if (!effect.isVisible() || effect.getType() == null || !effect.getType().isShadow()) {
                continue;
            }
            double x = effect.getOffset() != null ? effect.getOffset().x() : 0;
            double y = effect.getOffset() != null ? effect.getOffset().y() : 0;
            ShadowToken shadow = new ShadowToken(
                    effect.getType() == EffectType.DROP_SHADOW ? ShadowToken.Kind.DROP : ShadowToken.Kind.INNER,
                    CssValues.px(x),
                    CssValues.px(y),
                    CssValues.px(effect.getRadius()),
                    CssValues.px(effect.getSpread() != null ? effect.getSpread() : 0),
                    effect.getColor() != null ? colorToken(effect.getColor(), null).value() : DEFAULT_SHADOW_COLOR);
            shadows.put(index == 0 ? "default" : Integer.toString(index), shadow);
            index++;
        }
        return shadows;
    }

    private static void traverse(DesignNode node, DesignTokens tokens) {
        if (!node.isVisible()) {
            return;
        }
        if (node.getCornerRadius() != null && node.getCornerRadius() > 0) {
            tokens.getRadii().putIfAbsent(tokenName(node.displayName()), CssValues.px(node.getCornerRadius()));
        }
        if (node.hasAutoLayout() && node.getItemSpacing() != null && node.getItemSpacing() != 0) {
            tokens.getSpacing().putIfAbsent(tokenName(node.displayName()), CssValues.px(node.getItemSpacing()));
        }
        List<DesignNode> children = node.getChildren() != null ? node.getChildren() : List.of();
        children.forEach(child -> traverse(child, tokens));
    }

    /**
     * Kebab-case token name: camelCase humps, whitespace, underscores and slashes become dashes.
     */
    static String tokenName(String name) {
        return name.replaceAll("([a-z])([A-Z])", "$1-$2")
                .replaceAll("[\\s_/]+", "-")
                .replaceAll("[^\\w-]", "")
                .toLowerCase(Locale.ROOT);
    }
}
