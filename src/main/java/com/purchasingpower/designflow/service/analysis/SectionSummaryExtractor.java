package com.purchasingpower.designflow.service.analysis;

import com.purchasingpower.designflow.model.design.ResolvedAssets;
import com.purchasingpower.designflow.model.design.SectionSummary;
import com.purchasingpower.designflow.model.design.SectionSummary.CompositeImage;
import com.purchasingpower.designflow.model.design.SectionSummary.Dimensions;
import com.purchasingpower.designflow.model.design.SectionSummary.SectionImage;
import com.purchasingpower.designflow.model.design.SectionSummary.SectionLayout;
import com.purchasingpower.designflow.model.design.SectionSummary.TypographyUsage;
import com.purchasingpower.designflow.model.figma.BoundingBox;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.Effect;
import com.purchasingpower.designflow.model.figma.EffectType;
import com.purchasingpower.designflow.model.figma.LayoutMode;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.model.figma.Paint;
import com.purchasingpower.designflow.model.figma.PaintType;
import com.purchasingpower.designflow.model.figma.StrokeWeights;
import com.purchasingpower.designflow.model.figma.TypeStyle;
import com.purchasingpower.designflow.util.CssValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds one {@link SectionSummary} per top-level frame.
 *
 * <p>Pages contribute their primary frame only; directly requested FRAME, COMPONENT or SECTION
 * nodes are summarised as they are.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SectionSummaryExtractor {

    static final int MAX_WALK_DEPTH = 6;
    static final int MAX_TYPOGRAPHY = 4;
    private static final Set<NodeType> SECTION_TYPES = Set.of(NodeType.FRAME, NodeType.COMPONENT, NodeType.SECTION);
    private static final Map<String, String> ALIGN = Map.of(
            "MIN", "start",
            "CENTER", "center",
            "MAX", "end",
            "SPACE_BETWEEN", "space-between",
            "BASELINE", "baseline");

    private final PrimaryFrameSelector primaryFrameSelector;
    private final NotableComponentDetector notableComponentDetector;

    public List<SectionSummary> extract(List<DesignNode> nodes, ResolvedAssets assets) {
        List<SectionSummary> sections = new ArrayList<>();
        for (DesignNode node : nodes) {
            if (!node.isVisible()) {
                continue;
            }
            if (node.getType() == NodeType.CANVAS && node.getChildren() != null) {
                for (DesignNode child : primaryFrameSelector.select(node.getChildren())) {
                    if (SECTION_TYPES.contains(child.getType())) {
                        sections.add(summarize(child, assets));
                    }
                }
            } else if (SECTION_TYPES.contains(node.getType())) {
                sections.add(summarize(node, assets));
            }
        }
        log.debug("Summarised {} section(s)", sections.size());
        return sections;
    }

    SectionSummary summarize(DesignNode node, ResolvedAssets assets) {
        BoundingBox box = node.getAbsoluteBoundingBox();
        return SectionSummary.builder()
                .nodeId(node.getId())
                .name(node.getName())
                .dimensions(box != null ? new Dimensions(Math.round(box.width()), Math.round(box.height())) : null)
                .layout(layout(node))
                .background(background(node))
                .images(images(node, assets))
                .compositeImage(compositeImage(node, assets))
                .icons(icons(node, assets))
                .typography(typography(node, assets))
                .borderRadius(borderRadius(node))
                .overflow(Boolean.TRUE.equals(node.getClipsContent()) ? "hidden" : null)
                .scrollBehavior(scrollBehavior(node))
                .effects(effects(node))
                .border(border(node))
                .childCount(node.visibleChildren().size())
                .notableComponents(notableComponentDetector.detect(node))
                .build();
    }

    private static SectionLayout layout(DesignNode node) {
        if (!node.hasAutoLayout()) {
            return null;
        }
        double top = orZero(node.getPaddingTop());
        double right = orZero(node.getPaddingRight());
        double bottom = orZero(node.getPaddingBottom());
        double left = orZero(node.getPaddingLeft());
        boolean hasPadding = top > 0 || right > 0 || bottom > 0 || left > 0;
        return new SectionLayout(
                node.getLayoutMode() == LayoutMode.HORIZONTAL ? "horizontal" : "vertical",
                node.getItemSpacing(),
                node.getCounterAxisSpacing(),
                hasPadding ? CssValues.px(top) + " " + CssValues.px(right) + " " + CssValues.px(bottom) + " "
                        + CssValues.px(left) : null,
                node.getPrimaryAxisAlignItems() != null ? ALIGN.get(node.getPrimaryAxisAlignItems()) : null,
                node.getCounterAxisAlignItems() != null ? ALIGN.get(node.getCounterAxisAlignItems()) : null,
                "WRAP".equals(node.getLayoutWrap()));
    }

    static String background(DesignNode node) {
        if (node.getFills() == null) {
            return null;
        }
        for (Paint fill : node.getFills()) {
            if (!fill.isVisible() || fill.getType() == null) {
                continue;
            }
            if (fill.getType() == PaintType.SOLID && fill.getColor() != null) {
                return CssValues.rgbaToCss(fill.getColor(), fill.getOpacity());
            }
            if (fill.getType().isGradient() && fill.getGradientStops() != null) {
                return CssValues.gradient(fill);
            }
        }
        return null;
    }

    private static List<SectionImage> images(DesignNode node, ResolvedAssets assets) {
        List<SectionImage> images = new ArrayList<>();
        walkImages(node, images, assets, 0);
        return images;
    }

    private static void walkImages(DesignNode node, List<SectionImage> images, ResolvedAssets assets, int depth) {
        if (!node.isVisible() || depth > MAX_WALK_DEPTH) {
            return;
        }
        BoundingBox box = node.getAbsoluteBoundingBox();
        for (Paint fill : node.imageFills()) {
            String ref = fill.getImageRef();
            String path;
            if (assets.hasImageDownload(ref)) {
                path = "/images/" + ref + ".png";
            } else if (box != null) {
                path = "placehold.co/" + box.sizeLabel();
            } else {
                path = "placehold.co/400x300";
            }
            boolean hero = node.hasChildren() && box != null && box.height() >= 400 && depth <= 1;
            images.add(new SectionImage(path, fill.getScaleMode() != null ? fill.getScaleMode() : "FILL", hero,
                    box != null ? box.sizeLabel() : ""));
        }
        for (DesignNode child : childrenOf(node)) {
            walkImages(child, images, assets, depth + 1);
        }
    }

    private static CompositeImage compositeImage(DesignNode node, ResolvedAssets assets) {
        if (assets.compositeImages().isEmpty()) {
            return null;
        }
        CompositeImage own = compositeOf(node, assets);
        if (own != null) {
            return own;
        }
        for (DesignNode child : node.visibleChildren()) {
            CompositeImage fromChild = compositeOf(child, assets);
            if (fromChild != null) {
                return fromChild;
            }
        }
        return null;
    }

    private static CompositeImage compositeOf(DesignNode node, ResolvedAssets assets) {
        String path = assets.compositeImages().get(node.getId());
        if (path == null) {
            return null;
        }
        BoundingBox box = node.getAbsoluteBoundingBox();
        return new CompositeImage(path, box != null ? box.sizeLabel() : "",
                assets.compositeTextOverlays().contains(node.getId()));
    }

    private static List<String> icons(DesignNode node, ResolvedAssets assets) {
        List<String> icons = new ArrayList<>();
        if (!assets.exportedIcons().isEmpty()) {
            walkIcons(node, icons, assets.exportedIcons(), 0);
        }
        return icons;
    }

    private static void walkIcons(DesignNode node, List<String> icons, Map<String, String> exported, int depth) {
        if (!node.isVisible() || depth > MAX_WALK_DEPTH) {
            return;
        }
        String file = exported.get(node.getId());
        if (file != null) {
            icons.add("/images/icons/" + file);
        }
        for (DesignNode child : childrenOf(node)) {
            walkIcons(child, icons, exported, depth + 1);
        }
    }

    private static List<TypographyUsage> typography(DesignNode node, ResolvedAssets assets) {
        List<TypographyUsage> styles = new ArrayList<>();
        walkTypography(node, styles, assets, 0);

        Map<String, TypographyUsage> unique = new LinkedHashMap<>();
        for (TypographyUsage style : styles) {
            unique.putIfAbsent(style.font() + "-" + style.size() + "-" + style.weight(), style);
        }
        return unique.values().stream()
                .sorted(Comparator.comparingDouble(TypographyUsage::size).reversed())
                .limit(MAX_TYPOGRAPHY)
                .toList();
    }

    private static void walkTypography(DesignNode node, List<TypographyUsage> styles, ResolvedAssets assets, int depth) {
        if (!node.isVisible() || depth > MAX_WALK_DEPTH) {
            return;
        }
        if (node.getType() == NodeType.TEXT && node.getStyle() != null) {
            TypeStyle style = node.getStyle();
            String family = style.getFontFamily();
            String font = family != null ? assets.fontSubstitutions().getOrDefault(family, family) : null;
            String color = null;
            if (style.getFills() != null) {
                color = style.getFills().stream()
                        .filter(fill -> fill.is(PaintType.SOLID) && fill.getColor() != null)
                        .findFirst()
                        .map(fill -> CssValues.rgbaToCss(fill.getColor(), fill.getOpacity()))
                        .orElse(null);
            }
            Double lineHeight = style.getLineHeightPx();
            styles.add(new TypographyUsage(font, style.fontSizeOrZero(), style.fontWeightOrZero(),
                    lineHeight != null && lineHeight > 0 ? Math.round(lineHeight) : null,
                    color,
                    node.getName() != null && !node.getName().isEmpty() ? node.getName() : "text"));
        }
        for (DesignNode child : childrenOf(node)) {
            walkTypography(child, styles, assets, depth + 1);
        }
    }

    static String borderRadius(DesignNode node) {
        if (node.getCornerRadius() != null && node.getCornerRadius() > 0) {
            return CssValues.px(node.getCornerRadius());
        }
        List<Double> radii = node.getRectangleCornerRadii();
        if (radii != null && radii.size() == 4 && radii.stream().anyMatch(radius -> radius > 0)) {
            return CssValues.px(radii.get(0)) + " " + CssValues.px(radii.get(1)) + " "
                    + CssValues.px(radii.get(2)) + " " + CssValues.px(radii.get(3));
        }
        return null;
    }

    private static String scrollBehavior(DesignNode node) {
        if ("FIXED".equals(node.getScrollBehavior())) {
            return "fixed";
        }
        if ("STICKY_SCROLLS".equals(node.getScrollBehavior())) {
            return "sticky";
        }
        return null;
    }

    private static List<String> effects(DesignNode node) {
        List<String> results = new ArrayList<>();
        if (node.getEffects() == null) {
            return results;
        }
        for (Effect effect : node.getEffects()) {
            if (!effect.isVisible()) {
                continue;
            }
            if (effect.getType() == EffectType.DROP_SHADOW && effect.getColor() != null && effect.getOffset() != null) {
                String spread = effect.getSpread() != null && effect.getSpread() != 0
                        ? " " + CssValues.px(effect.getSpread()) : "";
                results.add("box-shadow: " + CssValues.px(effect.getOffset().x()) + " "
                        + CssValues.px(effect.getOffset().y()) + " " + CssValues.px(effect.getRadius())
                        + spread + " " + CssValues.rgbaToCss(effect.getColor()));
            } else if (effect.getType() == EffectType.BACKGROUND_BLUR) {
                results.add("backdrop-filter: blur(" + CssValues.px(effect.getRadius()) + ")");
            }
        }
        return results;
    }

    static String border(DesignNode node) {
        if (node.getStrokes() == null) {
            return null;
        }
        for (Paint stroke : node.getStrokes()) {
            if (!stroke.is(PaintType.SOLID) || stroke.getColor() == null) {
                continue;
            }
            String color = CssValues.rgbaToCss(stroke.getColor(), stroke.getOpacity());
            double weight = node.getStrokeWeight() != null && node.getStrokeWeight() > 0 ? node.getStrokeWeight() : 1;
            String style = node.getStrokeDashes() != null && !node.getStrokeDashes().isEmpty() ? "dashed" : "solid";
            StrokeWeights sides = node.getIndividualStrokeWeights();
            if (sides != null) {
                List<String> parts = new ArrayList<>();
                addSide(parts, "border-top", sides.top(), style, color);
                addSide(parts, "border-right", sides.right(), style, color);
                addSide(parts, "border-bottom", sides.bottom(), style, color);
                addSide(parts, "border-left", sides.left(), style, color);
                return String.join(", ", parts);
            }
            return CssValues.px(weight) + " " + style + " " + color;
        }
        return null;
    }

    private static void addSide(List<String> parts, String property, double width, String style, String color) {
        if (width > 0) {
            parts.add(property + ": " + CssValues.px(width) + " " + style + " " + color);
        }
    }

    private static List<DesignNode> childrenOf(DesignNode node) {
        return node.getChildren() != null ? node.getChildren() : List.of();
    }

    private static double orZero(Double value) {
        return value != null ? value : 0;
    }
}
