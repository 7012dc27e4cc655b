package com.purchasingpower.designflow.service.format;

import com.purchasingpower.designflow.model.design.InferredLayout;
import com.purchasingpower.designflow.model.design.ResolvedAssets;
import com.purchasingpower.designflow.model.design.SequentialPattern;
import com.purchasingpower.designflow.model.figma.BoundingBox;
import com.purchasingpower.designflow.model.figma.ComponentPropertyDefinition;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.Effect;
import com.purchasingpower.designflow.model.figma.EffectType;
import com.purchasingpower.designflow.model.figma.ImageFilters;
import com.purchasingpower.designflow.model.figma.LayoutConstraint;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.model.figma.Paint;
import com.purchasingpower.designflow.model.figma.PaintType;
import com.purchasingpower.designflow.model.figma.StrokeWeights;
import com.purchasingpower.designflow.model.figma.TypeStyle;
import com.purchasingpower.designflow.service.analysis.LayoutInferenceEngine;
import com.purchasingpower.designflow.service.analysis.PrimaryFrameSelector;
import com.purchasingpower.designflow.service.classification.ImageImportanceClassifier;
import com.purchasingpower.designflow.service.classification.SequentialPatternDetector;
import com.purchasingpower.designflow.util.CssValues;
import com.purchasingpower.designflow.util.NodeTrees;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Renders a node tree as the markdown design specification handed to a coding agent.
 *
 * <p>Every visible node becomes a heading followed by CSS-oriented hints: layout (explicit or
 * inferred), sizing, fills, strokes, typography, effects, images and exported assets. Children
 * are rendered below their parent up to depth 6; from depth 4 on only content-bearing children
 * are kept. Siblings of containers without auto-layout get z-index comments because browsers do
 * not stack overlapping elements in the design tool's paint order.
 *
 * <p>Rendering is a pure function of the tree and the {@link ResolvedAssets}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DesignSpecFormatter {

    static final int MAX_DEPTH = 6;
    static final int SELECTIVE_DEPTH = 4;
    static final double HERO_MIN_HEIGHT = 400;

    private static final Set<NodeType> STRUCTURAL_TYPES = Set.of(
            NodeType.FRAME, NodeType.COMPONENT, NodeType.COMPONENT_SET, NodeType.INSTANCE, NodeType.GROUP,
            NodeType.TEXT, NodeType.SECTION);
    private static final Map<String, String> ALIGNMENT = Map.of(
            "MIN", "start",
            "CENTER", "center",
            "MAX", "end",
            "SPACE_BETWEEN", "space-between",
            "BASELINE", "baseline");
    private static final Map<String, String> SELF_ALIGNMENT = Map.of(
            "STRETCH", "stretch (fill cross-axis)",
            "MIN", "align-self: flex-start",
            "CENTER", "align-self: center",
            "MAX", "align-self: flex-end");
    private static final Map<String, String> CONSTRAINT_HINTS = Map.of(
            "LEFT", "fixed left",
            "RIGHT", "fixed right",
            "TOP", "fixed top",
            "BOTTOM", "fixed bottom",
            "CENTER", "centered",
            "LEFT_RIGHT", "fill container width",
            "TOP_BOTTOM", "fill container height",
            "SCALE", "scale with parent");
    private static final Map<String, String> SCROLL_DIRECTIONS = Map.of(
            "HORIZONTAL_SCROLLING", "`overflow-x: auto` (horizontal scroll)",
            "VERTICAL_SCROLLING", "`overflow-y: auto` (vertical scroll)",
            "HORIZONTAL_AND_VERTICAL_SCROLLING", "`overflow: auto` (both axes)");
    private static final Map<String, String> TEXT_CASES = Map.of(
            "UPPER", "uppercase",
            "LOWER", "lowercase",
            "TITLE", "capitalize",
            "SMALL_CAPS", "small-caps",
            "SMALL_CAPS_FORCED", "small-caps");
    private static final Map<String, String> TEXT_SIZING = Map.of(
            "HEIGHT", "fixed width, auto height",
            "WIDTH_AND_HEIGHT", "auto width and height (hug contents)",
            "TRUNCATE", "fixed size, truncate overflow");

    private final PrimaryFrameSelector primaryFrameSelector;
    private final LayoutInferenceEngine layoutInferenceEngine;
    private final ImageImportanceClassifier imageImportanceClassifier;
    private final SequentialPatternDetector sequentialPatternDetector;

    public String format(List<DesignNode> nodes, String fileName, ResolvedAssets assets) {
        List<String> sections = new ArrayList<>();
        sections.add("# Design Specification: " + fileName + "\n");

        for (DesignNode node : nodes) {
            if (!node.isVisible()) {
                continue;
            }
            if (node.getType() == NodeType.CANVAS) {
                sections.add("## Page: " + node.displayName() + "\n");
                if (node.getChildren() != null) {
                    for (DesignNode child : primaryFrameSelector.select(node.getChildren())) {
                        sections.add(render(child, 2, null, assets));
                    }
                }
            } else {
                sections.add(render(node, 1, null, assets));
            }
        }
        return String.join("\n", sections);
    }

    /**
     * @param parentBox box of the enclosing node, used to judge how dominant an image is
     */
    private String render(DesignNode node, int depth, BoundingBox parentBox, ResolvedAssets assets) {
        if (!node.isVisible()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        BoundingBox box = node.getAbsoluteBoundingBox();

        lines.add("#".repeat(Math.min(depth + 1, 6)) + " " + node.displayName());
        lines.add("\n*Type: " + typeLabel(node) + "*");
        if (box != null) {
            lines.add("*Dimensions: " + Math.round(box.width()) + " x " + Math.round(box.height())
                    + " px — Position: (" + Math.round(box.x()) + ", " + Math.round(box.y()) + ")*");
        }
        if (node.getDescription() != null && !node.getDescription().isEmpty()) {
            lines.add("\n" + node.getDescription());
        }

        appendLayout(node, lines);
        appendPlacement(node, lines);
        appendFills(node, lines);
        appendStrokes(node, lines);

        if (node.getOpacity() != null && node.getOpacity() < 1) {
            lines.add("\n**Opacity:** " + CssValues.number(node.getOpacity()));
        }
        if (node.getRotation() != null && Math.abs(node.getRotation()) > 0.1) {
            lines.add("\n**Rotation:** `transform: rotate(" + Math.round(node.getRotation()) + "deg)`");
        }
        if (Boolean.TRUE.equals(node.getIsMask())) {
            lines.add("\n**Mask layer** (clips following siblings to this shape)");
        }

        appendText(node, lines, assets);
        appendComponentProperties(node, lines);
        appendCornerRadius(node, lines);
        appendEffects(node, lines);
        appendImages(node, depth, parentBox, lines, assets);
        appendIcon(node, lines, assets);

        lines.add("");

        String compositePath = assets.compositeImages().get(node.getId());
        if (compositePath != null) {
            appendComposite(node, depth, compositePath, lines, assets);
        } else if (node.getChildren() != null && depth < MAX_DEPTH) {
            appendChildren(node, depth, lines, assets);
        }
        return String.join("\n", lines);
    }

    private static String typeLabel(DesignNode node) {
        return node.getType() != null ? node.getType().displayName() : NodeType.OTHER.displayName();
    }

    private void appendLayout(DesignNode node, List<String> lines) {
        if (node.hasAutoLayout()) {
            lines.add("\n**Layout:** " + node.getLayoutMode().name().toLowerCase(Locale.ROOT));
            layoutSizing(node.getLayoutSizingHorizontal(), true).ifPresent(hint -> lines.add("- Width sizing: " + hint));
            layoutSizing(node.getLayoutSizingVertical(), false).ifPresent(hint -> lines.add("- Height sizing: " + hint));
            if ("WRAP".equals(node.getLayoutWrap())) {
                lines.add("- Wrap: flex-wrap: wrap");
            }
            if (isNonZero(node.getItemSpacing())) {
                lines.add("- Gap: " + CssValues.px(node.getItemSpacing()));
            }
            if (isNonZero(node.getCounterAxisSpacing())) {
                lines.add("- Row gap: " + CssValues.px(node.getCounterAxisSpacing()));
            }
            if (isNonZero(node.getPaddingTop()) || isNonZero(node.getPaddingRight())
                    || isNonZero(node.getPaddingBottom()) || isNonZero(node.getPaddingLeft())) {
                lines.add("- Padding: " + CssValues.px(orZero(node.getPaddingTop())) + " "
                        + CssValues.px(orZero(node.getPaddingRight())) + " "
                        + CssValues.px(orZero(node.getPaddingBottom())) + " "
                        + CssValues.px(orZero(node.getPaddingLeft())));
            }
            if (node.getPrimaryAxisAlignItems() != null) {
                lines.add("- Main axis: " + alignment(node.getPrimaryAxisAlignItems()));
            }
            if (node.getCounterAxisAlignItems() != null) {
                lines.add("- Cross axis: " + alignment(node.getCounterAxisAlignItems()));
            }
        } else {
            Optional<InferredLayout> inferred = layoutInferenceEngine.infer(node);
            if (inferred.isPresent() && inferred.get().isFlex()) {
                InferredLayout layout = inferred.get();
                lines.add("\n**Inferred Layout** (no auto-layout in Figma — derived from element positions):");
                lines.add("- CSS: `display: flex; flex-direction: " + layout.kind().cssDirection() + "`");
                if (layout.gap() != null) {
                    lines.add("- Gap: " + layout.gap() + "px");
                }
                if (layout.padding() != null) {
                    lines.add("- Padding: " + layout.padding().css());
                }
                if (layout.justify() != null) {
                    lines.add("- Justify: " + layout.justify());
                }
            }
        }

        if (node.getLayoutGrow() != null && node.getLayoutGrow() > 0) {
            lines.add("- Flex grow: " + CssValues.number(node.getLayoutGrow()));
        }
        if (!node.hasAutoLayout()) {
            layoutSizing(node.getLayoutSizingHorizontal(), true).ifPresent(hint -> lines.add("- Width: " + hint));
            layoutSizing(node.getLayoutSizingVertical(), false).ifPresent(hint -> lines.add("- Height: " + hint));
        }
        if (node.getLayoutAlign() != null && !"INHERIT".equals(node.getLayoutAlign())) {
            lines.add("- Self alignment: " + SELF_ALIGNMENT.getOrDefault(node.getLayoutAlign(), node.getLayoutAlign()));
        }
    }

    private static void appendPlacement(DesignNode node, List<String> lines) {
        if ("ABSOLUTE".equals(node.getLayoutPositioning())) {
            lines.add("\n**Positioning:** absolute (not in flow — use `position: absolute` with coordinates)");
        }
        if (Boolean.TRUE.equals(node.getClipsContent())) {
            lines.add("\n**Overflow:** hidden");
        }
        String scroll = node.getScrollBehavior();
        if (scroll != null && !"SCROLLS".equals(scroll)) {
            String hint = switch (scroll) {
                case "FIXED" -> "`position: fixed`";
                case "STICKY_SCROLLS" -> "`position: sticky; top: 0`";
                default -> scroll;
            };
            lines.add("\n**Scroll behavior:** " + hint);
        }
        String overflow = node.getOverflowDirection();
        if (overflow != null && !"NONE".equals(overflow)) {
            lines.add("\n**Scrollable:** " + SCROLL_DIRECTIONS.getOrDefault(overflow, overflow));
        }

        List<String> sizeConstraints = new ArrayList<>();
        addSizeConstraint(sizeConstraints, "min-width", node.getMinWidth());
        addSizeConstraint(sizeConstraints, "max-width", node.getMaxWidth());
        addSizeConstraint(sizeConstraints, "min-height", node.getMinHeight());
        addSizeConstraint(sizeConstraints, "max-height", node.getMaxHeight());
        if (!sizeConstraints.isEmpty()) {
            lines.add("\n**Size constraints:** " + String.join(", ", sizeConstraints));
        }

        // layout sizing already says how an auto-layout child resizes
        LayoutConstraint constraints = node.getConstraints();
        if (constraints != null
                && (node.getLayoutSizingHorizontal() == null || "ABSOLUTE".equals(node.getLayoutPositioning()))) {
            String horizontal = constraintHint(constraints.horizontal(), "LEFT");
            String vertical = constraintHint(constraints.vertical(), "TOP");
            if (horizontal != null || vertical != null) {
                lines.add("\n**Constraints:**");
                if (horizontal != null) {
                    lines.add("- Horizontal: " + horizontal);
                }
                if (vertical != null) {
                    lines.add("- Vertical: " + vertical);
                }
            }
        }
    }

    private static void addSizeConstraint(List<String> into, String property, Double value) {
        if (isNonZero(value)) {
            into.add(property + ": " + CssValues.px(value));
        }
    }

    private static String constraintHint(String constraint, String trivialDefault) {
        if (constraint == null || constraint.equals(trivialDefault)) {
            return null;
        }
        return CONSTRAINT_HINTS.get(constraint);
    }

    private static void appendFills(DesignNode node, List<String> lines) {
        if (node.getFills() == null) {
            return;
        }
        List<String> parts = new ArrayList<>();
        for (Paint fill : node.getFills()) {
            if (!fill.isVisible() || fill.getType() == null) {
                continue;
            }
            if (fill.getType() == PaintType.SOLID && fill.getColor() != null) {
                parts.add("- Background: " + CssValues.rgbaToCss(fill.getColor(), fill.getOpacity()));
            } else if (fill.getType().isGradient() && fill.getGradientStops() != null) {
                parts.add("- Background: " + CssValues.gradient(fill));
            }
        }
        if (!parts.isEmpty()) {
            lines.add("\n**Fills:**\n" + String.join("\n", parts));
        }
    }

    private static void appendStrokes(DesignNode node, List<String> lines) {
        if (node.getStrokes() == null || node.getStrokes().isEmpty()) {
            return;
        }
        List<String> parts = new ArrayList<>();
        for (Paint stroke : node.getStrokes()) {
            if (!stroke.is(PaintType.SOLID) || stroke.getColor() == null) {
                continue;
            }
            String color = CssValues.rgbaToCss(stroke.getColor(), stroke.getOpacity());
            String align = node.getStrokeAlign() != null ? " (" + node.getStrokeAlign().toLowerCase(Locale.ROOT) + ")" : "";
            String style = node.getStrokeDashes() != null && !node.getStrokeDashes().isEmpty() ? "dashed" : "solid";
            String suffix = " " + style + " " + color + align;

            StrokeWeights sides = node.getIndividualStrokeWeights();
            if (sides != null) {
                addBorderSide(parts, "border-top", sides.top(), suffix);
                addBorderSide(parts, "border-right", sides.right(), suffix);
                addBorderSide(parts, "border-bottom", sides.bottom(), suffix);
                addBorderSide(parts, "border-left", sides.left(), suffix);
            } else {
                double weight = isNonZero(node.getStrokeWeight()) ? node.getStrokeWeight() : 1;
                parts.add("- Border: " + CssValues.px(weight) + suffix);
            }
        }
        if (!parts.isEmpty()) {
            lines.add("\n**Strokes:**\n" + String.join("\n", parts));
        }
    }

    private static void addBorderSide(List<String> parts, String side, double width, String suffix) {
        if (width > 0) {
            parts.add("- " + side + ": " + CssValues.px(width) + suffix);
        }
    }

    private static void appendText(DesignNode node, List<String> lines, ResolvedAssets assets) {
        if (node.getType() != NodeType.TEXT || node.getCharacters() == null || node.getCharacters().isEmpty()) {
            return;
        }
        lines.add("\n**Text content:**");
        lines.add("> " + node.getCharacters().replace("\n", "\n> "));

        TypeStyle style = node.getStyle();
        if (style == null) {
            return;
        }
        if (style.getHyperlink() != null && "URL".equals(style.getHyperlink().type())
                && style.getHyperlink().url() != null) {
            lines.add("- Link: `" + style.getHyperlink().url() + "`");
        }
        lines.add("\n**Typography:**");
        lines.add(typography(style, assets.fontSubstitutions()));
    }

    static String typography(TypeStyle style, Map<String, String> fontSubstitutions) {
        List<String> parts = new ArrayList<>();
        if (style.getFontFamily() != null) {
            String substitute = fontSubstitutions.get(style.getFontFamily());
            parts.add(substitute != null
                    ? "- Font: " + substitute + " (original: " + style.getFontFamily() + ")"
                    : "- Font: " + style.getFontFamily());
        }
        if (isNonZero(style.getFontSize())) {
            parts.add("- Size: " + CssValues.px(style.getFontSize()));
        }
        if (isNonZero(style.getFontWeight())) {
            parts.add("- Weight: " + CssValues.number(style.getFontWeight()));
        }
        if (Boolean.TRUE.equals(style.getItalic()) || "italic".equals(style.getFontStyle())) {
            parts.add("- Style: italic");
        }
        if (isNonZero(style.getLineHeightPx())) {
            parts.add("- Line height: " + Math.round(style.getLineHeightPx()) + "px");
        }
        if (isNonZero(style.getLetterSpacing())) {
            parts.add("- Letter spacing: " + CssValues.fixed2(style.getLetterSpacing()) + "px");
        }
        if (style.getTextAlignHorizontal() != null) {
            parts.add("- Align: " + style.getTextAlignHorizontal().toLowerCase(Locale.ROOT));
        }
        if (style.getTextCase() != null && !"ORIGINAL".equals(style.getTextCase())) {
            parts.add("- Text transform: " + TEXT_CASES.getOrDefault(style.getTextCase(),
                    style.getTextCase().toLowerCase(Locale.ROOT)));
        }
        if (style.getTextDecoration() != null && !"NONE".equals(style.getTextDecoration())) {
            parts.add("- Text decoration: " + style.getTextDecoration().toLowerCase(Locale.ROOT));
        }
        if (style.getTextAutoResize() != null && !"NONE".equals(style.getTextAutoResize())) {
            parts.add("- Text sizing: " + TEXT_SIZING.getOrDefault(style.getTextAutoResize(), style.getTextAutoResize()));
        }
        if ("ENDING".equals(style.getTextTruncation())) {
            Integer maxLines = style.getMaxLines();
            if (maxLines != null && maxLines > 1) {
                parts.add("- Truncation: ellipsis after " + maxLines + " lines → `display: -webkit-box; "
                        + "-webkit-line-clamp: " + maxLines + "; -webkit-box-orient: vertical; overflow: hidden`");
            } else {
                parts.add("- Truncation: ellipsis → `text-overflow: ellipsis; overflow: hidden; white-space: nowrap`");
            }
        }
        return String.join("\n", parts);
    }

    private static void appendComponentProperties(DesignNode node, List<String> lines) {
        Map<String, ComponentPropertyDefinition> definitions = node.getComponentPropertyDefinitions();
        if (definitions == null) {
            return;
        }
        lines.add("\n**Component Properties:**");
        for (Map.Entry<String, ComponentPropertyDefinition> entry : definitions.entrySet()) {
            ComponentPropertyDefinition definition = entry.getValue();
            String name = entry.getKey();
            switch (String.valueOf(definition.type())) {
                case "VARIANT" -> {
                    if (definition.variantOptions() != null) {
                        lines.add("- " + name + ": " + String.join(" | ", definition.variantOptions()));
                    }
                }
                case "BOOLEAN" -> lines.add("- " + name + ": boolean (default: " + definition.defaultValue() + ")");
                case "TEXT" -> lines.add("- " + name + ": text (default: \"" + definition.defaultValue() + "\")");
                case "INSTANCE_SWAP" -> lines.add("- " + name + ": component swap");
                default -> log.trace("Skipping component property {} of type {}", name, definition.type());
            }
        }
    }

    private static void appendCornerRadius(DesignNode node, List<String> lines) {
        if (node.getCornerRadius() != null && node.getCornerRadius() > 0) {
            lines.add("\n**Border radius:** " + CssValues.px(node.getCornerRadius()));
            return;
        }
        List<Double> radii = node.getRectangleCornerRadii();
        if (radii != null && radii.size() == 4 && radii.stream().anyMatch(radius -> radius > 0)) {
            lines.add("\n**Border radius:** " + CssValues.px(radii.get(0)) + " " + CssValues.px(radii.get(1)) + " "
                    + CssValues.px(radii.get(2)) + " " + CssValues.px(radii.get(3)));
        }
    }

    private static void appendEffects(DesignNode node, List<String> lines) {
        if (node.getEffects() == null) {
            return;
        }
        List<Effect> visible = node.getEffects().stream().filter(Effect::isVisible).toList();
        if (visible.isEmpty()) {
            return;
        }
        lines.add("\n**Effects:**");
        visible.forEach(effect -> lines.add("- " + effect(effect)));
    }

    static String effect(Effect effect) {
        String color = effect.getColor() != null ? " " + CssValues.rgbaToCss(effect.getColor()) : "";
        String x = CssValues.px(effect.getOffset() != null ? effect.getOffset().x() : 0);
        String y = CssValues.px(effect.getOffset() != null ? effect.getOffset().y() : 0);
        String radius = CssValues.px(effect.getRadius());
        EffectType type = effect.getType() != null ? effect.getType() : EffectType.OTHER;
        return switch (type) {
            case DROP_SHADOW -> "Drop shadow: " + x + " " + y + " " + radius
                    + (isNonZero(effect.getSpread()) ? " spread " + CssValues.px(effect.getSpread()) : "") + color;
            case INNER_SHADOW -> "Inner shadow: " + x + " " + y + " " + radius + color;
            case LAYER_BLUR -> "PROGRESSIVE".equals(effect.getBlurType())
                    ? "Progressive blur: " + radius + " (approximate with gradient mask + filter: blur())"
                    : "Blur: " + radius;
            case BACKGROUND_BLUR -> "Background blur: " + radius + " → `backdrop-filter: blur(" + radius + ")`";
            case OTHER -> type.name();
        };
    }

    private void appendImages(DesignNode node, int depth, BoundingBox parentBox, List<String> lines,
                              ResolvedAssets assets) {
        List<Paint> imageFills = node.imageFills();
        if (imageFills.isEmpty()) {
            return;
        }
        BoundingBox box = node.getAbsoluteBoundingBox();
        boolean background = node.hasChildren();
        boolean hero = background && box != null && box.height() >= HERO_MIN_HEIGHT && depth <= 3;
        String label = hero ? "Image (Hero Background)" : background ? "Image (Background)" : "Image";
        lines.add("\n**" + label + ":**");

        for (Paint fill : imageFills) {
            String dimensions = box != null ? " (" + box.sizeLabel() + ")" : "";
            String path = assets.hasImageDownload(fill.getImageRef())
                    ? "/images/" + fill.getImageRef() + ".png"
                    : "placehold.co/" + (box != null ? box.sizeLabel() : "400x300");
            lines.add("- Source: `" + path + "`" + dimensions);
            lines.add("- Element: \"" + node.displayName() + "\"");
            if (fill.getScaleMode() != null) {
                lines.add("- Scale mode: " + fill.getScaleMode() + " → CSS: " + scaleModeCss(fill.getScaleMode(), background));
            }

            String cropPosition = cropPosition(fill.getImageTransform());
            if (cropPosition != null) {
                lines.add(background
                        ? "- Crop position: `background-position: " + cropPosition + "`"
                        : "- Crop position: `object-position: " + cropPosition + "`");
            }
            if (fill.getFilters() != null) {
                String filters = imageFilters(fill.getFilters());
                if (filters != null) {
                    lines.add("- Filters: `filter: " + filters + "`");
                }
            }

            if (background) {
                String position = cropPosition != null ? cropPosition : "center";
                if (hero) {
                    lines.add("- Implementation (HERO): This image MUST fill the entire section. Use `position: relative` "
                            + "on the section container with `min-height: " + Math.round(box.height())
                            + "px`. Apply the image as either:");
                    lines.add("  * CSS background: `background-image: url(" + path + "); background-size: cover; "
                            + "background-position: " + position + "`");
                    lines.add("  * Or absolute `<img>`: `position: absolute; inset: 0; width: 100%; height: 100%; "
                            + "object-fit: cover; object-position: " + position + "; z-index: 0`");
                    lines.add("  * All child content must use `position: relative; z-index: 1` to appear above the image");
                } else {
                    lines.add("- Implementation: Use CSS `background-image: url(" + path + ")` with `background-size: cover; "
                            + "background-position: " + position + "` on container div, or `<img>` with `object-fit: cover; "
                            + "object-position: " + position + "` as absolute-positioned child behind content");
                }
            }

            imageImportanceClassifier.classify(node.getName(), box, parentBox).ifPresent(importance ->
                    lines.add("- **Responsive Priority: " + importance.priority().name() + "** — " + importance.hint()));
        }
    }

    static String scaleModeCss(String scaleMode, boolean background) {
        if (background) {
            return switch (scaleMode) {
                case "FILL" -> "`background-size: cover; background-position: center`";
                case "FIT" -> "`background-size: contain; background-repeat: no-repeat; background-position: center`";
                case "TILE" -> "`background-repeat: repeat; background-size: auto`";
                case "STRETCH" -> "`background-size: 100% 100%`";
                default -> "`background-size: cover`";
            };
        }
        return switch (scaleMode) {
            case "FIT" -> "`object-fit: contain`";
            case "STRETCH" -> "`object-fit: fill`";
            case "TILE" -> "`background-repeat: repeat` (use as CSS background)";
            default -> "`object-fit: cover`";
        };
    }

    /**
     * Anchor of a cropped image as CSS percentages, from the {@code [[a, b, tx], [c, d, ty]]}
     * image transform. {@code null} when the image is not cropped or is centred.
     */
    static String cropPosition(List<List<Double>> transform) {
        if (transform == null || transform.size() < 2 || transform.get(0).size() < 3 || transform.get(1).size() < 3) {
            return null;
        }
        double a = transform.get(0).get(0);
        double tx = transform.get(0).get(2);
        double d = transform.get(1).get(1);
        double ty = transform.get(1).get(2);
        if (a > 0.99 && d > 0.99) {
            return null;
        }
        long x = a < 0.99 ? Math.round(tx / (1 - a) * 100) : 50;
        long y = d < 0.99 ? Math.round(ty / (1 - d) * 100) : 50;
        if (x == 50 && y == 50) {
            return null;
        }
        return clampPercent(x) + "% " + clampPercent(y) + "%";
    }

    private static long clampPercent(long value) {
        return Math.max(0, Math.min(100, value));
    }

    static String imageFilters(ImageFilters filters) {
        List<String> parts = new ArrayList<>();
        if (isNonZero(filters.exposure())) {
            parts.add("brightness(" + CssValues.fixed2(1 + filters.exposure() / 100) + ")");
        }
        if (isNonZero(filters.contrast())) {
            parts.add("contrast(" + CssValues.fixed2(1 + filters.contrast() / 100) + ")");
        }
        if (isNonZero(filters.saturation())) {
            parts.add("saturate(" + CssValues.fixed2(1 + filters.saturation() / 100) + ")");
        }
        if (isNonZero(filters.temperature())) {
            // no CSS temperature filter; hue-rotate is the closest
            parts.add("hue-rotate(" + Math.round(filters.temperature() * 0.3) + "deg)");
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    private static void appendIcon(DesignNode node, List<String> lines, ResolvedAssets assets) {
        String iconFile = assets.exportedIcons().get(node.getId());
        if (iconFile == null) {
            return;
        }
        String source = "/images/icons/" + iconFile;
        lines.add("\n**Icon (SVG):**");
        lines.add("- Source: `" + source + "`");
        lines.add("- Element: \"" + node.displayName() + "\"");
        lines.add("- Implementation: Use `<img src=\"" + source + "\" alt=\"" + node.displayName() + "\" />` or inline SVG");
    }

    private void appendComposite(DesignNode node, int depth, String imagePath, List<String> lines,
                                 ResolvedAssets assets) {
        BoundingBox box = node.getAbsoluteBoundingBox();
        String dimensions = box != null ? " (" + box.sizeLabel() + ")" : "";
        boolean tall = box != null && box.height() >= HERO_MIN_HEIGHT;

        if (assets.compositeTextOverlays().contains(node.getId())) {
            lines.add("\n**Composite Background (visual layers only — text NOT included in this image):**");
            lines.add("- Source: `" + imagePath + "`" + dimensions);
            lines.add("- Element: \"" + node.displayName() + "\"");
            lines.add("- This image contains ONLY the visual layers (mountains, gradients, images). Text content appears "
                    + "BELOW as separate elements — overlay them on top.");
            if (tall) {
                long height = Math.round(box.height());
                lines.add("- Implementation (HERO PARALLAX):");
                lines.add("  * Container: `position: relative; overflow: hidden; min-height: " + height + "px`");
                lines.add("  * Background image: `position: absolute; inset: 0; width: 100%; height: 100%; "
                        + "object-fit: cover; z-index: 0`");
                lines.add("  * CSS: `background-image: url(" + imagePath + "); background-size: cover; "
                        + "background-position: center; min-height: " + height + "px`");
                lines.add("  * ALL text/content below must use `position: relative; z-index: 1` to layer OVER the background");
            } else {
                lines.add("- Implementation: Use as full-bleed `background-image` with `background-size: cover`, "
                        + "all content with `position: relative; z-index: 1`");
            }
            // text was not baked into the image, so it is rendered on its own
            for (DesignNode child : node.visibleChildren()) {
                if (child.getType() == NodeType.TEXT || NodeTrees.containsText(child)) {
                    lines.add(render(child, depth + 1, box, assets));
                }
            }
            return;
        }

        lines.add("\n**Composite Background (rendered as single image):**");
        lines.add("- Source: `" + imagePath + "`" + dimensions);
        lines.add("- Element: \"" + node.displayName() + "\"");
        lines.add("- This image combines multiple overlapping visual layers from the Figma design into a single background.");
        if (tall) {
            long height = Math.round(box.height());
            lines.add("- Implementation (HERO): This image MUST fill the entire section.");
            lines.add("  * CSS: `background-image: url(" + imagePath + "); background-size: cover; "
                    + "background-position: center; min-height: " + height + "px`");
            lines.add("  * Or: `<img src=\"" + imagePath + "\" style=\"position: absolute; inset: 0; width: 100%; "
                    + "height: 100%; object-fit: cover; z-index: 0\" />`");
            lines.add("  * All text/content on top must use `position: relative; z-index: 1`");
        } else {
            lines.add("- Implementation: Use as `background-image` with `background-size: cover` or as an `<img>` "
                    + "with `object-fit: cover`");
        }
    }

    private void appendChildren(DesignNode node, int depth, List<String> lines, ResolvedAssets assets) {
        boolean deep = depth >= SELECTIVE_DEPTH;
        List<DesignNode> children = node.getChildren().stream()
                .filter(DesignNode::isVisible)
                .filter(child -> deep ? carriesContent(child) : isMeaningful(child))
                .toList();

        sequentialPatternDetector.detect(children).ifPresent(pattern -> appendSequentialPattern(pattern, lines));

        boolean stacked = !node.hasAutoLayout() && children.size() > 1;
        BoundingBox box = node.getAbsoluteBoundingBox();
        for (int i = 0; i < children.size(); i++) {
            DesignNode child = children.get(i);
            if (stacked) {
                lines.add(zIndexComment(child, i));
            }
            lines.add(render(child, depth + 1, box, assets));
        }
    }

    private static void appendSequentialPattern(SequentialPattern pattern, List<String> lines) {
        lines.add("\n**Sequential Pattern Detected (" + pattern.type() + "):** " + pattern.description());
        lines.add("- IMPORTANT: These elements follow an ordered sequence. Preserve the exact layout order and "
                + "spacing from the design.");
        lines.add("- Items: " + String.join(" → ", pattern.labels()));
    }

    /**
     * Text always stacks above visual layers; visual layers keep their paint order.
     */
    static String zIndexComment(DesignNode child, int index) {
        if (child.getType() == NodeType.TEXT || NodeTrees.containsText(child)) {
            return "<!-- z-index: 10 (text/content layer — MUST be above all visual layers: "
                    + "use position: relative; z-index: 10) -->";
        }
        String layer = NodeTrees.hasImageFill(child) ? "image" : "visual";
        return "<!-- z-index: " + index + " (" + layer + " layer: " + (index == 0 ? "back" : "middle")
                + " — behind text content) -->";
    }

    private static boolean carriesContent(DesignNode child) {
        if (child.getType() == NodeType.TEXT || NodeTrees.hasImageFill(child)) {
            return true;
        }
        BoundingBox box = child.getAbsoluteBoundingBox();
        return box != null && box.width() >= 50 && box.height() >= 50;
    }

    private static boolean isMeaningful(DesignNode child) {
        NodeType type = child.getType();
        if (STRUCTURAL_TYPES.contains(type)) {
            return true;
        }
        BoundingBox box = child.getAbsoluteBoundingBox();
        if (type == NodeType.RECTANGLE || type == NodeType.ELLIPSE) {
            boolean filled = child.getFills() != null && child.getFills().stream().anyMatch(Paint::isVisible);
            return filled && box != null && box.width() >= 20 && box.height() >= 20;
        }
        if (type == NodeType.VECTOR || type == NodeType.BOOLEAN_OPERATION) {
            return box != null && box.width() >= 8 && box.height() >= 8;
        }
        return false;
    }

    private static Optional<String> layoutSizing(String sizing, boolean width) {
        if ("HUG".equals(sizing)) {
            return Optional.of("fit-content (hug contents)");
        }
        if ("FILL".equals(sizing)) {
            return Optional.of(width ? "100% (fill container)" : "flex: 1 (fill container)");
        }
        return Optional.empty();
    }

    private static String alignment(String value) {
        return ALIGNMENT.getOrDefault(value, value.toLowerCase(Locale.ROOT));
    }

    private static boolean isNonZero(Double value) {
        return value != null && value != 0;
    }

    private static double orZero(Double value) {
        return value != null ? value : 0;
    }
}
