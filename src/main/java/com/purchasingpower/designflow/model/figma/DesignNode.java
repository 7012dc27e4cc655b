package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One node of a Figma document tree.
 *
 * <p>A node exclusively owns its {@code children}; list order is paint order, so later
 * siblings render on top of earlier ones. Invisible nodes are kept in the tree and every
 * consumer is expected to skip {@code visible == false} on its own.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DesignNode {

    private String id;
    private String name;
    private NodeType type;

    @Builder.Default
    private boolean visible = true;

    private String description;

    private BoundingBox absoluteBoundingBox;

    @Builder.Default
    private List<Paint> fills = new ArrayList<>();

    @Builder.Default
    private List<Paint> strokes = new ArrayList<>();

    private Double strokeWeight;
    private String strokeAlign;
    private List<Double> strokeDashes;
    private StrokeWeights individualStrokeWeights;

    @Builder.Default
    private List<Effect> effects = new ArrayList<>();

    // auto-layout
    private LayoutMode layoutMode;
    private Double itemSpacing;
    private Double counterAxisSpacing;
    private Double paddingTop;
    private Double paddingRight;
    private Double paddingBottom;
    private Double paddingLeft;
    private String primaryAxisAlignItems;
    private String counterAxisAlignItems;
    private String layoutWrap;
    private String layoutSizingHorizontal;
    private String layoutSizingVertical;
    private String layoutAlign;
    private String layoutPositioning;
    private Double layoutGrow;

    private LayoutConstraint constraints;

    private Boolean clipsContent;
    private String scrollBehavior;
    private String overflowDirection;

    private Double minWidth;
    private Double maxWidth;
    private Double minHeight;
    private Double maxHeight;

    private Double cornerRadius;
    private List<Double> rectangleCornerRadii;

    private Double opacity;
    private Double rotation;
    private Boolean isMask;

    // TEXT nodes only
    private String characters;
    private TypeStyle style;
    private Map<String, TypeStyle> styleOverrideTable;

    private Map<String, ComponentPropertyDefinition> componentPropertyDefinitions;

    /** Style ids applied to this node, keyed by style type ("fill", "text", "effect", ...). */
    private Map<String, String> styles;

    @Builder.Default
    private List<DesignNode> children = new ArrayList<>();

    public List<DesignNode> visibleChildren() {
        if (children == null) {
            return List.of();
        }
        return children.stream().filter(DesignNode::isVisible).toList();
    }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    public boolean hasAutoLayout() {
        return layoutMode != null && layoutMode != LayoutMode.NONE;
    }

    public boolean hasVisibleFill(PaintType paintType) {
        return fills != null && fills.stream().anyMatch(fill -> fill.is(paintType));
    }

    public List<Paint> imageFills() {
        if (fills == null) {
            return List.of();
        }
        return fills.stream().filter(Paint::isVisibleImage).toList();
    }

    public String displayName() {
        return name != null ? name : "";
    }
}
