package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;

/**
 * Node kinds of a Figma document tree.
 *
 * <p>Kinds the compiler has no dedicated handling for (stars, polygons, slices, ...)
 * deserialize to {@link #OTHER} so that a new kind never breaks parsing.
 *
 * @since 1.0.0
 */
public enum NodeType {
    DOCUMENT,
    CANVAS,
    FRAME,
    GROUP,
    SECTION,
    COMPONENT,
    COMPONENT_SET,
    INSTANCE,
    TEXT,
    RECTANGLE,
    ELLIPSE,
    VECTOR,
    BOOLEAN_OPERATION,
    LINE,
    OTHER;

    @JsonCreator
    public static NodeType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.name().equals(value))
                .findFirst()
                .orElse(OTHER);
    }

    /**
     * Structural containers whose children form sections of content.
     */
    public boolean isContainer() {
        return switch (this) {
            case FRAME, GROUP, SECTION, COMPONENT, COMPONENT_SET, INSTANCE -> true;
            case DOCUMENT, CANVAS, TEXT, RECTANGLE, ELLIPSE, VECTOR, BOOLEAN_OPERATION, LINE, OTHER -> false;
        };
    }

    /**
     * Primitive shapes that paint pixels by themselves.
     */
    public boolean isShape() {
        return switch (this) {
            case VECTOR, BOOLEAN_OPERATION, RECTANGLE, ELLIPSE -> true;
            case DOCUMENT, CANVAS, FRAME, GROUP, SECTION, COMPONENT, COMPONENT_SET, INSTANCE, TEXT, LINE, OTHER -> false;
        };
    }

    public String displayName() {
        return switch (this) {
            case DOCUMENT -> "Document";
            case CANVAS -> "Page";
            case FRAME -> "Frame";
            case GROUP -> "Group";
            case SECTION -> "Section";
            case COMPONENT -> "Component";
            case COMPONENT_SET -> "Component Set (Variants)";
            case INSTANCE -> "Component Instance";
            case TEXT -> "Text";
            case RECTANGLE -> "Rectangle";
            case ELLIPSE -> "Ellipse";
            case VECTOR -> "Vector";
            case BOOLEAN_OPERATION -> "Boolean Operation";
            case LINE -> "Line";
            case OTHER -> "Other";
        };
    }
}
