package com.purchasingpower.designflow.model.design;

/**
 * Flex layout derived from child coordinates of a container without auto-layout.
 *
 * @param gap     average gap between neighbours, {@code null} when not positive
 * @param padding {@code null} when every side is zero
 * @param justify {@code null} when no justification could be told apart
 */
public record InferredLayout(Kind kind, Integer gap, Padding padding, String justify) {

    public enum Kind {
        FLEX_ROW,
        FLEX_COLUMN,
        ABSOLUTE;

        public String cssDirection() {
            return switch (this) {
                case FLEX_ROW -> "row";
                case FLEX_COLUMN -> "column";
                case ABSOLUTE -> "none";
            };
        }
    }

    public record Padding(long top, long right, long bottom, long left) {

        public String css() {
            return top + "px " + right + "px " + bottom + "px " + left + "px";
        }
    }

    public static InferredLayout absolute() {
        return new InferredLayout(Kind.ABSOLUTE, null, null, null);
    }

    public boolean isFlex() {
        return kind != Kind.ABSOLUTE;
    }
}
