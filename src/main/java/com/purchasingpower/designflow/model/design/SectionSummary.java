package com.purchasingpower.designflow.model.design;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Digest of one top-level frame, the input of the implementation plan.
 */
@Value
@Builder
public class SectionSummary {

    String nodeId;
    String name;
    Dimensions dimensions;
    SectionLayout layout;
    String background;
    @Builder.Default
    List<SectionImage> images = List.of();
    CompositeImage compositeImage;
    @Builder.Default
    List<String> icons = List.of();
    @Builder.Default
    List<TypographyUsage> typography = List.of();
    String borderRadius;
    String overflow;
    String scrollBehavior;
    @Builder.Default
    List<String> effects = List.of();
    String border;
    int childCount;
    @Builder.Default
    List<NotableComponent> notableComponents = List.of();

    public record Dimensions(long width, long height) {
    }

    /**
     * Explicit auto-layout of the section; {@code direction} is {@code horizontal} or {@code vertical}.
     */
    public record SectionLayout(
            String direction,
            Double gap,
            Double rowGap,
            String padding,
            String mainAlign,
            String crossAlign,
            boolean wrap
    ) {
    }

    /**
     * @param dimensions "WxH", empty when the node has no bounding box
     */
    public record SectionImage(String path, String scaleMode, boolean hero, String dimensions) {
    }

    public record CompositeImage(String path, String dimensions, boolean hasTextOverlays) {
    }

    public record TypographyUsage(String font, double size, double weight, Long lineHeight, String color,
                                  String usage) {
    }
}
