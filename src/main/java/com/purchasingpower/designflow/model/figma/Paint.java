package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A fill or stroke paint. Which fields are populated depends on {@link #type}:
 * SOLID uses {@code color}, gradients use {@code gradientStops}, IMAGE uses
 * {@code imageRef}, {@code scaleMode}, {@code imageTransform} and {@code filters}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Paint {

    private PaintType type;

    @Builder.Default
    private boolean visible = true;

    private Double opacity;

    private Rgba color;

    @Builder.Default
    private List<GradientStop> gradientStops = new ArrayList<>();

    private String imageRef;

    private String scaleMode;

    /** 2x3 affine matrix {@code [[a, b, tx], [c, d, ty]]}. */
    private List<List<Double>> imageTransform;

    private ImageFilters filters;

    public boolean is(PaintType candidate) {
        return visible && type == candidate;
    }

    public boolean isVisibleImage() {
        return visible && type == PaintType.IMAGE && imageRef != null && !imageRef.isEmpty();
    }
}
