package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Image adjustments applied to an IMAGE paint. Values are percentages in the -100..100 range.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageFilters(
        Double exposure,
        Double contrast,
        Double saturation,
        Double temperature,
        Double tint,
        Double highlights,
        Double shadows
) {
}
