package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Published style entry of a file ({@code styleType} is FILL, TEXT, EFFECT or GRID).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StyleMetadata(String key, String name, String styleType, String description) {
}
