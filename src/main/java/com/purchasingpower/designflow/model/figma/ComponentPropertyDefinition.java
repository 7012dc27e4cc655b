package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Definition of a component property (VARIANT, BOOLEAN, TEXT or INSTANCE_SWAP).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComponentPropertyDefinition(String type, Object defaultValue, List<String> variantOptions) {
}
