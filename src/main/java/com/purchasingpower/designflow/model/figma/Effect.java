package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Effect {

    private EffectType type;

    @Builder.Default
    private boolean visible = true;

    private double radius;

    private Rgba color;

    private Vector2 offset;

    private Double spread;

    /** NORMAL or PROGRESSIVE, layer blur only. */
    private String blurType;
}
