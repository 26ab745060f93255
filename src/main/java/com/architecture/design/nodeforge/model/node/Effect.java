package com.architecture.design.nodeforge.model.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Effect {
    @Builder.Default
    private EffectType type = EffectType.DROP_SHADOW;
    private RgbColor color;
    private Vector offset;
    private double radius;
    private double spread;
    @Builder.Default
    private boolean visible = true;
    @Builder.Default
    private String blendMode = "NORMAL";
}
