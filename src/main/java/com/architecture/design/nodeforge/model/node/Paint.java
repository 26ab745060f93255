package com.architecture.design.nodeforge.model.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Paint {
    @Builder.Default
    private PaintType type = PaintType.SOLID;
    private RgbColor color;
    @Builder.Default
    private double opacity = 1;

    public static Paint solid(RgbColor color) {
        return Paint.builder().color(color).build();
    }

    public static Paint solid(RgbColor color, double opacity) {
        return Paint.builder().color(color).opacity(opacity).build();
    }
}
