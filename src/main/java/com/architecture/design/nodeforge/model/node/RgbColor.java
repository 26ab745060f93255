package com.architecture.design.nodeforge.model.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RGB colour with channels in the 0..1 range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RgbColor {
    private double r;
    private double g;
    private double b;

    public static RgbColor white() {
        return new RgbColor(1, 1, 1);
    }

    public static RgbColor black() {
        return new RgbColor(0, 0, 0);
    }
}
