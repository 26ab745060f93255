package com.architecture.design.nodeforge.dto.widget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Edge insets for padding/margin.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeInsets {
    private double top;
    private double right;
    private double bottom;
    private double left;

    public static EdgeInsets all(double value) {
        return new EdgeInsets(value, value, value, value);
    }

    public double max() {
        return Math.max(Math.max(top, right), Math.max(bottom, left));
    }
}
