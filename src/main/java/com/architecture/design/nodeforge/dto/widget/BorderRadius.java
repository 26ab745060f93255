package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BorderRadius {
    private double topLeft;
    private double topRight;
    private double bottomLeft;
    private double bottomRight;

    public static BorderRadius circular(double radius) {
        return new BorderRadius(radius, radius, radius, radius);
    }

    @JsonIgnore
    public boolean isUniform() {
        return topLeft == topRight && topRight == bottomLeft && bottomLeft == bottomRight;
    }
}
