package com.architecture.design.nodeforge.dto.widget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BorderInfo {
    private Double width;
    private String color;        // hex
    private BorderRadius radius;
    private String style;        // solid, dashed, dotted
}
