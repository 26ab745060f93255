package com.architecture.design.nodeforge.dto.theme;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextStyleSpec {
    private Double fontSize;
    private String fontWeight;
    private String fontFamily;
    private Double letterSpacing;
    private Double height;       // line height multiplier
}
