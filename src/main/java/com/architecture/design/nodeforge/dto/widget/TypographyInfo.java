package com.architecture.design.nodeforge.dto.widget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TypographyInfo {
    private Double fontSize;
    private String fontWeight;       // "100".."900", "normal", "bold"
    private String fontFamily;
    private Double letterSpacing;
    private Double lineHeight;       // multiplier of the font size
    private String color;
    private boolean themeReference;
    private String themePath;        // e.g. textTheme.bodyLarge
}
