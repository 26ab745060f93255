package com.architecture.design.nodeforge.dto.widget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One colour usage on a widget. {@code value} is always the literal hex, even for theme
 * references, so it can serve as a fallback.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ColorInfo {
    private String property;          // backgroundColor, color, borderColor
    private String value;
    private boolean themeReference;
    private String themePath;         // e.g. colorScheme.primary
}
