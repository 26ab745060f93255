package com.architecture.design.nodeforge.dto.widget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A recorded usage variation: partial property and styling overrides of the base widget.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WidgetVariant {
    private String name;
    @Builder.Default
    private WidgetProperties properties = new WidgetProperties();
    private StyleInfo styling;
}
