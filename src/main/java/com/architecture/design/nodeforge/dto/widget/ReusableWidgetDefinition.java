package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A widget recognised as recurring, with the variations observed across its usages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReusableWidgetDefinition {
    private String name;
    private WidgetNode widget;
    @Builder.Default
    private List<WidgetVariant> variants = new ArrayList<>();
    private int usageCount;
    // Ids of tree nodes that are usages of this widget
    @Builder.Default
    private List<String> instanceIds = new ArrayList<>();

    @JsonIgnore
    public WidgetType getType() {
        return widget != null ? widget.getType() : WidgetType.CUSTOM;
    }
}
