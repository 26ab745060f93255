package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Abstract widget tree node, as produced by the widget-tree analysis stage.
 * Treated as immutable by every pipeline stage; derived widgets are built with {@code toBuilder()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WidgetNode {
    private String id;
    private WidgetType type;
    @Builder.Default
    private WidgetProperties properties = new WidgetProperties();
    @Builder.Default
    private List<WidgetNode> children = new ArrayList<>();
    @Builder.Default
    private StyleInfo styling = new StyleInfo();
    private LayoutInfo layout;
    private PositionInfo position;

    public WidgetType getType() {
        return type != null ? type : WidgetType.CUSTOM;
    }

    @JsonIgnore
    public boolean isStack() {
        return type == WidgetType.STACK || (layout != null && layout.getType() == LayoutType.STACK);
    }

    /**
     * Direct literal text content ({@code data} or {@code text}), or null.
     */
    public String literalText() {
        if (properties == null) return null;
        if (properties.isSet(WidgetProperties.DATA)) return properties.getText(WidgetProperties.DATA);
        if (properties.isSet(WidgetProperties.TEXT)) return properties.getText(WidgetProperties.TEXT);
        return null;
    }
}
