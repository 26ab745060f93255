package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Closed set of widget kinds produced by the widget-tree analysis stage.
 */
public enum WidgetType {
    CONTAINER("container", "Container"),
    ROW("row", "Row"),
    COLUMN("column", "Column"),
    STACK("stack", "Stack"),
    TEXT("text", "Text"),
    IMAGE("image", "Image"),
    BUTTON("button", "Button"),
    CARD("card", "Card"),
    SCAFFOLD("scaffold", "Scaffold"),
    APP_BAR("appbar", "AppBar"),
    CUSTOM("custom", "Custom");

    // Flutter class names emitted by older analyzers
    private static final Map<String, WidgetType> ALIASES = Map.of(
            "elevatedbutton", BUTTON,
            "textbutton", BUTTON,
            "outlinedbutton", BUTTON,
            "cupertinobutton", BUTTON,
            "cupertinonavigationbar", APP_BAR,
            "app_bar", APP_BAR
    );

    private final String value;
    private final String displayName;

    WidgetType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Get the enum value from a tag, case-insensitive. Unknown tags map to {@link #CUSTOM}.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static WidgetType fromString(String value) {
        if (value == null) return CUSTOM;
        String normalized = value.trim().toLowerCase();
        for (WidgetType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return ALIASES.getOrDefault(normalized, CUSTOM);
    }
}
