package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Widget properties: a few structured members plus an ordered map of scalar values.
 *
 * On the wire this is one flat JSON object; scalar entries sit next to the structured ones.
 */
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class WidgetProperties {

    public static final String WIDTH = "width";
    public static final String HEIGHT = "height";
    public static final String FLEX = "flex";
    public static final String IS_EXPANDED = "isExpanded";
    public static final String IS_POSITIONED = "isPositioned";
    public static final String KEY = "key";
    public static final String DATA = "data";
    public static final String TEXT = "text";
    public static final String TEXT_ALIGN = "textAlign";
    public static final String CLIP_BEHAVIOR = "clipBehavior";
    public static final String ICON = "icon";
    public static final String ICON_DATA = "iconData";
    public static final String STYLE = "style";
    public static final String SIZE = "size";
    public static final String ELEVATION = "elevation";
    public static final String OUTLINED = "outlined";
    public static final String DISABLED = "disabled";
    public static final String LEFT = "left";
    public static final String RIGHT = "right";
    public static final String TOP = "top";
    public static final String BOTTOM = "bottom";

    private EdgeInsets padding;
    private EdgeInsets margin;
    private BoxDecoration decoration;
    private PositionInfo positioned;

    @Getter(lombok.AccessLevel.NONE)
    @Setter(lombok.AccessLevel.NONE)
    private final Map<String, PropertyValue> values = new LinkedHashMap<>();

    @JsonAnySetter
    public void put(String key, PropertyValue value) {
        if (value != null) {
            values.put(key, value);
        }
    }

    public WidgetProperties with(String key, boolean value) {
        values.put(key, PropertyValue.of(value));
        return this;
    }

    public WidgetProperties with(String key, String value) {
        values.put(key, PropertyValue.of(value));
        return this;
    }

    public WidgetProperties with(String key, double value) {
        values.put(key, PropertyValue.of(value));
        return this;
    }

    public WidgetProperties withPadding(EdgeInsets padding) {
        this.padding = padding;
        return this;
    }

    public WidgetProperties withMargin(EdgeInsets margin) {
        this.margin = margin;
        return this;
    }

    /**
     * Scalar entries in insertion order. Read-only view.
     */
    @JsonAnyGetter
    public Map<String, PropertyValue> values() {
        return Collections.unmodifiableMap(values);
    }

    public PropertyValue get(String key) {
        return values.get(key);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Double getNumber(String key) {
        PropertyValue value = values.get(key);
        return value != null && value.isNumber() ? value.asNumber() : null;
    }

    /**
     * String form of any scalar entry, or null when absent.
     */
    public String getText(String key) {
        PropertyValue value = values.get(key);
        return value != null ? value.toString() : null;
    }

    public boolean isSet(String key) {
        PropertyValue value = values.get(key);
        return value != null && value.isTruthy();
    }

    /**
     * Number of configurable entries, structured members included.
     */
    public int size() {
        int count = values.size();
        if (padding != null) count++;
        if (margin != null) count++;
        if (decoration != null) count++;
        if (positioned != null) count++;
        return count;
    }

    public WidgetProperties copy() {
        WidgetProperties copy = new WidgetProperties();
        copy.padding = padding;
        copy.margin = margin;
        copy.decoration = decoration;
        copy.positioned = positioned;
        copy.values.putAll(values);
        return copy;
    }

    /**
     * New property set with {@code overrides} applied on top of this one.
     */
    public WidgetProperties merge(WidgetProperties overrides) {
        WidgetProperties merged = copy();
        if (overrides == null) {
            return merged;
        }
        if (overrides.padding != null) merged.padding = overrides.padding;
        if (overrides.margin != null) merged.margin = overrides.margin;
        if (overrides.decoration != null) merged.decoration = overrides.decoration;
        if (overrides.positioned != null) merged.positioned = overrides.positioned;
        merged.values.putAll(overrides.values);
        return merged;
    }

    public WidgetProperties merge(Map<String, PropertyValue> scalars) {
        WidgetProperties merged = copy();
        merged.values.putAll(scalars);
        return merged;
    }
}
