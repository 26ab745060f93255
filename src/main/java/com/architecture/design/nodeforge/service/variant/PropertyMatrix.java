package com.architecture.design.nodeforge.service.variant;

import com.architecture.design.nodeforge.dto.widget.PropertyValue;
import com.architecture.design.nodeforge.dto.widget.ReusableWidgetDefinition;
import com.architecture.design.nodeforge.dto.widget.WidgetProperties;
import com.architecture.design.nodeforge.dto.widget.WidgetVariant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Distinct scalar values per property key across a reusable widget and its recorded variants.
 * Only keys with more than one distinct value are kept; values keep first-seen order.
 */
public final class PropertyMatrix {

    public static final int MAX_COMBINATIONS = 16;

    private final Map<String, List<PropertyValue>> dimensions;

    private PropertyMatrix(Map<String, List<PropertyValue>> dimensions) {
        this.dimensions = dimensions;
    }

    public static PropertyMatrix of(ReusableWidgetDefinition definition) {
        Map<String, Set<PropertyValue>> observed = new LinkedHashMap<>();
        if (definition.getWidget() != null) {
            collect(observed, definition.getWidget().getProperties());
        }
        if (definition.getVariants() != null) {
            for (WidgetVariant variant : definition.getVariants()) {
                collect(observed, variant.getProperties());
            }
        }

        Map<String, List<PropertyValue>> dimensions = new LinkedHashMap<>();
        observed.forEach((key, values) -> {
            if (values.size() > 1) {
                dimensions.put(key, List.copyOf(values));
            }
        });
        return new PropertyMatrix(dimensions);
    }

    private static void collect(Map<String, Set<PropertyValue>> observed, WidgetProperties properties) {
        if (properties == null) {
            return;
        }
        properties.values().forEach((key, value) ->
                observed.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(value));
    }

    public boolean isEmpty() {
        return dimensions.isEmpty();
    }

    public Map<String, List<PropertyValue>> dimensions() {
        return Collections.unmodifiableMap(dimensions);
    }

    /**
     * Cartesian product of the dimensions in key order, stopping after {@link #MAX_COMBINATIONS}.
     */
    public List<Map<String, PropertyValue>> combinations() {
        List<Map<String, PropertyValue>> combinations = new ArrayList<>();
        if (dimensions.isEmpty()) {
            return combinations;
        }
        expand(new ArrayList<>(dimensions.keySet()), 0, new LinkedHashMap<>(), combinations);
        return combinations;
    }

    private void expand(List<String> keys, int index, Map<String, PropertyValue> current,
                        List<Map<String, PropertyValue>> out) {
        if (out.size() >= MAX_COMBINATIONS) {
            return;
        }
        if (index == keys.size()) {
            out.add(new LinkedHashMap<>(current));
            return;
        }
        String key = keys.get(index);
        for (PropertyValue value : dimensions.get(key)) {
            current.put(key, value);
            expand(keys, index + 1, current, out);
            if (out.size() >= MAX_COMBINATIONS) {
                break;
            }
        }
        current.remove(key);
    }
}
