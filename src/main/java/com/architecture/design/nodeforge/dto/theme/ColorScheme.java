package com.architecture.design.nodeforge.dto.theme;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Material-style colour scheme, hex strings. The last four roles are optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColorScheme {
    private String primary;
    private String onPrimary;
    private String secondary;
    private String onSecondary;
    private String error;
    private String onError;
    private String background;
    private String onBackground;
    private String surface;
    private String onSurface;
    private String surfaceVariant;
    private String onSurfaceVariant;
    private String outline;
    private String shadow;

    /**
     * Present colour roles keyed by field name, in declaration order.
     */
    public Map<String, String> roles() {
        Map<String, String> roles = new LinkedHashMap<>();
        putIfPresent(roles, "primary", primary);
        putIfPresent(roles, "onPrimary", onPrimary);
        putIfPresent(roles, "secondary", secondary);
        putIfPresent(roles, "onSecondary", onSecondary);
        putIfPresent(roles, "error", error);
        putIfPresent(roles, "onError", onError);
        putIfPresent(roles, "background", background);
        putIfPresent(roles, "onBackground", onBackground);
        putIfPresent(roles, "surface", surface);
        putIfPresent(roles, "onSurface", onSurface);
        putIfPresent(roles, "surfaceVariant", surfaceVariant);
        putIfPresent(roles, "onSurfaceVariant", onSurfaceVariant);
        putIfPresent(roles, "outline", outline);
        putIfPresent(roles, "shadow", shadow);
        return roles;
    }

    private static void putIfPresent(Map<String, String> roles, String name, String value) {
        if (value != null && !value.isBlank()) {
            roles.put(name, value);
        }
    }
}
