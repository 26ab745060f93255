package com.architecture.design.nodeforge.dto.theme;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved application theme as delivered by the theme extraction stage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThemeModel {
    private String name;
    private ColorScheme colorScheme;
    @Builder.Default
    private Map<String, TextStyleSpec> textTheme = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Double> spacing = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Double> borderRadius = new LinkedHashMap<>();
}
