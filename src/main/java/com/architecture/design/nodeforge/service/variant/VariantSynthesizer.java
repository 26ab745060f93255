package com.architecture.design.nodeforge.service.variant;

import com.architecture.design.nodeforge.dto.widget.PropertyValue;
import com.architecture.design.nodeforge.dto.widget.ReusableWidgetDefinition;
import com.architecture.design.nodeforge.dto.widget.StyleInfo;
import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import com.architecture.design.nodeforge.dto.widget.WidgetVariant;
import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import com.architecture.design.nodeforge.model.component.ComponentProperty;
import com.architecture.design.nodeforge.model.component.ComponentPropertyKind;
import com.architecture.design.nodeforge.model.component.ComponentVariant;
import com.architecture.design.nodeforge.model.component.VariantGroup;
import com.architecture.design.nodeforge.service.lowering.LoweringContext;
import com.architecture.design.nodeforge.service.lowering.NodeLoweringEngine;
import com.architecture.design.nodeforge.service.lowering.WidgetContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Derives component variants and component properties from a reusable widget and its recorded variants.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VariantSynthesizer {

    public static final String DEFAULT_VARIANT = "Default";
    public static final String VARIANT_KEY = "variant";
    public static final String ICON_PLACEHOLDER = "icon-placeholder";

    private final NodeLoweringEngine loweringEngine;

    // ========================= VARIANTS =========================

    /**
     * One variant per combination of the property matrix, at most {@link PropertyMatrix#MAX_COMBINATIONS}.
     * A definition without varying properties yields a single {@value #DEFAULT_VARIANT} variant.
     */
    public List<ComponentVariant> synthesizeVariants(ReusableWidgetDefinition definition, LoweringContext ctx) {
        WidgetNode base = definition.getWidget();
        if (base == null) {
            log.warn("[variants] Reusable widget {} has no base widget; no variants generated", definition.getName());
            return List.of();
        }

        PropertyMatrix matrix = PropertyMatrix.of(definition);
        if (matrix.isEmpty()) {
            Map<String, PropertyValue> properties = new LinkedHashMap<>();
            properties.put(VARIANT_KEY, PropertyValue.of("default"));
            return List.of(ComponentVariant.builder()
                    .name(DEFAULT_VARIANT)
                    .properties(properties)
                    .nodeSpec(loweringEngine.lower(base, ctx))
                    .build());
        }

        List<ComponentVariant> variants = new ArrayList<>();
        for (Map<String, PropertyValue> combination : matrix.combinations()) {
            variants.add(variantFor(definition, base, combination, ctx));
        }
        log.debug("[variants] {}: {} dimension(s), {} variant(s)",
                definition.getName(), matrix.dimensions().size(), variants.size());
        return variants;
    }

    private ComponentVariant variantFor(ReusableWidgetDefinition definition, WidgetNode base,
                                        Map<String, PropertyValue> combination, LoweringContext ctx) {
        Optional<WidgetVariant> recorded = findRecorded(definition, combination);

        if (recorded.isPresent()) {
            WidgetVariant match = recorded.get();
            StyleInfo baseStyling = base.getStyling() != null ? base.getStyling() : StyleInfo.empty();
            WidgetNode widget = base.toBuilder()
                    .properties(base.getProperties().merge(match.getProperties()))
                    .styling(baseStyling.overlay(match.getStyling()))
                    .build();
            String name = match.getName() != null && !match.getName().isBlank()
                    ? match.getName()
                    : variantName(combination);
            return ComponentVariant.builder()
                    .name(name)
                    .properties(new LinkedHashMap<>(combination))
                    .nodeSpec(loweringEngine.lower(widget, ctx))
                    .build();
        }

        WidgetNode widget = base.toBuilder()
                .properties(base.getProperties().merge(combination))
                .build();
        return ComponentVariant.builder()
                .name(variantName(combination))
                .properties(new LinkedHashMap<>(combination))
                .nodeSpec(loweringEngine.lower(widget, ctx))
                .build();
    }

    private Optional<WidgetVariant> findRecorded(ReusableWidgetDefinition definition,
                                                 Map<String, PropertyValue> combination) {
        if (definition.getVariants() == null) {
            return Optional.empty();
        }
        return definition.getVariants().stream()
                .filter(variant -> variant.getProperties() != null)
                .filter(variant -> combination.entrySet().stream()
                        .allMatch(e -> Objects.equals(variant.getProperties().get(e.getKey()), e.getValue())))
                .findFirst();
    }

    /**
     * Name from the non-{@code variant} entries sorted by key: capitalised values, booleans as
     * {@code Key} or {@code NoKey}.
     */
    public static String variantName(Map<String, PropertyValue> properties) {
        String name = properties.entrySet().stream()
                .filter(e -> !VARIANT_KEY.equals(e.getKey()) && e.getValue() != null)
                .sorted(Map.Entry.comparingByKey())
                .map(e -> {
                    PropertyValue value = e.getValue();
                    if (value.isBool()) {
                        return value.asBoolean() ? capitalize(e.getKey()) : "No" + capitalize(e.getKey());
                    }
                    return capitalize(value.toString());
                })
                .collect(Collectors.joining(" "));
        return name.isEmpty() ? DEFAULT_VARIANT : name;
    }

    // ========================= PROPERTIES =========================

    public List<ComponentProperty> deriveProperties(ReusableWidgetDefinition definition) {
        List<ComponentProperty> properties = new ArrayList<>();

        PropertyMatrix.of(definition).dimensions().forEach((key, values) ->
                properties.add(classify(displayName(key), values)));

        addSemanticProperties(properties, definition);
        addContentProperties(properties, definition.getWidget());
        return properties;
    }

    private ComponentProperty classify(String name, List<PropertyValue> values) {
        if (values.stream().allMatch(PropertyValue::isBool)) {
            return ComponentProperty.builder()
                    .name(name)
                    .kind(ComponentPropertyKind.BOOLEAN)
                    .defaultValue(PropertyValue.of(false))
                    .build();
        }
        if (values.stream().allMatch(PropertyValue::isString)) {
            return ComponentProperty.builder()
                    .name(name)
                    .kind(ComponentPropertyKind.VARIANT)
                    .defaultValue(values.get(0))
                    .variantOptions(values.stream().map(PropertyValue::toString).collect(Collectors.toList()))
                    .build();
        }
        return ComponentProperty.builder()
                .name(name)
                .kind(ComponentPropertyKind.TEXT)
                .defaultValue(PropertyValue.of(values.get(0).toString()))
                .build();
    }

    private void addSemanticProperties(List<ComponentProperty> properties, ReusableWidgetDefinition definition) {
        switch (definition.getType()) {
            case BUTTON -> {
                addVariantIfAbsent(properties, "State", "default", List.of("default", "hover", "pressed", "disabled"));
                addVariantIfAbsent(properties, "Size", "medium", List.of("small", "medium", "large"));
            }
            case CARD -> addVariantIfAbsent(properties, "Elevation", "low", List.of("none", "low", "medium", "high"));
            case TEXT -> addVariantIfAbsent(properties, "Emphasis", "normal", List.of("normal", "bold", "italic"));
            default -> {
            }
        }
    }

    private void addVariantIfAbsent(List<ComponentProperty> properties, String name, String defaultValue,
                                    List<String> options) {
        if (hasProperty(properties, name)) {
            return;
        }
        properties.add(ComponentProperty.builder()
                .name(name)
                .kind(ComponentPropertyKind.VARIANT)
                .defaultValue(PropertyValue.of(defaultValue))
                .variantOptions(options)
                .build());
    }

    private void addContentProperties(List<ComponentProperty> properties, WidgetNode widget) {
        if (widget == null) {
            return;
        }
        if (WidgetContent.hasText(widget) && !hasProperty(properties, "Text")) {
            properties.add(ComponentProperty.builder()
                    .name("Text")
                    .kind(ComponentPropertyKind.TEXT)
                    .defaultValue(PropertyValue.of(
                            WidgetContent.textOf(widget).orElse(NodeLoweringEngine.DEFAULT_TEXT)))
                    .build());
        }
        if (WidgetContent.hasIcon(widget) && !hasProperty(properties, "Icon")) {
            properties.add(ComponentProperty.builder()
                    .name("Icon")
                    .kind(ComponentPropertyKind.INSTANCE_SWAP)
                    .defaultValue(PropertyValue.of(ICON_PLACEHOLDER))
                    .build());
        }
    }

    private static boolean hasProperty(List<ComponentProperty> properties, String name) {
        return properties.stream().anyMatch(p -> name.equals(p.getName()));
    }

    // ========================= ORGANIZATION =========================

    /**
     * Groups variants by the property key they carry most often; the first key wins a tie.
     */
    public List<VariantGroup> organizeVariants(List<ComponentVariant> variants) {
        Optional<String> primary = primaryProperty(variants);
        if (primary.isEmpty()) {
            return List.of(VariantGroup.builder()
                    .name(DEFAULT_VARIANT)
                    .property(VARIANT_KEY)
                    .variants(new ArrayList<>(variants))
                    .build());
        }

        String property = primary.get();
        Map<String, List<ComponentVariant>> byValue = new LinkedHashMap<>();
        for (ComponentVariant variant : variants) {
            PropertyValue value = variant.getProperties().get(property);
            String key = value != null ? value.toString() : "default";
            byValue.computeIfAbsent(key, k -> new ArrayList<>()).add(variant);
        }

        List<VariantGroup> groups = new ArrayList<>();
        byValue.forEach((value, members) -> groups.add(VariantGroup.builder()
                .name(capitalize(value))
                .property(property)
                .variants(members)
                .build()));
        return groups;
    }

    private Optional<String> primaryProperty(List<ComponentVariant> variants) {
        Map<String, Integer> frequency = new LinkedHashMap<>();
        for (ComponentVariant variant : variants) {
            for (String key : variant.getProperties().keySet()) {
                if (!VARIANT_KEY.equals(key)) {
                    frequency.merge(key, 1, Integer::sum);
                }
            }
        }

        String primary = null;
        int max = 0;
        for (Map.Entry<String, Integer> entry : frequency.entrySet()) {
            if (entry.getValue() > max) {
                max = entry.getValue();
                primary = entry.getKey();
            }
        }
        return Optional.ofNullable(primary);
    }

    /**
     * Variant of {@code component} whose properties match every entry of {@code selection}.
     */
    public Optional<ComponentVariant> findVariant(ComponentDefinition component, Map<String, PropertyValue> selection) {
        if (component.getVariants() == null) {
            return Optional.empty();
        }
        return component.getVariants().stream()
                .filter(variant -> selection.entrySet().stream()
                        .allMatch(e -> Objects.equals(variant.getProperties().get(e.getKey()), e.getValue())))
                .findFirst();
    }

    // ========================= NAMING =========================

    /**
     * {@code isExpanded} becomes {@code Is Expanded}.
     */
    public static String displayName(String key) {
        String spaced = key.replaceAll("([A-Z])", " $1").trim();
        return capitalize(spaced);
    }

    static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
