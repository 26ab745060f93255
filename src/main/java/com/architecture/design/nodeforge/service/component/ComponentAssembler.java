package com.architecture.design.nodeforge.service.component;

import com.architecture.design.nodeforge.dto.widget.ColorInfo;
import com.architecture.design.nodeforge.dto.widget.PropertyValue;
import com.architecture.design.nodeforge.dto.widget.ReusableWidgetDefinition;
import com.architecture.design.nodeforge.dto.widget.StyleInfo;
import com.architecture.design.nodeforge.dto.widget.TypographyInfo;
import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import com.architecture.design.nodeforge.dto.widget.WidgetProperties;
import com.architecture.design.nodeforge.dto.widget.WidgetType;
import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import com.architecture.design.nodeforge.model.component.ComponentProperty;
import com.architecture.design.nodeforge.model.component.ComponentVariant;
import com.architecture.design.nodeforge.model.node.NodeProperties;
import com.architecture.design.nodeforge.model.node.TargetNodeSpec;
import com.architecture.design.nodeforge.model.node.TargetNodeType;
import com.architecture.design.nodeforge.service.lowering.LoweringContext;
import com.architecture.design.nodeforge.service.lowering.WidgetContent;
import com.architecture.design.nodeforge.service.style.FontWeights;
import com.architecture.design.nodeforge.service.variant.VariantSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds component definitions from reusable widgets and instance nodes from their usages.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ComponentAssembler {

    public static final String TEXT_OVERRIDE = "Text";
    public static final String WIDTH_OVERRIDE = "Width";
    public static final String HEIGHT_OVERRIDE = "Height";
    public static final String COLOR_OVERRIDE_PREFIX = "Color_";

    private static final double HEADING_FONT_SIZE = 20;

    private final VariantSynthesizer variantSynthesizer;

    // ========================= COMPONENTS =========================

    public ComponentDefinition buildComponent(ReusableWidgetDefinition definition, LoweringContext ctx) {
        String name = componentName(definition);
        List<ComponentProperty> properties = variantSynthesizer.deriveProperties(definition);
        List<ComponentVariant> variants = variantSynthesizer.synthesizeVariants(definition, ctx);

        ComponentDefinition component = ComponentDefinition.builder()
                .id(ctx.nextComponentId(name))
                .name(name)
                .description(describe(definition))
                .variants(variants)
                .properties(properties)
                .overrideDefaults(definition.getWidget() != null
                        ? literalOverrides(definition.getWidget())
                        : new LinkedHashMap<>())
                .build();

        ctx.registerComponent(component);
        log.info("[components] Built {} ({}) with {} variant(s) and {} propert(ies)",
                component.getName(), component.getId(), variants.size(), properties.size());
        return component;
    }

    public ComponentDefinition buildComponent(ReusableWidgetDefinition definition) {
        return buildComponent(definition, new LoweringContext());
    }

    /**
     * {@code "{Type} / {Context}"} when a usage context can be inferred, else the sanitized declared
     * name when it differs from the type, else {@code "{Type} Component"}.
     */
    public String componentName(ReusableWidgetDefinition definition) {
        String typeName = definition.getType().getDisplayName();
        String context = usageContext(definition);
        if (context != null) {
            return typeName + " / " + context;
        }

        String declared = definition.getName();
        if (declared != null && !declared.equalsIgnoreCase(typeName)) {
            String sanitized = sanitize(declared);
            if (!sanitized.isEmpty()) {
                return sanitized;
            }
        }
        return typeName + " Component";
    }

    private String usageContext(ReusableWidgetDefinition definition) {
        WidgetNode widget = definition.getWidget();
        if (widget == null) {
            return null;
        }
        WidgetProperties props = widget.getProperties();

        if (definition.getType() == WidgetType.BUTTON) {
            String style = props.getText(WidgetProperties.STYLE);
            String size = props.getText(WidgetProperties.SIZE);
            if ("primary".equals(style)) return "Primary";
            if ("secondary".equals(style)) return "Secondary";
            if ("large".equals(size)) return "Large";
            if ("small".equals(size)) return "Small";
        }

        if (definition.getType() == WidgetType.CARD) {
            if (props.isSet(WidgetProperties.ELEVATION)) return "Elevated";
            if (props.isSet(WidgetProperties.OUTLINED)) return "Outlined";
        }

        if (definition.getType() == WidgetType.TEXT && widget.getStyling() != null) {
            TypographyInfo typography = widget.getStyling().getTypography();
            if (typography != null) {
                if (typography.getFontSize() != null && typography.getFontSize() > HEADING_FONT_SIZE) {
                    return "Heading";
                }
                if (FontWeights.isBold(typography.getFontWeight())) {
                    return "Bold";
                }
            }
        }
        return null;
    }

    static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9\\s/\\-_]", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private String describe(ReusableWidgetDefinition definition) {
        StringBuilder description = new StringBuilder()
                .append("Component generated from ").append(definition.getType().getDisplayName()).append(" widget.")
                .append(" Used ").append(definition.getUsageCount()).append(" times in the codebase.");

        int variantCount = definition.getVariants() != null ? definition.getVariants().size() : 0;
        if (variantCount > 0) {
            description.append(" Has ").append(variantCount).append(" variants.");
        }

        int propertyCount = definition.getWidget() != null ? definition.getWidget().getProperties().size() : 0;
        if (propertyCount > 0) {
            description.append(" Contains ").append(propertyCount).append(" configurable properties.");
        }
        return description.toString();
    }

    // ========================= INSTANCES =========================

    /**
     * Instance node for one usage of {@code componentName}. Overrides only carry the usage's literal
     * text, colours and size where they differ from the component's; theme-bound colours are inherited.
     */
    public TargetNodeSpec buildInstance(WidgetNode usage, String componentName, LoweringContext ctx) {
        ComponentDefinition component = ctx.findComponent(componentName).orElse(null);
        if (component == null) {
            log.debug("[components] No component registered as {}; instance gets a fresh id", componentName);
        }
        return instance(usage, componentName, component, ctx);
    }

    /**
     * Instance node for one usage of an already built component.
     */
    public TargetNodeSpec buildInstance(WidgetNode usage, ComponentDefinition component, LoweringContext ctx) {
        return instance(usage, component.getName(), component, ctx);
    }

    private TargetNodeSpec instance(WidgetNode usage, String componentName, ComponentDefinition component,
                                    LoweringContext ctx) {
        Map<String, PropertyValue> overrides = new LinkedHashMap<>();
        Map<String, PropertyValue> defaults = component != null ? component.getOverrideDefaults() : Map.of();
        literalOverrides(usage).forEach((key, value) -> {
            if (!Objects.equals(defaults.get(key), value)) {
                overrides.put(key, value);
            }
        });

        WidgetProperties props = usage.getProperties();
        NodeProperties properties = NodeProperties.builder()
                .componentId(component != null ? component.getId() : ctx.nextComponentId(componentName))
                .overrides(overrides)
                .width(props.getNumber(WidgetProperties.WIDTH))
                .height(props.getNumber(WidgetProperties.HEIGHT))
                .visible(true)
                .locked(false)
                .build();
        Double flex = props.getNumber(WidgetProperties.FLEX);
        if (flex != null && flex > 0) {
            properties.setLayoutGrow(flex);
        }

        return TargetNodeSpec.builder()
                .id(ctx.nextNodeId())
                .type(TargetNodeType.INSTANCE)
                .name(WidgetContent.label(componentName,
                        WidgetContent.textOf(usage).orElse(null), WidgetContent.keyOf(usage)))
                .properties(properties)
                .build();
    }

    public TargetNodeSpec buildInstance(WidgetNode usage, String componentName) {
        return buildInstance(usage, componentName, new LoweringContext());
    }

    private Map<String, PropertyValue> literalOverrides(WidgetNode widget) {
        Map<String, PropertyValue> values = new LinkedHashMap<>();

        WidgetContent.textOf(widget).ifPresent(text -> values.put(TEXT_OVERRIDE, PropertyValue.of(text)));

        StyleInfo styling = widget.getStyling();
        if (styling != null) {
            for (ColorInfo color : styling.getColors()) {
                if (!color.isThemeReference() && color.getValue() != null) {
                    values.put(COLOR_OVERRIDE_PREFIX + color.getProperty(), PropertyValue.of(color.getValue()));
                }
            }
        }

        WidgetProperties props = widget.getProperties();
        Double width = props.getNumber(WidgetProperties.WIDTH);
        Double height = props.getNumber(WidgetProperties.HEIGHT);
        if (width != null) values.put(WIDTH_OVERRIDE, PropertyValue.of(width));
        if (height != null) values.put(HEIGHT_OVERRIDE, PropertyValue.of(height));
        return values;
    }
}
