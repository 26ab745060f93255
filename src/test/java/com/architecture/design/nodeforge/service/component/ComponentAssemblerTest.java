package com.architecture.design.nodeforge.service.component;

import com.architecture.design.nodeforge.dto.widget.ColorInfo;
import com.architecture.design.nodeforge.dto.widget.PropertyValue;
import com.architecture.design.nodeforge.dto.widget.ReusableWidgetDefinition;
import com.architecture.design.nodeforge.dto.widget.StyleInfo;
import com.architecture.design.nodeforge.dto.widget.TypographyInfo;
import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import com.architecture.design.nodeforge.dto.widget.WidgetProperties;
import com.architecture.design.nodeforge.dto.widget.WidgetType;
import com.architecture.design.nodeforge.dto.widget.WidgetVariant;
import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import com.architecture.design.nodeforge.model.component.ComponentProperty;
import com.architecture.design.nodeforge.model.component.ComponentPropertyKind;
import com.architecture.design.nodeforge.model.component.ComponentVariant;
import com.architecture.design.nodeforge.model.node.TargetNodeSpec;
import com.architecture.design.nodeforge.model.node.TargetNodeType;
import com.architecture.design.nodeforge.service.lowering.LoweringContext;
import com.architecture.design.nodeforge.service.variant.VariantSynthesizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComponentAssemblerTest {

    @Mock
    private VariantSynthesizer variantSynthesizer;

    @InjectMocks
    private ComponentAssembler assembler;

    // ========================= NAMING =========================

    @Test
    void namesButtonByStyleBeforeSize() {
        ReusableWidgetDefinition definition = definition(WidgetType.BUTTON, "ElevatedButton",
                new WidgetProperties().with(WidgetProperties.STYLE, "primary").with(WidgetProperties.SIZE, "large"));

        assertThat(assembler.componentName(definition)).isEqualTo("Button / Primary");
    }

    @Test
    void namesButtonBySize_whenStyleUnknown() {
        ReusableWidgetDefinition definition = definition(WidgetType.BUTTON, "ElevatedButton",
                new WidgetProperties().with(WidgetProperties.STYLE, "ghost").with(WidgetProperties.SIZE, "small"));

        assertThat(assembler.componentName(definition)).isEqualTo("Button / Small");
    }

    @Test
    void namesElevatedCard() {
        ReusableWidgetDefinition definition = definition(WidgetType.CARD, "Card",
                new WidgetProperties().with(WidgetProperties.ELEVATION, 4));

        assertThat(assembler.componentName(definition)).isEqualTo("Card / Elevated");
    }

    @Test
    void namesTextHeading_whenFontSizeAboveTwenty() {
        assertThat(assembler.componentName(textDefinition(24d, "400"))).isEqualTo("Text / Heading");
        assertThat(assembler.componentName(textDefinition(14d, "w700"))).isEqualTo("Text / Bold");
        assertThat(assembler.componentName(textDefinition(20d, "400"))).isEqualTo("Text Component");
    }

    @Test
    void sanitizesDeclaredName_whenNoContextApplies() {
        ReusableWidgetDefinition definition = definition(WidgetType.CONTAINER, "Profile  Tile!*", new WidgetProperties());

        assertThat(assembler.componentName(definition)).isEqualTo("Profile Tile");
    }

    @Test
    void fallsBackToTypeComponent_whenDeclaredNameIsTheType() {
        ReusableWidgetDefinition definition = definition(WidgetType.CONTAINER, "container", new WidgetProperties());

        assertThat(assembler.componentName(definition)).isEqualTo("Container Component");
    }

    // ========================= COMPONENTS =========================

    @Test
    void buildsAndRegistersComponent() {
        ReusableWidgetDefinition definition = definition(WidgetType.BUTTON, "ElevatedButton",
                new WidgetProperties().with(WidgetProperties.STYLE, "primary"));
        definition.setUsageCount(4);
        definition.setVariants(List.of(WidgetVariant.builder().name("A").build(), WidgetVariant.builder().name("B").build()));
        List<ComponentProperty> properties = List.of(ComponentProperty.builder()
                .name("Style").kind(ComponentPropertyKind.VARIANT).build());
        List<ComponentVariant> variants = List.of(ComponentVariant.builder().name("Primary").build());
        when(variantSynthesizer.deriveProperties(definition)).thenReturn(properties);
        when(variantSynthesizer.synthesizeVariants(eq(definition), any(LoweringContext.class))).thenReturn(variants);
        LoweringContext ctx = new LoweringContext();

        ComponentDefinition component = assembler.buildComponent(definition, ctx);

        assertThat(component.getId()).isEqualTo("component-button---primary-1");
        assertThat(component.getName()).isEqualTo("Button / Primary");
        assertThat(component.getDescription()).isEqualTo("Component generated from Button widget. "
                + "Used 4 times in the codebase. Has 2 variants. Contains 1 configurable properties.");
        assertThat(component.getProperties()).isSameAs(properties);
        assertThat(component.getVariants()).isSameAs(variants);
        assertThat(ctx.findComponent("Button / Primary")).contains(component);
        assertThat(ctx.findComponentById(component.getId())).contains(component);
    }

    @Test
    void omitsVariantAndPropertyCounts_whenNone() {
        ReusableWidgetDefinition definition = definition(WidgetType.IMAGE, "image", new WidgetProperties());
        definition.setUsageCount(2);
        when(variantSynthesizer.deriveProperties(definition)).thenReturn(List.of());
        when(variantSynthesizer.synthesizeVariants(eq(definition), any(LoweringContext.class))).thenReturn(List.of());

        ComponentDefinition component = assembler.buildComponent(definition);

        assertThat(component.getDescription())
                .isEqualTo("Component generated from Image widget. Used 2 times in the codebase.");
    }

    // ========================= INSTANCES =========================

    @Test
    void overridesOnlyLiteralsThatDifferFromComponent() {
        LoweringContext ctx = new LoweringContext();
        ctx.registerComponent(ComponentDefinition.builder()
                .id("component-button---primary-1")
                .name("Button / Primary")
                .overrideDefaults(Map.of(
                        ComponentAssembler.TEXT_OVERRIDE, PropertyValue.of("Save"),
                        ComponentAssembler.WIDTH_OVERRIDE, PropertyValue.of(100)))
                .build());
        WidgetNode usage = button("Cancel", new WidgetProperties()
                .with(WidgetProperties.WIDTH, 100)
                .with(WidgetProperties.FLEX, 2));

        TargetNodeSpec instance = assembler.buildInstance(usage, "Button / Primary", ctx);

        assertThat(instance.getType()).isEqualTo(TargetNodeType.INSTANCE);
        assertThat(instance.getId()).isEqualTo("node_1");
        assertThat(instance.getName()).isEqualTo("Button / Primary \"Cancel\"");
        assertThat(instance.getProperties().getComponentId()).isEqualTo("component-button---primary-1");
        assertThat(instance.getProperties().getOverrides())
                .containsExactly(Map.entry(ComponentAssembler.TEXT_OVERRIDE, PropertyValue.of("Cancel")));
        assertThat(instance.getProperties().getWidth()).isEqualTo(100d);
        assertThat(instance.getProperties().getLayoutGrow()).isEqualTo(2d);
        assertThat(instance.getProperties().getVisible()).isTrue();
        assertThat(instance.getProperties().getLocked()).isFalse();
    }

    @Test
    void inheritsThemeBoundColours() {
        WidgetNode usage = WidgetNode.builder()
                .type(WidgetType.CONTAINER)
                .styling(StyleInfo.builder()
                        .colors(List.of(
                                ColorInfo.builder().property("backgroundColor").value("#6200EE")
                                        .themeReference(true).themePath("colorScheme.primary").build(),
                                ColorInfo.builder().property("borderColor").value("#FF0000").build()))
                        .build())
                .build();

        TargetNodeSpec instance = assembler.buildInstance(usage, "Card Component");

        assertThat(instance.getProperties().getOverrides())
                .containsOnlyKeys(ComponentAssembler.COLOR_OVERRIDE_PREFIX + "borderColor");
        assertThat(instance.getProperties().getComponentId()).isEqualTo("component-card-component-1");
        assertThat(instance.getProperties().getLayoutGrow()).isNull();
    }

    @Test
    void labelsInstanceWithKey_whenNoText() {
        WidgetNode usage = WidgetNode.builder()
                .type(WidgetType.CARD)
                .properties(new WidgetProperties().with(WidgetProperties.KEY, "profileCard"))
                .build();

        TargetNodeSpec instance = assembler.buildInstance(usage, "Card / Elevated");

        assertThat(instance.getName()).isEqualTo("Card / Elevated (profileCard)");
    }

    private static ReusableWidgetDefinition definition(WidgetType type, String name, WidgetProperties properties) {
        return ReusableWidgetDefinition.builder()
                .name(name)
                .widget(WidgetNode.builder().type(type).properties(properties).build())
                .build();
    }

    private static ReusableWidgetDefinition textDefinition(Double fontSize, String fontWeight) {
        WidgetNode text = WidgetNode.builder()
                .type(WidgetType.TEXT)
                .properties(new WidgetProperties().with(WidgetProperties.DATA, "Hello"))
                .styling(StyleInfo.builder()
                        .typography(TypographyInfo.builder().fontSize(fontSize).fontWeight(fontWeight).build())
                        .build())
                .build();
        return ReusableWidgetDefinition.builder().name("Text").widget(text).build();
    }

    private static WidgetNode button(String label, WidgetProperties properties) {
        return WidgetNode.builder()
                .type(WidgetType.BUTTON)
                .properties(properties)
                .children(List.of(WidgetNode.builder()
                        .type(WidgetType.TEXT)
                        .properties(new WidgetProperties().with(WidgetProperties.DATA, label))
                        .build()))
                .build();
    }
}
