package com.architecture.design.nodeforge.service;

import com.architecture.design.nodeforge.dto.ConversionRequest;
import com.architecture.design.nodeforge.dto.ConversionResponse;
import com.architecture.design.nodeforge.dto.ConversionStats;
import com.architecture.design.nodeforge.dto.style.StyleMappingConfig;
import com.architecture.design.nodeforge.dto.theme.ColorScheme;
import com.architecture.design.nodeforge.dto.theme.ThemeModel;
import com.architecture.design.nodeforge.dto.widget.ColorInfo;
import com.architecture.design.nodeforge.dto.widget.ReusableWidgetDefinition;
import com.architecture.design.nodeforge.dto.widget.StyleInfo;
import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import com.architecture.design.nodeforge.dto.widget.WidgetProperties;
import com.architecture.design.nodeforge.dto.widget.WidgetType;
import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import com.architecture.design.nodeforge.model.library.ComponentCategory;
import com.architecture.design.nodeforge.model.node.TargetNodeSpec;
import com.architecture.design.nodeforge.model.node.TargetNodeType;
import com.architecture.design.nodeforge.service.component.ComponentAssembler;
import com.architecture.design.nodeforge.service.library.LibraryOrganizer;
import com.architecture.design.nodeforge.service.lowering.AutoLayoutMapper;
import com.architecture.design.nodeforge.service.lowering.NodeLoweringEngine;
import com.architecture.design.nodeforge.service.lowering.StackPositioner;
import com.architecture.design.nodeforge.service.variable.VariableCatalogBuilder;
import com.architecture.design.nodeforge.service.variant.VariantSynthesizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversionServiceTest {

    private ConversionService conversionService;

    @BeforeEach
    void setUp() {
        NodeLoweringEngine engine = new NodeLoweringEngine(new AutoLayoutMapper(), new StackPositioner());
        conversionService = new ConversionService(
                new VariableCatalogBuilder(),
                engine,
                new ComponentAssembler(new VariantSynthesizer(engine)),
                new LibraryOrganizer(),
                StyleMappingConfig.defaults());
    }

    @Test
    void convertsTreeWithBindingsInstancesAndLibrary() {
        ConversionResponse response = conversionService.convert(request(StyleMappingConfig.defaults(), "colorScheme.primary"));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getComponents()).singleElement()
                .extracting(ComponentDefinition::getName).isEqualTo("Button / Primary");
        String componentId = response.getComponents().get(0).getId();

        TargetNodeSpec root = response.getRoot();
        assertThat(root.getChildren()).extracting(TargetNodeSpec::getType)
                .containsExactly(TargetNodeType.TEXT, TargetNodeType.INSTANCE, TargetNodeType.FRAME);

        TargetNodeSpec text = root.getChildren().get(0);
        assertThat(text.getVariables()).singleElement().satisfies(binding -> {
            assertThat(binding.getTargetProperty()).isEqualTo("fills");
            assertThat(binding.getVariableId()).isEqualTo("Default Colors-primary");
        });

        TargetNodeSpec instance = root.getChildren().get(1);
        assertThat(instance.getName()).isEqualTo("Button / Primary \"Save\"");
        assertThat(instance.getProperties().getComponentId()).isEqualTo(componentId);
        assertThat(instance.getProperties().getOverrides()).isEmpty();

        assertThat(response.getVariableCollections()).hasSize(4);
        assertThat(response.getMultiModeVariableCollections()).isEmpty();
        assertThat(response.getLibrary().getCategories()).extracting(ComponentCategory::getName)
                .containsExactly(LibraryOrganizer.BUTTONS);
        assertThat(response.getPages().getPages()).hasSize(3);
    }

    @Test
    void countsWidgetsInstancesAndUnsupported() {
        ConversionStats stats = conversionService.convert(request(StyleMappingConfig.defaults(), "colorScheme.primary"))
                .getStats();

        assertThat(stats.getWidgetsFound()).isEqualTo(5);
        assertThat(stats.getWidgetsConverted()).isEqualTo(5);
        assertThat(stats.getComponentsCreated()).isEqualTo(1);
        assertThat(stats.getInstancesCreated()).isEqualTo(1);
        assertThat(stats.getUnsupportedWidgets()).containsExactly("c1");
        assertThat(stats.getFramesCreated()).isEqualTo(2);
        assertThat(stats.getTextNodesCreated()).isEqualTo(1);
        assertThat(stats.getVariablesCreated()).isPositive();
        assertThat(stats.getErrors()).isZero();
        assertThat(stats.successRate()).isEqualTo(100.0);
    }

    @Test
    void reportsFailure_whenStrictModeMissesToken() {
        StyleMappingConfig strict = StyleMappingConfig.builder().fallbackToDirectValues(false).build();

        ConversionResponse response = conversionService.convert(request(strict, "colorScheme.tertiary"));

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getStats().getErrors()).isEqualTo(1);
        assertThat(response.getStats().getWidgetsConverted()).isEqualTo(4);
        assertThat(response.getStyleReports())
                .filteredOn(report -> !report.getResult().isSuccess())
                .singleElement()
                .satisfies(report -> assertThat(report.getResult().getErrors()).singleElement().asString()
                        .contains("colorScheme.tertiary"));
    }

    @Test
    void fallsBackToLiterals_whenNoThemeSupplied() {
        ConversionRequest request = request(StyleMappingConfig.defaults(), "colorScheme.primary");
        request.setThemes(List.of());

        ConversionResponse response = conversionService.convert(request);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getVariableCollections()).isEmpty();
        assertThat(response.getStats().getVariablesCreated()).isZero();
        assertThat(response.getStats().getWarnings()).isEqualTo(1);
        assertThat(response.getRoot().getChildren().get(0).getVariables()).isEmpty();
    }

    @Test
    void usesDefaultConfig_whenRequestHasNone() {
        ConversionRequest request = ConversionRequest.builder()
                .root(WidgetNode.builder().type(WidgetType.CONTAINER).build())
                .build();

        ConversionResponse response = conversionService.convert(request);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getRoot().getType()).isEqualTo(TargetNodeType.FRAME);
        assertThat(response.getComponents()).isEmpty();
        assertThat(response.getStats().getWidgetsFound()).isEqualTo(1);
    }

    @Test
    void keepsComponentsApart_whenInferredNamesCollide() {
        WidgetNode save = primaryButton("b1", "Save");
        WidgetNode submit = primaryButton("b2", "Submit");
        ConversionRequest request = ConversionRequest.builder()
                .root(WidgetNode.builder().id("root").type(WidgetType.ROW).children(List.of(save, submit)).build())
                .reusableWidgets(List.of(
                        ReusableWidgetDefinition.builder().name("SaveButton").widget(save)
                                .usageCount(1).instanceIds(List.of("b1")).build(),
                        ReusableWidgetDefinition.builder().name("SubmitButton").widget(submit)
                                .usageCount(1).instanceIds(List.of("b2")).build()))
                .build();

        ConversionResponse response = conversionService.convert(request);

        assertThat(response.getComponents()).hasSize(2)
                .extracting(ComponentDefinition::getName)
                .containsOnly("Button / Primary");
        String saveId = response.getComponents().get(0).getId();
        String submitId = response.getComponents().get(1).getId();
        assertThat(saveId).isNotEqualTo(submitId);
        assertThat(response.getStats().getComponentsCreated()).isEqualTo(2);
        assertThat(response.getLibrary().getMetadata().getTotalComponents()).isEqualTo(2);

        List<TargetNodeSpec> instances = response.getRoot().getChildren();
        assertThat(instances).extracting(TargetNodeSpec::getType)
                .containsExactly(TargetNodeType.INSTANCE, TargetNodeType.INSTANCE);
        assertThat(instances.get(0).getProperties().getComponentId()).isEqualTo(saveId);
        assertThat(instances.get(0).getProperties().getOverrides()).isEmpty();
        assertThat(instances.get(1).getProperties().getComponentId()).isEqualTo(submitId);
        assertThat(instances.get(1).getProperties().getOverrides()).isEmpty();
    }

    private static WidgetNode primaryButton(String id, String label) {
        return WidgetNode.builder()
                .id(id)
                .type(WidgetType.BUTTON)
                .properties(new WidgetProperties().with(WidgetProperties.STYLE, "primary"))
                .children(List.of(WidgetNode.builder()
                        .id(id + "-label")
                        .type(WidgetType.TEXT)
                        .properties(new WidgetProperties().with(WidgetProperties.DATA, label))
                        .build()))
                .build();
    }

    private static ConversionRequest request(StyleMappingConfig config, String textThemePath) {
        WidgetNode text = WidgetNode.builder()
                .id("t1")
                .type(WidgetType.TEXT)
                .properties(new WidgetProperties().with(WidgetProperties.DATA, "Hello"))
                .styling(StyleInfo.builder()
                        .colors(List.of(ColorInfo.builder()
                                .property("color")
                                .value("#6200EE")
                                .themeReference(true)
                                .themePath(textThemePath)
                                .build()))
                        .build())
                .build();
        WidgetNode button = WidgetNode.builder()
                .id("b1")
                .type(WidgetType.BUTTON)
                .properties(new WidgetProperties().with(WidgetProperties.STYLE, "primary"))
                .children(List.of(WidgetNode.builder()
                        .id("b1-label")
                        .type(WidgetType.TEXT)
                        .properties(new WidgetProperties().with(WidgetProperties.DATA, "Save"))
                        .build()))
                .build();
        WidgetNode custom = WidgetNode.builder().id("c1").type(WidgetType.CUSTOM).build();
        WidgetNode root = WidgetNode.builder()
                .id("root")
                .type(WidgetType.COLUMN)
                .children(List.of(text, button, custom))
                .build();

        ReusableWidgetDefinition reusable = ReusableWidgetDefinition.builder()
                .name("ElevatedButton")
                .widget(button)
                .usageCount(1)
                .instanceIds(List.of("b1"))
                .build();

        ThemeModel light = ThemeModel.builder()
                .name("Light")
                .colorScheme(ColorScheme.builder().primary("#6200EE").onPrimary("#FFFFFF").build())
                .build();

        return ConversionRequest.builder()
                .root(root)
                .reusableWidgets(List.of(reusable))
                .themes(List.of(light))
                .styleConfig(config)
                .build();
    }
}
