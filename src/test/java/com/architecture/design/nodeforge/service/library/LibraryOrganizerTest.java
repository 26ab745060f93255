package com.architecture.design.nodeforge.service.library;

import com.architecture.design.nodeforge.dto.widget.ColorInfo;
import com.architecture.design.nodeforge.dto.widget.EdgeInsets;
import com.architecture.design.nodeforge.dto.widget.ReusableWidgetDefinition;
import com.architecture.design.nodeforge.dto.widget.StyleInfo;
import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import com.architecture.design.nodeforge.dto.widget.WidgetProperties;
import com.architecture.design.nodeforge.dto.widget.WidgetType;
import com.architecture.design.nodeforge.dto.widget.WidgetVariant;
import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import com.architecture.design.nodeforge.model.component.ComponentVariant;
import com.architecture.design.nodeforge.model.library.ComplexityLevel;
import com.architecture.design.nodeforge.model.library.ComponentCategory;
import com.architecture.design.nodeforge.model.library.ComponentDocumentation;
import com.architecture.design.nodeforge.model.library.ComponentGroup;
import com.architecture.design.nodeforge.model.library.ComponentSubGroup;
import com.architecture.design.nodeforge.model.library.LibraryPageStructure;
import com.architecture.design.nodeforge.model.library.LibraryStructure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LibraryOrganizerTest {

    private LibraryOrganizer organizer;

    @BeforeEach
    void setUp() {
        organizer = new LibraryOrganizer();
    }

    @Test
    void ordersCategoriesByPriority() {
        ComponentSource text = source("Text / Heading", widget(WidgetType.TEXT, new WidgetProperties()), 3);
        ComponentSource button = source("Button / Primary",
                widget(WidgetType.BUTTON, new WidgetProperties().with(WidgetProperties.DISABLED, false)), 12);

        LibraryStructure library = organizer.organize(List.of(text, button));

        assertThat(library.getName()).isEqualTo(LibraryOrganizer.LIBRARY_NAME);
        assertThat(library.getCategories()).extracting(ComponentCategory::getName)
                .containsExactly(LibraryOrganizer.BUTTONS, LibraryOrganizer.TYPOGRAPHY);
        assertThat(library.getCategories()).extracting(ComponentCategory::getPriority).containsExactly(1, 2);
        assertThat(library.getMetadata().getTotalComponents()).isEqualTo(2);
        assertThat(library.getMetadata().getVersion()).isEqualTo("1.0.0");
        assertThat(library.getMetadata().getGeneratedAt()).isNotNull();
    }

    @Test
    void computesCategoryMetadata() {
        ComponentSource first = source("Button / Primary", widget(WidgetType.BUTTON, new WidgetProperties()), 3);
        ComponentSource second = source("Button / Small", widget(WidgetType.BUTTON, new WidgetProperties()), 4);

        ComponentCategory buttons = organizer.organize(List.of(first, second)).getCategories().get(0);

        assertThat(buttons.getMetadata().getComponentCount()).isEqualTo(2);
        assertThat(buttons.getMetadata().getAverageUsage()).isEqualTo(4);
        assertThat(buttons.getMetadata().getComplexity()).isEqualTo(ComplexityLevel.SIMPLE);
        assertThat(buttons.getDescription()).isEqualTo("Interactive button components for user actions");
    }

    @Test
    void attachesDocumentationToEachComponent() {
        ComponentSource button = source("Button / Primary",
                widget(WidgetType.BUTTON, new WidgetProperties().with(WidgetProperties.DISABLED, false)), 12);
        button.getDefinition().setName("ElevatedButton");

        organizer.organize(List.of(button));

        ComponentDocumentation documentation = button.getComponent().getDocumentation();
        assertThat(documentation.getCategory()).isEqualTo(LibraryOrganizer.BUTTONS);
        assertThat(documentation.getUsageCount()).isEqualTo(12);
        assertThat(documentation.getTags()).containsExactly("button", "interactive", "frequently-used");
        assertThat(documentation.getDescription())
                .startsWith("Button / Primary component generated from Button widget. Used 12 times")
                .endsWith("Complexity: Simple.");
        assertThat(documentation.getExamples()).containsExactly("Basic usage: <ElevatedButton />");
    }

    @Test
    void limitsExamplesToThree() {
        ReusableWidgetDefinition definition = ReusableWidgetDefinition.builder()
                .name("Chip")
                .widget(widget(WidgetType.CONTAINER, new WidgetProperties()))
                .variants(List.of(
                        WidgetVariant.builder().name("Small")
                                .properties(new WidgetProperties().with(WidgetProperties.SIZE, "small")).build(),
                        WidgetVariant.builder().name("Large").build(),
                        WidgetVariant.builder().name("Huge").build()))
                .build();
        ComponentSource source = new ComponentSource(ComponentDefinition.builder().name("Chip").build(), definition);

        organizer.organize(List.of(source));

        assertThat(source.getComponent().getDocumentation().getExamples()).containsExactly(
                "Basic usage: <Chip />",
                "Small: <Chip size=\"small\" />",
                "Large: <Chip  />");
    }

    @Test
    void categorisesContainersByDecorationThenSpacing() {
        WidgetNode coloured = WidgetNode.builder()
                .type(WidgetType.CONTAINER)
                .styling(StyleInfo.builder()
                        .colors(List.of(ColorInfo.builder().property("backgroundColor").value("#FFFFFF").build()))
                        .build())
                .build();
        WidgetNode padded = widget(WidgetType.CONTAINER, new WidgetProperties().withPadding(EdgeInsets.all(8)));
        WidgetNode plain = widget(WidgetType.CONTAINER, new WidgetProperties());

        assertThat(organizer.categoryOf(definition(coloured))).isEqualTo(LibraryOrganizer.SURFACES);
        assertThat(organizer.categoryOf(definition(padded))).isEqualTo(LibraryOrganizer.LAYOUT);
        assertThat(organizer.categoryOf(definition(plain))).isEqualTo(LibraryOrganizer.COMPONENTS);
        assertThat(organizer.categoryOf(definition(widget(WidgetType.APP_BAR, new WidgetProperties()))))
                .isEqualTo(LibraryOrganizer.NAVIGATION);
        assertThat(organizer.categoryOf(definition(widget(WidgetType.CUSTOM, new WidgetProperties()))))
                .isEqualTo(LibraryOrganizer.COMPONENTS);
    }

    @Test
    void scoresComplexityFromStructureAndVariants() {
        ReusableWidgetDefinition medium = ReusableWidgetDefinition.builder()
                .widget(widget(WidgetType.BUTTON, new WidgetProperties().with(WidgetProperties.STYLE, "primary")))
                .variants(List.of(WidgetVariant.builder().name("Secondary").build(),
                        WidgetVariant.builder().name("Ghost").build()))
                .build();
        List<WidgetNode> children = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            children.add(widget(WidgetType.TEXT, new WidgetProperties()));
        }
        ReusableWidgetDefinition complex = ReusableWidgetDefinition.builder()
                .widget(WidgetNode.builder().type(WidgetType.COLUMN).children(children).build())
                .variants(medium.getVariants())
                .build();

        assertThat(organizer.complexityOf(definition(widget(WidgetType.TEXT, new WidgetProperties()))))
                .isEqualTo(ComplexityLevel.SIMPLE);
        assertThat(organizer.complexityOf(medium)).isEqualTo(ComplexityLevel.MEDIUM);
        assertThat(organizer.complexityOf(complex)).isEqualTo(ComplexityLevel.COMPLEX);
    }

    @Test
    void ranksPrimaryGroupsFirst_andSplitsByVariants() {
        ComponentDefinition secondary = component("Button / Secondary", 1);
        ComponentDefinition primary = component("Button / Primary", 3);
        ComponentDefinition primaryLarge = component("Primary Button Large", 1);
        ComponentDefinition tile = component("Profile Tile", 1);

        List<ComponentGroup> groups = organizer.createGroups(List.of(tile, secondary, primary, primaryLarge));

        assertThat(groups).extracting(ComponentGroup::getName)
                .containsExactly("Primary Buttons", "Secondary Buttons", "Profile");
        ComponentGroup primaryButtons = groups.get(0);
        assertThat(primaryButtons.getDescription()).isEqualTo("Primary Buttons group containing 2 components");
        assertThat(primaryButtons.getSubGroups()).extracting(ComponentSubGroup::getName)
                .containsExactly("With Variants", "Simple Components");
        assertThat(primaryButtons.getSubGroups().get(0).getComponents()).containsExactly(primary);
        assertThat(groups.get(2).getDescription()).isEqualTo("Profile group containing 1 component");
    }

    @Test
    void derivesGroupFromNameSubstrings() {
        assertThat(LibraryOrganizer.groupOf("Icon Button")).isEqualTo("Icon Buttons");
        assertThat(LibraryOrganizer.groupOf("Text / Heading")).isEqualTo("Headings");
        assertThat(LibraryOrganizer.groupOf("Body Label")).isEqualTo("Body Text");
        assertThat(LibraryOrganizer.groupOf("Card / Outlined")).isEqualTo("Outlined Cards");
        assertThat(LibraryOrganizer.groupOf("Avatar / Round")).isEqualTo("Avatar");
    }

    @Test
    void buildsOverviewCategoryAndUtilityPages() {
        LibraryStructure library = organizer.organize(List.of(
                source("Button / Primary", widget(WidgetType.BUTTON, new WidgetProperties()), 2),
                source("Text / Heading", widget(WidgetType.TEXT, new WidgetProperties()), 5)));

        LibraryPageStructure pages = organizer.createPageStructure(library);

        assertThat(pages.getName()).isEqualTo(LibraryOrganizer.LIBRARY_NAME);
        assertThat(pages.getPages()).extracting(LibraryPageStructure.Page::getName)
                .containsExactly("📚 Library Overview", "🔘 Buttons", "📝 Typography", "🔧 Utilities");
        assertThat(pages.getPages().get(1).getSections()).extracting(LibraryPageStructure.Section::getName)
                .containsExactly("Primary Buttons");
        assertThat(pages.getCoverPage().getTotalComponents()).isEqualTo(2);
        assertThat(pages.getCoverPage().getTotalCategories()).isEqualTo(2);
        assertThat(pages.getCoverPage().getQuickLinks()).extracting(LibraryPageStructure.QuickLink::getComponentCount)
                .containsExactly(1, 1);
    }

    private static WidgetNode widget(WidgetType type, WidgetProperties properties) {
        return WidgetNode.builder().type(type).properties(properties).build();
    }

    private static ReusableWidgetDefinition definition(WidgetNode widget) {
        return ReusableWidgetDefinition.builder().name(widget.getType().getDisplayName()).widget(widget).build();
    }

    private static ComponentSource source(String componentName, WidgetNode widget, int usageCount) {
        ReusableWidgetDefinition definition = definition(widget);
        definition.setUsageCount(usageCount);
        return new ComponentSource(ComponentDefinition.builder().name(componentName).build(), definition);
    }

    private static ComponentDefinition component(String name, int variantCount) {
        List<ComponentVariant> variants = new ArrayList<>();
        for (int i = 0; i < variantCount; i++) {
            variants.add(ComponentVariant.builder().name("V" + i).build());
        }
        return ComponentDefinition.builder().name(name).variants(variants).build();
    }
}
