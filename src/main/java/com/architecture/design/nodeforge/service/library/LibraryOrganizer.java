package com.architecture.design.nodeforge.service.library;

import com.architecture.design.nodeforge.dto.widget.ReusableWidgetDefinition;
import com.architecture.design.nodeforge.dto.widget.StyleInfo;
import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import com.architecture.design.nodeforge.dto.widget.WidgetProperties;
import com.architecture.design.nodeforge.dto.widget.WidgetVariant;
import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import com.architecture.design.nodeforge.model.library.ComplexityLevel;
import com.architecture.design.nodeforge.model.library.ComponentCategory;
import com.architecture.design.nodeforge.model.library.ComponentDocumentation;
import com.architecture.design.nodeforge.model.library.ComponentGroup;
import com.architecture.design.nodeforge.model.library.ComponentSubGroup;
import com.architecture.design.nodeforge.model.library.LibraryPageStructure;
import com.architecture.design.nodeforge.model.library.LibraryStructure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Arranges built components into a categorised library and derives its page structure.
 */
@Service
@Slf4j
public class LibraryOrganizer {

    public static final String LIBRARY_NAME = "Generated Component Library";
    public static final String LIBRARY_DESCRIPTION = "Components generated from analysed widget trees";
    public static final String LIBRARY_VERSION = "1.0.0";

    public static final String BUTTONS = "Buttons";
    public static final String TYPOGRAPHY = "Typography";
    public static final String SURFACES = "Surfaces";
    public static final String LAYOUT = "Layout";
    public static final String NAVIGATION = "Navigation";
    public static final String MEDIA = "Media";
    public static final String COMPONENTS = "Components";

    private static final int UNKNOWN_PRIORITY = 99;
    private static final int MAX_EXAMPLES = 3;
    private static final int FREQUENT_USAGE = 10;

    private static final Map<String, Integer> CATEGORY_PRIORITY = Map.of(
            BUTTONS, 1,
            TYPOGRAPHY, 2,
            SURFACES, 3,
            LAYOUT, 4,
            NAVIGATION, 5,
            MEDIA, 6,
            COMPONENTS, 7
    );

    private static final Map<String, String> CATEGORY_DESCRIPTION = Map.of(
            BUTTONS, "Interactive button components for user actions",
            TYPOGRAPHY, "Text components for content display",
            SURFACES, "Container components that provide visual surfaces",
            LAYOUT, "Components for organizing and structuring content",
            MEDIA, "Components for displaying images and media content",
            NAVIGATION, "Components for app navigation and structure",
            COMPONENTS, "General purpose components"
    );

    private static final Map<String, String> CATEGORY_ICON = Map.of(
            BUTTONS, "🔘",
            TYPOGRAPHY, "📝",
            SURFACES, "📄",
            LAYOUT, "📐",
            NAVIGATION, "🧭",
            MEDIA, "🖼️",
            COMPONENTS, "🧩"
    );

    // ========================= LIBRARY =========================

    /**
     * Categorise, group and document {@code sources}. Categories come out in priority order.
     */
    public LibraryStructure organize(List<ComponentSource> sources) {
        Map<String, List<ComponentSource>> byCategory = new LinkedHashMap<>();
        for (ComponentSource source : sources) {
            String category = categoryOf(source.getDefinition());
            source.getComponent().setDocumentation(document(source, category));
            byCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(source);
        }

        List<ComponentCategory> categories = byCategory.entrySet().stream()
                .map(e -> buildCategory(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingInt(ComponentCategory::getPriority))
                .collect(Collectors.toList());

        log.info("[library] Organized {} component(s) into {} categor(ies)", sources.size(), categories.size());
        return LibraryStructure.builder()
                .name(LIBRARY_NAME)
                .description(LIBRARY_DESCRIPTION)
                .categories(categories)
                .metadata(LibraryStructure.Metadata.builder()
                        .totalComponents(sources.size())
                        .generatedAt(Instant.now())
                        .version(LIBRARY_VERSION)
                        .build())
                .build();
    }

    private ComponentCategory buildCategory(String name, List<ComponentSource> members) {
        List<ComponentDefinition> components = members.stream()
                .map(ComponentSource::getComponent)
                .collect(Collectors.toList());

        return ComponentCategory.builder()
                .name(name)
                .description(CATEGORY_DESCRIPTION.getOrDefault(name, name + " components"))
                .priority(priorityOf(name))
                .components(components)
                .groups(createGroups(components))
                .metadata(ComponentCategory.Metadata.builder()
                        .componentCount(members.size())
                        .averageUsage(averageUsage(members))
                        .complexity(categoryComplexity(members))
                        .build())
                .build();
    }

    public static int priorityOf(String category) {
        return CATEGORY_PRIORITY.getOrDefault(category, UNKNOWN_PRIORITY);
    }

    /**
     * Type-driven category. Containers are Surfaces when decorated, bordered or coloured, Layout
     * when padded or laid out, else Components.
     */
    public String categoryOf(ReusableWidgetDefinition definition) {
        switch (definition.getType()) {
            case BUTTON:
                return BUTTONS;
            case TEXT:
                return TYPOGRAPHY;
            case CARD:
                return SURFACES;
            case CONTAINER:
                return containerCategory(definition.getWidget());
            case ROW:
            case COLUMN:
            case STACK:
                return LAYOUT;
            case IMAGE:
                return MEDIA;
            case SCAFFOLD:
            case APP_BAR:
                return NAVIGATION;
            default:
                return COMPONENTS;
        }
    }

    private String containerCategory(WidgetNode widget) {
        if (widget == null) {
            return COMPONENTS;
        }
        WidgetProperties props = widget.getProperties();
        StyleInfo styling = styling(widget);
        if (props.getDecoration() != null || styling.getBorders() != null || !styling.getColors().isEmpty()) {
            return SURFACES;
        }
        if (props.getPadding() != null || props.getMargin() != null || widget.getLayout() != null) {
            return LAYOUT;
        }
        return COMPONENTS;
    }

    private long averageUsage(List<ComponentSource> members) {
        if (members.isEmpty()) {
            return 0;
        }
        double total = members.stream().mapToInt(m -> m.getDefinition().getUsageCount()).sum();
        return Math.round(total / members.size());
    }

    private ComplexityLevel categoryComplexity(List<ComponentSource> members) {
        long complex = members.stream().filter(m -> complexityOf(m.getDefinition()) == ComplexityLevel.COMPLEX).count();
        long medium = members.stream().filter(m -> complexityOf(m.getDefinition()) == ComplexityLevel.MEDIUM).count();
        double half = members.size() / 2.0;

        if (complex > half) return ComplexityLevel.COMPLEX;
        if (medium + complex > half) return ComplexityLevel.MEDIUM;
        return ComplexityLevel.SIMPLE;
    }

    // ========================= GROUPS =========================

    public List<ComponentGroup> createGroups(List<ComponentDefinition> components) {
        Map<String, List<ComponentDefinition>> byGroup = new LinkedHashMap<>();
        for (ComponentDefinition component : components) {
            byGroup.computeIfAbsent(groupOf(component.getName()), k -> new ArrayList<>()).add(component);
        }

        return byGroup.entrySet().stream()
                .map(e -> ComponentGroup.builder()
                        .name(e.getKey())
                        .description(groupDescription(e.getKey(), e.getValue().size()))
                        .components(e.getValue())
                        .subGroups(subGroups(e.getValue()))
                        .build())
                .sorted(Comparator.comparingInt((ComponentGroup g) -> groupRank(g.getName()))
                        .thenComparing(ComponentGroup::getName))
                .collect(Collectors.toList());
    }

    /**
     * Group from name substrings: buttons, text and cards get dedicated groups, anything else is
     * grouped by the first word of its name.
     */
    public static String groupOf(String componentName) {
        String name = componentName.toLowerCase();

        if (name.contains("button")) {
            if (name.contains("primary")) return "Primary Buttons";
            if (name.contains("secondary")) return "Secondary Buttons";
            if (name.contains("icon")) return "Icon Buttons";
            return "Buttons";
        }
        if (name.contains("text") || name.contains("label")) {
            if (name.contains("heading") || name.contains("title")) return "Headings";
            if (name.contains("body") || name.contains("paragraph")) return "Body Text";
            return "Text";
        }
        if (name.contains("card")) {
            if (name.contains("elevated")) return "Elevated Cards";
            if (name.contains("outlined")) return "Outlined Cards";
            return "Cards";
        }

        String[] words = componentName.trim().split("[\\s/]+");
        return words.length > 0 && !words[0].isEmpty() ? words[0] : COMPONENTS;
    }

    private static int groupRank(String groupName) {
        if (groupName.contains("Primary")) return 0;
        if (groupName.contains("Secondary")) return 1;
        return 2;
    }

    private static String groupDescription(String name, int count) {
        return name + " group containing " + count + " component" + (count == 1 ? "" : "s");
    }

    private List<ComponentSubGroup> subGroups(List<ComponentDefinition> components) {
        List<ComponentSubGroup> subGroups = new ArrayList<>();
        List<ComponentDefinition> withVariants = components.stream()
                .filter(ComponentDefinition::hasVariants)
                .collect(Collectors.toList());
        List<ComponentDefinition> simple = components.stream()
                .filter(c -> !c.hasVariants())
                .collect(Collectors.toList());

        if (!withVariants.isEmpty()) {
            subGroups.add(ComponentSubGroup.builder().name("With Variants").components(withVariants).build());
        }
        if (!simple.isEmpty()) {
            subGroups.add(ComponentSubGroup.builder().name("Simple Components").components(simple).build());
        }
        return subGroups;
    }

    // ========================= DOCUMENTATION =========================

    /**
     * Weighted score: children + properties + 2 x variants + colours + 2 if bordered + shadows.
     */
    public ComplexityLevel complexityOf(ReusableWidgetDefinition definition) {
        WidgetNode widget = definition.getWidget();
        int score = 2 * variantsOf(definition).size();
        if (widget != null) {
            StyleInfo styling = styling(widget);
            score += widget.getChildren() != null ? widget.getChildren().size() : 0;
            score += widget.getProperties().size();
            score += styling.getColors().size();
            if (styling.getBorders() != null) score += 2;
            score += styling.getShadows().size();
        }
        return ComplexityLevel.fromScore(score);
    }

    private ComponentDocumentation document(ComponentSource source, String category) {
        ComponentDefinition component = source.getComponent();
        ReusableWidgetDefinition definition = source.getDefinition();
        ComplexityLevel complexity = complexityOf(definition);

        StringBuilder description = new StringBuilder()
                .append(component.getName()).append(" component generated from ")
                .append(definition.getType().getDisplayName()).append(" widget.")
                .append(" Used ").append(definition.getUsageCount()).append(" times in the codebase.");
        if (component.hasVariants()) {
            description.append(" Available in ").append(component.getVariants().size()).append(" variants.");
        }
        if (component.getProperties() != null && !component.getProperties().isEmpty()) {
            description.append(" Configurable with ").append(component.getProperties().size()).append(" properties.");
        }
        description.append(" Complexity: ").append(complexity.getLabel()).append('.');

        return ComponentDocumentation.builder()
                .description(description.toString())
                .category(category)
                .tags(tags(definition))
                .usageCount(definition.getUsageCount())
                .complexity(complexity)
                .examples(examples(definition))
                .build();
    }

    private List<String> tags(ReusableWidgetDefinition definition) {
        List<String> tags = new ArrayList<>();
        tags.add(definition.getType().getValue());

        WidgetNode widget = definition.getWidget();
        if (widget != null) {
            if (widget.getProperties().has(WidgetProperties.DISABLED)) tags.add("interactive");
            if (!styling(widget).getColors().isEmpty()) tags.add("colored");
            if (widget.getChildren() != null && !widget.getChildren().isEmpty()) tags.add("container");
            if (widget.getLayout() != null) tags.add("layout");
        }
        if (definition.getUsageCount() > FREQUENT_USAGE) tags.add("frequently-used");
        if (!variantsOf(definition).isEmpty()) tags.add("variants");
        return tags;
    }

    private List<String> examples(ReusableWidgetDefinition definition) {
        List<String> examples = new ArrayList<>();
        examples.add("Basic usage: <" + definition.getName() + " />");
        for (WidgetVariant variant : variantsOf(definition)) {
            if (examples.size() >= MAX_EXAMPLES) {
                break;
            }
            String props = variant.getProperties() == null ? "" : variant.getProperties().values().entrySet().stream()
                    .map(e -> e.getKey() + "=\"" + e.getValue() + "\"")
                    .collect(Collectors.joining(" "));
            examples.add(variant.getName() + ": <" + definition.getName() + " " + props + " />");
        }
        return examples;
    }

    // ========================= PAGES =========================

    public LibraryPageStructure createPageStructure(LibraryStructure library) {
        List<LibraryPageStructure.Page> pages = new ArrayList<>();

        pages.add(LibraryPageStructure.Page.builder()
                .name("📚 Library Overview")
                .description("Overview of all components in the library")
                .sections(List.of(LibraryPageStructure.Section.builder()
                        .name("Getting Started")
                        .description("How to use this component library")
                        .build()))
                .build());

        for (ComponentCategory category : library.getCategories()) {
            pages.add(LibraryPageStructure.Page.builder()
                    .name(CATEGORY_ICON.getOrDefault(category.getName(), "📦") + " " + category.getName())
                    .description(category.getDescription())
                    .sections(category.getGroups().stream()
                            .map(group -> LibraryPageStructure.Section.builder()
                                    .name(group.getName())
                                    .description(group.getDescription())
                                    .components(group.getComponents())
                                    .build())
                            .collect(Collectors.toList()))
                    .build());
        }

        pages.add(LibraryPageStructure.Page.builder()
                .name("🔧 Utilities")
                .description("Utility components and helpers")
                .sections(List.of(LibraryPageStructure.Section.builder()
                        .name("Icons")
                        .description("Icon components and placeholders")
                        .build()))
                .build());

        LibraryPageStructure.CoverPage cover = LibraryPageStructure.CoverPage.builder()
                .title(library.getName())
                .description(library.getDescription())
                .totalComponents(library.getMetadata() != null ? library.getMetadata().getTotalComponents() : 0)
                .totalCategories(library.getCategories().size())
                .version(library.getMetadata() != null ? library.getMetadata().getVersion() : LIBRARY_VERSION)
                .quickLinks(library.getCategories().stream()
                        .map(category -> LibraryPageStructure.QuickLink.builder()
                                .name(category.getName())
                                .description(category.getDescription())
                                .componentCount(category.getMetadata() != null
                                        ? category.getMetadata().getComponentCount()
                                        : category.getComponents().size())
                                .build())
                        .collect(Collectors.toList()))
                .build();

        return LibraryPageStructure.builder()
                .name(library.getName())
                .pages(pages)
                .coverPage(cover)
                .build();
    }

    // ========================= HELPERS =========================

    private static StyleInfo styling(WidgetNode widget) {
        return widget.getStyling() != null ? widget.getStyling() : StyleInfo.empty();
    }

    private static List<WidgetVariant> variantsOf(ReusableWidgetDefinition definition) {
        return definition.getVariants() != null ? definition.getVariants() : List.of();
    }
}
