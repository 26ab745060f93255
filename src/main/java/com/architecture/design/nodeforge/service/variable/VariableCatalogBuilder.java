package com.architecture.design.nodeforge.service.variable;

import com.architecture.design.nodeforge.dto.theme.ColorScheme;
import com.architecture.design.nodeforge.dto.theme.TextStyleSpec;
import com.architecture.design.nodeforge.dto.theme.ThemeModel;
import com.architecture.design.nodeforge.exception.InvalidColorException;
import com.architecture.design.nodeforge.exception.ThemeConfigurationException;
import com.architecture.design.nodeforge.model.node.RgbColor;
import com.architecture.design.nodeforge.model.variable.MultiModeVariableCollection;
import com.architecture.design.nodeforge.model.variable.MultiModeVariableDefinition;
import com.architecture.design.nodeforge.model.variable.VariableCollection;
import com.architecture.design.nodeforge.model.variable.VariableDefinition;
import com.architecture.design.nodeforge.model.variable.VariableMode;
import com.architecture.design.nodeforge.model.variable.VariableScope;
import com.architecture.design.nodeforge.model.variable.VariableType;
import com.architecture.design.nodeforge.model.variable.VariableValue;
import com.architecture.design.nodeforge.service.style.ColorParser;
import com.architecture.design.nodeforge.service.style.FontWeights;
import com.architecture.design.nodeforge.service.style.TokenNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds the design variables (tokens) of a run from the resolved themes.
 *
 * The first theme produces the single-mode collections. When two or more themes are supplied,
 * multi-mode collections with the same names hold one value per theme, the theme name being the mode.
 */
@Service
@Slf4j
public class VariableCatalogBuilder {

    public static final String COLORS = "Colors";
    public static final String TYPOGRAPHY = "Typography";
    public static final String SPACING = "Spacing";
    public static final String BORDER_RADIUS = "Border Radius";

    private static final List<String> COLOR_ROLES = List.of(
            "primary", "onPrimary", "secondary", "onSecondary",
            "error", "onError", "background", "onBackground",
            "surface", "onSurface", "surfaceVariant", "onSurfaceVariant",
            "outline", "shadow");

    // Typography property (camelCase) -> variable scope
    private static final Map<String, VariableScope> TYPOGRAPHY_SCOPES = new LinkedHashMap<>();

    static {
        TYPOGRAPHY_SCOPES.put("fontSize", VariableScope.FONT_SIZE);
        TYPOGRAPHY_SCOPES.put("fontFamily", VariableScope.FONT_FAMILY);
        TYPOGRAPHY_SCOPES.put("fontWeight", VariableScope.FONT_WEIGHT);
        TYPOGRAPHY_SCOPES.put("lineHeight", VariableScope.LINE_HEIGHT);
        TYPOGRAPHY_SCOPES.put("letterSpacing", VariableScope.LETTER_SPACING);
    }

    public static String collectionName(String prefix, String kind) {
        return prefix + " " + kind;
    }

    public VariableCatalog build(List<ThemeModel> themes, String prefix) {
        if (themes == null || themes.isEmpty()) {
            log.debug("[variables] No theme supplied, catalog is empty");
            return VariableCatalog.empty();
        }

        List<VariableCollection> collections = buildSingleMode(themes.get(0), prefix);
        List<MultiModeVariableCollection> multiMode = themes.size() > 1
                ? buildMultiMode(themes, prefix)
                : List.of();

        VariableCatalog catalog = new VariableCatalog(collections, multiMode);
        log.info("[variables] Built {} collections and {} multi-mode collections with {} variables",
                collections.size(), multiMode.size(), catalog.variableCount());
        return catalog;
    }

    // ========================= SINGLE MODE =========================

    private List<VariableCollection> buildSingleMode(ThemeModel theme, String prefix) {
        List<VariableCollection> collections = new ArrayList<>();
        collections.add(colorCollection(theme, collectionName(prefix, COLORS)));
        collections.add(typographyCollection(theme, collectionName(prefix, TYPOGRAPHY)));
        collections.add(scaleCollection(theme.getSpacing(), collectionName(prefix, SPACING), "spacing-",
                List.of(VariableScope.GAP, VariableScope.WIDTH_HEIGHT), "Spacing scale"));
        collections.add(scaleCollection(theme.getBorderRadius(), collectionName(prefix, BORDER_RADIUS),
                "border-radius-", List.of(VariableScope.CORNER_RADIUS), "Border radius"));
        return collections;
    }

    private VariableCollection colorCollection(ThemeModel theme, String collectionName) {
        List<VariableDefinition> variables = new ArrayList<>();
        if (theme.getColorScheme() != null) {
            theme.getColorScheme().roles().forEach((role, hex) -> variables.add(VariableDefinition.builder()
                    .name(TokenNames.kebab(role))
                    .type(VariableType.COLOR)
                    .scopes(colorScopes(role))
                    .value(VariableValue.color(parseThemeColor(theme.getName(), role, hex)))
                    .description(humanize(role) + " color")
                    .collection(collectionName)
                    .build()));
        }
        return VariableCollection.builder()
                .name(collectionName)
                .description("Color variables from the color scheme")
                .variables(variables)
                .build();
    }

    private VariableCollection typographyCollection(ThemeModel theme, String collectionName) {
        List<VariableDefinition> variables = new ArrayList<>();
        if (theme.getTextTheme() != null) {
            theme.getTextTheme().forEach((styleName, style) -> typographyValues(style).forEach((property, value) ->
                    variables.add(VariableDefinition.builder()
                            .name(TokenNames.kebab(styleName) + "-" + TokenNames.kebab(property))
                            .type(typographyType(property))
                            .scopes(List.of(TYPOGRAPHY_SCOPES.get(property)))
                            .value(value)
                            .description(humanize(styleName) + " " + humanize(property).toLowerCase())
                            .collection(collectionName)
                            .build())));
        }
        return VariableCollection.builder()
                .name(collectionName)
                .description("Typography variables from the text theme")
                .variables(variables)
                .build();
    }

    private VariableCollection scaleCollection(Map<String, Double> scale, String collectionName, String namePrefix,
                                               List<VariableScope> scopes, String label) {
        List<VariableDefinition> variables = new ArrayList<>();
        if (scale != null) {
            scale.forEach((key, value) -> variables.add(VariableDefinition.builder()
                    .name(namePrefix + key)
                    .type(VariableType.FLOAT)
                    .scopes(scopes)
                    .value(VariableValue.number(value))
                    .description(label + " " + key + " (" + value + "px)")
                    .collection(collectionName)
                    .build()));
        }
        return VariableCollection.builder()
                .name(collectionName)
                .description(label + " variables")
                .variables(variables)
                .build();
    }

    // ========================= MULTI MODE =========================

    private List<MultiModeVariableCollection> buildMultiMode(List<ThemeModel> themes, String prefix) {
        List<VariableMode> modes = modesOf(themes);

        List<MultiModeVariableCollection> collections = new ArrayList<>();
        collections.add(multiModeColors(themes, modes, collectionName(prefix, COLORS)));
        collections.add(multiModeTypography(themes, modes, collectionName(prefix, TYPOGRAPHY)));
        collections.add(multiModeScale(themes, modes, collectionName(prefix, SPACING), ThemeModel::getSpacing,
                "spacing-", List.of(VariableScope.GAP, VariableScope.WIDTH_HEIGHT)));
        collections.add(multiModeScale(themes, modes, collectionName(prefix, BORDER_RADIUS), ThemeModel::getBorderRadius,
                "border-radius-", List.of(VariableScope.CORNER_RADIUS)));
        return collections;
    }

    private List<VariableMode> modesOf(List<ThemeModel> themes) {
        Set<String> seen = new HashSet<>();
        List<VariableMode> modes = new ArrayList<>();
        for (int i = 0; i < themes.size(); i++) {
            String name = themes.get(i).getName();
            if (name == null || name.isBlank()) {
                throw new ThemeConfigurationException("Theme at index " + i + " has no name; multi-mode themes need a mode name");
            }
            if (!seen.add(name)) {
                throw new ThemeConfigurationException("Duplicate theme mode name: " + name);
            }
            modes.add(new VariableMode(name, "mode-" + i));
        }
        return modes;
    }

    private MultiModeVariableCollection multiModeColors(List<ThemeModel> themes, List<VariableMode> modes,
                                                        String collectionName) {
        List<MultiModeVariableDefinition> variables = new ArrayList<>();
        for (String role : COLOR_ROLES) {
            Map<String, VariableValue> values = new LinkedHashMap<>();
            for (ThemeModel theme : themes) {
                ColorScheme scheme = theme.getColorScheme();
                String hex = scheme != null ? scheme.roles().get(role) : null;
                if (hex != null) {
                    values.put(theme.getName(), VariableValue.color(parseThemeColor(theme.getName(), role, hex)));
                }
            }
            if (!values.isEmpty()) {
                variables.add(MultiModeVariableDefinition.builder()
                        .name(TokenNames.kebab(role))
                        .type(VariableType.COLOR)
                        .scopes(colorScopes(role))
                        .values(values)
                        .description(humanize(role) + " color across theme modes")
                        .collection(collectionName)
                        .build());
            }
        }
        return MultiModeVariableCollection.builder()
                .name(collectionName)
                .description("Color variables across theme modes")
                .modes(modes)
                .variables(variables)
                .build();
    }

    private MultiModeVariableCollection multiModeTypography(List<ThemeModel> themes, List<VariableMode> modes,
                                                            String collectionName) {
        // variable name -> (mode -> value), first-seen order
        Map<String, Map<String, VariableValue>> valuesByVariable = new LinkedHashMap<>();
        Map<String, String> propertyByVariable = new LinkedHashMap<>();
        for (ThemeModel theme : themes) {
            if (theme.getTextTheme() == null) continue;
            theme.getTextTheme().forEach((styleName, style) -> typographyValues(style).forEach((property, value) -> {
                String name = TokenNames.kebab(styleName) + "-" + TokenNames.kebab(property);
                valuesByVariable.computeIfAbsent(name, k -> new LinkedHashMap<>()).put(theme.getName(), value);
                propertyByVariable.putIfAbsent(name, property);
            }));
        }

        List<MultiModeVariableDefinition> variables = new ArrayList<>();
        valuesByVariable.forEach((name, values) -> {
            String property = propertyByVariable.get(name);
            variables.add(MultiModeVariableDefinition.builder()
                    .name(name)
                    .type(typographyType(property))
                    .scopes(List.of(TYPOGRAPHY_SCOPES.get(property)))
                    .values(values)
                    .description(name + " across theme modes")
                    .collection(collectionName)
                    .build());
        });
        return MultiModeVariableCollection.builder()
                .name(collectionName)
                .description("Typography variables across theme modes")
                .modes(modes)
                .variables(variables)
                .build();
    }

    private MultiModeVariableCollection multiModeScale(List<ThemeModel> themes, List<VariableMode> modes,
                                                       String collectionName,
                                                       Function<ThemeModel, Map<String, Double>> scaleOf,
                                                       String namePrefix, List<VariableScope> scopes) {
        Set<String> keys = new LinkedHashSet<>();
        themes.forEach(theme -> {
            Map<String, Double> scale = scaleOf.apply(theme);
            if (scale != null) keys.addAll(scale.keySet());
        });

        List<MultiModeVariableDefinition> variables = new ArrayList<>();
        for (String key : keys) {
            Map<String, VariableValue> values = new LinkedHashMap<>();
            for (ThemeModel theme : themes) {
                Map<String, Double> scale = scaleOf.apply(theme);
                if (scale != null && scale.get(key) != null) {
                    values.put(theme.getName(), VariableValue.number(scale.get(key)));
                }
            }
            variables.add(MultiModeVariableDefinition.builder()
                    .name(namePrefix + key)
                    .type(VariableType.FLOAT)
                    .scopes(scopes)
                    .values(values)
                    .description(namePrefix + key + " across theme modes")
                    .collection(collectionName)
                    .build());
        }
        return MultiModeVariableCollection.builder()
                .name(collectionName)
                .description(collectionName + " across theme modes")
                .modes(modes)
                .variables(variables)
                .build();
    }

    // ========================= HELPERS =========================

    private Map<String, VariableValue> typographyValues(TextStyleSpec style) {
        Map<String, VariableValue> values = new LinkedHashMap<>();
        if (style == null) return values;
        if (style.getFontSize() != null && style.getFontSize() > 0) {
            values.put("fontSize", VariableValue.number(style.getFontSize()));
        }
        if (style.getFontFamily() != null && !style.getFontFamily().isBlank()) {
            values.put("fontFamily", VariableValue.text(style.getFontFamily()));
        }
        if (style.getFontWeight() != null && !style.getFontWeight().isBlank()) {
            values.put("fontWeight", VariableValue.text(FontWeights.styleOrRegular(style.getFontWeight())));
        }
        if (style.getHeight() != null && style.getHeight() != 0) {
            values.put("lineHeight", VariableValue.number(style.getHeight()));
        }
        if (style.getLetterSpacing() != null && style.getLetterSpacing() != 0) {
            values.put("letterSpacing", VariableValue.number(style.getLetterSpacing()));
        }
        return values;
    }

    private VariableType typographyType(String property) {
        return switch (property) {
            case "fontFamily", "fontWeight" -> VariableType.STRING;
            default -> VariableType.FLOAT;
        };
    }

    private List<VariableScope> colorScopes(String role) {
        return switch (role) {
            case "outline" -> List.of(VariableScope.ALL_STROKES);
            case "background", "surface", "surfaceVariant", "shadow" -> List.of(VariableScope.ALL_FILLS);
            default -> List.of(VariableScope.ALL_FILLS, VariableScope.ALL_STROKES);
        };
    }

    private RgbColor parseThemeColor(String themeName, String role, String hex) {
        try {
            return ColorParser.parseHex(hex);
        } catch (InvalidColorException e) {
            throw new ThemeConfigurationException(
                    "Theme '" + themeName + "' has an invalid " + role + " color: " + e.getMessage());
        }
    }

    private static String humanize(String camel) {
        String spaced = TokenNames.kebab(camel).replace('-', ' ');
        return spaced.isEmpty() ? spaced : Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }
}
