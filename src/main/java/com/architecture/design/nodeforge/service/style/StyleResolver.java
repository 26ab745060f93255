package com.architecture.design.nodeforge.service.style;

import com.architecture.design.nodeforge.dto.style.StyleMappingConfig;
import com.architecture.design.nodeforge.dto.style.StyleResult;
import com.architecture.design.nodeforge.dto.widget.BorderInfo;
import com.architecture.design.nodeforge.dto.widget.BorderRadius;
import com.architecture.design.nodeforge.dto.widget.ColorInfo;
import com.architecture.design.nodeforge.dto.widget.EdgeInsets;
import com.architecture.design.nodeforge.dto.widget.ShadowInfo;
import com.architecture.design.nodeforge.dto.widget.SpacingInfo;
import com.architecture.design.nodeforge.dto.widget.StyleInfo;
import com.architecture.design.nodeforge.dto.widget.TypographyInfo;
import com.architecture.design.nodeforge.exception.InvalidColorException;
import com.architecture.design.nodeforge.model.node.AutoLayoutSpec;
import com.architecture.design.nodeforge.model.node.Effect;
import com.architecture.design.nodeforge.model.node.FontName;
import com.architecture.design.nodeforge.model.node.NodeProperties;
import com.architecture.design.nodeforge.model.node.Paint;
import com.architecture.design.nodeforge.model.node.TargetNodeSpec;
import com.architecture.design.nodeforge.model.node.TargetNodeType;
import com.architecture.design.nodeforge.model.node.UnitValue;
import com.architecture.design.nodeforge.model.node.VariableBinding;
import com.architecture.design.nodeforge.model.node.Vector;
import com.architecture.design.nodeforge.service.variable.VariableCatalog;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.architecture.design.nodeforge.service.variable.VariableCatalogBuilder.COLORS;
import static com.architecture.design.nodeforge.service.variable.VariableCatalogBuilder.TYPOGRAPHY;
import static com.architecture.design.nodeforge.service.variable.VariableCatalogBuilder.collectionName;

/**
 * Applies a widget's styling to its lowered node.
 *
 * Theme references become variable bindings when the catalog has a matching token. A miss falls back
 * to the literal value with a warning, or is an error when {@code fallbackToDirectValues} is off.
 * Errors are collected per property and never thrown; {@code success} is false once any error was collected.
 *
 * One resolver serves one run: it reads the run's {@link VariableCatalog} and holds no other state.
 */
@Slf4j
public class StyleResolver {

    public static final String FILLS = "fills";
    public static final String STROKES = "strokes";

    private final VariableCatalog catalog;
    private final StyleMappingConfig config;

    public StyleResolver(VariableCatalog catalog, StyleMappingConfig config) {
        this.catalog = catalog;
        this.config = config != null ? config : StyleMappingConfig.defaults();
    }

    public StyleResult applyStyles(TargetNodeSpec node, StyleInfo styling) {
        StyleResult result = StyleResult.builder().success(true).build();
        if (styling == null) {
            return result;
        }

        try {
            PaintWriter paints = new PaintWriter(node.getProperties());

            for (ColorInfo color : styling.getColors()) {
                applyColor(node, color, result, paints);
            }
            if (styling.getTypography() != null && node.getType() == TargetNodeType.TEXT) {
                applyTypography(node, styling.getTypography(), result, paints);
            }
            if (styling.getSpacing() != null) {
                applySpacing(node, styling.getSpacing(), result);
            }
            if (styling.getBorders() != null) {
                applyBorders(node, styling.getBorders(), result, paints);
            }
            if (!styling.getShadows().isEmpty()) {
                applyShadows(node, styling.getShadows(), result);
            }

            if (!result.getVariableBindings().isEmpty()) {
                node.getVariables().addAll(result.getVariableBindings());
            }
        } catch (RuntimeException e) {
            log.error("[style] Failed to apply styles to {}", node.getName(), e);
            result.getErrors().add("Failed to apply styles: " + e.getMessage());
        }

        result.setSuccess(result.getErrors().isEmpty());
        log.debug("[style] {}: applied={} bindings={} errors={} warnings={}", node.getName(),
                result.getAppliedProperties(), result.getVariableBindings().size(),
                result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    // ========================= COLORS =========================

    private void applyColor(TargetNodeSpec node, ColorInfo color, StyleResult result, PaintWriter paints) {
        try {
            if (isTokenCandidate(color.isThemeReference(), color.getThemePath())) {
                Optional<VariableBinding> binding = bind(COLORS,
                        TokenNames.variableName(color.getThemePath()), paintTarget(color.getProperty()));
                if (binding.isPresent()) {
                    result.getVariableBindings().add(binding.get());
                    result.getAppliedProperties().add(color.getProperty());
                } else if (config.isFallbackToDirectValues()) {
                    applyDirectColor(color, paints);
                    result.getAppliedProperties().add(color.getProperty());
                    warnOnce(result, missingTokenWarning(color.getThemePath()));
                } else {
                    result.getErrors().add(missingTokenError(color.getThemePath()));
                }
            } else {
                applyDirectColor(color, paints);
                result.getAppliedProperties().add(color.getProperty());
            }
        } catch (InvalidColorException e) {
            result.getErrors().add("Failed to apply color " + color.getProperty() + ": " + e.getMessage());
        }
    }

    private void applyDirectColor(ColorInfo color, PaintWriter paints) {
        if (ColorParser.isTransparent(color.getValue())) {
            return;
        }
        Paint paint = Paint.solid(ColorParser.parseHex(color.getValue()));
        paints.write(paintTarget(color.getProperty()), paint);
    }

    private String paintTarget(String colorProperty) {
        return "borderColor".equals(colorProperty) ? STROKES : FILLS;
    }

    // ========================= TYPOGRAPHY =========================

    private void applyTypography(TargetNodeSpec node, TypographyInfo typography, StyleResult result,
                                 PaintWriter paints) {
        NodeProperties props = node.getProperties();

        if (typography.getFontSize() != null) {
            applyTypographyProperty("fontSize", typography, result,
                    () -> props.setFontSize(typography.getFontSize()));
        }
        if (typography.getFontFamily() != null && !typography.getFontFamily().isBlank()) {
            applyTypographyProperty("fontFamily", typography, result,
                    () -> fontName(props).setFamily(typography.getFontFamily()));
        }
        if (typography.getFontWeight() != null && !typography.getFontWeight().isBlank()) {
            applyTypographyProperty("fontWeight", typography, result,
                    () -> fontName(props).setStyle(resolveFontStyle(typography.getFontWeight(), result)));
        }
        if (typography.getLineHeight() != null) {
            applyTypographyProperty("lineHeight", typography, result,
                    () -> props.setLineHeight(UnitValue.percent(typography.getLineHeight() * 100)));
        }
        if (typography.getLetterSpacing() != null) {
            applyTypographyProperty("letterSpacing", typography, result,
                    () -> props.setLetterSpacing(UnitValue.pixels(typography.getLetterSpacing())));
        }
        if (typography.getColor() != null) {
            ColorInfo textColor = ColorInfo.builder()
                    .property("color")
                    .value(typography.getColor())
                    .themeReference(typography.isThemeReference())
                    .themePath(typography.getThemePath())
                    .build();
            applyColor(node, textColor, result, paints);
        }
    }

    private void applyTypographyProperty(String property, TypographyInfo typography, StyleResult result,
                                         Runnable direct) {
        if (isTokenCandidate(typography.isThemeReference(), typography.getThemePath())) {
            Optional<VariableBinding> binding = bind(TYPOGRAPHY,
                    TokenNames.typographyVariableName(typography.getThemePath(), property), property);
            if (binding.isPresent()) {
                result.getVariableBindings().add(binding.get());
                result.getAppliedProperties().add(property);
            } else if (config.isFallbackToDirectValues()) {
                direct.run();
                result.getAppliedProperties().add(property);
                warnOnce(result, missingTokenWarning(typography.getThemePath()));
            } else {
                result.getErrors().add(missingTokenError(typography.getThemePath()));
            }
            return;
        }
        direct.run();
        result.getAppliedProperties().add(property);
    }

    private String resolveFontStyle(String fontWeight, StyleResult result) {
        Optional<String> style = FontWeights.styleFor(fontWeight);
        if (style.isEmpty()) {
            result.getWarnings().add("Unknown font weight " + fontWeight + ", using " + FontWeights.REGULAR);
        }
        return style.orElse(FontWeights.REGULAR);
    }

    private FontName fontName(NodeProperties props) {
        if (props.getFontName() == null) {
            props.setFontName(FontName.builder().build());
        }
        FontName fontName = props.getFontName();
        if (fontName.getFamily() == null) fontName.setFamily("Inter");
        if (fontName.getStyle() == null) fontName.setStyle(FontWeights.REGULAR);
        return fontName;
    }

    // ========================= SPACING / BORDERS / SHADOWS =========================

    private void applySpacing(TargetNodeSpec node, SpacingInfo spacing, StyleResult result) {
        AutoLayoutSpec autoLayout = node.getAutoLayout();
        if (autoLayout == null) {
            return;
        }
        EdgeInsets padding = spacing.getPadding();
        if (padding != null) {
            autoLayout.setPaddingTop(padding.getTop());
            autoLayout.setPaddingRight(padding.getRight());
            autoLayout.setPaddingBottom(padding.getBottom());
            autoLayout.setPaddingLeft(padding.getLeft());
            result.getAppliedProperties().add("padding");
        }
        if (spacing.getMargin() != null) {
            // Approximated as the gap between items; asymmetric margins are lost
            autoLayout.setItemSpacing(spacing.getMargin().max());
            result.getAppliedProperties().add("margin");
        }
    }

    private void applyBorders(TargetNodeSpec node, BorderInfo border, StyleResult result, PaintWriter paints) {
        NodeProperties props = node.getProperties();

        if (border.getWidth() != null && border.getWidth() > 0 && border.getColor() != null) {
            try {
                paints.write(STROKES, Paint.solid(ColorParser.parseHex(border.getColor())));
                props.setStrokeWeight(border.getWidth());
                result.getAppliedProperties().add("border");
            } catch (InvalidColorException e) {
                result.getErrors().add("Failed to apply border: " + e.getMessage());
            }
        }

        BorderRadius radius = border.getRadius();
        if (radius != null) {
            if (radius.isUniform()) {
                props.setCornerRadius(radius.getTopLeft());
            } else {
                props.setTopLeftRadius(radius.getTopLeft());
                props.setTopRightRadius(radius.getTopRight());
                props.setBottomRightRadius(radius.getBottomRight());
                props.setBottomLeftRadius(radius.getBottomLeft());
            }
            result.getAppliedProperties().add("borderRadius");
        }
    }

    private void applyShadows(TargetNodeSpec node, List<ShadowInfo> shadows, StyleResult result) {
        NodeProperties props = node.getProperties();
        if (props.getEffects() == null) {
            props.setEffects(new ArrayList<>());
        }

        int applied = 0;
        for (int i = 0; i < shadows.size(); i++) {
            ShadowInfo shadow = shadows.get(i);
            try {
                props.getEffects().add(Effect.builder()
                        .color(ColorParser.parseHex(shadow.getColor()))
                        .offset(shadow.getOffset() != null
                                ? new Vector(shadow.getOffset().getX(), shadow.getOffset().getY())
                                : new Vector(0, 0))
                        .radius(shadow.getBlur())
                        .spread(shadow.getSpread() != null ? shadow.getSpread() : 0)
                        .build());
                applied++;
            } catch (InvalidColorException e) {
                result.getErrors().add("Failed to apply shadow " + i + ": " + e.getMessage());
            }
        }
        if (applied > 0) {
            result.getAppliedProperties().add("shadows");
        }
    }

    // ========================= VARIABLES =========================

    private boolean isTokenCandidate(boolean themeReference, String themePath) {
        return themeReference && themePath != null && !themePath.isBlank() && config.isUseVariables();
    }

    private Optional<VariableBinding> bind(String collectionKind, String variableName, String targetProperty) {
        String collection = collectionName(config.getCollectionPrefix(), collectionKind);
        String alias = "{" + collection + "." + variableName + "}";

        if (config.isPreferMultiMode() && catalog.getMultiModeVariable(collection, variableName).isPresent()) {
            return Optional.of(new VariableBinding(targetProperty,
                    "multimode-" + collection + "-" + variableName, alias));
        }
        if (catalog.getVariable(collection, variableName).isPresent()) {
            return Optional.of(new VariableBinding(targetProperty, collection + "-" + variableName, alias));
        }
        return Optional.empty();
    }

    // One warning per theme path and node, however many properties fell back
    private static void warnOnce(StyleResult result, String warning) {
        if (!result.getWarnings().contains(warning)) {
            result.getWarnings().add(warning);
        }
    }

    private static String missingTokenWarning(String themePath) {
        return "Variable not found for " + themePath + ", using direct value";
    }

    private static String missingTokenError(String themePath) {
        return "Variable not found for theme path: " + themePath;
    }

    /**
     * Writes literal paints. Within one {@code applyStyles} call the first write to a paint list replaces
     * what lowering put there; later writes append.
     */
    private static final class PaintWriter {

        private final NodeProperties properties;
        private final Set<String> touched = new HashSet<>();

        private PaintWriter(NodeProperties properties) {
            this.properties = properties;
        }

        void write(String target, Paint paint) {
            boolean first = touched.add(target);
            List<Paint> current = STROKES.equals(target) ? properties.getStrokes() : properties.getFills();
            List<Paint> next = first || current == null ? new ArrayList<>() : current;
            next.add(paint);
            if (STROKES.equals(target)) {
                properties.setStrokes(next);
            } else {
                properties.setFills(next);
            }
        }
    }
}
