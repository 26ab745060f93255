package com.architecture.design.nodeforge.service.style;

import java.util.regex.Pattern;

/**
 * Derives variable names from dotted theme paths.
 *
 * <pre>
 * colorScheme.onPrimary          -> on-primary
 * textTheme.bodyLarge.fontSize   -> body-large-font-size
 * </pre>
 */
public final class TokenNames {

    public static final String COLOR_SCHEME = "colorScheme";
    public static final String TEXT_THEME = "textTheme";

    private static final Pattern ROOT_PREFIX = Pattern.compile("^(colorScheme|textTheme)\\.");
    private static final Pattern UPPER = Pattern.compile("([A-Z])");

    private TokenNames() {
    }

    public static String variableName(String themePath) {
        String stripped = ROOT_PREFIX.matcher(themePath).replaceFirst("");
        String kebab = kebab(stripped).replace('.', '-');
        return kebab.startsWith("-") ? kebab.substring(1) : kebab;
    }

    /**
     * Typography variable for one property of a text-theme style; {@code property} is camelCase.
     * Paths outside the text theme fall back to {@link #variableName(String)}.
     */
    public static String typographyVariableName(String themePath, String property) {
        String[] parts = themePath.split("\\.");
        if (themePath.contains(TEXT_THEME) && parts.length >= 2) {
            return kebab(parts[1]) + "-" + kebab(property);
        }
        return variableName(themePath);
    }

    /**
     * camelCase to kebab-case: {@code bodyLarge -> body-large}.
     */
    public static String kebab(String camel) {
        return UPPER.matcher(camel).replaceAll("-$1").toLowerCase();
    }
}
