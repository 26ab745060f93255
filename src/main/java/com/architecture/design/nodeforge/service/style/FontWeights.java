package com.architecture.design.nodeforge.service.style;

import java.util.Map;
import java.util.Optional;

/**
 * Numeric and keyword font weights to font style names.
 */
public final class FontWeights {

    public static final String REGULAR = "Regular";

    private static final Map<String, String> WEIGHT_TO_STYLE = Map.ofEntries(
            Map.entry("100", "Thin"),
            Map.entry("200", "Extra Light"),
            Map.entry("300", "Light"),
            Map.entry("400", REGULAR),
            Map.entry("500", "Medium"),
            Map.entry("600", "Semi Bold"),
            Map.entry("700", "Bold"),
            Map.entry("800", "Extra Bold"),
            Map.entry("900", "Black"),
            Map.entry("normal", REGULAR),
            Map.entry("bold", "Bold")
    );

    private FontWeights() {
    }

    /**
     * Style name for a weight such as {@code "600"}, {@code "w600"} or {@code "bold"}; empty if unknown.
     */
    public static Optional<String> styleFor(String fontWeight) {
        if (fontWeight == null) {
            return Optional.empty();
        }
        String key = fontWeight.trim().toLowerCase();
        if (key.startsWith("fontweight.")) {
            key = key.substring("fontweight.".length());
        }
        if (key.startsWith("w") && key.length() == 4) {
            key = key.substring(1);
        }
        return Optional.ofNullable(WEIGHT_TO_STYLE.get(key));
    }

    public static String styleOrRegular(String fontWeight) {
        return styleFor(fontWeight).orElse(REGULAR);
    }

    public static boolean isBold(String fontWeight) {
        String style = styleFor(fontWeight).orElse(REGULAR);
        return style.endsWith("Bold") || style.equals("Black");
    }
}
