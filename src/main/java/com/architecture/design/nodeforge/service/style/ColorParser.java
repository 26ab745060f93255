package com.architecture.design.nodeforge.service.style;

import com.architecture.design.nodeforge.exception.InvalidColorException;
import com.architecture.design.nodeforge.model.node.RgbColor;

import java.util.regex.Pattern;

/**
 * Hex colour literals to 0..1 RGB.
 */
public final class ColorParser {

    private static final Pattern HEX_PATTERN = Pattern.compile("^[0-9A-Fa-f]{3}$|^[0-9A-Fa-f]{6}$");

    private static final String TRANSPARENT = "transparent";

    private ColorParser() {
    }

    /**
     * Parse {@code #RGB} or {@code #RRGGBB}; the leading '#' is optional.
     *
     * @throws InvalidColorException for any other length or a non-hex digit
     */
    public static RgbColor parseHex(String value) {
        if (value == null) {
            throw new InvalidColorException("Invalid hex color format: null");
        }
        String hex = value.startsWith("#") ? value.substring(1) : value;
        if (!HEX_PATTERN.matcher(hex).matches()) {
            throw new InvalidColorException("Invalid hex color format: " + hex);
        }
        if (hex.length() == 3) {
            hex = new StringBuilder()
                    .append(hex.charAt(0)).append(hex.charAt(0))
                    .append(hex.charAt(1)).append(hex.charAt(1))
                    .append(hex.charAt(2)).append(hex.charAt(2))
                    .toString();
        }
        return new RgbColor(
                channel(hex, 0),
                channel(hex, 2),
                channel(hex, 4));
    }

    public static boolean isTransparent(String value) {
        return value != null && TRANSPARENT.equalsIgnoreCase(value.trim());
    }

    private static double channel(String hex, int offset) {
        return Integer.parseInt(hex.substring(offset, offset + 2), 16) / 255.0;
    }
}
