package com.architecture.design.nodeforge.service.lowering;

import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import com.architecture.design.nodeforge.dto.widget.WidgetProperties;
import com.architecture.design.nodeforge.dto.widget.WidgetType;

import java.util.Optional;

/**
 * Content queries over a widget subtree shared by lowering, variant synthesis and component assembly.
 */
public final class WidgetContent {

    public static final int LABEL_LIMIT = 20;

    private WidgetContent() {
    }

    /**
     * First literal text found in the widget or, depth first, its descendants.
     */
    public static Optional<String> textOf(WidgetNode widget) {
        String direct = widget.literalText();
        if (direct != null) {
            return Optional.of(direct);
        }
        if (widget.getChildren() != null) {
            for (WidgetNode child : widget.getChildren()) {
                Optional<String> text = textOf(child);
                if (text.isPresent()) return text;
            }
        }
        return Optional.empty();
    }

    public static boolean hasText(WidgetNode widget) {
        return widget.getType() == WidgetType.TEXT || textOf(widget).isPresent();
    }

    public static boolean hasIcon(WidgetNode widget) {
        WidgetProperties props = widget.getProperties();
        return props != null && (props.isSet(WidgetProperties.ICON) || props.isSet(WidgetProperties.ICON_DATA));
    }

    /**
     * {@code base "text..."} for literal text, {@code base (key)} for a declared key, else {@code base}.
     */
    public static String label(String base, String text, String key) {
        if (text != null) {
            return base + " \"" + truncate(text) + "\"";
        }
        if (key != null) {
            return base + " (" + key + ")";
        }
        return base;
    }

    public static String truncate(String text) {
        if (text.length() <= LABEL_LIMIT) {
            return text;
        }
        return text.substring(0, LABEL_LIMIT) + "...";
    }

    public static String keyOf(WidgetNode widget) {
        WidgetProperties props = widget.getProperties();
        return props != null && props.isSet(WidgetProperties.KEY) ? props.getText(WidgetProperties.KEY) : null;
    }
}
