package com.architecture.design.nodeforge.model.variable;

/**
 * Node properties a variable may be bound to.
 */
public enum VariableScope {
    ALL_FILLS,
    ALL_STROKES,
    TEXT_CONTENT,
    CORNER_RADIUS,
    WIDTH_HEIGHT,
    GAP,
    FONT_SIZE,
    FONT_FAMILY,
    FONT_WEIGHT,
    LINE_HEIGHT,
    LETTER_SPACING
}
