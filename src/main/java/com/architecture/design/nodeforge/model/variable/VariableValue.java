package com.architecture.design.nodeforge.model.variable;

import com.architecture.design.nodeforge.model.node.RgbColor;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Value held by a variable: a colour, a number or a string, matching its {@link VariableType}.
 */
@EqualsAndHashCode
@ToString
public final class VariableValue {

    private final Object value;

    private VariableValue(Object value) {
        this.value = value;
    }

    public static VariableValue color(RgbColor color) {
        return new VariableValue(color);
    }

    public static VariableValue number(double number) {
        return new VariableValue(number);
    }

    public static VariableValue text(String text) {
        return new VariableValue(text);
    }

    @JsonValue
    public Object raw() {
        return value;
    }

    public RgbColor asColor() {
        if (value instanceof RgbColor color) return color;
        throw new IllegalStateException("Not a colour value: " + value);
    }

    public double asNumber() {
        if (value instanceof Double number) return number;
        throw new IllegalStateException("Not a numeric value: " + value);
    }

    public String asText() {
        return String.valueOf(value);
    }
}
