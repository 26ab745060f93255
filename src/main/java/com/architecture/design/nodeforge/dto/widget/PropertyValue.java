package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;

/**
 * Scalar widget property value: a boolean, a string or a number.
 * Serialized as the bare JSON scalar.
 */
@EqualsAndHashCode
public final class PropertyValue {

    public enum Kind {
        BOOL,
        STRING,
        NUMBER
    }

    private final Kind kind;
    private final Object value;

    private PropertyValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static PropertyValue of(boolean value) {
        return new PropertyValue(Kind.BOOL, value);
    }

    public static PropertyValue of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("String property value must not be null");
        }
        return new PropertyValue(Kind.STRING, value);
    }

    public static PropertyValue of(double value) {
        return new PropertyValue(Kind.NUMBER, value);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PropertyValue fromJson(Object raw) {
        if (raw instanceof Boolean b) return of(b);
        if (raw instanceof Number n) return of(n.doubleValue());
        if (raw instanceof String s) return of(s);
        throw new IllegalArgumentException("Unsupported property value: " + raw);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isBool() {
        return kind == Kind.BOOL;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean asBoolean() {
        return kind == Kind.BOOL && (Boolean) value;
    }

    public double asNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return (Double) value;
    }

    /**
     * Truthiness in the widget-analysis sense: false, empty string and zero are falsy.
     */
    public boolean isTruthy() {
        return switch (kind) {
            case BOOL -> (Boolean) value;
            case STRING -> !((String) value).isEmpty();
            case NUMBER -> (Double) value != 0d;
        };
    }

    @JsonValue
    public Object raw() {
        return value;
    }

    /**
     * Display form; whole numbers drop their fractional part ({@code 2.0} renders as {@code 2}).
     */
    @Override
    public String toString() {
        if (kind == Kind.NUMBER) {
            return BigDecimal.valueOf((Double) value).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }
}
