package com.architecture.design.nodeforge.model.library;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplexityLevel {
    SIMPLE("Simple"),
    MEDIUM("Medium"),
    COMPLEX("Complex");

    private final String label;

    ComplexityLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Level for a weighted complexity score.
     */
    public static ComplexityLevel fromScore(int score) {
        if (score <= 3) return SIMPLE;
        if (score <= 8) return MEDIUM;
        return COMPLEX;
    }
}
