package com.architecture.design.nodeforge.model.variable;

public enum VariableType {
    COLOR,
    FLOAT,
    STRING,
    BOOLEAN
}
