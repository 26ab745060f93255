package com.architecture.design.nodeforge.model.node;

public enum AxisSizingMode {
    FIXED,
    AUTO
}
