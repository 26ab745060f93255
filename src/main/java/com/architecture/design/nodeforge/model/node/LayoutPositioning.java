package com.architecture.design.nodeforge.model.node;

public enum LayoutPositioning {
    AUTO,
    ABSOLUTE
}
