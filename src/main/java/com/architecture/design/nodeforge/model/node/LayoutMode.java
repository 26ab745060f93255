package com.architecture.design.nodeforge.model.node;

public enum LayoutMode {
    HORIZONTAL,
    VERTICAL,
    NONE
}
