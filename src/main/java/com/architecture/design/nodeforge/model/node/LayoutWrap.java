package com.architecture.design.nodeforge.model.node;

public enum LayoutWrap {
    NO_WRAP,
    WRAP
}
