package com.architecture.design.nodeforge.model.node;

/**
 * How a child sizes itself inside an auto-layout parent.
 */
public enum LayoutSizing {
    FIXED,
    HUG,
    FILL
}
