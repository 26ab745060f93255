package com.architecture.design.nodeforge.model.node;

/**
 * Edge a node stays pinned to when its parent resizes.
 */
public enum ConstraintType {
    LEFT,
    RIGHT,
    TOP,
    BOTTOM,
    CENTER
}
