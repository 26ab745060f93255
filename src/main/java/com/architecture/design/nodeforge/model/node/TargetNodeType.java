package com.architecture.design.nodeforge.model.node;

/**
 * Kinds of node in the target design document.
 */
public enum TargetNodeType {
    FRAME,
    TEXT,
    RECTANGLE,
    COMPONENT,
    INSTANCE,
    GROUP,
    VECTOR
}
