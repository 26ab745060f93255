package com.architecture.design.nodeforge.model.component;

public enum ComponentPropertyKind {
    BOOLEAN,
    TEXT,
    VARIANT,
    INSTANCE_SWAP
}
