package com.architecture.design.nodeforge.model.node;

public enum PrimaryAxisAlign {
    MIN,
    CENTER,
    MAX,
    SPACE_BETWEEN
}
