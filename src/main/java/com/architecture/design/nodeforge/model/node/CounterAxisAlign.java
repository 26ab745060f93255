package com.architecture.design.nodeforge.model.node;

public enum CounterAxisAlign {
    MIN,
    CENTER,
    MAX
}
