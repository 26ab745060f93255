package com.architecture.design.nodeforge.model.node;

public enum TextAlign {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFIED
}
