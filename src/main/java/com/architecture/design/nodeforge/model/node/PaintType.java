package com.architecture.design.nodeforge.model.node;

public enum PaintType {
    SOLID
}
