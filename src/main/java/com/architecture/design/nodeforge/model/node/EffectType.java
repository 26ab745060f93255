package com.architecture.design.nodeforge.model.node;

public enum EffectType {
    DROP_SHADOW
}
