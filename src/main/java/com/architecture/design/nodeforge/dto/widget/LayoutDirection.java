package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LayoutDirection {
    @JsonProperty("horizontal") HORIZONTAL,
    @JsonProperty("vertical") VERTICAL
}
