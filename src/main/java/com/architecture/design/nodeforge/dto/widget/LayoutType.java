package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LayoutType {
    @JsonProperty("row") ROW,
    @JsonProperty("column") COLUMN,
    @JsonProperty("stack") STACK,
    @JsonProperty("wrap") WRAP,
    @JsonProperty("flex") FLEX
}
