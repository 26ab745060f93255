package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CrossAxisAlignment {
    @JsonProperty("start") START,
    @JsonProperty("center") CENTER,
    @JsonProperty("end") END,
    @JsonProperty("stretch") STRETCH
}
