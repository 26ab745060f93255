package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MainAxisAlignment {
    @JsonProperty("start") START,
    @JsonProperty("center") CENTER,
    @JsonProperty("end") END,
    @JsonProperty("spaceBetween") SPACE_BETWEEN,
    @JsonProperty("spaceAround") SPACE_AROUND,
    @JsonProperty("spaceEvenly") SPACE_EVENLY
}
