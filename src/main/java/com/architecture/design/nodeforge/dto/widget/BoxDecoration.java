package com.architecture.design.nodeforge.dto.widget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoxDecoration {
    private String color;
    private BorderInfo border;
    private BorderRadius borderRadius;
    private List<ShadowInfo> boxShadow;
}
