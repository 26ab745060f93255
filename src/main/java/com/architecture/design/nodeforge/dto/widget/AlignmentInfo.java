package com.architecture.design.nodeforge.dto.widget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlignmentInfo {
    private MainAxisAlignment mainAxis;
    private CrossAxisAlignment crossAxis;
}
