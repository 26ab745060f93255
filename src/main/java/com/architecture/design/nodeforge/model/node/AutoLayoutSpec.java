package com.architecture.design.nodeforge.model.node;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Auto layout parameters of a frame-like node.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AutoLayoutSpec {
    @Builder.Default
    private LayoutMode layoutMode = LayoutMode.NONE;
    @Builder.Default
    private AxisSizingMode primaryAxisSizingMode = AxisSizingMode.AUTO;
    @Builder.Default
    private AxisSizingMode counterAxisSizingMode = AxisSizingMode.AUTO;
    @Builder.Default
    private PrimaryAxisAlign primaryAxisAlignItems = PrimaryAxisAlign.MIN;
    @Builder.Default
    private CounterAxisAlign counterAxisAlignItems = CounterAxisAlign.MIN;
    private double paddingLeft;
    private double paddingRight;
    private double paddingTop;
    private double paddingBottom;
    private double itemSpacing;

    // Wrap layouts only
    private LayoutWrap layoutWrap;
    private Double counterAxisSpacing;
}
