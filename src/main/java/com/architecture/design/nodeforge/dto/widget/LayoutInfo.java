package com.architecture.design.nodeforge.dto.widget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Layout information for container widgets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutInfo {
    private LayoutType type;
    private LayoutDirection direction;   // only meaningful for FLEX
    private AlignmentInfo alignment;
    private Double spacing;
    private EdgeInsets padding;

    // Fixed-size bounds
    private Double width;
    private Double height;
    private Double minWidth;
    private Double maxWidth;
    private Double minHeight;
    private Double maxHeight;
}
