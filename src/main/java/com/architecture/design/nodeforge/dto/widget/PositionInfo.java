package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Absolute placement of a Stack child. Opposing edges may both be present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionInfo {
    private Double left;
    private Double right;
    private Double top;
    private Double bottom;
    private Double width;
    private Double height;

    @JsonIgnore
    public boolean isEmpty() {
        return left == null && right == null && top == null && bottom == null
                && width == null && height == null;
    }
}
