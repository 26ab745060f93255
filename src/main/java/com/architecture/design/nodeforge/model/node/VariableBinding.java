package com.architecture.design.nodeforge.model.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A node property driven by a design variable instead of a literal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariableBinding {
    private String targetProperty;   // fills, strokes, fontSize, ...
    private String variableId;
    private String variableAlias;    // {Collection.name}
}
