package com.architecture.design.nodeforge.dto.style;

import com.architecture.design.nodeforge.model.node.VariableBinding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of applying one widget's styling to one node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StyleResult {
    private boolean success;
    @Builder.Default
    private List<String> appliedProperties = new ArrayList<>();
    @Builder.Default
    private List<VariableBinding> variableBindings = new ArrayList<>();
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
