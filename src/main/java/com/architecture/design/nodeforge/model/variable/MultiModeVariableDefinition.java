package com.architecture.design.nodeforge.model.variable;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Variable holding one value per theme mode, keyed by mode name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultiModeVariableDefinition {
    private String name;
    private VariableType type;
    @Builder.Default
    private List<VariableScope> scopes = new ArrayList<>();
    @Builder.Default
    private Map<String, VariableValue> values = new LinkedHashMap<>();
    private String description;
    private String collection;
}
