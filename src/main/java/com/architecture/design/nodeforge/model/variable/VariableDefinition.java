package com.architecture.design.nodeforge.model.variable;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariableDefinition {
    private String name;
    private VariableType type;
    @Builder.Default
    private List<VariableScope> scopes = new ArrayList<>();
    private VariableValue value;
    private String description;
    private String collection;
}
