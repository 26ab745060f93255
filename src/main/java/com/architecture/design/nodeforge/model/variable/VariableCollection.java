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
public class VariableCollection {
    private String name;
    private String description;
    @Builder.Default
    private List<VariableDefinition> variables = new ArrayList<>();
}
