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
public class MultiModeVariableCollection {
    private String name;
    private String description;
    @Builder.Default
    private List<VariableMode> modes = new ArrayList<>();
    @Builder.Default
    private List<MultiModeVariableDefinition> variables = new ArrayList<>();
}
