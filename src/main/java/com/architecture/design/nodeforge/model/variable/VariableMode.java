package com.architecture.design.nodeforge.model.variable;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VariableMode {
    private String name;
    private String modeId;
}
