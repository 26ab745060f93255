package com.architecture.design.nodeforge.model.library;

import com.architecture.design.nodeforge.model.component.ComponentDefinition;
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
public class ComponentSubGroup {
    private String name;
    @Builder.Default
    private List<ComponentDefinition> components = new ArrayList<>();
}
