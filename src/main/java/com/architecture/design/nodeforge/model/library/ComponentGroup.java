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
public class ComponentGroup {
    private String name;
    private String description;
    @Builder.Default
    private List<ComponentDefinition> components = new ArrayList<>();
    @Builder.Default
    private List<ComponentSubGroup> subGroups = new ArrayList<>();
}
