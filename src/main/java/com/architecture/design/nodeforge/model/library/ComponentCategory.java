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
public class ComponentCategory {
    private String name;
    private String description;
    private int priority;
    @Builder.Default
    private List<ComponentDefinition> components = new ArrayList<>();
    @Builder.Default
    private List<ComponentGroup> groups = new ArrayList<>();
    private Metadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private int componentCount;
        private long averageUsage;
        private ComplexityLevel complexity;
    }
}
