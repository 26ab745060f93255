package com.architecture.design.nodeforge.dto;

import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import com.architecture.design.nodeforge.model.library.LibraryPageStructure;
import com.architecture.design.nodeforge.model.library.LibraryStructure;
import com.architecture.design.nodeforge.model.node.TargetNodeSpec;
import com.architecture.design.nodeforge.model.variable.MultiModeVariableCollection;
import com.architecture.design.nodeforge.model.variable.VariableCollection;
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
public class ConversionResponse {
    private boolean success;
    private TargetNodeSpec root;
    @Builder.Default
    private List<ComponentDefinition> components = new ArrayList<>();
    private LibraryStructure library;
    private LibraryPageStructure pages;
    @Builder.Default
    private List<VariableCollection> variableCollections = new ArrayList<>();
    @Builder.Default
    private List<MultiModeVariableCollection> multiModeVariableCollections = new ArrayList<>();
    @Builder.Default
    private List<NodeStyleReport> styleReports = new ArrayList<>();
    @Builder.Default
    private List<String> loweringWarnings = new ArrayList<>();
    private ConversionStats stats;
}
