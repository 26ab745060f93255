package com.architecture.design.nodeforge.service.variable;

import com.architecture.design.nodeforge.model.variable.MultiModeVariableCollection;
import com.architecture.design.nodeforge.model.variable.MultiModeVariableDefinition;
import com.architecture.design.nodeforge.model.variable.VariableCollection;
import com.architecture.design.nodeforge.model.variable.VariableDefinition;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only token lookup keyed by (collection name, variable name). Built once per run before lowering.
 */
public class VariableCatalog {

    private final Map<String, VariableCollection> collections = new LinkedHashMap<>();
    private final Map<String, MultiModeVariableCollection> multiModeCollections = new LinkedHashMap<>();

    public VariableCatalog(Collection<VariableCollection> collections,
                           Collection<MultiModeVariableCollection> multiModeCollections) {
        collections.forEach(c -> this.collections.put(c.getName(), c));
        multiModeCollections.forEach(c -> this.multiModeCollections.put(c.getName(), c));
    }

    public static VariableCatalog empty() {
        return new VariableCatalog(List.of(), List.of());
    }

    public Optional<VariableDefinition> getVariable(String collectionName, String variableName) {
        VariableCollection collection = collections.get(collectionName);
        if (collection == null) return Optional.empty();
        return collection.getVariables().stream()
                .filter(v -> v.getName().equals(variableName))
                .findFirst();
    }

    public Optional<MultiModeVariableDefinition> getMultiModeVariable(String collectionName, String variableName) {
        MultiModeVariableCollection collection = multiModeCollections.get(collectionName);
        if (collection == null) return Optional.empty();
        return collection.getVariables().stream()
                .filter(v -> v.getName().equals(variableName))
                .findFirst();
    }

    public List<VariableCollection> getCollections() {
        return List.copyOf(collections.values());
    }

    public List<MultiModeVariableCollection> getMultiModeCollections() {
        return List.copyOf(multiModeCollections.values());
    }

    /**
     * Total number of variables across single- and multi-mode collections.
     */
    public int variableCount() {
        int single = collections.values().stream().mapToInt(c -> c.getVariables().size()).sum();
        int multi = multiModeCollections.values().stream().mapToInt(c -> c.getVariables().size()).sum();
        return single + multi;
    }
}
