package com.architecture.design.nodeforge.service.lowering;

import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one conversion run: id counters, lowering warnings and the components built so far.
 *
 * A context belongs to exactly one run and is not thread-safe; concurrent runs each create their own.
 */
@Slf4j
public class LoweringContext {

    private int nodeCounter;
    private int componentCounter;
    private final Set<String> warnings = new LinkedHashSet<>();
    private final Map<String, ComponentDefinition> componentsById = new LinkedHashMap<>();

    public String nextNodeId() {
        return "node_" + (++nodeCounter);
    }

    /**
     * Component id of the form {@code component-{sanitized lower-case name}-{n}}.
     */
    public String nextComponentId(String componentName) {
        String sanitized = componentName.toLowerCase().replaceAll("[^a-z0-9]", "-");
        return "component-" + sanitized + "-" + (++componentCounter);
    }

    /**
     * Records a warning once; lowering the same widget again (as a component variant) repeats nothing.
     */
    public void warn(String warning) {
        if (warnings.add(warning)) {
            log.warn("[lowering] {}", warning);
        }
    }

    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    public int nodesCreated() {
        return nodeCounter;
    }

    /**
     * Registers a component under its id. Display names may repeat; ids never do.
     */
    public void registerComponent(ComponentDefinition component) {
        componentsById.put(component.getId(), component);
    }

    public Optional<ComponentDefinition> findComponentById(String componentId) {
        return Optional.ofNullable(componentsById.get(componentId));
    }

    /**
     * First component registered under {@code componentName}.
     */
    public Optional<ComponentDefinition> findComponent(String componentName) {
        return componentsById.values().stream()
                .filter(component -> component.getName().equals(componentName))
                .findFirst();
    }

    public List<ComponentDefinition> getComponents() {
        return List.copyOf(componentsById.values());
    }
}
