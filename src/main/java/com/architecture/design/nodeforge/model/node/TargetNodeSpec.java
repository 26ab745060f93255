package com.architecture.design.nodeforge.model.node;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Node of the generated design document. Children are owned and ordered; z-order is child order.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TargetNodeSpec {
    private String id;
    private TargetNodeType type;
    private String name;
    @Builder.Default
    private NodeProperties properties = new NodeProperties();
    private AutoLayoutSpec autoLayout;
    @Builder.Default
    private List<VariableBinding> variables = new ArrayList<>();
    @Builder.Default
    private List<TargetNodeSpec> children = new ArrayList<>();

    @JsonIgnore
    public boolean isFrameLike() {
        return type == TargetNodeType.FRAME || type == TargetNodeType.COMPONENT;
    }

    /**
     * Pre-order walk over this node and its descendants.
     */
    public void walk(Consumer<TargetNodeSpec> visitor) {
        visitor.accept(this);
        if (children != null) {
            children.forEach(child -> child.walk(visitor));
        }
    }
}
