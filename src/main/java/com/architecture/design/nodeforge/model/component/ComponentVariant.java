package com.architecture.design.nodeforge.model.component;

import com.architecture.design.nodeforge.dto.widget.PropertyValue;
import com.architecture.design.nodeforge.model.node.TargetNodeSpec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentVariant {
    private String name;
    @Builder.Default
    private Map<String, PropertyValue> properties = new LinkedHashMap<>();
    private TargetNodeSpec nodeSpec;
}
