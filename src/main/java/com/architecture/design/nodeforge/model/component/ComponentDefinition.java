package com.architecture.design.nodeforge.model.component;

import com.architecture.design.nodeforge.dto.widget.PropertyValue;
import com.architecture.design.nodeforge.model.library.ComponentDocumentation;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reusable component generated from a recurring widget. Instances refer to it by {@code id}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComponentDefinition {
    private String id;
    private String name;
    private String description;
    @Builder.Default
    private List<ComponentVariant> variants = new ArrayList<>();
    @Builder.Default
    private List<ComponentProperty> properties = new ArrayList<>();
    private ComponentDocumentation documentation;

    // Literal text/colour/size of the base widget, keyed like instance overrides
    @JsonIgnore
    @Builder.Default
    private Map<String, PropertyValue> overrideDefaults = new LinkedHashMap<>();

    public boolean hasVariants() {
        return variants != null && variants.size() > 1;
    }
}
