package com.architecture.design.nodeforge.model.component;

import com.architecture.design.nodeforge.dto.widget.PropertyValue;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A switchable property exposed on a component.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComponentProperty {
    private String name;
    private ComponentPropertyKind kind;
    private PropertyValue defaultValue;
    private List<String> variantOptions;   // VARIANT only
}
