package com.architecture.design.nodeforge.service.library;

import com.architecture.design.nodeforge.dto.widget.ReusableWidgetDefinition;
import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A built component together with the reusable widget it was generated from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentSource {
    private ComponentDefinition component;
    private ReusableWidgetDefinition definition;
}
