package com.architecture.design.nodeforge.model.component;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Variants sharing one value of their most significant property.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantGroup {
    private String name;
    private String property;
    @Builder.Default
    private List<ComponentVariant> variants = new ArrayList<>();
}
