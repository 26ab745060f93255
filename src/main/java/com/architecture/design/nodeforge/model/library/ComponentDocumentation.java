package com.architecture.design.nodeforge.model.library;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Searchable documentation attached to a component in the library.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentDocumentation {
    private String description;
    private String category;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private int usageCount;
    private ComplexityLevel complexity;
    @Builder.Default
    private List<String> examples = new ArrayList<>();
}
