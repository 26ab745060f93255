package com.architecture.design.nodeforge.model.library;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Generated component library: categories, ordered by priority, each with its groups.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LibraryStructure {
    private String name;
    private String description;
    @Builder.Default
    private List<ComponentCategory> categories = new ArrayList<>();
    private Metadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private int totalComponents;
        private Instant generatedAt;
        private String version;
    }
}
