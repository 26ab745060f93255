package com.architecture.design.nodeforge.model.library;

import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Page layout of the library document: overview, one page per category, utilities, plus a cover.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LibraryPageStructure {
    private String name;
    @Builder.Default
    private List<Page> pages = new ArrayList<>();
    private CoverPage coverPage;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Page {
        private String name;
        private String description;
        @Builder.Default
        private List<Section> sections = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Section {
        private String name;
        private String description;
        @Builder.Default
        private List<ComponentDefinition> components = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CoverPage {
        private String title;
        private String description;
        private int totalComponents;
        private int totalCategories;
        private String version;
        @Builder.Default
        private List<QuickLink> quickLinks = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QuickLink {
        private String name;
        private String description;
        private int componentCount;
    }
}
