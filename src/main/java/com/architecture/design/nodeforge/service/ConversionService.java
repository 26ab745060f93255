package com.architecture.design.nodeforge.service;

import com.architecture.design.nodeforge.dto.ConversionRequest;
import com.architecture.design.nodeforge.dto.ConversionResponse;
import com.architecture.design.nodeforge.dto.ConversionStats;
import com.architecture.design.nodeforge.dto.NodeStyleReport;
import com.architecture.design.nodeforge.dto.style.StyleMappingConfig;
import com.architecture.design.nodeforge.dto.style.StyleResult;
import com.architecture.design.nodeforge.dto.widget.ReusableWidgetDefinition;
import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import com.architecture.design.nodeforge.dto.widget.WidgetType;
import com.architecture.design.nodeforge.model.component.ComponentDefinition;
import com.architecture.design.nodeforge.model.library.LibraryPageStructure;
import com.architecture.design.nodeforge.model.library.LibraryStructure;
import com.architecture.design.nodeforge.model.node.NodeProperties;
import com.architecture.design.nodeforge.model.node.TargetNodeSpec;
import com.architecture.design.nodeforge.model.node.TargetNodeType;
import com.architecture.design.nodeforge.service.component.ComponentAssembler;
import com.architecture.design.nodeforge.service.library.ComponentSource;
import com.architecture.design.nodeforge.service.library.LibraryOrganizer;
import com.architecture.design.nodeforge.service.lowering.LoweringContext;
import com.architecture.design.nodeforge.service.lowering.NodeLoweringEngine;
import com.architecture.design.nodeforge.service.style.StyleResolver;
import com.architecture.design.nodeforge.service.variable.VariableCatalog;
import com.architecture.design.nodeforge.service.variable.VariableCatalogBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one conversion: token catalog, lowering, component assembly, per-node styling with instance
 * substitution, then library organisation.
 *
 * Every call owns its {@link LoweringContext} and {@link StyleResolver}, so concurrent calls share
 * nothing mutable.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConversionService {

    private final VariableCatalogBuilder catalogBuilder;
    private final NodeLoweringEngine loweringEngine;
    private final ComponentAssembler componentAssembler;
    private final LibraryOrganizer libraryOrganizer;
    private final StyleMappingConfig defaultStyleConfig;

    public ConversionResponse convert(ConversionRequest request) {
        long startTime = System.currentTimeMillis();
        StyleMappingConfig config = request.getStyleConfig() != null ? request.getStyleConfig() : defaultStyleConfig;
        List<ReusableWidgetDefinition> reusableWidgets = request.getReusableWidgets() != null
                ? request.getReusableWidgets()
                : List.of();

        log.info("[conversion] Starting conversion: {} reusable widget(s), {} theme(s), useVariables={}",
                reusableWidgets.size(), request.getThemes() != null ? request.getThemes().size() : 0,
                config.isUseVariables());

        // Step 1: token catalog, read-only for the rest of the run
        VariableCatalog catalog = catalogBuilder.build(request.getThemes(), config.getCollectionPrefix());

        // Step 2: lowering
        LoweringContext ctx = new LoweringContext();
        TargetNodeSpec root = loweringEngine.lower(request.getRoot(), ctx);
        log.info("[conversion] Lowered {} node(s)", ctx.nodesCreated());

        // Step 3: components, registered in the context so instances can refer to them
        List<ComponentSource> sources = new ArrayList<>();
        Map<String, String> usages = new HashMap<>();
        for (ReusableWidgetDefinition definition : reusableWidgets) {
            ComponentDefinition component = componentAssembler.buildComponent(definition, ctx);
            sources.add(new ComponentSource(component, definition));
            if (definition.getInstanceIds() != null) {
                definition.getInstanceIds().forEach(id -> usages.put(id, component.getId()));
            }
        }

        // Step 4: styles and instance substitution over the widget and node trees in parallel
        RunState run = new RunState(new StyleResolver(catalog, config), ctx, usages);
        root = resolve(request.getRoot(), root, run);

        // Step 5: library
        List<ComponentDefinition> components = ctx.getComponents();
        LibraryStructure library = libraryOrganizer.organize(sources);
        LibraryPageStructure pages = libraryOrganizer.createPageStructure(library);

        ConversionStats stats = stats(request.getRoot(), root, run, components.size(), catalog, ctx);
        stats.setProcessingTimeMs(System.currentTimeMillis() - startTime);

        boolean success = run.reports.stream().allMatch(report -> report.getResult().isSuccess());
        log.info("[conversion] {}", stats.summary());

        return ConversionResponse.builder()
                .success(success)
                .root(root)
                .components(components)
                .library(library)
                .pages(pages)
                .variableCollections(catalog.getCollections())
                .multiModeVariableCollections(catalog.getMultiModeCollections())
                .styleReports(run.reports)
                .loweringWarnings(new ArrayList<>(ctx.getWarnings()))
                .stats(stats)
                .build();
    }

    // ========================= TREE WALK =========================

    private TargetNodeSpec resolve(WidgetNode widget, TargetNodeSpec node, RunState run) {
        if (widget.getType() == WidgetType.CUSTOM) {
            run.unsupported.add(widget.getId() != null ? widget.getId() : node.getName());
        }

        String componentId = widget.getId() != null ? run.usages.get(widget.getId()) : null;
        ComponentDefinition component = componentId != null
                ? run.ctx.findComponentById(componentId).orElse(null)
                : null;
        if (component != null) {
            TargetNodeSpec instance = componentAssembler.buildInstance(widget, component, run.ctx);
            keepPlacement(node.getProperties(), instance.getProperties());
            run.instances++;
            run.converted += countWidgets(widget);
            log.debug("[conversion] Replaced {} by an instance of {} ({})",
                    node.getName(), component.getName(), componentId);
            return instance;
        }

        StyleResult result = run.resolver.applyStyles(node, widget.getStyling());
        run.reports.add(NodeStyleReport.builder()
                .nodeId(node.getId())
                .nodeName(node.getName())
                .result(result)
                .build());
        if (result.isSuccess()) {
            run.converted++;
        }

        List<WidgetNode> widgetChildren = widget.getChildren() != null ? widget.getChildren() : List.of();
        for (int i = 0; i < widgetChildren.size() && i < node.getChildren().size(); i++) {
            node.getChildren().set(i, resolve(widgetChildren.get(i), node.getChildren().get(i), run));
        }
        return node;
    }

    private void keepPlacement(NodeProperties lowered, NodeProperties instance) {
        if (instance.getX() == null) instance.setX(lowered.getX());
        if (instance.getY() == null) instance.setY(lowered.getY());
        if (instance.getLayoutGrow() == null) instance.setLayoutGrow(lowered.getLayoutGrow());
        instance.setConstraints(lowered.getConstraints());
        instance.setZIndex(lowered.getZIndex());
        instance.setLayoutSizingHorizontal(lowered.getLayoutSizingHorizontal());
        instance.setLayoutSizingVertical(lowered.getLayoutSizingVertical());
        instance.setLayoutPositioning(lowered.getLayoutPositioning());
    }

    // ========================= STATS =========================

    private ConversionStats stats(WidgetNode widgetRoot, TargetNodeSpec root, RunState run, int componentCount,
                                  VariableCatalog catalog, LoweringContext ctx) {
        int[] frames = {0};
        int[] texts = {0};
        root.walk(node -> {
            if (node.isFrameLike()) frames[0]++;
            if (node.getType() == TargetNodeType.TEXT) texts[0]++;
        });

        int errors = run.reports.stream().mapToInt(r -> r.getResult().getErrors().size()).sum();
        int warnings = run.reports.stream().mapToInt(r -> r.getResult().getWarnings().size()).sum()
                + ctx.getWarnings().size();

        return ConversionStats.builder()
                .widgetsFound(countWidgets(widgetRoot))
                .widgetsConverted(run.converted)
                .componentsCreated(componentCount)
                .instancesCreated(run.instances)
                .variablesCreated(catalog.variableCount())
                .framesCreated(frames[0])
                .textNodesCreated(texts[0])
                .unsupportedWidgets(run.unsupported)
                .errors(errors)
                .warnings(warnings)
                .build();
    }

    private int countWidgets(WidgetNode widget) {
        int count = 1;
        if (widget.getChildren() != null) {
            for (WidgetNode child : widget.getChildren()) {
                count += countWidgets(child);
            }
        }
        return count;
    }

    /**
     * Per-call accumulators of the tree walk.
     */
    private static final class RunState {
        private final StyleResolver resolver;
        private final LoweringContext ctx;
        private final Map<String, String> usages;
        private final List<NodeStyleReport> reports = new ArrayList<>();
        private final List<String> unsupported = new ArrayList<>();
        private int converted;
        private int instances;

        private RunState(StyleResolver resolver, LoweringContext ctx, Map<String, String> usages) {
            this.resolver = resolver;
            this.ctx = ctx;
            this.usages = usages;
        }
    }
}
