package com.architecture.design.nodeforge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters of one conversion run, for progress and error reporting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionStats {
    private int widgetsFound;
    private int widgetsConverted;
    private int componentsCreated;
    private int instancesCreated;
    private int variablesCreated;
    private int framesCreated;
    private int textNodesCreated;
    @Builder.Default
    private List<String> unsupportedWidgets = new ArrayList<>();
    private int errors;
    private int warnings;
    private long processingTimeMs;

    /**
     * Percentage of found widgets that were converted, 0 when nothing was found.
     */
    @JsonProperty("successRate")
    public double successRate() {
        if (widgetsFound == 0) return 0;
        return Math.round(widgetsConverted * 1000.0 / widgetsFound) / 10.0;
    }

    @JsonProperty("summary")
    public String summary() {
        StringBuilder summary = new StringBuilder()
                .append("Converted ").append(widgetsConverted).append(" of ").append(widgetsFound)
                .append(" widgets (").append(formatRate()).append("%)");
        if (componentsCreated > 0 || instancesCreated > 0) {
            summary.append(", ").append(componentsCreated).append(" components and ")
                    .append(instancesCreated).append(" instances");
        }
        if (variablesCreated > 0) {
            summary.append(", ").append(variablesCreated).append(" variables");
        }
        summary.append(" in ").append(processingTimeMs).append("ms");
        if (errors > 0 || warnings > 0) {
            summary.append(" with ").append(errors).append(" errors and ").append(warnings).append(" warnings");
        }
        return summary.toString();
    }

    private String formatRate() {
        double rate = successRate();
        return rate == Math.rint(rate) ? String.valueOf((long) rate) : String.valueOf(rate);
    }
}
