package com.portfolio.analytics.pulse.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Represents a detected circular dependency between projects.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircularDependency {

    public enum Severity {
        WARNING,  // Two-project loop, usually a mutual hand-off
        ERROR     // Loop through three or more projects
    }

    private Severity severity;
    private String description;
    private List<String> cycle;          // e.g., ["Alpha", "Beta", "Gamma", "Alpha"]
    private List<CycleEdge> cycleEdges;
    private boolean newInScenario;       // true if the cycle is absent from the baseline graph

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CycleEdge {
        private String fromProject;
        private String toProject;
        private String relationshipType; // DEPENDS_ON
    }
}
