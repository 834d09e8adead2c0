package com.portfolio.analytics.pulse.service.graph;

import com.portfolio.analytics.pulse.dto.graph.CircularDependency;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Turns the cycle found by {@link DependencyGraph#detectCycle()} into a report the
 * reporting layer can render.
 */
@Service
@Slf4j
public class CircularDependencyDetector {

    public Optional<CircularDependency> detect(DependencyGraph graph) {
        Optional<List<String>> cycle = graph.detectCycle();
        if (cycle.isEmpty()) {
            log.debug("No circular dependency among {} project(s)", graph.getAllProjects().size());
            return Optional.empty();
        }
        CircularDependency dependency = describe(cycle.get());
        log.info("Circular dependency detected: {}", String.join(" -> ", cycle.get()));
        return Optional.of(dependency);
    }

    /**
     * Compare a candidate graph against a baseline and flag the candidate's cycle
     * when the baseline does not contain it.
     */
    public Optional<CircularDependency> detectAndCompare(DependencyGraph baseline, DependencyGraph candidate) {
        Optional<CircularDependency> candidateCycle = detect(candidate);
        candidateCycle.ifPresent(found -> {
            String baselineSignature = baseline.detectCycle().map(this::normalizeCycleKey).orElse("");
            found.setNewInScenario(!baselineSignature.equals(normalizeCycleKey(found.getCycle())));
        });
        return candidateCycle;
    }

    CircularDependency describe(List<String> cycle) {
        List<CircularDependency.CycleEdge> edges = new ArrayList<>();
        for (int i = 0; i < cycle.size() - 1; i++) {
            edges.add(CircularDependency.CycleEdge.builder()
                    .fromProject(cycle.get(i))
                    .toProject(cycle.get(i + 1))
                    .relationshipType("DEPENDS_ON")
                    .build());
        }

        int distinctProjects = cycle.size() - 1;
        return CircularDependency.builder()
                .severity(distinctProjects > 2 ? CircularDependency.Severity.ERROR : CircularDependency.Severity.WARNING)
                .description("Circular dependency between projects: " + String.join(" -> ", cycle))
                .cycle(cycle)
                .cycleEdges(edges)
                .newInScenario(false)
                .build();
    }

    /**
     * Normalize a cycle key so that the same cycle starting from different projects
     * produces the same signature.
     */
    String normalizeCycleKey(List<String> cycle) {
        if (cycle.size() <= 1) return cycle.toString();
        List<String> core = cycle.subList(0, cycle.size() - 1);
        String min = Collections.min(core);
        int minIdx = core.indexOf(min);
        List<String> normalized = new ArrayList<>();
        for (int i = 0; i < core.size(); i++) {
            normalized.add(core.get((minIdx + i) % core.size()));
        }
        return normalized.toString();
    }
}
