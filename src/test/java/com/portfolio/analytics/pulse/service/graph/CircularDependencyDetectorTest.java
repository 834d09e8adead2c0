package com.portfolio.analytics.pulse.service.graph;

import com.portfolio.analytics.pulse.dto.graph.CircularDependency;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CircularDependencyDetectorTest {

    private final CircularDependencyDetector detector = new CircularDependencyDetector();

    private static DependencyGraph graph(String[]... edges) {
        DependencyGraph.Builder builder = DependencyGraph.builder().projects(List.of("A", "B", "C", "D"));
        for (String[] edge : edges) {
            builder.dependency(edge[0], edge[1]);
        }
        return builder.build();
    }

    @Test
    void detect_reportsThreeProjectCycleAsError() {
        Optional<CircularDependency> found = detector.detect(
                graph(new String[]{"A", "B"}, new String[]{"B", "C"}, new String[]{"C", "A"}));

        assertThat(found).isPresent();
        CircularDependency cycle = found.get();
        assertThat(cycle.getSeverity()).isEqualTo(CircularDependency.Severity.ERROR);
        assertThat(cycle.getCycle()).containsExactly("A", "B", "C", "A");
        assertThat(cycle.getCycleEdges()).hasSize(3);
        assertThat(cycle.getCycleEdges().get(0).getFromProject()).isEqualTo("A");
        assertThat(cycle.getCycleEdges().get(0).getToProject()).isEqualTo("B");
        assertThat(cycle.getDescription()).contains("A -> B -> C -> A");
    }

    @Test
    void detect_reportsMutualDependencyAsWarning() {
        Optional<CircularDependency> found = detector.detect(graph(new String[]{"A", "B"}, new String[]{"B", "A"}));

        assertThat(found).map(CircularDependency::getSeverity).hasValue(CircularDependency.Severity.WARNING);
    }

    @Test
    void detect_returnsEmpty_forAcyclicGraph() {
        assertThat(detector.detect(graph(new String[]{"A", "B"}, new String[]{"B", "C"}))).isEmpty();
    }

    @Test
    void detectAndCompare_flagsCycleAbsentFromBaseline() {
        DependencyGraph baseline = graph(new String[]{"A", "B"}, new String[]{"B", "C"});
        DependencyGraph candidate = graph(new String[]{"A", "B"}, new String[]{"B", "C"}, new String[]{"C", "A"});

        assertThat(detector.detectAndCompare(baseline, candidate))
                .hasValueSatisfying(cycle -> assertThat(cycle.isNewInScenario()).isTrue());
    }

    @Test
    void detectAndCompare_doesNotFlagExistingCycle() {
        DependencyGraph cyclic = graph(new String[]{"A", "B"}, new String[]{"B", "A"});

        assertThat(detector.detectAndCompare(cyclic, cyclic))
                .hasValueSatisfying(cycle -> assertThat(cycle.isNewInScenario()).isFalse());
    }

    @Test
    void normalizeCycleKey_isIndependentOfStartingProject() {
        assertThat(detector.normalizeCycleKey(List.of("B", "C", "A", "B")))
                .isEqualTo(detector.normalizeCycleKey(List.of("A", "B", "C", "A")));
    }
}
