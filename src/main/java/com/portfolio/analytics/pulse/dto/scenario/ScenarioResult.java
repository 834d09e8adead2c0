package com.portfolio.analytics.pulse.dto.scenario;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Before and after states, impacts and warnings for one simulated scenario.
 * Impacts list the direct target first, then cascades.
 */
@Value
@Builder
public class ScenarioResult {

    ScenarioAction action;

    @Builder.Default
    Map<String, ProjectSnapshot> beforeState = Map.of();   // keyed by project name, portfolio order

    @Builder.Default
    Map<String, ProjectSnapshot> afterState = Map.of();

    @Singular
    List<ProjectImpact> impacts;

    @Singular
    List<String> warnings;

    public List<ProjectImpact> directImpacts() {
        return impacts.stream().filter(i -> i.getImpactType() == ImpactType.DIRECT).collect(Collectors.toList());
    }

    public List<ProjectImpact> cascadeImpacts() {
        return impacts.stream().filter(i -> i.getImpactType() == ImpactType.CASCADE).collect(Collectors.toList());
    }
}
