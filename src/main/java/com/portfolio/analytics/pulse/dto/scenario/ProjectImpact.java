package com.portfolio.analytics.pulse.dto.scenario;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Effect of a scenario on one project. Each change is rendered "before → after"
 * or as an informational note.
 */
@Value
@Builder
public class ProjectImpact {

    String projectName;
    ImpactType impactType;

    @Singular
    Map<String, String> changes;    // insertion ordered

    public String change(String key) {
        return changes.getOrDefault(key, "");
    }
}
