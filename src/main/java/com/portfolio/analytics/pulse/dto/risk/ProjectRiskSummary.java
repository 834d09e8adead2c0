package com.portfolio.analytics.pulse.dto.risk;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Per-project rollup of the retained (top N) risks.
 */
@Value
@Builder
public class ProjectRiskSummary {

    String projectName;
    String projectStatus;

    @Singular
    List<Risk> risks;       // worst first

    RagStatus ragStatus;

    public int getRiskCount() {
        return risks.size();
    }

    /**
     * Worst retained severity, or null when the project has no risks.
     */
    public RiskSeverity worstSeverity() {
        return risks.isEmpty() ? null : risks.get(0).getSeverity();
    }
}
