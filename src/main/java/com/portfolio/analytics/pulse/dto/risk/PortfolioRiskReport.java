package com.portfolio.analytics.pulse.dto.risk;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Output of one aggregation run over the portfolio.
 */
@Value
@Builder
public class PortfolioRiskReport {

    LocalDate referenceDate;

    @Singular
    List<ProjectRiskSummary> projectSummaries;  // worst project first

    int totalRisks;
    int projectsAtRisk;
    RagStatus portfolioRag;

    public Optional<ProjectRiskSummary> findProject(String projectName) {
        return projectSummaries.stream()
                .filter(s -> s.getProjectName().equalsIgnoreCase(projectName))
                .findFirst();
    }
}
