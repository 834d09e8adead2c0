package com.portfolio.analytics.pulse.service.risk;

import com.portfolio.analytics.pulse.dto.risk.PortfolioRiskReport;
import com.portfolio.analytics.pulse.dto.risk.ProjectRiskSummary;
import com.portfolio.analytics.pulse.dto.risk.RagStatus;
import com.portfolio.analytics.pulse.dto.risk.Risk;
import com.portfolio.analytics.pulse.dto.risk.RiskSeverity;
import com.portfolio.analytics.pulse.model.Project;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every detector over every project, keeps the top N risks per project and rolls
 * them up into project and portfolio RAG statuses.
 *
 * A project's RAG is derived from its retained risks only, so a smaller top N can hide
 * a worse risk that was truncated away.
 */
@Service
@Slf4j
public class RiskAggregationService {

    private static final Comparator<ProjectRiskSummary> WORST_PROJECT_FIRST = Comparator
            .comparing(ProjectRiskSummary::getRagStatus)
            .thenComparingInt(RiskAggregationService::worstRank)
            .thenComparing(Comparator.comparingInt(ProjectRiskSummary::getRiskCount).reversed())
            .thenComparing(ProjectRiskSummary::getProjectName);

    private final List<RiskDetector> detectors;
    private final Clock clock;
    private final int defaultTopN;

    @Autowired
    public RiskAggregationService(List<RiskDetector> detectors,
                                  Clock clock,
                                  @Value("${portfolio.risk.top-n:5}") int defaultTopN) {
        if (defaultTopN < 0) {
            throw new IllegalArgumentException("top-n must not be negative, got " + defaultTopN);
        }
        this.detectors = List.copyOf(detectors);
        this.clock = clock;
        this.defaultTopN = defaultTopN;
    }

    public PortfolioRiskReport analysePortfolio(List<Project> projects) {
        return analysePortfolio(projects, defaultTopN, null);
    }

    public PortfolioRiskReport analysePortfolio(List<Project> projects, int topN) {
        return analysePortfolio(projects, topN, null);
    }

    /**
     * @param projects      the portfolio
     * @param topN          risks retained per project
     * @param referenceDate date the burn-rate maths is evaluated at; null means today
     */
    public PortfolioRiskReport analysePortfolio(List<Project> projects, int topN, LocalDate referenceDate) {
        if (topN < 0) {
            throw new IllegalArgumentException("topN must not be negative, got " + topN);
        }
        LocalDate refDate = referenceDate != null ? referenceDate : LocalDate.now(clock);
        log.info("Analysing risk for {} project(s), top {} per project, reference date {}",
                projects.size(), topN, refDate);

        List<ProjectRiskSummary> summaries = new ArrayList<>();
        for (Project project : projects) {
            summaries.add(summarise(project, topN, refDate));
        }
        summaries.sort(WORST_PROJECT_FIRST);

        int totalRisks = summaries.stream().mapToInt(ProjectRiskSummary::getRiskCount).sum();
        int projectsAtRisk = (int) summaries.stream().filter(s -> s.getRiskCount() > 0).count();
        RagStatus portfolioRag = summaries.stream()
                .map(ProjectRiskSummary::getRagStatus)
                .reduce(RagStatus.GREEN, RagStatus::worst);

        log.info("Risk analysis complete: {} risk(s) across {} project(s) at risk, portfolio {}",
                totalRisks, projectsAtRisk, portfolioRag.getLabel());

        return PortfolioRiskReport.builder()
                .referenceDate(refDate)
                .projectSummaries(summaries)
                .totalRisks(totalRisks)
                .projectsAtRisk(projectsAtRisk)
                .portfolioRag(portfolioRag)
                .build();
    }

    /**
     * All detectors for one project, worst first, truncated to {@code topN}.
     */
    public ProjectRiskSummary summarise(Project project, int topN, LocalDate referenceDate) {
        List<Risk> risks = new ArrayList<>();
        for (RiskDetector detector : detectors) {
            risks.addAll(detector.detect(project, referenceDate));
        }
        risks.sort(RiskVocabulary.WORST_FIRST);

        List<Risk> retained = risks.size() > topN ? risks.subList(0, topN) : risks;
        RiskSeverity worst = retained.isEmpty() ? null : retained.get(0).getSeverity();

        if (retained.size() < risks.size()) {
            log.debug("Project {}: kept {} of {} risk(s)", project.getName(), retained.size(), risks.size());
        }

        return ProjectRiskSummary.builder()
                .projectName(project.getName())
                .projectStatus(project.getStatus())
                .risks(retained)
                .ragStatus(RagStatus.fromWorstSeverity(worst))
                .build();
    }

    private static int worstRank(ProjectRiskSummary summary) {
        RiskSeverity worst = summary.worstSeverity();
        return worst == null ? RiskSeverity.values().length : worst.getRank();
    }
}
