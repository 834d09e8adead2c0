package com.portfolio.analytics.pulse.service.decision;

import com.portfolio.analytics.pulse.dto.decision.Decision;
import com.portfolio.analytics.pulse.dto.decision.DecisionLog;
import com.portfolio.analytics.pulse.dto.decision.DecisionOption;
import com.portfolio.analytics.pulse.dto.decision.DecisionSource;
import com.portfolio.analytics.pulse.dto.decision.DecisionStatus;
import com.portfolio.analytics.pulse.dto.risk.PortfolioRiskReport;
import com.portfolio.analytics.pulse.dto.risk.ProjectRiskSummary;
import com.portfolio.analytics.pulse.dto.risk.RagStatus;
import com.portfolio.analytics.pulse.dto.scenario.ProjectImpact;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioNarrative;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioResult;
import com.portfolio.analytics.pulse.service.scenario.ScenarioNarrativeService;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Records the decisions raised by scenario runs and risk reviews into a {@link DecisionLog}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DecisionLogService {

    static final int MAX_ESCALATED_PROJECTS = 5;

    private final ScenarioNarrativeService narrativeService;

    /**
     * Logs a pending "apply vs do nothing" decision for a simulated scenario. Scenarios
     * that raised warnings are recommended with caution.
     */
    public Decision fromScenario(@NonNull ScenarioResult result, @NonNull DecisionLog decisionLog,
                                 @NonNull LocalDate date) {
        ScenarioNarrative narrative = narrativeService.generate(result);
        String actionDescription = result.getAction().getDescription().isEmpty()
                ? result.getAction().getActionType().getValue() + " on " + result.getAction().getProject()
                : result.getAction().getDescription();

        Set<String> affected = new LinkedHashSet<>();
        for (ProjectImpact impact : result.getImpacts()) {
            affected.add(impact.getProjectName());
        }
        if (affected.isEmpty()) {
            affected.add(result.getAction().getProject());
        }

        DecisionOption apply = DecisionOption.builder()
                .label("Apply: " + actionDescription)
                .description(narrative.getImpactAnalysis().isEmpty() ? narrative.getAfterSummary() : narrative.getImpactAnalysis())
                .impactSummary(narrative.getAfterSummary())
                .build();
        DecisionOption doNothing = DecisionOption.builder()
                .label("Do nothing: maintain current plan")
                .description("Continue on current trajectory without change.")
                .impactSummary(narrative.getBeforeSummary().isEmpty()
                        ? "No change to delivery dates, budget, or dependencies."
                        : narrative.getBeforeSummary())
                .build();

        String recommendation;
        String rationale;
        List<String> warnings = result.getWarnings();
        if (!warnings.isEmpty()) {
            recommendation = "Proceed with caution: " + actionDescription;
            rationale = "Scenario modelled successfully but " + warnings.size() + " warning(s) flagged: "
                    + String.join("; ", warnings.subList(0, Math.min(2, warnings.size()))) + ".";
        } else {
            recommendation = "Recommend: " + actionDescription;
            rationale = narrative.getRecommendations().isEmpty()
                    ? "Scenario impact is manageable."
                    : String.join("; ", narrative.getRecommendations());
        }

        Decision decision = Decision.builder()
                .decisionId(decisionLog.nextId())
                .date(date)
                .title("Scenario: " + actionDescription)
                .context("Scenario simulation for " + result.getAction().getProject() + ".")
                .projectsAffected(new ArrayList<>(affected))
                .options(new ArrayList<>(List.of(apply, doNothing)))
                .recommendation(recommendation)
                .recommendationRationale(rationale)
                .status(DecisionStatus.PENDING)
                .source(DecisionSource.SCENARIO)
                .build();
        decisionLog.add(decision);

        log.info("Logged decision {}: {}", decision.getDecisionId(), decision.getTitle());
        return decision;
    }

    /**
     * Logs an escalation decision when any project is Red. Returns an empty list otherwise.
     */
    public List<Decision> fromRiskReport(@NonNull PortfolioRiskReport report, @NonNull DecisionLog decisionLog,
                                         @NonNull LocalDate date) {
        List<ProjectRiskSummary> red = report.getProjectSummaries().stream()
                .filter(summary -> summary.getRagStatus() == RagStatus.RED)
                .collect(Collectors.toList());
        if (red.isEmpty()) {
            log.debug("No Red projects, no escalation decision needed");
            return List.of();
        }

        int redCount = red.size();
        int riskCount = red.stream().mapToInt(ProjectRiskSummary::getRiskCount).sum();
        List<String> names = red.stream()
                .map(ProjectRiskSummary::getProjectName)
                .limit(MAX_ESCALATED_PROJECTS)
                .collect(Collectors.toList());

        Decision decision = Decision.builder()
                .decisionId(decisionLog.nextId())
                .date(date)
                .title("Escalate " + redCount + " Red project" + (redCount > 1 ? "s" : "") + " to executive review")
                .context(redCount + " projects at Red status with combined " + riskCount + " risks.")
                .projectsAffected(names)
                .options(new ArrayList<>(List.of(
                        new DecisionOption("Escalate to executive review",
                                "Schedule emergency review within 5 days.",
                                "Leadership intervention, possible resource reallocation."),
                        new DecisionOption("Enhanced monitoring",
                                "Increase reporting frequency to weekly.",
                                "Earlier detection but no direct intervention."),
                        new DecisionOption("Accept risk",
                                "Continue with current oversight level.",
                                "No additional overhead but risk of further deterioration."))))
                .recommendation("Escalate to executive review")
                .recommendationRationale(redCount + " projects at Red status requires leadership attention. "
                        + "Monitoring alone is insufficient.")
                .status(DecisionStatus.PENDING)
                .source(DecisionSource.RISK_ANALYSIS)
                .build();
        decisionLog.add(decision);

        log.info("Logged decision {}: {}", decision.getDecisionId(), decision.getTitle());
        return List.of(decision);
    }
}
