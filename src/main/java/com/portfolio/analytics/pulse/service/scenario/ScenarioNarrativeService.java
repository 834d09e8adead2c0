package com.portfolio.analytics.pulse.service.scenario;

import com.portfolio.analytics.pulse.dto.scenario.ActionType;
import com.portfolio.analytics.pulse.dto.scenario.ProjectImpact;
import com.portfolio.analytics.pulse.dto.scenario.ProjectSnapshot;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioAction;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioNarrative;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioResult;
import com.portfolio.analytics.pulse.util.Formats;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a simulated scenario into a one-page briefing: before and after summaries,
 * impact and cascade analysis, and recommended next steps.
 */
@Service
@Slf4j
public class ScenarioNarrativeService {

    private static final String ARROW = " → ";

    public ScenarioNarrative generate(@NonNull ScenarioResult result) {
        ScenarioAction action = result.getAction();
        List<ProjectImpact> direct = result.directImpacts();
        List<ProjectImpact> cascade = result.cascadeImpacts();
        String projectName = direct.isEmpty() ? action.getProject() : direct.get(0).getProjectName();

        ScenarioNarrative narrative = ScenarioNarrative.builder()
                .title(action.getActionType().getTitle() + ": " + projectName)
                .scenarioDescription(describe(action))
                .beforeSummary(beforeSummary(projectName, result.getBeforeState()))
                .afterSummary(afterSummary(direct))
                .impactAnalysis(impactAnalysis(action, direct))
                .cascadeAnalysis(cascade.isEmpty() ? "" : cascadeAnalysis(cascade))
                .recommendations(recommendations(action, projectName, cascade.size(), result.getWarnings()))
                .warnings(result.getWarnings())
                .build();

        log.debug("Generated narrative '{}' with {} recommendations", narrative.getTitle(),
                narrative.getRecommendations().size());
        return narrative;
    }

    static String describe(ScenarioAction action) {
        if (!action.getDescription().isEmpty()) {
            return action.getDescription();
        }
        String project = action.getProject();
        switch (action.getActionType()) {
            case BUDGET_INCREASE:
                return "Increase " + project + " budget by " + budgetAmount(action);
            case BUDGET_DECREASE:
                return "Decrease " + project + " budget by " + budgetAmount(action);
            case SCOPE_CUT:
                return "Cut " + project + " scope by " + Formats.percent(action.getAmount());
            case DELAY:
                return "Delay " + project + " by " + Formats.plural(action.getDurationWeeks(), "week", "weeks");
            case REMOVE:
                return "Remove " + project + " from portfolio";
            default:
                return action.toString();
        }
    }

    private static String budgetAmount(ScenarioAction action) {
        return action.isAbsolute() ? Formats.currency(action.getAmountAbsolute()) : Formats.percent(action.getAmount());
    }

    static String beforeSummary(String projectName, Map<String, ProjectSnapshot> before) {
        ProjectSnapshot state = before.get(projectName);
        if (state == null) {
            return projectName + ": No data available.";
        }

        List<String> parts = new ArrayList<>();
        parts.add(projectName + " is currently " + state.getStatus() + ".");
        if (state.getBudget() > 0) {
            parts.add("Budget: " + Formats.currency(state.getBudget()) + " ("
                    + Formats.percent(state.getActualSpend() / state.getBudget()) + " consumed, "
                    + Formats.currency(state.getActualSpend()) + " spent).");
        }
        if (state.getStartDate() != null && state.getEndDate() != null) {
            parts.add("Timeline: " + state.getStartDate() + " to " + state.getEndDate() + ".");
        }
        if (state.getTaskCount() > 0) {
            parts.add(state.getTaskCount() + " tasks in progress.");
        }
        return String.join(" ", parts);
    }

    static String afterSummary(List<ProjectImpact> direct) {
        if (direct.isEmpty()) {
            return "No direct impact identified.";
        }
        List<String> parts = new ArrayList<>();
        direct.get(0).getChanges().forEach((field, change) -> parts.add(label(field) + ": " + change + "."));
        return String.join(" ", parts);
    }

    static String impactAnalysis(ScenarioAction action, List<ProjectImpact> direct) {
        if (direct.isEmpty()) {
            return "No measurable impact.";
        }
        ProjectImpact impact = direct.get(0);
        String project = impact.getProjectName();

        switch (action.getActionType()) {
            case BUDGET_INCREASE:
                return "Increasing the budget for " + project + " extends the financial runway, "
                        + "reducing the risk of budget exhaustion before delivery. "
                        + "This may allow the team to address scope or resource constraints "
                        + "that are currently limiting progress.";
            case BUDGET_DECREASE:
                return "Decreasing the budget for " + project + " shortens the financial runway. "
                        + "The team may need to reduce scope or find efficiencies to deliver "
                        + "within the revised budget. Review whether current commitments "
                        + "are achievable with reduced funding.";
            case SCOPE_CUT:
                String days = impact.change("days_saved").isEmpty() ? "0" : impact.change("days_saved");
                return "Reducing scope on " + project + " by " + Formats.percent(action.getAmount())
                        + " is estimated to save " + days + " days on the delivery timeline. "
                        + "This trades feature completeness for earlier delivery. "
                        + "Review which deliverables are deferred and whether benefits "
                        + "targets are still achievable with reduced scope.";
            case DELAY:
                return "Delaying " + project + " by " + Formats.plural(action.getDurationWeeks(), "week", "weeks")
                        + " shifts the delivery window forward. "
                        + "This may impact dependent projects and downstream milestones. "
                        + "Benefits realisation will be correspondingly delayed.";
            case REMOVE:
                return "Removing " + project + " from the portfolio frees up budget and resources. "
                        + "However, any projects dependent on " + project + " will need "
                        + "re-planning or alternative delivery paths. "
                        + "Expected benefits from " + project + " will not be realised.";
            default:
                return "Impact analysis not available for this scenario type.";
        }
    }

    static String cascadeAnalysis(List<ProjectImpact> cascade) {
        List<String> lines = new ArrayList<>();
        lines.add(Formats.plural(cascade, "downstream project", "downstream projects") + " affected:");

        for (ProjectImpact impact : cascade) {
            StringBuilder line = new StringBuilder("**").append(impact.getProjectName()).append("**: ");
            String delay = impact.change("delay_weeks");
            String end = impact.change("end_date");
            if (!delay.isEmpty()) {
                line.append("Delayed by ").append(delay).append(" weeks. ");
            }
            if (!end.isEmpty()) {
                int arrow = end.lastIndexOf(ARROW);
                line.append("New end date: ").append(arrow >= 0 ? end.substring(arrow + ARROW.length()) : end).append(". ");
            }
            if (!impact.change("reason").isEmpty()) {
                line.append(impact.change("reason")).append(". ");
            }
            line.append(impact.change("note"));
            lines.add(line.toString().strip());
        }
        return String.join("\n", lines);
    }

    static List<String> recommendations(ScenarioAction action, String project, int cascadeCount, List<String> warnings) {
        List<String> recs = new ArrayList<>();
        ActionType type = action.getActionType();

        if (type == ActionType.BUDGET_INCREASE) {
            recs.add("Approve the budget increase for " + project
                    + " and communicate the revised allocation to the delivery team.");
            recs.add("Set a checkpoint in 4 weeks to verify the additional funding is translating into accelerated delivery.");
        } else if (type == ActionType.BUDGET_DECREASE) {
            recs.add("Confirm the revised budget with the " + project + " delivery team and agree scope trade-offs.");
            recs.add("Identify which deliverables can be deferred to Phase 2 to fit within the reduced budget.");
            boolean overBudget = warnings.stream().anyMatch(w -> w.toLowerCase(Locale.ROOT).contains("over budget"));
            if (overBudget) {
                recs.add("URGENT: " + project + " is already over budget. Immediate intervention required.");
            }
        } else if (type == ActionType.SCOPE_CUT) {
            recs.add("Agree the deferred scope items with the " + project + " sponsor and update the benefits register.");
            recs.add("Communicate the revised delivery date to stakeholders.");
            if (cascadeCount > 0) {
                recs.add("Notify the " + Formats.plural(cascadeCount, "dependent project", "dependent projects")
                        + " of the earlier delivery window.");
            }
        } else if (type == ActionType.DELAY) {
            recs.add("Communicate the revised timeline for " + project + " to all stakeholders.");
            if (cascadeCount > 0) {
                recs.add("Assess the cascade impact on " + Formats.plural(cascadeCount, "dependent project", "dependent projects")
                        + " and update their timelines.");
            }
            recs.add("Review whether the delay changes the cost profile (extended team costs, contract implications).");
        } else if (type == ActionType.REMOVE) {
            recs.add("Formally close " + project + " and release resources back to the portfolio.");
            recs.add("Update the benefits register to remove " + project + "'s expected benefits.");
            if (cascadeCount > 0) {
                recs.add("Urgently re-plan the " + Formats.plural(cascadeCount, "project", "projects")
                        + " that depend on " + project + ".");
            }
        }
        return recs;
    }

    /**
     * "runway_weeks" -> "Runway Weeks"
     */
    static String label(String field) {
        StringBuilder label = new StringBuilder();
        for (String word : field.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return label.toString();
    }
}
