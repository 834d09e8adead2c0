package com.portfolio.analytics.pulse.service.scenario;

import com.portfolio.analytics.pulse.dto.scenario.ActionType;
import com.portfolio.analytics.pulse.dto.scenario.ImpactType;
import com.portfolio.analytics.pulse.dto.scenario.ProjectImpact;
import com.portfolio.analytics.pulse.dto.scenario.ProjectSnapshot;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioAction;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioResult;
import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.service.graph.DependencyGraph;
import com.portfolio.analytics.pulse.util.Formats;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Applies a {@link ScenarioAction} to an in-memory portfolio and reports the
 * before/after state. Every simulation starts from the same frozen snapshot of the
 * input projects; the projects themselves are never modified.
 */
@Service
@Slf4j
public class ScenarioSimulator {

    static final String REMOVED_STATUS = "Removed";

    public ScenarioResult simulate(@NonNull ScenarioAction action, @NonNull List<Project> projects,
                                   @NonNull DependencyGraph graph, @NonNull LocalDate referenceDate) {
        log.info("Simulating {} on '{}' across {} projects", action.getActionType(), action.getProject(), projects.size());

        Map<String, ProjectSnapshot> before = snapshot(projects);
        Optional<Project> target = resolveProject(action.getProject(), projects);

        if (target.isEmpty()) {
            String available = projects.stream()
                    .map(Project::getName)
                    .sorted()
                    .collect(Collectors.joining(", "));
            log.warn("Scenario target '{}' not found in portfolio", action.getProject());
            return ScenarioResult.builder()
                    .action(action)
                    .beforeState(Collections.unmodifiableMap(before))
                    .afterState(Collections.unmodifiableMap(new LinkedHashMap<>(before)))
                    .warning("Project '" + action.getProject() + "' not found in portfolio. "
                            + "Available projects: " + available)
                    .build();
        }

        Map<String, Project> projectsByName = projects.stream()
                .collect(Collectors.toMap(Project::getName, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        ScenarioResult result;
        switch (action.getActionType()) {
            case BUDGET_INCREASE:
            case BUDGET_DECREASE:
                result = simulateBudget(action, target.get(), before, referenceDate);
                break;
            case SCOPE_CUT:
                result = simulateScopeCut(action, target.get(), graph, before);
                break;
            case DELAY:
                result = simulateDelay(action, target.get(), projectsByName, graph, before);
                break;
            case REMOVE:
                result = simulateRemove(action, target.get(), graph, before);
                break;
            default:
                throw new IllegalStateException("Unsupported action type: " + action.getActionType());
        }

        log.info("Scenario produced {} impacts and {} warnings", result.getImpacts().size(), result.getWarnings().size());
        return result;
    }

    private ScenarioResult simulateBudget(ScenarioAction action, Project project,
                                          Map<String, ProjectSnapshot> before, LocalDate referenceDate) {
        double oldBudget = project.getBudget();
        double changeAmount = action.isAbsolute() ? action.getAmountAbsolute() : oldBudget * action.getAmount();
        double newBudget = action.getActionType() == ActionType.BUDGET_INCREASE
                ? oldBudget + changeAmount
                : Math.max(0, oldBudget - changeAmount);

        Integer oldRunway = runwayWeeks(project, oldBudget, referenceDate);
        Integer newRunway = runwayWeeks(project, newBudget, referenceDate);

        Map<String, ProjectSnapshot> after = new LinkedHashMap<>(before);
        update(after, project.getName(), s -> s.budget(newBudget).runwayWeeks(newRunway));

        ScenarioResult.ScenarioResultBuilder result = ScenarioResult.builder()
                .action(action)
                .beforeState(Collections.unmodifiableMap(before))
                .afterState(Collections.unmodifiableMap(after))
                .impact(ProjectImpact.builder()
                        .projectName(project.getName())
                        .impactType(ImpactType.DIRECT)
                        .change("budget", Formats.change(Formats.currency(oldBudget), Formats.currency(newBudget)))
                        .change("runway_weeks", Formats.change(oldRunway, newRunway))
                        .build());

        if (newBudget < project.getActualSpend()) {
            result.warning("New budget (" + Formats.currency(newBudget) + ") is below actual spend ("
                    + Formats.currency(project.getActualSpend()) + "). The project is already over budget.");
        }
        if (action.getActionType() == ActionType.BUDGET_DECREASE
                && oldRunway != null && newRunway != null && newRunway < oldRunway) {
            result.warning("Budget decrease reduces runway from " + oldRunway + " to " + newRunway + " weeks.");
        }
        return result.build();
    }

    private ScenarioResult simulateScopeCut(ScenarioAction action, Project project, DependencyGraph graph,
                                            Map<String, ProjectSnapshot> before) {
        double cut = Math.min(1.0, Math.max(0.0, action.getAmount()));
        LocalDate oldEnd = project.getEndDate();
        LocalDate newEnd = null;
        long daysSaved = 0;

        if (project.hasTimeline()) {
            long totalDays = ChronoUnit.DAYS.between(project.getStartDate(), project.getEndDate());
            daysSaved = (long) Math.floor(totalDays * cut);
            newEnd = oldEnd.minusDays(daysSaved);
        }

        LocalDate afterEnd = newEnd != null ? newEnd : oldEnd;
        Map<String, ProjectSnapshot> after = new LinkedHashMap<>(before);
        update(after, project.getName(), s -> s.scopePct((1 - cut) * 100).endDate(afterEnd));

        ScenarioResult.ScenarioResultBuilder result = ScenarioResult.builder()
                .action(action)
                .beforeState(Collections.unmodifiableMap(before))
                .afterState(Collections.unmodifiableMap(after))
                .impact(ProjectImpact.builder()
                        .projectName(project.getName())
                        .impactType(ImpactType.DIRECT)
                        .change("scope", Formats.change("100%", Formats.percent(1 - cut)))
                        .change("end_date", Formats.change(oldEnd, newEnd))
                        .change("days_saved", String.valueOf(daysSaved))
                        .build());

        if (cut != action.getAmount()) {
            result.warning("Scope cut of " + Formats.percent(action.getAmount())
                    + " is outside 0% to 100% and was limited to " + Formats.percent(cut) + ".");
        }

        // advisory only, an earlier upstream delivery does not move downstream dates
        for (String dependent : graph.allDependents(project.getName())) {
            result.impact(ProjectImpact.builder()
                    .projectName(dependent)
                    .impactType(ImpactType.CASCADE)
                    .change("note", "Dependency on " + project.getName() + " delivers " + daysSaved + " days earlier.")
                    .build());
        }
        return result.build();
    }

    private ScenarioResult simulateDelay(ScenarioAction action, Project project, Map<String, Project> projectsByName,
                                         DependencyGraph graph, Map<String, ProjectSnapshot> before) {
        long delayDays = action.getDurationWeeks() * 7L;
        LocalDate oldStart = project.getStartDate();
        LocalDate oldEnd = project.getEndDate();
        LocalDate newStart = oldStart != null ? oldStart.plusDays(delayDays) : null;
        LocalDate newEnd = oldEnd != null ? oldEnd.plusDays(delayDays) : null;

        Map<String, ProjectSnapshot> after = new LinkedHashMap<>(before);
        update(after, project.getName(), s -> s.startDate(newStart).endDate(newEnd));

        ScenarioResult.ScenarioResultBuilder result = ScenarioResult.builder()
                .action(action)
                .impact(ProjectImpact.builder()
                        .projectName(project.getName())
                        .impactType(ImpactType.DIRECT)
                        .change("start_date", Formats.change(oldStart, newStart))
                        .change("end_date", Formats.change(oldEnd, newEnd))
                        .change("delay_weeks", String.valueOf(action.getDurationWeeks()))
                        .build());

        SortedSet<String> dependents = graph.allDependents(project.getName());
        for (String dependentName : dependents) {
            Project dependent = projectsByName.get(dependentName);
            if (dependent == null) {
                continue;
            }
            LocalDate dependentOldEnd = dependent.getEndDate();
            LocalDate dependentNewEnd = dependentOldEnd != null ? dependentOldEnd.plusDays(delayDays) : null;
            if (dependentNewEnd != null) {
                update(after, dependentName, s -> s.endDate(dependentNewEnd));
            }
            result.impact(ProjectImpact.builder()
                    .projectName(dependentName)
                    .impactType(ImpactType.CASCADE)
                    .change("end_date", Formats.change(dependentOldEnd, dependentNewEnd))
                    .change("delay_weeks", String.valueOf(action.getDurationWeeks()))
                    .change("reason", "Cascade delay from " + project.getName())
                    .build());
        }

        if (!dependents.isEmpty()) {
            result.warning("Delay on " + project.getName() + " cascades to "
                    + Formats.plural(dependents, "dependent project", "dependent projects") + ": "
                    + String.join(", ", dependents) + ".");
        }

        return result
                .beforeState(Collections.unmodifiableMap(before))
                .afterState(Collections.unmodifiableMap(after))
                .build();
    }

    private ScenarioResult simulateRemove(ScenarioAction action, Project project, DependencyGraph graph,
                                          Map<String, ProjectSnapshot> before) {
        Map<String, ProjectSnapshot> after = new LinkedHashMap<>(before);
        update(after, project.getName(), s -> s.status(REMOVED_STATUS));

        ScenarioResult.ScenarioResultBuilder result = ScenarioResult.builder()
                .action(action)
                .beforeState(Collections.unmodifiableMap(before))
                .afterState(Collections.unmodifiableMap(after))
                .impact(ProjectImpact.builder()
                        .projectName(project.getName())
                        .impactType(ImpactType.DIRECT)
                        .change("status", Formats.change(project.getStatus(), REMOVED_STATUS))
                        .change("budget_freed", Formats.currency(project.getBudget()))
                        .change("remaining_budget",
                                Formats.currency(Math.max(0, project.getBudget() - project.getActualSpend())))
                        .build());

        SortedSet<String> dependents = graph.dependents(project.getName());
        for (String dependent : dependents) {
            result.impact(ProjectImpact.builder()
                    .projectName(dependent)
                    .impactType(ImpactType.CASCADE)
                    .change("note", "Dependency on " + project.getName()
                            + " is broken. The project may need re-planning.")
                    .build());
        }

        if (!dependents.isEmpty()) {
            result.warning("Removing " + project.getName() + " breaks dependencies for: "
                    + String.join(", ", dependents)
                    + ". These projects may need re-scoping or alternative delivery paths.");
        }
        return result.build();
    }

    /**
     * Weeks of spend left at the current burn rate. Null when there is no budget, no
     * spend or no start date; 0 when the budget is already exhausted.
     */
    static Integer runwayWeeks(Project project, double budget, LocalDate referenceDate) {
        if (budget <= 0 || project.getActualSpend() <= 0 || project.getStartDate() == null) {
            return null;
        }
        long elapsedDays = Math.max(1, ChronoUnit.DAYS.between(project.getStartDate(), referenceDate));
        double dailyBurn = project.getActualSpend() / elapsedDays;
        double remaining = budget - project.getActualSpend();
        if (dailyBurn <= 0 || remaining <= 0) {
            return 0;
        }
        return (int) (remaining / dailyBurn / 7);
    }

    static Optional<Project> resolveProject(String name, List<Project> projects) {
        Optional<Project> exact = projects.stream().filter(p -> p.getName().equals(name)).findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return projects.stream().filter(p -> p.getName().equalsIgnoreCase(name)).findFirst();
    }

    private static Map<String, ProjectSnapshot> snapshot(List<Project> projects) {
        Map<String, ProjectSnapshot> snapshots = new LinkedHashMap<>();
        for (Project project : projects) {
            snapshots.put(project.getName(), ProjectSnapshot.of(project));
        }
        return snapshots;
    }

    private static void update(Map<String, ProjectSnapshot> states, String name,
                               UnaryOperator<ProjectSnapshot.ProjectSnapshotBuilder> change) {
        states.computeIfPresent(name, (key, snapshot) -> change.apply(snapshot.toBuilder()).build());
    }
}
