package com.portfolio.analytics.pulse.service.risk;

import com.portfolio.analytics.pulse.dto.risk.Risk;
import com.portfolio.analytics.pulse.dto.risk.RiskCategory;
import com.portfolio.analytics.pulse.dto.risk.RiskSeverity;
import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.model.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags unfinished tasks that have been carried over across too many sprints.
 */
@Component
@Order(2)
@Slf4j
public class CarryoverDetector implements RiskDetector {

    public static final int DEFAULT_THRESHOLD = 3;

    private static final int EXCESSIVE_CARRYOVER = 5;

    private final int threshold;

    @Autowired
    public CarryoverDetector(@Value("${portfolio.risk.carryover-threshold:3}") int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Carry-over threshold must be at least 1, got " + threshold);
        }
        this.threshold = threshold;
    }

    public CarryoverDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public int getThreshold() {
        return threshold;
    }

    @Override
    public RiskCategory category() {
        return RiskCategory.CHRONIC_CARRYOVER;
    }

    @Override
    public List<Risk> detect(Project project, LocalDate referenceDate) {
        return detect(project, threshold);
    }

    /**
     * Detect with a caller-supplied threshold instead of the configured one.
     */
    public List<Risk> detect(Project project, int threshold) {
        List<Risk> risks = new ArrayList<>();

        for (Task task : project.getTasks()) {
            if (isComplete(task)) {
                continue;
            }
            int sprintCount = task.getPreviousSprints().size();
            if (sprintCount < threshold) {
                continue;
            }

            risks.add(Risk.builder()
                    .projectName(project.getName())
                    .category(RiskCategory.CHRONIC_CARRYOVER)
                    .severity(calculateSeverity(task, sprintCount))
                    .title("'" + task.getName() + "' stuck — carried over " + sprintCount + " sprints")
                    .explanation(buildExplanation(project, task, sprintCount))
                    .suggestedMitigation(buildMitigation(task, sprintCount))
                    .build());
        }

        log.debug("Carry-over (threshold {}): {} risk(s) in project {}", threshold, risks.size(), project.getName());
        return RiskVocabulary.sortWorstFirst(risks);
    }

    static boolean isComplete(Task task) {
        return RiskVocabulary.COMPLETED_STATUSES.contains(RiskVocabulary.normalise(task.getStatus()));
    }

    static RiskSeverity calculateSeverity(Task task, int sprintCount) {
        RiskSeverity base = RiskVocabulary.severityFromPriority(task.getPriority());
        return sprintCount >= EXCESSIVE_CARRYOVER ? base.elevate() : base;
    }

    static String sprintChain(Task task) {
        List<String> chain = new ArrayList<>(task.getPreviousSprints());
        if (task.getSprint() != null && !task.getSprint().isBlank()) {
            chain.add(task.getSprint());
        }
        return String.join(" → ", chain);
    }

    private String buildExplanation(Project project, Task task, int sprintCount) {
        return "'" + task.getName() + "' in " + project.getName() + " has bounced across " + sprintCount
                + " sprints (" + sprintChain(task) + ") without getting done. "
                + "Assigned to " + (task.isAssigned() ? task.getAssignee() : "nobody")
                + " at " + RiskVocabulary.normalise(task.getPriority()) + " priority. "
                + "Either the task is too large, blocked on something unstated, or consistently deprioritised.";
    }

    private String buildMitigation(Task task, int sprintCount) {
        List<String> parts = new ArrayList<>();
        parts.add("Review why '" + task.getName() + "' has not been completed after " + sprintCount + " sprints. "
                + "Consider whether it needs to be re-scoped, broken into smaller tasks, or escalated.");
        if (sprintCount >= EXCESSIVE_CARRYOVER) {
            parts.add("This task has been carried over excessively; run a dedicated spike "
                    + "or assign additional resource to unblock it.");
        }
        if (RiskVocabulary.isHighPriority(task.getPriority())) {
            parts.add("As a " + RiskVocabulary.normalise(task.getPriority())
                    + "-priority item, continued delay may impact project milestones.");
        }
        return String.join(" ", parts);
    }
}
