package com.portfolio.analytics.pulse.service.risk;

import com.portfolio.analytics.pulse.dto.risk.Risk;
import com.portfolio.analytics.pulse.dto.risk.RiskCategory;
import com.portfolio.analytics.pulse.dto.risk.RiskSeverity;
import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.model.Task;
import com.portfolio.analytics.pulse.util.CommentScanner;
import com.portfolio.analytics.pulse.util.CommentScanner.KeywordMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags tasks whose status says they are blocked or whose comments name a blocker.
 * A task with both signals is elevated one severity step.
 */
@Component
@Order(1)
@Slf4j
public class BlockedWorkDetector implements RiskDetector {

    static final List<String> BLOCKER_PHRASES = List.of(
            "blocked by",
            "waiting for",
            "waiting on",
            "on hold pending",
            "on hold until",
            "held up by",
            "stalled"
    );

    @Override
    public RiskCategory category() {
        return RiskCategory.BLOCKED_WORK;
    }

    @Override
    public List<Risk> detect(Project project, LocalDate referenceDate) {
        List<Risk> risks = new ArrayList<>();

        for (Task task : project.getTasks()) {
            boolean statusBlocked = isStatusBlocked(task);
            Optional<KeywordMatch> blocker = findBlocker(task);

            if (!statusBlocked && blocker.isEmpty()) {
                continue;
            }

            RiskSeverity severity = RiskVocabulary.severityFromPriority(task.getPriority());
            if (statusBlocked && blocker.isPresent()) {
                severity = severity.elevate();
            }

            risks.add(Risk.builder()
                    .projectName(project.getName())
                    .category(RiskCategory.BLOCKED_WORK)
                    .severity(severity)
                    .title(statusBlocked
                            ? "'" + task.getName() + "' is blocked"
                            : "'" + task.getName() + "' has a blocker in comments")
                    .explanation(buildExplanation(project, task, statusBlocked, blocker.orElse(null)))
                    .suggestedMitigation(buildMitigation(task, blocker.orElse(null)))
                    .build());
        }

        log.debug("Blocked work: {} risk(s) in project {}", risks.size(), project.getName());
        return RiskVocabulary.sortWorstFirst(risks);
    }

    static boolean isStatusBlocked(Task task) {
        return RiskVocabulary.BLOCKED_STATUSES.contains(RiskVocabulary.normalise(task.getStatus()));
    }

    static Optional<KeywordMatch> findBlocker(Task task) {
        return CommentScanner.firstMatch(task.getComments(), BLOCKER_PHRASES);
    }

    private String buildExplanation(Project project, Task task, boolean statusBlocked, KeywordMatch blocker) {
        StringBuilder sb = new StringBuilder();
        sb.append("'").append(task.getName()).append("' in ").append(project.getName());
        if (statusBlocked) {
            sb.append(" is marked '").append(RiskVocabulary.display(task.getStatus())).append("'");
            if (blocker != null) {
                sb.append(" and the comments say: \"").append(blocker.getContext()).append("\"");
            }
        } else {
            String status = RiskVocabulary.display(task.getStatus());
            sb.append(status.isEmpty() ? " has no recorded status" : " is still '" + status + "'")
                    .append(" but the comments say: \"").append(blocker.getContext()).append("\"");
        }
        sb.append(". It is a ").append(RiskVocabulary.normalise(task.getPriority())).append("-priority task ")
                .append(task.isAssigned() ? "assigned to " + task.getAssignee() : "that is unassigned")
                .append(", and nothing moves until the blocker is cleared.");
        return sb.toString();
    }

    private String buildMitigation(Task task, KeywordMatch blocker) {
        StringBuilder sb = new StringBuilder();
        sb.append("Escalate '").append(task.getName()).append("' to the project lead")
                .append(task.isAssigned() ? " with " + task.getAssignee() : " and assign an owner")
                .append(" and agree a date by which the blocker must be cleared.");
        if (blocker != null) {
            sb.append(" Confirm who owns the dependency (\"").append(blocker.getContext())
                    .append("\") and put it on the dependency log with a named contact.");
        }
        return sb.toString();
    }
}
