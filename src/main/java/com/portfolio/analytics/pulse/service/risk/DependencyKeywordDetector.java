package com.portfolio.analytics.pulse.service.risk;

import com.portfolio.analytics.pulse.dto.risk.Risk;
import com.portfolio.analytics.pulse.dto.risk.RiskCategory;
import com.portfolio.analytics.pulse.dto.risk.RiskSeverity;
import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.model.Task;
import com.portfolio.analytics.pulse.util.CommentScanner;
import com.portfolio.analytics.pulse.util.CommentScanner.KeywordMatch;
import com.portfolio.analytics.pulse.util.Formats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Counts unresolved dependencies mentioned in the comments of a project's own active tasks.
 * Cross-project edges are the graph builder's job, not this detector's.
 */
@Component
@Order(4)
@Slf4j
public class DependencyKeywordDetector implements RiskDetector {

    static final List<String> DEPENDENCY_KEYWORDS = List.of(
            "depends on",
            "dependent on",
            "blocked by",
            "waiting for",
            "waiting on",
            "prerequisite",
            "requires",
            "contingent on",
            "cannot proceed until",
            "needs"
    );

    private static final int MAX_CONTEXTS_QUOTED = 3;

    @Override
    public RiskCategory category() {
        return RiskCategory.DEPENDENCY;
    }

    @Override
    public List<Risk> detect(Project project, LocalDate referenceDate) {
        List<Risk> risks = new ArrayList<>();

        for (Task task : project.getTasks()) {
            if (!isActive(task)) {
                continue;
            }
            List<KeywordMatch> matches = findDependencyMatches(task);
            if (matches.isEmpty()) {
                continue;
            }

            int count = matches.size();
            risks.add(Risk.builder()
                    .projectName(project.getName())
                    .category(RiskCategory.DEPENDENCY)
                    .severity(calculateSeverity(task, count))
                    .title("'" + task.getName() + "' has " + Formats.plural(count, "dependency", "dependencies"))
                    .explanation(buildExplanation(project, task, matches))
                    .suggestedMitigation(buildMitigation(task, count))
                    .build());
        }

        log.debug("Dependencies: {} risk(s) in project {}", risks.size(), project.getName());
        return RiskVocabulary.sortWorstFirst(risks);
    }

    static boolean isActive(Task task) {
        return RiskVocabulary.ACTIVE_STATUSES.contains(RiskVocabulary.normalise(task.getStatus()));
    }

    static List<KeywordMatch> findDependencyMatches(Task task) {
        return CommentScanner.findAll(task.getComments(), DEPENDENCY_KEYWORDS);
    }

    /**
     * One dependency keeps the priority-derived severity, two elevate one step,
     * three or more lift the severity to at least HIGH.
     */
    static RiskSeverity calculateSeverity(Task task, int dependencyCount) {
        RiskSeverity base = RiskVocabulary.severityFromPriority(task.getPriority());
        if (dependencyCount >= 3) {
            return base == RiskSeverity.LOW || base == RiskSeverity.MEDIUM ? RiskSeverity.HIGH : RiskSeverity.CRITICAL;
        }
        if (dependencyCount == 2) {
            return base.elevate();
        }
        return base;
    }

    private String buildExplanation(Project project, Task task, List<KeywordMatch> matches) {
        String quoted = matches.stream()
                .limit(MAX_CONTEXTS_QUOTED)
                .map(m -> "\"" + m.getKeyword() + " " + m.getContext() + "\"")
                .collect(Collectors.joining("; "));

        StringBuilder sb = new StringBuilder();
        sb.append("'").append(task.getName()).append("' in ").append(project.getName())
                .append(" (").append(task.isAssigned() ? "assigned to " + task.getAssignee() : "unassigned")
                .append(") is waiting on ")
                .append(Formats.plural(matches.size(), "unresolved dependency", "unresolved dependencies"))
                .append(": ").append(quoted);
        if (matches.size() > MAX_CONTEXTS_QUOTED) {
            sb.append(" and ").append(matches.size() - MAX_CONTEXTS_QUOTED).append(" more");
        }
        sb.append(".");
        if (matches.size() > 1) {
            sb.append(" Multiple dependencies compound the risk: any one of them slipping holds up the task.");
        }
        return sb.toString();
    }

    private String buildMitigation(Task task, int count) {
        String mitigation = "Confirm an owner and a committed date for each dependency of '" + task.getName()
                + "' and track them on the dependency log.";
        if (count > 1) {
            mitigation += " Sequence the " + count + " dependencies and check whether any can be removed "
                    + "or worked around to shorten the critical path.";
        }
        return mitigation;
    }
}
