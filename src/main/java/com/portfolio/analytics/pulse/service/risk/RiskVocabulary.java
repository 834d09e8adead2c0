package com.portfolio.analytics.pulse.service.risk;

import com.portfolio.analytics.pulse.dto.risk.Risk;
import com.portfolio.analytics.pulse.dto.risk.RiskSeverity;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Status vocabularies and priority mapping shared by the task-level detectors.
 */
final class RiskVocabulary {

    static final Set<String> COMPLETED_STATUSES = Set.of(
            "done", "complete", "completed", "closed", "resolved"
    );

    static final Set<String> BLOCKED_STATUSES = Set.of(
            "blocked", "waiting", "on hold", "on_hold", "on-hold", "suspended"
    );

    static final Set<String> ACTIVE_STATUSES = Set.of(
            "to do", "todo", "in progress", "in-progress", "open", "new",
            "blocked", "waiting", "on hold", "on_hold", "on-hold"
    );

    private static final Map<String, RiskSeverity> PRIORITY_SEVERITY = Map.of(
            "critical", RiskSeverity.CRITICAL,
            "high", RiskSeverity.HIGH,
            "medium", RiskSeverity.MEDIUM,
            "low", RiskSeverity.LOW
    );

    static final Comparator<Risk> WORST_FIRST = Comparator.comparing(Risk::getSeverity);

    private RiskVocabulary() {
    }

    static String normalise(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }

    static String display(String value) {
        return value == null ? "" : value.strip();
    }

    /**
     * Task priority mapped 1:1 onto severity; anything unrecognised is MEDIUM.
     */
    static RiskSeverity severityFromPriority(String priority) {
        return PRIORITY_SEVERITY.getOrDefault(normalise(priority), RiskSeverity.MEDIUM);
    }

    static boolean isHighPriority(String priority) {
        String p = normalise(priority);
        return p.equals("critical") || p.equals("high");
    }

    static List<Risk> sortWorstFirst(List<Risk> risks) {
        risks.sort(WORST_FIRST);
        return risks;
    }
}
