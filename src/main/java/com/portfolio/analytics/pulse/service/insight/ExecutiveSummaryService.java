package com.portfolio.analytics.pulse.service.insight;

import com.portfolio.analytics.pulse.dto.risk.PortfolioRiskReport;
import com.portfolio.analytics.pulse.dto.risk.ProjectRiskSummary;
import com.portfolio.analytics.pulse.dto.risk.RagStatus;
import com.portfolio.analytics.pulse.dto.risk.Risk;
import com.portfolio.analytics.pulse.dto.risk.RiskCategory;
import com.portfolio.analytics.pulse.dto.risk.RiskSeverity;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the single paragraph that opens an executive briefing: the (at most three)
 * most urgent items leadership should act on this cycle, ranked by priority.
 */
@Service
@Slf4j
public class ExecutiveSummaryService {

    static final int MAX_ITEMS = 3;

    static final List<String> REGULATORY_KEYWORDS = List.of("compliance", "regulatory", "audit", "cyber", "security");

    private static final int PRIORITY_BUDGET = 1;
    private static final int PRIORITY_REGULATORY = 2;
    private static final int PRIORITY_BLOCKED_CASCADE = 3;
    private static final int PRIORITY_ON_HOLD = 6;

    @Value
    static class UrgentItem {
        int priority;
        String text;
    }

    public String summarise(@NonNull PortfolioRiskReport report) {
        List<ProjectRiskSummary> summaries = report.getProjectSummaries();
        List<UrgentItem> items = new ArrayList<>();

        items.addAll(budgetCritical(summaries));
        items.addAll(regulatoryAtRisk(summaries));
        items.addAll(blockedCascades(summaries));
        items.addAll(onHold(summaries));

        List<UrgentItem> top = dedupe(items).stream()
                .sorted(Comparator.comparingInt(UrgentItem::getPriority))
                .limit(MAX_ITEMS)
                .collect(Collectors.toList());
        log.debug("Executive summary found {} urgent items, reporting {}", items.size(), top.size());

        if (top.isEmpty()) {
            long reds = summaries.stream().filter(s -> s.getRagStatus() == RagStatus.RED).count();
            long ambers = summaries.stream().filter(s -> s.getRagStatus() == RagStatus.AMBER).count();
            return "The portfolio is tracking " + summaries.size() + " active projects with "
                    + reds + " at Red status and " + ambers + " at Amber. "
                    + "No critical escalation needed this cycle. Continue standard monitoring.";
        }

        List<String> numbered = new ArrayList<>();
        for (int i = 0; i < top.size(); i++) {
            numbered.add("(" + (i + 1) + ") " + top.get(i).getText());
        }
        return "Your portfolio has " + top.size() + " urgent issue" + (top.size() > 1 ? "s" : "")
                + " this cycle: " + String.join("; ", numbered) + ". " + urgency(top);
    }

    private static List<UrgentItem> budgetCritical(List<ProjectRiskSummary> summaries) {
        List<UrgentItem> items = new ArrayList<>();
        for (ProjectRiskSummary summary : summaries) {
            boolean critical = summary.getRisks().stream()
                    .anyMatch(r -> r.getCategory() == RiskCategory.BURN_RATE && r.getSeverity() == RiskSeverity.CRITICAL);
            if (critical) {
                items.add(new UrgentItem(PRIORITY_BUDGET, summary.getProjectName()
                        + " will exhaust its budget before delivery completes. Approve a top-up or cut scope"));
            }
        }
        return items;
    }

    private static List<UrgentItem> regulatoryAtRisk(List<ProjectRiskSummary> summaries) {
        List<UrgentItem> items = new ArrayList<>();
        for (ProjectRiskSummary summary : summaries) {
            String name = summary.getProjectName().toLowerCase(Locale.ROOT);
            boolean regulatory = REGULATORY_KEYWORDS.stream().anyMatch(name::contains);
            if (!regulatory || summary.getRagStatus() == RagStatus.GREEN) {
                continue;
            }
            long criticalCount = summary.getRisks().stream()
                    .filter(r -> r.getSeverity() == RiskSeverity.CRITICAL)
                    .count();
            if (criticalCount > 0) {
                items.add(new UrgentItem(PRIORITY_REGULATORY, summary.getProjectName() + " has " + criticalCount
                        + " critical issues and may miss its regulatory deadline"));
            }
        }
        return items;
    }

    /**
     * Projects with serious blocked work whose names show up in another project's
     * dependency explanation.
     */
    private static List<UrgentItem> blockedCascades(List<ProjectRiskSummary> summaries) {
        Set<String> blocked = new LinkedHashSet<>();
        for (ProjectRiskSummary summary : summaries) {
            for (Risk risk : summary.getRisks()) {
                if (risk.getCategory() == RiskCategory.BLOCKED_WORK
                        && (risk.getSeverity() == RiskSeverity.CRITICAL || risk.getSeverity() == RiskSeverity.HIGH)) {
                    blocked.add(summary.getProjectName());
                }
            }
        }

        List<UrgentItem> items = new ArrayList<>();
        for (ProjectRiskSummary summary : summaries) {
            for (Risk risk : summary.getRisks()) {
                if (risk.getCategory() != RiskCategory.DEPENDENCY) {
                    continue;
                }
                String explanation = risk.getExplanation().toLowerCase(Locale.ROOT);
                for (String blockedProject : blocked) {
                    String key = blockedProject.toLowerCase(Locale.ROOT).split(" - ")[0];
                    if (explanation.contains(key)) {
                        items.add(new UrgentItem(PRIORITY_BLOCKED_CASCADE,
                                "blockers in " + blockedProject + " are cascading into dependent projects"));
                        break;
                    }
                }
            }
        }
        return items;
    }

    private static List<UrgentItem> onHold(List<ProjectRiskSummary> summaries) {
        List<String> names = summaries.stream()
                .filter(s -> s.getProjectStatus() != null && s.getProjectStatus().toLowerCase(Locale.ROOT).contains("hold"))
                .map(ProjectRiskSummary::getProjectName)
                .limit(2)
                .collect(Collectors.toList());
        if (names.isEmpty()) {
            return List.of();
        }
        return List.of(new UrgentItem(PRIORITY_ON_HOLD,
                String.join(", ", names) + " stalled. Confirm go/no-go to release committed resources"));
    }

    private static List<UrgentItem> dedupe(List<UrgentItem> items) {
        Set<String> seen = new LinkedHashSet<>();
        List<UrgentItem> unique = new ArrayList<>();
        for (UrgentItem item : items) {
            if (seen.add(item.getText())) {
                unique.add(item);
            }
        }
        return unique;
    }

    static String urgency(List<UrgentItem> top) {
        int highest = top.stream().mapToInt(UrgentItem::getPriority).min().orElse(Integer.MAX_VALUE);
        if (highest <= PRIORITY_REGULATORY) {
            return "Recommended: schedule emergency portfolio review within 5 working days.";
        }
        if (highest <= PRIORITY_BLOCKED_CASCADE) {
            return "Recommended: address these items before the next steering cycle.";
        }
        return "Recommended: review at next scheduled steering committee.";
    }
}
