package com.portfolio.analytics.pulse.service.risk;

import com.portfolio.analytics.pulse.dto.risk.Risk;
import com.portfolio.analytics.pulse.dto.risk.RiskCategory;
import com.portfolio.analytics.pulse.dto.risk.RiskSeverity;
import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.util.Formats;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Compares budget consumed against time elapsed on the project timeline.
 *
 * <ul>
 *   <li>spend above budget: one CRITICAL overspend risk, dates irrelevant</li>
 *   <li>spend at or above 90% with more than 10% of the timeline left: one risk, graded by
 *       {@link #burnRateSeverity(double, double)}</li>
 *   <li>spend at or above 90% and no usable dates: one HIGH risk flagged as lacking timeline data</li>
 * </ul>
 *
 * Projects without a budget are skipped. A zero-length timeline is treated as missing data
 * and produces no risk.
 */
@Component
@Order(3)
@Slf4j
public class BurnRateDetector implements RiskDetector {

    static final double SPEND_THRESHOLD = 0.90;
    static final double CRITICAL_SPEND = 0.95;
    static final double TIME_REMAINING_THRESHOLD = 0.10;
    static final double COMFORTABLE_TIME_REMAINING = 0.20;

    @Override
    public RiskCategory category() {
        return RiskCategory.BURN_RATE;
    }

    @Override
    public List<Risk> detect(Project project, @NonNull LocalDate referenceDate) {
        double budget = project.getBudget();
        if (budget <= 0) {
            return List.of();
        }

        double spend = project.getActualSpend();
        double spendPct = spend / budget;

        if (spendPct > 1.0) {
            return List.of(overspendRisk(project, spendPct));
        }

        if (!project.hasTimeline()) {
            if (spendPct >= SPEND_THRESHOLD) {
                return List.of(noTimelineRisk(project, spendPct));
            }
            return List.of();
        }

        long totalDays = ChronoUnit.DAYS.between(project.getStartDate(), project.getEndDate());
        if (totalDays <= 0) {
            log.debug("Burn rate: {} has a zero-length timeline, skipping", project.getName());
            return List.of();
        }

        long elapsedDays = ChronoUnit.DAYS.between(project.getStartDate(), referenceDate);
        double timeElapsedPct = Math.max(0.0, Math.min(1.0, (double) elapsedDays / totalDays));
        double timeRemainingPct = 1.0 - timeElapsedPct;

        if (spendPct >= SPEND_THRESHOLD && timeRemainingPct > TIME_REMAINING_THRESHOLD) {
            return List.of(burnRisk(project, spendPct, timeElapsedPct, timeRemainingPct, referenceDate));
        }
        return List.of();
    }

    /**
     * Severity ladder for a qualifying burn. The final MEDIUM branch cannot be reached
     * through {@link #detect}, which only grades spend at or above {@link #SPEND_THRESHOLD}.
     */
    static RiskSeverity burnRateSeverity(double spendPct, double timeRemainingPct) {
        if (spendPct >= CRITICAL_SPEND) {
            return RiskSeverity.CRITICAL;
        }
        if (spendPct >= SPEND_THRESHOLD && timeRemainingPct >= COMFORTABLE_TIME_REMAINING) {
            return RiskSeverity.CRITICAL;
        }
        if (spendPct >= SPEND_THRESHOLD) {
            return RiskSeverity.HIGH;
        }
        return RiskSeverity.MEDIUM;
    }

    private Risk overspendRisk(Project project, double spendPct) {
        double overrun = project.getActualSpend() - project.getBudget();
        return Risk.builder()
                .projectName(project.getName())
                .category(RiskCategory.BURN_RATE)
                .severity(RiskSeverity.CRITICAL)
                .title(project.getName() + " has exceeded budget (" + Formats.percent(spendPct) + " spent)")
                .explanation(project.getName() + " has spent " + Formats.currency(project.getActualSpend())
                        + " against a budget of " + Formats.currency(project.getBudget()) + ", an overrun of "
                        + Formats.currency(overrun) + ". Every further week of delivery adds to the overspend.")
                .suggestedMitigation("Take " + project.getName() + " to the steering committee now: approve a "
                        + "budget top-up, cut remaining scope, or stop discretionary spend until a recovery plan "
                        + "is agreed.")
                .build();
    }

    private Risk noTimelineRisk(Project project, double spendPct) {
        return Risk.builder()
                .projectName(project.getName())
                .category(RiskCategory.BURN_RATE)
                .severity(RiskSeverity.HIGH)
                .title(project.getName() + " has burned " + Formats.percent(spendPct) + " of budget")
                .explanation(project.getName() + " has spent " + Formats.currency(project.getActualSpend())
                        + " of its " + Formats.currency(project.getBudget()) + " budget ("
                        + Formats.percent(spendPct) + "). No timeline data is available, so the burn cannot be "
                        + "compared against time elapsed; treat the remaining budget as nearly exhausted.")
                .suggestedMitigation("Confirm start and end dates for " + project.getName()
                        + " and review the forecast to completion at the next steering committee.")
                .build();
    }

    private Risk burnRisk(Project project, double spendPct, double timeElapsedPct, double timeRemainingPct,
                          LocalDate referenceDate) {
        RiskSeverity severity = burnRateSeverity(spendPct, timeRemainingPct);
        return Risk.builder()
                .projectName(project.getName())
                .category(RiskCategory.BURN_RATE)
                .severity(severity)
                .title(project.getName() + " burning budget ahead of schedule (" + Formats.percent(spendPct)
                        + " spent, " + Formats.percent(timeRemainingPct) + " of time remaining)")
                .explanation(project.getName() + " has spent " + Formats.currency(project.getActualSpend())
                        + " of its " + Formats.currency(project.getBudget()) + " budget ("
                        + Formats.percent(spendPct) + ") but only " + Formats.percent(timeElapsedPct)
                        + " of the timeline (" + project.getStartDate() + " to " + project.getEndDate()
                        + ") had elapsed by " + referenceDate + ". At this rate the budget runs out before "
                        + "delivery completes.")
                .suggestedMitigation("Raise " + project.getName() + " at the next steering committee with a "
                        + "forecast to completion; agree a budget top-up or descope before the remaining "
                        + Formats.currency(project.getBudget() - project.getActualSpend()) + " is consumed.")
                .build();
    }
}
