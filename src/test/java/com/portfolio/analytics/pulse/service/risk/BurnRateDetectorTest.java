package com.portfolio.analytics.pulse.service.risk;

import com.portfolio.analytics.pulse.dto.risk.Risk;
import com.portfolio.analytics.pulse.dto.risk.RiskCategory;
import com.portfolio.analytics.pulse.dto.risk.RiskSeverity;
import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.support.PortfolioFixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.portfolio.analytics.pulse.support.PortfolioFixtures.REFERENCE_DATE;
import static org.assertj.core.api.Assertions.assertThat;

class BurnRateDetectorTest {

    private static final LocalDate START = LocalDate.of(2026, 1, 1);
    private static final LocalDate END = LocalDate.of(2026, 4, 11);   // 100 days

    private final BurnRateDetector detector = new BurnRateDetector();

    private static Project project(double budget, double spend, LocalDate start, LocalDate end) {
        return Project.builder()
                .name("Omega")
                .status("Active")
                .budget(budget)
                .actualSpend(spend)
                .startDate(start)
                .endDate(end)
                .build();
    }

    @Test
    void flagsCritical_whenNinetyPercentSpentWithPlentyOfTimeLeft() {
        List<Risk> risks = detector.detect(PortfolioFixtures.alpha(), REFERENCE_DATE);

        assertThat(risks).singleElement().satisfies(risk -> {
            assertThat(risk.getSeverity()).isEqualTo(RiskSeverity.CRITICAL);
            assertThat(risk.getCategory()).isEqualTo(RiskCategory.BURN_RATE);
            assertThat(risk.getTitle()).contains("92% spent");
            assertThat(risk.getExplanation()).contains("185,000").contains("200,000");
            assertThat(risk.getSuggestedMitigation()).contains("steering committee");
        });
    }

    @Test
    void returnsNothing_whenBudgetIsZero() {
        assertThat(detector.detect(project(0, 50_000, START, END), REFERENCE_DATE)).isEmpty();
    }

    @Test
    void flagsSingleCriticalOverspend_regardlessOfDates() {
        List<Risk> risks = detector.detect(project(100_000, 150_000, null, null), REFERENCE_DATE);

        assertThat(risks).singleElement().satisfies(risk -> {
            assertThat(risk.getSeverity()).isEqualTo(RiskSeverity.CRITICAL);
            assertThat(risk.getTitle()).contains("exceeded budget").contains("150%");
            assertThat(risk.getExplanation()).contains("50,000");
        });
    }

    @Test
    void flagsHigh_whenHeavilySpentWithoutTimeline() {
        List<Risk> risks = detector.detect(project(100_000, 95_000, null, END), REFERENCE_DATE);

        assertThat(risks).singleElement().satisfies(risk -> {
            assertThat(risk.getSeverity()).isEqualTo(RiskSeverity.HIGH);
            assertThat(risk.getExplanation()).contains("No timeline data");
        });
    }

    @Test
    void returnsNothing_whenLightlySpentWithoutTimeline() {
        assertThat(detector.detect(project(100_000, 50_000, null, null), REFERENCE_DATE)).isEmpty();
    }

    @Test
    void returnsNothing_forZeroLengthTimeline() {
        assertThat(detector.detect(project(100_000, 95_000, START, START), REFERENCE_DATE)).isEmpty();
    }

    @Test
    void flagsHigh_whenLessThanTwentyPercentOfTimeRemains() {
        // 85 of 100 days elapsed
        List<Risk> risks = detector.detect(project(100_000, 92_000, START, END), LocalDate.of(2026, 3, 27));

        assertThat(risks).singleElement().extracting(Risk::getSeverity).isEqualTo(RiskSeverity.HIGH);
    }

    @Test
    void flagsCritical_whenNinetyFivePercentSpentEvenLateInTimeline() {
        List<Risk> risks = detector.detect(project(100_000, 96_000, START, END), LocalDate.of(2026, 3, 27));

        assertThat(risks).singleElement().extracting(Risk::getSeverity).isEqualTo(RiskSeverity.CRITICAL);
    }

    @Test
    void returnsNothing_whenProjectIsNearlyFinished() {
        // 94 of 100 days elapsed
        assertThat(detector.detect(project(100_000, 96_000, START, END), LocalDate.of(2026, 4, 5))).isEmpty();
    }

    @Test
    void clampsElapsedTime_whenReferenceDateBeforeStart() {
        List<Risk> risks = detector.detect(project(100_000, 92_000, START, END), LocalDate.of(2025, 12, 1));

        assertThat(risks).singleElement().satisfies(risk -> {
            assertThat(risk.getSeverity()).isEqualTo(RiskSeverity.CRITICAL);
            assertThat(risk.getTitle()).contains("100% of time remaining");
        });
    }

    @Test
    void severityLadder_fallsBackToMediumBelowSpendThreshold() {
        assertThat(BurnRateDetector.burnRateSeverity(0.85, 0.5)).isEqualTo(RiskSeverity.MEDIUM);
        assertThat(BurnRateDetector.burnRateSeverity(0.92, 0.15)).isEqualTo(RiskSeverity.HIGH);
        assertThat(BurnRateDetector.burnRateSeverity(0.92, 0.25)).isEqualTo(RiskSeverity.CRITICAL);
    }
}
