package com.portfolio.analytics.pulse;

import com.portfolio.analytics.pulse.dto.scenario.ScenarioResult;
import com.portfolio.analytics.pulse.service.PortfolioAnalysisService;
import com.portfolio.analytics.pulse.service.risk.CarryoverDetector;
import com.portfolio.analytics.pulse.service.risk.RiskDetector;
import com.portfolio.analytics.pulse.support.PortfolioFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "portfolio.risk.carryover-threshold=2")
class PortfolioPulseApplicationTests {

    @Autowired
    private List<RiskDetector> detectors;

    @Autowired
    private CarryoverDetector carryoverDetector;

    @Autowired
    private Clock clock;

    @Autowired
    private PortfolioAnalysisService analysisService;

    @Test
    void contextLoads_withAllDetectorsInOrder() {
        assertThat(detectors).extracting(RiskDetector::category).extracting(Enum::name)
                .containsExactly("BLOCKED_WORK", "CHRONIC_CARRYOVER", "BURN_RATE", "DEPENDENCY");
    }

    @Test
    void carryoverThreshold_isReadFromProperties() {
        assertThat(carryoverDetector.getThreshold()).isEqualTo(2);
    }

    @Test
    void clock_usesConfiguredZone() {
        assertThat(clock.getZone()).isEqualTo(ZoneId.of("UTC"));
    }

    @Test
    void runScenario_endToEnd() {
        ScenarioResult result = analysisService.runScenario("delay Project Gamma by 1 quarter",
                PortfolioFixtures.portfolio());

        assertThat(result.getAfterState().get("Gamma").getEndDate()).hasToString("2026-07-30");
        assertThat(result.getWarnings()).hasSize(1);
    }
}
