package com.portfolio.analytics.pulse.service.scenario;

import com.portfolio.analytics.pulse.dto.scenario.ActionType;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioAction;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioNarrative;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioResult;
import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.service.graph.DependencyGraphBuilder;
import com.portfolio.analytics.pulse.support.PortfolioFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.portfolio.analytics.pulse.support.PortfolioFixtures.REFERENCE_DATE;
import static org.assertj.core.api.Assertions.assertThat;

class ScenarioNarrativeServiceTest {

    private final ScenarioSimulator simulator = new ScenarioSimulator();
    private final ScenarioNarrativeService narrativeService = new ScenarioNarrativeService();

    private ScenarioResult simulate(ScenarioAction action) {
        List<Project> projects = PortfolioFixtures.portfolio();
        return simulator.simulate(action, projects, new DependencyGraphBuilder().build(projects), REFERENCE_DATE);
    }

    @Test
    void generate_describesDelayWithCascade() {
        ScenarioNarrative narrative = narrativeService.generate(simulate(ScenarioAction.builder()
                .actionType(ActionType.DELAY).project("Gamma").durationWeeks(13).build()));

        assertThat(narrative.getTitle()).isEqualTo("Schedule Delay: Gamma");
        assertThat(narrative.getScenarioDescription()).isEqualTo("Delay Gamma by 13 weeks");
        assertThat(narrative.getBeforeSummary()).isEqualTo("Gamma is currently Active. "
                + "Budget: 300,000 (33% consumed, 100,000 spent). "
                + "Timeline: 2025-11-01 to 2026-04-30. 1 tasks in progress.");
        assertThat(narrative.getAfterSummary()).isEqualTo("Start Date: 2025-11-01 → 2026-01-31. "
                + "End Date: 2026-04-30 → 2026-07-30. Delay Weeks: 13.");
        assertThat(narrative.getCascadeAnalysis()).isEqualTo("1 downstream project affected:\n"
                + "**Epsilon**: Delayed by 13 weeks. New end date: 2027-04-01. Cascade delay from Gamma.");
        assertThat(narrative.getRecommendations()).hasSize(3);
        assertThat(narrative.getRecommendations().get(1)).contains("1 dependent project");
        assertThat(narrative.getWarnings()).hasSize(1);
    }

    @Test
    void fullText_includesOnlyPopulatedSections() {
        ScenarioNarrative narrative = narrativeService.generate(simulate(ScenarioAction.builder()
                .actionType(ActionType.DELAY).project("Gamma").durationWeeks(13).description("delay Gamma by 1 quarter").build()));

        String text = narrative.fullText();

        assertThat(text).startsWith("# Scenario Impact Summary\n");
        assertThat(text).contains("## Scenario\ndelay Gamma by 1 quarter\n")
                .contains("## Cascade Effects")
                .contains("## Recommended Actions\n- Communicate the revised timeline for Gamma")
                .contains("## Warnings\n- Delay on Gamma cascades");
    }

    @Test
    void generate_handlesUnknownProject() {
        ScenarioNarrative narrative = narrativeService.generate(simulate(ScenarioAction.builder()
                .actionType(ActionType.REMOVE).project("Omega").build()));

        assertThat(narrative.getBeforeSummary()).isEqualTo("Omega: No data available.");
        assertThat(narrative.getAfterSummary()).isEqualTo("No direct impact identified.");
        assertThat(narrative.getImpactAnalysis()).isEqualTo("No measurable impact.");
        assertThat(narrative.fullText()).doesNotContain("## Cascade Effects").contains("## Warnings");
    }

    @Test
    void recommendations_flagUrgentOverspend_onBudgetDecrease() {
        ScenarioNarrative narrative = narrativeService.generate(simulate(ScenarioAction.builder()
                .actionType(ActionType.BUDGET_DECREASE).project("Beta").amountAbsolute(400_000).build()));

        assertThat(narrative.getScenarioDescription()).isEqualTo("Decrease Beta budget by 400,000");
        assertThat(narrative.getRecommendations()).anyMatch(r -> r.startsWith("URGENT: Beta is already over budget"));
    }

    @Test
    void recommendations_askToReplanDependents_onRemoval() {
        ScenarioNarrative narrative = narrativeService.generate(simulate(ScenarioAction.builder()
                .actionType(ActionType.REMOVE).project("Alpha").build()));

        assertThat(narrative.getImpactAnalysis()).contains("frees up budget");
        assertThat(narrative.getCascadeAnalysis()).contains("**Beta**: Dependency on Alpha is broken");
        assertThat(narrative.getRecommendations()).contains("Urgently re-plan the 1 project that depend on Alpha.");
    }

    @Test
    void scopeCutAnalysis_quotesDaysSaved() {
        ScenarioNarrative narrative = narrativeService.generate(simulate(ScenarioAction.builder()
                .actionType(ActionType.SCOPE_CUT).project("Beta").amount(0.3).build()));

        assertThat(narrative.getImpactAnalysis()).startsWith("Reducing scope on Beta by 30% is estimated to save 109 days");
    }

    @Test
    void label_titleCasesFieldNames() {
        assertThat(ScenarioNarrativeService.label("runway_weeks")).isEqualTo("Runway Weeks");
        assertThat(ScenarioNarrativeService.label("budget")).isEqualTo("Budget");
    }
}
