package com.portfolio.analytics.pulse.service;

import com.portfolio.analytics.pulse.dto.graph.CircularDependency;
import com.portfolio.analytics.pulse.dto.risk.PortfolioRiskReport;
import com.portfolio.analytics.pulse.dto.scenario.ActionType;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioAction;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioNarrative;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioResult;
import com.portfolio.analytics.pulse.exception.ScenarioParseException;
import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.service.graph.CircularDependencyDetector;
import com.portfolio.analytics.pulse.service.graph.DependencyGraph;
import com.portfolio.analytics.pulse.service.graph.DependencyGraphBuilder;
import com.portfolio.analytics.pulse.service.risk.RiskAggregationService;
import com.portfolio.analytics.pulse.service.scenario.ScenarioNarrativeService;
import com.portfolio.analytics.pulse.service.scenario.ScenarioParser;
import com.portfolio.analytics.pulse.service.scenario.ScenarioSimulator;
import com.portfolio.analytics.pulse.support.PortfolioFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.portfolio.analytics.pulse.support.PortfolioFixtures.REFERENCE_DATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PortfolioAnalysisServiceTest {

    @Mock
    private RiskAggregationService riskAggregationService;

    @Mock
    private ScenarioParser scenarioParser;

    @Mock
    private ScenarioSimulator scenarioSimulator;

    private PortfolioAnalysisService service;

    private final List<Project> projects = PortfolioFixtures.portfolio();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(REFERENCE_DATE.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
        service = new PortfolioAnalysisService(riskAggregationService, new DependencyGraphBuilder(),
                new CircularDependencyDetector(), scenarioParser, scenarioSimulator, new ScenarioNarrativeService(), clock);
    }

    @Test
    void assessRisks_delegatesToAggregation() {
        PortfolioRiskReport report = PortfolioRiskReport.builder().referenceDate(REFERENCE_DATE).build();
        when(riskAggregationService.analysePortfolio(projects)).thenReturn(report);

        assertThat(service.assessRisks(projects)).isSameAs(report);
    }

    @Test
    void runScenario_simulatesParsedActionAtClockDate() {
        ScenarioAction action = ScenarioAction.builder().actionType(ActionType.DELAY).project("Gamma").durationWeeks(13).build();
        ScenarioResult result = ScenarioResult.builder().action(action).build();
        when(scenarioParser.parse("delay Gamma by 1 quarter")).thenReturn(action);
        when(scenarioSimulator.simulate(any(), any(), any(), any())).thenReturn(result);

        assertThat(service.runScenario("delay Gamma by 1 quarter", projects)).isSameAs(result);

        verify(scenarioSimulator).simulate(eq(action), eq(projects), any(DependencyGraph.class), eq(REFERENCE_DATE));
    }

    @Test
    void runScenario_propagatesParseErrors_withoutSimulating() {
        when(scenarioParser.parse("nonsense")).thenThrow(new ScenarioParseException("Could not parse", "nonsense"));

        assertThatThrownBy(() -> service.runScenario("nonsense", projects))
                .isInstanceOf(ScenarioParseException.class);
        verify(scenarioSimulator, never()).simulate(any(), any(), any(), any());
    }

    @Test
    void narrate_wrapsSimulatedResult() {
        ScenarioAction action = ScenarioAction.builder().actionType(ActionType.REMOVE).project("Delta").build();
        when(scenarioParser.parse("remove Delta")).thenReturn(action);
        when(scenarioSimulator.simulate(any(), any(), any(), any()))
                .thenReturn(ScenarioResult.builder().action(action).build());

        ScenarioNarrative narrative = service.narrate("remove Delta", projects);

        assertThat(narrative.getTitle()).isEqualTo("Project Removal: Delta");
    }

    @Test
    void buildGraph_readsEdgesFromComments() {
        DependencyGraph graph = service.buildGraph(projects);

        assertThat(graph.allDependents("Alpha")).containsExactly("Beta", "Epsilon", "Gamma");
    }

    @Test
    void findCircularDependency_flagsCycleIntroducedByUpdate() {
        Project alphaNeedsEpsilon = PortfolioFixtures.alpha().toBuilder()
                .task(PortfolioFixtures.task("Sign-off", "Open", "High", "Waiting on Epsilon docs"))
                .build();
        List<Project> updated = List.of(alphaNeedsEpsilon, PortfolioFixtures.beta(), PortfolioFixtures.gamma(),
                PortfolioFixtures.delta(), PortfolioFixtures.epsilon(), PortfolioFixtures.zeta());

        Optional<CircularDependency> cycle = service.findCircularDependency(projects, updated);

        assertThat(cycle).hasValueSatisfying(found -> {
            assertThat(found.isNewInScenario()).isTrue();
            assertThat(found.getCycle()).containsExactly("Alpha", "Epsilon", "Gamma", "Beta", "Alpha");
        });
    }
}
