package com.portfolio.analytics.pulse.service;

import com.portfolio.analytics.pulse.dto.graph.CircularDependency;
import com.portfolio.analytics.pulse.dto.risk.PortfolioRiskReport;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioAction;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioNarrative;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioResult;
import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.service.graph.CircularDependencyDetector;
import com.portfolio.analytics.pulse.service.graph.DependencyGraph;
import com.portfolio.analytics.pulse.service.graph.DependencyGraphBuilder;
import com.portfolio.analytics.pulse.service.risk.RiskAggregationService;
import com.portfolio.analytics.pulse.service.scenario.ScenarioNarrativeService;
import com.portfolio.analytics.pulse.service.scenario.ScenarioParser;
import com.portfolio.analytics.pulse.service.scenario.ScenarioSimulator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for callers holding an in-memory portfolio: risk assessment,
 * dependency graph, and what-if scenarios.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioAnalysisService {

    private final RiskAggregationService riskAggregationService;
    private final DependencyGraphBuilder graphBuilder;
    private final CircularDependencyDetector circularDependencyDetector;
    private final ScenarioParser scenarioParser;
    private final ScenarioSimulator scenarioSimulator;
    private final ScenarioNarrativeService narrativeService;
    private final Clock clock;

    public PortfolioRiskReport assessRisks(List<Project> projects) {
        return riskAggregationService.analysePortfolio(projects);
    }

    public DependencyGraph buildGraph(List<Project> projects) {
        DependencyGraph graph = graphBuilder.build(projects);
        circularDependencyDetector.detect(graph)
                .ifPresent(cycle -> log.warn("{}", cycle.getDescription()));
        return graph;
    }

    /**
     * Parses the instruction and simulates it against the portfolio as of today.
     *
     * @throws com.portfolio.analytics.pulse.exception.ScenarioParseException when the text
     *                                                                        is not a supported instruction
     */
    public ScenarioResult runScenario(String text, List<Project> projects) {
        ScenarioAction action = scenarioParser.parse(text);
        DependencyGraph graph = buildGraph(projects);
        return scenarioSimulator.simulate(action, projects, graph, LocalDate.now(clock));
    }

    public ScenarioNarrative narrate(String text, List<Project> projects) {
        return narrativeService.generate(runScenario(text, projects));
    }

    /**
     * A cycle present in the updated portfolio, flagged when the baseline portfolio
     * did not already have it.
     */
    public Optional<CircularDependency> findCircularDependency(List<Project> baselineProjects,
                                                               List<Project> updatedProjects) {
        return circularDependencyDetector.detectAndCompare(
                graphBuilder.build(baselineProjects), graphBuilder.build(updatedProjects));
    }
}
