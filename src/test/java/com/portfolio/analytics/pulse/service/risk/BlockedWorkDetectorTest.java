package com.portfolio.analytics.pulse.service.risk;

import com.portfolio.analytics.pulse.dto.risk.Risk;
import com.portfolio.analytics.pulse.dto.risk.RiskCategory;
import com.portfolio.analytics.pulse.dto.risk.RiskSeverity;
import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.model.Task;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.portfolio.analytics.pulse.support.PortfolioFixtures.REFERENCE_DATE;
import static com.portfolio.analytics.pulse.support.PortfolioFixtures.project;
import static com.portfolio.analytics.pulse.support.PortfolioFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;

class BlockedWorkDetectorTest {

    private final BlockedWorkDetector detector = new BlockedWorkDetector();

    @Test
    void flagsSingleCriticalRisk_whenStatusAndCommentsBothSayBlocked() {
        Project project = project("Alpha", task("API Gateway", "Blocked", "Critical", "Blocked by vendor"));

        List<Risk> risks = detector.detect(project, REFERENCE_DATE);

        assertThat(risks).hasSize(1);
        Risk risk = risks.get(0);
        assertThat(risk.getSeverity()).isEqualTo(RiskSeverity.CRITICAL);
        assertThat(risk.getCategory()).isEqualTo(RiskCategory.BLOCKED_WORK);
        assertThat(risk.getTitle()).isEqualTo("'API Gateway' is blocked");
        assertThat(risk.getExplanation()).contains("Blocked by vendor").contains("that is unassigned");
        assertThat(risk.getSuggestedMitigation()).startsWith("Escalate");
    }

    @Test
    void elevatesOneStep_whenBothSignalsPresent() {
        Project project = project("Beta", task("Load test", "On Hold", "Medium", "Waiting on infra team"));

        List<Risk> risks = detector.detect(project, REFERENCE_DATE);

        assertThat(risks).singleElement().extracting(Risk::getSeverity).isEqualTo(RiskSeverity.HIGH);
    }

    @Test
    void keepsPrioritySeverity_whenOnlyStatusIsBlocked() {
        Project project = project("Beta", task("Load test", "blocked", "Low", ""));

        List<Risk> risks = detector.detect(project, REFERENCE_DATE);

        assertThat(risks).singleElement().satisfies(risk -> {
            assertThat(risk.getSeverity()).isEqualTo(RiskSeverity.LOW);
            assertThat(risk.getTitle()).isEqualTo("'Load test' is blocked");
        });
    }

    @Test
    void flagsCommentBlocker_whenStatusLooksHealthy() {
        Task task = Task.builder()
                .name("Payments")
                .status("In Progress")
                .priority("High")
                .assignee("Bob")
                .comments("Progress stalled on the supplier side")
                .build();

        List<Risk> risks = detector.detect(project("Gamma", task), REFERENCE_DATE);

        assertThat(risks).singleElement().satisfies(risk -> {
            assertThat(risk.getSeverity()).isEqualTo(RiskSeverity.HIGH);
            assertThat(risk.getTitle()).isEqualTo("'Payments' has a blocker in comments");
            assertThat(risk.getExplanation()).contains("assigned to Bob").contains("high-priority task");
        });
    }

    @Test
    void describesMissingStatus_whenCommentsReportBlocker() {
        Task task = Task.builder()
                .name("Vendor API")
                .status(null)
                .priority("High")
                .comments("Blocked by vendor")
                .build();

        List<Risk> risks = detector.detect(project("Alpha", task), REFERENCE_DATE);

        assertThat(risks).singleElement().satisfies(risk -> {
            assertThat(risk.getTitle()).isEqualTo("'Vendor API' has a blocker in comments");
            assertThat(risk.getExplanation())
                    .startsWith("'Vendor API' in Alpha has no recorded status but the comments say:")
                    .contains("Blocked by vendor");
        });
    }

    @Test
    void ignoresTasks_withoutAnyBlockerSignal() {
        Project project = project("Delta",
                task("Docs", "In Progress", "High", "Going well"),
                task("Release", "Done", "Critical", ""));

        assertThat(detector.detect(project, REFERENCE_DATE)).isEmpty();
    }

    @Test
    void sortsWorstFirst() {
        Project project = project("Epsilon",
                task("Low one", "Blocked", "Low", ""),
                task("Critical one", "Blocked", "Critical", ""),
                task("Medium one", "Blocked", "Medium", ""));

        assertThat(detector.detect(project, REFERENCE_DATE))
                .extracting(Risk::getSeverity)
                .containsExactly(RiskSeverity.CRITICAL, RiskSeverity.MEDIUM, RiskSeverity.LOW);
    }
}
