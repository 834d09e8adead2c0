package com.portfolio.analytics.pulse.dto.scenario;

import com.portfolio.analytics.pulse.model.Project;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Point-in-time copy of the project fields a scenario can change. Read-only; the
 * simulator derives after-states with {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class ProjectSnapshot {

    String name;
    String status;
    LocalDate startDate;
    LocalDate endDate;
    double budget;
    double actualSpend;

    @Builder.Default
    double scopePct = 100.0;

    int taskCount;
    Integer runwayWeeks;    // set by budget scenarios, null when it cannot be computed

    public static ProjectSnapshot of(Project project) {
        return ProjectSnapshot.builder()
                .name(project.getName())
                .status(project.getStatus())
                .startDate(project.getStartDate())
                .endDate(project.getEndDate())
                .budget(project.getBudget())
                .actualSpend(project.getActualSpend())
                .taskCount(project.getTasks().size())
                .build();
    }
}
