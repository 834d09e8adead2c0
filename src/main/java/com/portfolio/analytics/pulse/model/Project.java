package com.portfolio.analytics.pulse.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * A project in the portfolio. The name is the key used by every cross-reference
 * (dependency graph edges, scenario targets, report rows).
 */
@Value
@Builder(toBuilder = true)
public class Project {

    @NonNull
    String name;

    @Builder.Default
    String status = "";

    LocalDate startDate;

    LocalDate endDate;

    @Builder.Default
    double budget = 0.0;

    @Builder.Default
    double actualSpend = 0.0;

    @Singular
    List<Task> tasks;

    public boolean hasTimeline() {
        return startDate != null && endDate != null;
    }
}
