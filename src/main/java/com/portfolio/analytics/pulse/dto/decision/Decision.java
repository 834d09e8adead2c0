package com.portfolio.analytics.pulse.dto.decision;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the portfolio decision log: the options weighed, the recommended one
 * and where the decision came from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Decision {

    private String decisionId;
    private LocalDate date;
    private String title;
    private String context;

    @Builder.Default
    private List<String> projectsAffected = new ArrayList<>();

    @Builder.Default
    private List<DecisionOption> options = new ArrayList<>();

    private String recommendation;
    private String recommendationRationale;

    @Builder.Default
    private DecisionStatus status = DecisionStatus.PENDING;

    private DecisionSource source;
}
