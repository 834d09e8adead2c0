package com.portfolio.analytics.pulse.dto.decision;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionOption {

    private String label;
    private String description;
    private String impactSummary;
}
