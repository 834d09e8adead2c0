package com.portfolio.analytics.pulse.dto.risk;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single risk finding produced by one detector call.
 */
@Value
@Builder
public class Risk {

    @NonNull
    String projectName;

    @NonNull
    RiskCategory category;

    @NonNull
    RiskSeverity severity;

    @NonNull
    String title;

    @NonNull
    String explanation;     // plain English, quotes the concrete facts

    @NonNull
    String suggestedMitigation;
}
