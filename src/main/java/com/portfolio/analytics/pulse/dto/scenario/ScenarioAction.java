package com.portfolio.analytics.pulse.dto.scenario;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A structured what-if command parsed from free text.
 */
@Value
@Builder
public class ScenarioAction {

    @NonNull
    ActionType actionType;

    @NonNull
    String project;

    @Builder.Default
    double amount = 0.0;            // fraction 0.0-1.0 for percentage changes

    @Builder.Default
    double amountAbsolute = 0.0;    // currency amount, exclusive with amount

    @Builder.Default
    int durationWeeks = 0;          // DELAY only

    @Builder.Default
    String description = "";        // original input text

    public boolean isAbsolute() {
        return amountAbsolute > 0;
    }
}
