package com.portfolio.analytics.pulse.dto.decision;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Which analysis raised a decision.
 */
@Getter
@RequiredArgsConstructor
public enum DecisionSource {
    SCENARIO("scenario"),
    RISK_ANALYSIS("risk_analysis");

    @JsonValue
    private final String value;
}
