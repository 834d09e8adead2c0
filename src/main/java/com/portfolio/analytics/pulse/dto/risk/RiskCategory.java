package com.portfolio.analytics.pulse.dto.risk;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskCategory {
    BLOCKED_WORK("Blocked Work"),
    CHRONIC_CARRYOVER("Chronic Carry-Over"),
    BURN_RATE("Burn Rate"),
    DEPENDENCY("Dependency");

    private final String label;

    RiskCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
