package com.portfolio.analytics.pulse.dto.scenario;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ImpactType {
    DIRECT("direct"),
    CASCADE("cascade");

    private final String value;

    ImpactType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
