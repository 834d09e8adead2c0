package com.portfolio.analytics.pulse.dto.scenario;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionType {
    BUDGET_INCREASE("budget_increase", "Budget Increase"),
    BUDGET_DECREASE("budget_decrease", "Budget Decrease"),
    SCOPE_CUT("scope_cut", "Scope Reduction"),
    DELAY("delay", "Schedule Delay"),
    REMOVE("remove", "Project Removal");

    private final String value;
    private final String title;

    ActionType(String value, String title) {
        this.value = value;
        this.title = title;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getTitle() {
        return title;
    }
}
