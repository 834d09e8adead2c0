package com.portfolio.analytics.pulse.dto.risk;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk severity, declared worst first so that the natural enum order sorts
 * CRITICAL before LOW.
 */
public enum RiskSeverity {
    CRITICAL("Critical", 0),
    HIGH("High", 1),
    MEDIUM("Medium", 2),
    LOW("Low", 3);

    private final String label;
    private final int rank;

    RiskSeverity(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    /**
     * One step worse, capped at CRITICAL.
     */
    public RiskSeverity elevate() {
        switch (this) {
            case LOW:
                return MEDIUM;
            case MEDIUM:
                return HIGH;
            default:
                return CRITICAL;
        }
    }

    public boolean isWorseThan(RiskSeverity other) {
        return rank < other.rank;
    }

    public static RiskSeverity worst(RiskSeverity a, RiskSeverity b) {
        return a.rank <= b.rank ? a : b;
    }
}
