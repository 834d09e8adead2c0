package com.portfolio.analytics.pulse.dto.risk;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Red/Amber/Green traffic light, declared worst first.
 */
public enum RagStatus {
    RED("Red", "🔴"),
    AMBER("Amber", "🟡"),
    GREEN("Green", "🟢");

    private final String label;
    private final String emoji;

    RagStatus(String label, String emoji) {
        this.label = label;
        this.emoji = emoji;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getEmoji() {
        return emoji;
    }

    /**
     * RED for any CRITICAL/HIGH, AMBER when the worst is MEDIUM, GREEN for LOW or no risk.
     */
    public static RagStatus fromWorstSeverity(RiskSeverity worst) {
        if (worst == null) {
            return GREEN;
        }
        switch (worst) {
            case CRITICAL:
            case HIGH:
                return RED;
            case MEDIUM:
                return AMBER;
            default:
                return GREEN;
        }
    }

    public static RagStatus worst(RagStatus a, RagStatus b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
