package com.portfolio.analytics.pulse.dto.scenario;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Executive-level write-up of a {@link ScenarioResult}.
 */
@Value
@Builder
public class ScenarioNarrative {

    String title;
    String scenarioDescription;
    String beforeSummary;
    String afterSummary;
    String impactAnalysis;

    @Builder.Default
    String cascadeAnalysis = "";

    @Singular
    List<String> recommendations;

    @Singular
    List<String> warnings;

    /**
     * Renders every populated section as markdown. Cascade, recommendation and warning
     * sections are left out when empty.
     */
    @JsonProperty("fullText")
    public String fullText() {
        List<String> sections = new ArrayList<>();
        sections.add("# Scenario Impact Summary\n");
        sections.add("## Scenario\n" + scenarioDescription + "\n");
        sections.add("## Before\n" + beforeSummary + "\n");
        sections.add("## After\n" + afterSummary + "\n");
        sections.add("## Impact Analysis\n" + impactAnalysis + "\n");
        if (!cascadeAnalysis.isEmpty()) {
            sections.add("## Cascade Effects\n" + cascadeAnalysis + "\n");
        }
        if (!recommendations.isEmpty()) {
            sections.add("## Recommended Actions\n" + bullets(recommendations) + "\n");
        }
        if (!warnings.isEmpty()) {
            sections.add("## Warnings\n" + bullets(warnings) + "\n");
        }
        return String.join("\n", sections);
    }

    private static String bullets(List<String> items) {
        List<String> lines = new ArrayList<>();
        for (String item : items) {
            lines.add("- " + item);
        }
        return String.join("\n", lines);
    }
}
