package com.portfolio.analytics.pulse.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A single task/issue from a project tracker export.
 * Status and priority are free text and matched case-insensitively by the detectors.
 */
@Value
@Builder(toBuilder = true)
public class Task {

    @NonNull
    String name;

    @Builder.Default
    String status = "";

    @Builder.Default
    String priority = "Medium";

    @Builder.Default
    String assignee = "";

    @Builder.Default
    String sprint = "";

    @Singular
    List<String> previousSprints;   // chronological, oldest first

    @Builder.Default
    String comments = "";

    public boolean hasComments() {
        return comments != null && !comments.isBlank();
    }

    public boolean isAssigned() {
        return assignee != null && !assignee.isBlank();
    }
}
