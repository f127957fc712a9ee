package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/** A problem definition as the user wrote it, before evaluation. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProblemDraft(
        String problemStatement,
        String targetAudience,
        String problemContext,
        List<String> successMetrics
) {
    public ProblemDraft {
        successMetrics = successMetrics == null ? List.of() : List.copyOf(successMetrics);
    }
}
