package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/** A solution design as the user wrote it, before evaluation. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SolutionDraft(
        String solutionApproach,
        List<String> keyComponents,
        String methodology,
        List<String> expectedOutcomes,
        String resourceRequirements
) {
    public SolutionDraft {
        keyComponents    = keyComponents == null ? List.of() : List.copyOf(keyComponents);
        expectedOutcomes = expectedOutcomes == null ? List.of() : List.copyOf(expectedOutcomes);
    }
}
