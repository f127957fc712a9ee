package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Deliverable(
        String name,
        String description,
        String format,
        String realWorldOutcome,
        List<String> evaluationCriteria
) {
    public Deliverable {
        evaluationCriteria = evaluationCriteria == null ? List.of() : List.copyOf(evaluationCriteria);
    }
}
