package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Stored problem artifact: the user's draft plus the evaluator's assessment of it. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProblemDefinition(String projectId, ProblemDraft draft, Evaluation evaluation) {}
