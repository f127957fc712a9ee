package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Stored solution artifact, tied to the problem artifact it answers. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SolutionDesign(String problemId, SolutionDraft draft, Evaluation evaluation) {}
