package com.sapiens.orchestrator.agent.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Input to the project generator. {@code rejectedTitles} lists proposals the
 * user already turned down, so the next one differs.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GeneratorInput(
        String targetRole,
        String targetDomain,
        String background,
        String interests,
        List<String> rejectedTitles
) {
    public GeneratorInput {
        rejectedTitles = rejectedTitles == null ? List.of() : List.copyOf(rejectedTitles);
    }
}
