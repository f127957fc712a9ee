package com.sapiens.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.service.JourneyQueryService;

/** Response body for GET /api/project/{userId}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectResponse(String projectId, boolean approved, ProjectProposal project) {

    public static ProjectResponse from(JourneyQueryService.ActiveProject active) {
        return new ProjectResponse(active.artifactId(), active.approved(), active.proposal());
    }
}
