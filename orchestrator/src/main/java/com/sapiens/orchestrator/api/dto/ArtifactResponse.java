package com.sapiens.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;

import java.time.Instant;

/**
 * One stored artifact revision. The payload is passed through as parsed
 * JSON so callers see the artifact's own fields.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArtifactResponse(
        String       artifactId,
        ArtifactKind kind,
        int          revision,
        String       supersedesId,
        JsonNode     payload,
        Instant      createdAt
) {
    public static ArtifactResponse from(Artifact a, JsonNode payload) {
        return new ArtifactResponse(a.getArtifactId(), a.getKind(), a.getRevision(),
                a.getSupersedesId(), payload, a.getCreatedAt());
    }
}
