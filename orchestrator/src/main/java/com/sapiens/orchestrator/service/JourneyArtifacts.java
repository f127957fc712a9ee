package com.sapiens.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sapiens.orchestrator.artifact.*;
import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.store.ArtifactStore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Typed access to stored artifacts: serializes domain records into
 * {@link Artifact} rows and reads them back.
 *
 * Preparing an artifact does not store it; the ledger does that together
 * with the rest of the request's writes.
 */
@Component
public class JourneyArtifacts {

    private final ArtifactStore store;
    private final ObjectMapper  json;

    public JourneyArtifacts(ArtifactStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.json  = objectMapper;
    }

    // ------------------------------------------------------------------
    // Write side
    // ------------------------------------------------------------------

    /**
     * Build (but do not store) a new artifact that supersedes the user's
     * latest artifact of the same kind, if there is one.
     */
    public Artifact prepare(String userId, ArtifactKind kind, Object payload, int revision, String requestId) {
        String supersedes = store.latest(userId, kind).map(Artifact::getArtifactId).orElse(null);
        return new Artifact(userId, kind, revision, supersedes, toJson(payload), requestId);
    }

    // ------------------------------------------------------------------
    // Read side
    // ------------------------------------------------------------------

    public Optional<ProjectProposal> project(String artifactId) {
        return load(artifactId, ProjectProposal.class);
    }

    public Optional<ProblemDefinition> problem(String artifactId) {
        return load(artifactId, ProblemDefinition.class);
    }

    public Optional<SolutionDesign> solution(String artifactId) {
        return load(artifactId, SolutionDesign.class);
    }

    public Optional<MilestonePlan> plan(String artifactId) {
        return load(artifactId, MilestonePlan.class);
    }

    public Optional<ArtifactReview> review(String artifactId) {
        return load(artifactId, ArtifactReview.class);
    }

    public Optional<Artifact> find(String artifactId) {
        return artifactId == null ? Optional.empty() : store.find(artifactId);
    }

    public List<Artifact> history(String userId, ArtifactKind kind) {
        return store.history(userId, kind);
    }

    /** Titles of every project ever proposed to this user, oldest first. */
    public List<String> proposedTitles(String userId) {
        return history(userId, ArtifactKind.PROJECT).stream()
                .map(a -> read(a, ProjectProposal.class).title())
                .toList();
    }

    public <T> Optional<T> load(String artifactId, Class<T> type) {
        return find(artifactId).map(a -> read(a, type));
    }

    public <T> T read(Artifact artifact, Class<T> type) {
        try {
            return json.readValue(artifact.getPayloadJson(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored artifact " + artifact.getArtifactId()
                    + " is not a valid " + type.getSimpleName(), e);
        }
    }

    private String toJson(Object payload) {
        try {
            return json.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + payload.getClass().getSimpleName(), e);
        }
    }
}
