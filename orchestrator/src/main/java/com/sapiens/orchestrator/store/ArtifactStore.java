package com.sapiens.orchestrator.store;

import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;

import java.util.List;
import java.util.Optional;

/** Append-only artifact storage. A revision is a new artifact, never an overwrite. */
public interface ArtifactStore {

    Artifact save(Artifact artifact);

    Optional<Artifact> find(String artifactId);

    /** Most recently stored artifact of this kind for the user. */
    Optional<Artifact> latest(String userId, ArtifactKind kind);

    /** Every stored artifact of this kind for the user, oldest first. */
    List<Artifact> history(String userId, ArtifactKind kind);

    /** Every stored artifact for the user, oldest first. */
    List<Artifact> all(String userId);
}
