package com.sapiens.orchestrator.support;

import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.store.ArtifactStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class InMemoryArtifactStore implements ArtifactStore {

    private final List<Artifact> rows = new ArrayList<>();

    @Override
    public synchronized Artifact save(Artifact artifact) {
        rows.add(artifact);
        return artifact;
    }

    @Override
    public synchronized Optional<Artifact> find(String artifactId) {
        return rows.stream().filter(a -> a.getArtifactId().equals(artifactId)).findFirst();
    }

    @Override
    public synchronized Optional<Artifact> latest(String userId, ArtifactKind kind) {
        List<Artifact> h = history(userId, kind);
        return h.isEmpty() ? Optional.empty() : Optional.of(h.get(h.size() - 1));
    }

    @Override
    public synchronized List<Artifact> history(String userId, ArtifactKind kind) {
        return rows.stream().filter(a -> a.getUserId().equals(userId) && a.getKind() == kind).toList();
    }

    @Override
    public synchronized List<Artifact> all(String userId) {
        return new ArrayList<>(rows.stream().filter(a -> a.getUserId().equals(userId)).toList());
    }
}
