package com.sapiens.orchestrator.store.jpa;

import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.repository.ArtifactRepository;
import com.sapiens.orchestrator.store.ArtifactStore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class JpaArtifactStore implements ArtifactStore {

    private final ArtifactRepository repo;

    public JpaArtifactStore(ArtifactRepository repo) {
        this.repo = repo;
    }

    @Override
    public Artifact save(Artifact artifact) {
        return repo.save(artifact);
    }

    @Override
    public Optional<Artifact> find(String artifactId) {
        return repo.findById(artifactId);
    }

    @Override
    public Optional<Artifact> latest(String userId, ArtifactKind kind) {
        return repo.findFirstByUserIdAndKindOrderByCreatedAtDescRevisionDesc(userId, kind);
    }

    @Override
    public List<Artifact> history(String userId, ArtifactKind kind) {
        return repo.findByUserIdAndKindOrderByCreatedAtAscRevisionAsc(userId, kind);
    }

    @Override
    public List<Artifact> all(String userId) {
        return repo.findByUserIdOrderByCreatedAtAsc(userId);
    }
}
