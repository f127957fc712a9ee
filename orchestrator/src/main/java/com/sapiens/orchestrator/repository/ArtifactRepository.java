package com.sapiens.orchestrator.repository;

import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ArtifactRepository extends JpaRepository<Artifact, String> {

    Optional<Artifact> findFirstByUserIdAndKindOrderByCreatedAtDescRevisionDesc(String userId, ArtifactKind kind);

    List<Artifact> findByUserIdAndKindOrderByCreatedAtAscRevisionAsc(String userId, ArtifactKind kind);

    List<Artifact> findByUserIdOrderByCreatedAtAsc(String userId);
}
