package com.sapiens.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored form of a domain artifact (proposal, evaluated draft, plan, review,
 * resume). The typed record is serialized into payload_json.
 *
 * A new revision never overwrites an old one: it is a new row whose
 * supersedes_id points at the artifact it replaces.
 *
 * DB table: artifacts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "artifacts")
public class Artifact {

    @Id
    @Column(name = "artifact_id", nullable = false, updatable = false)
    private String artifactId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ArtifactKind kind;

    // 1 for the first version, then revision counter of the producing phase + 1.
    @Column(nullable = false, updatable = false)
    private int revision;

    @Column(name = "supersedes_id", updatable = false)
    private String supersedesId;

    @Column(name = "payload_json", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payloadJson;

    @Column(name = "request_id", updatable = false)
    private String requestId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Artifact() {}   // required by JPA

    public Artifact(String userId, ArtifactKind kind, int revision,
                    String supersedesId, String payloadJson, String requestId) {
        this.artifactId   = newId(kind);
        this.userId       = userId;
        this.kind         = kind;
        this.revision     = revision;
        this.supersedesId = supersedesId;
        this.payloadJson  = payloadJson;
        this.requestId    = requestId;
    }

    /** e.g. "proj_3f9a01bc" */
    static String newId(ArtifactKind kind) {
        return kind.idPrefix() + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public String       getArtifactId()   { return artifactId; }
    public String       getUserId()       { return userId; }
    public ArtifactKind getKind()         { return kind; }
    public int          getRevision()     { return revision; }
    public String       getSupersedesId() { return supersedesId; }
    public String       getPayloadJson()  { return payloadJson; }
    public String       getRequestId()    { return requestId; }
    public Instant      getCreatedAt()    { return createdAt; }
}
