package com.sapiens.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One proposed phase change, accepted or rejected. Written once, never updated.
 *
 * DB table: state_transitions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "state_transitions")
public class StateTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", nullable = false, updatable = false)
    private Phase fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false, updatable = false)
    private Phase toState;

    @Column(nullable = false, updatable = false)
    private boolean accepted;

    // Short machine-readable cause, e.g. "solution_approved" or "missing: [problem_id]".
    @Column(updatable = false, columnDefinition = "TEXT")
    private String reason;

    @Column(name = "request_id", updatable = false)
    private String requestId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected StateTransition() {}   // required by JPA

    public StateTransition(String userId, Phase fromState, Phase toState,
                           boolean accepted, String reason, String requestId) {
        this.userId    = userId;
        this.fromState = fromState;
        this.toState   = toState;
        this.accepted  = accepted;
        this.reason    = reason;
        this.requestId = requestId;
    }

    public Long    getId()        { return id; }
    public String  getUserId()    { return userId; }
    public Phase   getFromState() { return fromState; }
    public Phase   getToState()   { return toState; }
    public boolean isAccepted()   { return accepted; }
    public String  getReason()    { return reason; }
    public String  getRequestId() { return requestId; }
    public Instant getCreatedAt() { return createdAt; }

    /** Used by in-memory stores that hand out their own sequence numbers. */
    public void assignId(long id) { this.id = id; }
}
