package com.sapiens.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One line of a user's conversation: an inbound message, a rendered reply,
 * or a recorded agent failure. Append-only; the identity column is the
 * per-log append sequence.
 *
 * DB table: conversation_entries  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "conversation_entries")
public class ConversationEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long sequence;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Actor actor;

    // Null for USER entries.
    @Column(name = "agent_name", updatable = false)
    private String agentName;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payload;

    // Phase the user was in when this entry was produced.
    @Enumerated(EnumType.STRING)
    @Column(name = "state_at_time", nullable = false, updatable = false)
    private Phase stateAtTime;

    @Column(name = "request_id", updatable = false)
    private String requestId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ConversationEntry() {}   // required by JPA

    private ConversationEntry(String userId, Actor actor, String agentName,
                              String payload, Phase stateAtTime, String requestId) {
        this.userId      = userId;
        this.actor       = actor;
        this.agentName   = agentName;
        this.payload     = payload;
        this.stateAtTime = stateAtTime;
        this.requestId   = requestId;
    }

    public static ConversationEntry fromUser(String userId, String message,
                                             Phase stateAtTime, String requestId) {
        return new ConversationEntry(userId, Actor.USER, null, message, stateAtTime, requestId);
    }

    public static ConversationEntry fromAgent(String userId, String agentName, String payload,
                                              Phase stateAtTime, String requestId) {
        return new ConversationEntry(userId, Actor.AGENT, agentName, payload, stateAtTime, requestId);
    }

    public Long    getSequence()    { return sequence; }
    public String  getUserId()      { return userId; }
    public Actor   getActor()       { return actor; }
    public String  getAgentName()   { return agentName; }
    public String  getPayload()     { return payload; }
    public Phase   getStateAtTime() { return stateAtTime; }
    public String  getRequestId()   { return requestId; }
    public Instant getCreatedAt()   { return createdAt; }

    /** Used by in-memory stores that hand out their own sequence numbers. */
    public void assignSequence(long sequence) { this.sequence = sequence; }
}
