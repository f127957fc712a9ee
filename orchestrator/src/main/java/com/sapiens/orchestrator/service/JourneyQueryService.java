package com.sapiens.orchestrator.service;

import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.model.ConversationEntry;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.model.StateTransition;
import com.sapiens.orchestrator.model.UserState;
import com.sapiens.orchestrator.statemachine.StateMachine;
import com.sapiens.orchestrator.store.ArtifactStore;
import com.sapiens.orchestrator.store.AuditLog;
import com.sapiens.orchestrator.store.UserStateStore;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Read-only views of a journey for the API. Never goes through the
 * single-flight gate: reads may interleave with a running chat request and
 * see the last committed state.
 */
@Service
@Transactional(readOnly = true)
public class JourneyQueryService {

    public static final int MAX_CONVERSATION_LIMIT = 500;

    /** A user's state plus the targets the state machine would accept now. */
    public record Snapshot(UserState state, List<Phase> validTargets) {}

    /** The active project and the id of the artifact it was read from. */
    public record ActiveProject(String artifactId, boolean approved, ProjectProposal proposal) {}

    private final UserStateStore   states;
    private final AuditLog         audit;
    private final ArtifactStore    artifactStore;
    private final JourneyArtifacts artifacts;
    private final StateMachine     stateMachine;

    public JourneyQueryService(UserStateStore states, AuditLog audit, ArtifactStore artifactStore,
                               JourneyArtifacts artifacts, StateMachine stateMachine) {
        this.states        = states;
        this.audit         = audit;
        this.artifactStore = artifactStore;
        this.artifacts     = artifacts;
        this.stateMachine  = stateMachine;
    }

    public Snapshot snapshot(String userId) {
        UserState state = require(userId);
        return new Snapshot(state, stateMachine.validTargets(state));
    }

    public Optional<ActiveProject> activeProject(String userId) {
        UserState state = require(userId);
        return artifacts.project(state.getProjectId())
                .map(p -> new ActiveProject(state.getProjectId(), state.isProjectApproved(), p));
    }

    /** Every revision of every artifact, or of one kind when {@code kind} is given. */
    public List<Artifact> artifacts(String userId, ArtifactKind kind) {
        require(userId);
        return kind == null ? artifactStore.all(userId) : artifactStore.history(userId, kind);
    }

    public List<ConversationEntry> conversation(String userId, int limit) {
        if (limit < 1 || limit > MAX_CONVERSATION_LIMIT) {
            throw new OrchestrationException(OrchestrationException.Kind.VALIDATION_FAILURE,
                    "limit must be between 1 and " + MAX_CONVERSATION_LIMIT);
        }
        require(userId);
        return audit.recentEntries(userId, limit);
    }

    public List<StateTransition> transitions(String userId) {
        require(userId);
        return audit.transitions(userId);
    }

    private UserState require(String userId) {
        return states.find(userId).orElseThrow(() -> new OrchestrationException(
                OrchestrationException.Kind.UNKNOWN_USER, "no journey for user " + userId));
    }
}
