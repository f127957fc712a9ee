package com.sapiens.orchestrator.service;

import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ConversationEntry;
import com.sapiens.orchestrator.model.StateTransition;
import com.sapiens.orchestrator.model.UserState;
import com.sapiens.orchestrator.store.ArtifactStore;
import com.sapiens.orchestrator.store.AuditLog;
import com.sapiens.orchestrator.store.UserStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Writes everything one request decided, in one transaction:
 * state, transition record, artifacts, conversation entries.
 *
 * Either all of it is stored or none of it is; the caller only responds
 * after {@link #commit} returns.
 */
@Service
public class JourneyLedger {

    private static final Logger log = LoggerFactory.getLogger(JourneyLedger.class);

    /**
     * @param state      new state to store, or null to leave the stored state as it is
     * @param transition accepted or rejected transition, or null when none was proposed
     */
    public record Commit(UserState state, StateTransition transition,
                         List<Artifact> artifacts, List<ConversationEntry> entries) {
        public Commit {
            artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
            entries   = entries == null ? List.of() : List.copyOf(entries);
        }
    }

    private final UserStateStore states;
    private final AuditLog       audit;
    private final ArtifactStore  artifacts;

    public JourneyLedger(UserStateStore states, AuditLog audit, ArtifactStore artifacts) {
        this.states    = states;
        this.audit     = audit;
        this.artifacts = artifacts;
    }

    /** @return the stored state, or null when {@code commit.state()} was null */
    @Transactional
    public UserState commit(Commit commit) {
        UserState saved = null;
        if (commit.state() != null) {
            saved = states.save(commit.state());
        }
        for (Artifact a : commit.artifacts()) {
            artifacts.save(a);
        }
        if (commit.transition() != null) {
            audit.append(commit.transition());
        }
        for (ConversationEntry e : commit.entries()) {
            audit.append(e);
        }
        log.debug("Committed {} artifact(s), {} entr(ies), transition={}",
                commit.artifacts().size(), commit.entries().size(), commit.transition() != null);
        return saved;
    }

    /** Store a brand-new user record. */
    @Transactional
    public UserState create(UserState state) {
        return states.save(state);
    }
}
