package com.sapiens.orchestrator.service.handler;

import com.sapiens.orchestrator.agent.AgentGateway;
import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.model.UserState;
import com.sapiens.orchestrator.service.JourneyArtifacts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything a handler gets for one message.
 *
 * {@link #state()} is a private working copy: the stored record is only
 * replaced if the orchestrator accepts the outcome.
 */
public final class Turn {

    private final String           requestId;
    private final String           message;
    private final UserState        state;
    private final AgentGateway     agents;
    private final JourneyArtifacts artifacts;
    private final List<Artifact>   staged = new ArrayList<>();

    public Turn(String requestId, String message, UserState state,
                AgentGateway agents, JourneyArtifacts artifacts) {
        this.requestId = requestId;
        this.message   = message;
        this.state     = state;
        this.agents    = agents;
        this.artifacts = artifacts;
    }

    public String           requestId() { return requestId; }
    public String           message()   { return message; }
    public String           userId()    { return state.getUserId(); }
    public UserState        state()     { return state; }
    public AgentGateway     agents()    { return agents; }
    public JourneyArtifacts artifacts() { return artifacts; }

    /** Prepare an artifact for storage with the rest of this turn's writes. */
    public Artifact stage(ArtifactKind kind, Object payload, int revision) {
        Artifact a = artifacts.prepare(userId(), kind, payload, revision, requestId);
        staged.add(a);
        return a;
    }

    public List<Artifact> stagedArtifacts() {
        return Collections.unmodifiableList(staged);
    }
}
