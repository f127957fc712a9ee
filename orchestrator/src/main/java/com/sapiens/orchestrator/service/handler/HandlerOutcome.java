package com.sapiens.orchestrator.service.handler;

import com.sapiens.orchestrator.agent.AgentResult;
import com.sapiens.orchestrator.agent.contract.ResponseIntent;
import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.Phase;

/** What a phase handler decided for one message. */
public sealed interface HandlerOutcome {

    /** Stay in the current phase; the turn's state changes (if any) are kept. */
    record Stay(ResponseIntent reply) implements HandlerOutcome {}

    /**
     * Propose moving to {@code target}. If the state machine refuses, nothing
     * the handler changed is kept and {@code fallback} is shown instead
     * (null means "list the missing fields").
     */
    record Advance(Phase target, String reason, ResponseIntent reply, ResponseIntent fallback)
            implements HandlerOutcome {}

    /** The turn's agent call failed on every attempt; nothing changes. */
    record AgentFailed(AgentCapability capability, String detail) implements HandlerOutcome {}

    static Stay stay(ResponseIntent reply) {
        return new Stay(reply);
    }

    static Advance advance(Phase target, String reason, ResponseIntent reply) {
        return new Advance(target, reason, reply, null);
    }

    static AgentFailed failed(AgentCapability capability, AgentResult<?> result) {
        return new AgentFailed(capability, result.describe());
    }
}
