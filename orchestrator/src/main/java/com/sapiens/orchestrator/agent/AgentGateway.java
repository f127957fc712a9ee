package com.sapiens.orchestrator.agent;

import com.sapiens.orchestrator.agent.contract.*;
import com.sapiens.orchestrator.artifact.Evaluation;
import com.sapiens.orchestrator.model.AgentCapability;

/**
 * The only way a phase handler can reach an agent.
 *
 * One gateway is opened per request and bound to the single capability the
 * current phase allows (or none). It permits exactly one invocation; a
 * second call, or a call to a different capability, is a programming error
 * and throws {@link IllegalStateException}.
 */
public final class AgentGateway {

    private final AgentCapability allowed;
    private final AgentGatewayFactory.Agents agents;
    private final AgentInvoker invoker;
    private final AgentContext ctx;

    private AgentCapability used;

    AgentGateway(AgentCapability allowed, AgentGatewayFactory.Agents agents,
                 AgentInvoker invoker, AgentContext ctx) {
        this.allowed = allowed;
        this.agents  = agents;
        this.invoker = invoker;
        this.ctx     = ctx;
    }

    // ------------------------------------------------------------------
    // Typed entry points
    // ------------------------------------------------------------------

    public AgentResult<GeneratorOutput> generateProject(GeneratorInput input) {
        return call(AgentCapability.GENERATOR, agents.generator(), input);
    }

    public AgentResult<Evaluation> evaluate(EvaluationInput input) {
        return call(AgentCapability.EVALUATOR, agents.evaluator(), input);
    }

    public AgentResult<ProgressOutput> trackProgress(ProgressInput input) {
        return call(AgentCapability.PROGRESS_TRACKER, agents.progressTracker(), input);
    }

    public AgentResult<ReviewOutput> review(ReviewInput input) {
        return call(AgentCapability.REVIEWER, agents.reviewer(), input);
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    /** Capability this gateway is bound to; null when the phase allows none. */
    public AgentCapability allowedCapability() {
        return allowed;
    }

    /** Capability that was invoked, or null if no agent was called. */
    public AgentCapability usedCapability() {
        return used;
    }

    public boolean wasUsed() {
        return used != null;
    }

    private synchronized <I, O> AgentResult<O> call(AgentCapability capability, Agent<I, O> agent, I input) {
        if (capability != allowed) {
            throw new IllegalStateException("Capability '" + capability.agentName()
                    + "' is not allowed in phase " + ctx.phase().wireName());
        }
        if (used != null) {
            throw new IllegalStateException("An agent was already invoked for request " + ctx.requestId());
        }
        used = capability;
        return invoker.invoke(capability, agent, input, ctx);
    }
}
