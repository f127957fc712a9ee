package com.sapiens.orchestrator.agent;

import com.sapiens.orchestrator.agent.contract.*;
import com.sapiens.orchestrator.artifact.Evaluation;
import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.Phase;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Owns the four backend-driven agents and hands out one {@link AgentGateway}
 * per request. Nothing else in the application holds an agent reference.
 *
 * Phase → capability:
 * <pre>
 *   onboarding, project_generation → generator
 *   problem_definition, solution_design → evaluator
 *   execution → progress_tracker
 *   review → reviewer
 *   completed → (none)
 * </pre>
 */
@Component
public class AgentGatewayFactory {

    /** The agent set behind the gateways. */
    public record Agents(
            Agent<GeneratorInput, GeneratorOutput> generator,
            Agent<EvaluationInput, Evaluation> evaluator,
            Agent<ProgressInput, ProgressOutput> progressTracker,
            Agent<ReviewInput, ReviewOutput> reviewer
    ) {}

    private static final Map<Phase, AgentCapability> PHASE_CAPABILITY = new EnumMap<>(Phase.class);

    static {
        PHASE_CAPABILITY.put(Phase.ONBOARDING,         AgentCapability.GENERATOR);
        PHASE_CAPABILITY.put(Phase.PROJECT_GENERATION, AgentCapability.GENERATOR);
        PHASE_CAPABILITY.put(Phase.PROBLEM_DEFINITION, AgentCapability.EVALUATOR);
        PHASE_CAPABILITY.put(Phase.SOLUTION_DESIGN,    AgentCapability.EVALUATOR);
        PHASE_CAPABILITY.put(Phase.EXECUTION,          AgentCapability.PROGRESS_TRACKER);
        PHASE_CAPABILITY.put(Phase.REVIEW,             AgentCapability.REVIEWER);
    }

    private final Agents       agents;
    private final AgentInvoker invoker;

    public AgentGatewayFactory(Agents agents, AgentInvoker invoker) {
        this.agents  = agents;
        this.invoker = invoker;
    }

    public static AgentCapability capabilityFor(Phase phase) {
        return PHASE_CAPABILITY.get(phase);
    }

    public AgentGateway open(AgentContext ctx) {
        return new AgentGateway(capabilityFor(ctx.phase()), agents, invoker, ctx);
    }
}
