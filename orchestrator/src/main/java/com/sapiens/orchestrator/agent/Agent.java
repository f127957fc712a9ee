package com.sapiens.orchestrator.agent;

/**
 * A stateless typed transformation from one agent input to one agent output.
 *
 * Agents never see {@link com.sapiens.orchestrator.model.UserState}, never
 * write to any store, and never call another agent.
 *
 * @param <I> typed input
 * @param <O> typed output
 */
@FunctionalInterface
public interface Agent<I, O> {

    /**
     * @throws AgentOutputException when the produced output violates the contract
     */
    O generate(I input, AgentContext ctx);
}
