package com.sapiens.orchestrator.service.handler;

import com.sapiens.orchestrator.model.Phase;

/**
 * Handles one inbound message for users in one phase.
 *
 * A handler may update fields on {@link Turn#state()}, stage artifacts,
 * and make at most one agent call through {@link Turn#agents()}. It never
 * changes the current phase itself: it proposes a transition by returning
 * {@link HandlerOutcome.Advance} and the orchestrator asks the state machine.
 */
public interface PhaseHandler {

    Phase phase();

    HandlerOutcome handle(Turn turn);
}
