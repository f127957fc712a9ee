package com.sapiens.orchestrator.agent;

/**
 * Thrown by an agent when the backend reply cannot be turned into a valid
 * typed output (missing result block, bad JSON, scores out of range,
 * unsupported resume claims...). The invoker treats it as a malformed
 * attempt and retries.
 */
public class AgentOutputException extends RuntimeException {

    public AgentOutputException(String message) {
        super(message);
    }

    public AgentOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
