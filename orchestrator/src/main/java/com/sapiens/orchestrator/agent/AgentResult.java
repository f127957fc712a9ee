package com.sapiens.orchestrator.agent;

import java.time.Duration;

/**
 * Outcome of one (possibly retried) agent invocation.
 *
 * Ok carries the typed output. TimedOut and Malformed mean the handler must
 * leave the state untouched and report a recoverable failure.
 */
public sealed interface AgentResult<O> permits AgentResult.Ok, AgentResult.TimedOut, AgentResult.Malformed {

    record Ok<O>(O output) implements AgentResult<O> {}

    record TimedOut<O>(Duration after) implements AgentResult<O> {}

    record Malformed<O>(String reason) implements AgentResult<O> {}

    default boolean isOk() {
        return this instanceof Ok;
    }

    /** Short description for logs and the failure audit entry. */
    default String describe() {
        if (this instanceof TimedOut<O> t) {
            return "timed out after " + t.after().toMillis() + " ms";
        }
        if (this instanceof Malformed<O> m) {
            return "malformed output: " + m.reason();
        }
        return "ok";
    }
}
