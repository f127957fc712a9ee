package com.sapiens.orchestrator.statemachine;

import com.sapiens.orchestrator.model.FieldName;
import com.sapiens.orchestrator.model.Phase;

import java.util.Set;

/**
 * Thrown by {@link StateMachine#apply} when a proposed transition is not
 * allowed. The input record is never modified when this is thrown.
 *
 * Unchecked so handlers can let it travel to the orchestrator, which turns
 * it into an audited rejection plus the handler's fallback message.
 */
public class InvalidTransitionException extends RuntimeException {

    public enum Reason { NOT_AN_EDGE, REVISION_LOCKED, MISSING_FIELDS }

    private final Phase from;
    private final Phase to;
    private final Reason reason;
    private final Set<FieldName> missingFields;

    public InvalidTransitionException(Phase from, Phase to, Reason reason, Set<FieldName> missingFields) {
        super("[" + reason + "] " + from.wireName() + " -> " + to.wireName()
                + (missingFields.isEmpty() ? "" : " missing " + labels(missingFields)));
        this.from          = from;
        this.to            = to;
        this.reason        = reason;
        this.missingFields = Set.copyOf(missingFields);
    }

    private static String labels(Set<FieldName> fields) {
        return fields.stream().map(FieldName::label).sorted().toList().toString();
    }

    public Phase getFrom()                  { return from; }
    public Phase getTo()                    { return to; }
    public Reason getReason()               { return reason; }
    public Set<FieldName> getMissingFields() { return missingFields; }

    /** Compact form stored in the rejected transition record. */
    public String auditReason() {
        return switch (reason) {
            case NOT_AN_EDGE     -> "not_an_edge";
            case REVISION_LOCKED -> "revision_locked";
            case MISSING_FIELDS  -> "missing: " + labels(missingFields);
        };
    }
}
