package com.sapiens.orchestrator.service;

/**
 * Failure of a chat request, classified so the API layer can map it to a
 * response without looking at causes.
 *
 * Unchecked so only the API boundary needs to know about it.
 */
public class OrchestrationException extends RuntimeException {

    public enum Kind {
        UNKNOWN_USER,               // strict mode: no state for this user
        USER_EXISTS,                // explicit creation of a user that already has state
        PERSISTENCE_FAILURE,        // a decision was made but could not be stored
        VALIDATION_FAILURE,         // malformed request, rejected before touching state
        BUSY,                       // the user's queue wait expired
        INTERNAL_FAILURE            // unexpected defect in a handler
    }

    private final Kind kind;
    private volatile String requestId;

    public OrchestrationException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public OrchestrationException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    // Keeps the already-prefixed message of the failure it copies.
    private OrchestrationException(OrchestrationException original) {
        super(original.getMessage(), original);
        this.kind = original.kind;
    }

    public Kind   getKind()      { return kind; }
    public String getRequestId() { return requestId; }

    /**
     * Same kind and message, as a separate instance that can carry another
     * request's id. The original becomes the cause.
     */
    public OrchestrationException copy() {
        return new OrchestrationException(this);
    }

    /** Tags the failure with the request it ended; the first request to tag it wins. */
    public OrchestrationException attachRequestId(String requestId) {
        if (this.requestId == null) {
            this.requestId = requestId;
        }
        return this;
    }
}
