package com.sapiens.orchestrator.llm;

/** Transport or API-level failure of the text-generation backend. */
public class BackendException extends RuntimeException {

    private final int statusCode;

    public BackendException(int statusCode, String body) {
        super("Backend error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when the call never got a response. */
    public int statusCode() { return statusCode; }
}
