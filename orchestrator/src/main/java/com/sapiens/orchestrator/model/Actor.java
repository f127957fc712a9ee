package com.sapiens.orchestrator.model;

/** Who produced a conversation entry. */
public enum Actor {
    USER,
    AGENT
}
