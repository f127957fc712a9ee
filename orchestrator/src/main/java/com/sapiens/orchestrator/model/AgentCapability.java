package com.sapiens.orchestrator.model;

/**
 * The five agent capabilities (one agent per capability).
 *
 * RELAY renders text for the user and runs in-process. The other four are
 * backed by the external text-generation service and are the ones bounded
 * by the one-invocation-per-request rule.
 */
public enum AgentCapability {
    RELAY("relay"),                       // Turns response intents into user-facing text
    GENERATOR("project_generator"),       // Proposes a portfolio project
    EVALUATOR("evaluator"),               // Scores problem definitions and solution designs
    PROGRESS_TRACKER("progress_tracker"), // Builds milestone plans, reacts to progress updates
    REVIEWER("reviewer");                 // Reviews final artifacts, writes resume content

    private final String agentName;

    AgentCapability(String agentName) {
        this.agentName = agentName;
    }

    /** Name recorded in conversation entries and metric tags. */
    public String agentName() {
        return agentName;
    }
}
