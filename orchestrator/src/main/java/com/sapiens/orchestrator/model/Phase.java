package com.sapiens.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The seven phases of a user's journey.
 *
 * Forward sequence:
 *   ONBOARDING → PROJECT_GENERATION → PROBLEM_DEFINITION → SOLUTION_DESIGN
 *     → EXECUTION → REVIEW → COMPLETED
 *
 * COMPLETED is terminal. The only backward edge is declared in
 * {@link com.sapiens.orchestrator.statemachine.StateMachine}.
 */
public enum Phase {
    ONBOARDING("onboarding"),
    PROJECT_GENERATION("project_generation"),
    PROBLEM_DEFINITION("problem_definition"),
    SOLUTION_DESIGN("solution_design"),
    EXECUTION("execution"),
    REVIEW("review"),
    COMPLETED("completed");

    private final String wireName;

    Phase(String wireName) {
        this.wireName = wireName;
    }

    /** Lower-case name used in API responses and log lines. */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
