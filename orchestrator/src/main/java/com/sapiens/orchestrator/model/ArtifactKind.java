package com.sapiens.orchestrator.model;

/** Domain artifacts produced during a journey, one kind per producing step. */
public enum ArtifactKind {
    PROJECT("proj"),
    PROBLEM_DEFINITION("prob"),
    SOLUTION_DESIGN("sol"),
    MILESTONE_PLAN("plan"),
    ARTIFACT_REVIEW("rev"),
    RESUME_PACKAGE("res");

    private final String idPrefix;

    ArtifactKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() {
        return idPrefix;
    }
}
