package com.sapiens.orchestrator.model;

/**
 * Phase-accumulated fields of a {@link UserState} that the state machine can
 * require before a phase may be left.
 *
 * Flags count as populated when true; MILESTONES_COMPLETED counts as populated
 * once every milestone of a non-empty plan is done.
 */
public enum FieldName {
    TARGET_ROLE("target_role"),
    TARGET_DOMAIN("target_domain"),
    PROJECT_ID("project_id"),
    PROJECT_APPROVED("project_approved"),
    PROBLEM_ID("problem_id"),
    PROBLEM_APPROVED("problem_approved"),
    SOLUTION_ID("solution_id"),
    SOLUTION_APPROVED("solution_approved"),
    MILESTONE_PLAN_ID("milestone_plan_id"),
    MILESTONES_COMPLETED("milestones_completed"),
    REVIEW_ID("review_id"),
    RESUME_ID("resume_id");

    private final String label;

    FieldName(String label) {
        this.label = label;
    }

    /** Snake-case label shown to users in "please provide ..." prompts. */
    public String label() {
        return label;
    }
}
