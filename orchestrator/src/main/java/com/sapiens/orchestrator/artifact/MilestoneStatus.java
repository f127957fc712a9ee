package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum MilestoneStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED,
    BLOCKED,
    SKIPPED;

    /** COMPLETED and SKIPPED both count toward finishing the plan. */
    public boolean isDone() {
        return this == COMPLETED || this == SKIPPED;
    }

    /** Accepts "in_progress", "In Progress" and "IN_PROGRESS"; null for anything else. */
    @JsonCreator
    public static MilestoneStatus from(String value) {
        if (value == null) {
            return null;
        }
        String v = value.strip().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (MilestoneStatus s : values()) {
            if (s.name().equals(v)) {
                return s;
            }
        }
        return null;
    }
}
