package com.sapiens.orchestrator.artifact;

/** Outcome of evaluating a problem definition or solution design. */
public enum Verdict {
    APPROVED,
    NEEDS_REVISION
}
