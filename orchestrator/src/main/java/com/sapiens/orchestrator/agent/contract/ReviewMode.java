package com.sapiens.orchestrator.agent.contract;

public enum ReviewMode {
    REVIEW,   // score the submitted artifacts
    RESUME    // write resume content grounded in the reviewed submission
}
