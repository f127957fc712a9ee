package com.sapiens.orchestrator.agent.contract;

public enum ProgressMode {
    PLAN,     // build the milestone plan
    UPDATE    // react to a progress update on the current milestone
}
