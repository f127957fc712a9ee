package com.sapiens.orchestrator.service.extract;

public enum Approval {
    YES,
    NO,
    UNCLEAR
}
