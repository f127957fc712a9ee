package com.sapiens.orchestrator.agent;

import com.sapiens.orchestrator.model.Phase;

/** Per-invocation metadata handed to an agent alongside its typed input. */
public record AgentContext(String requestId, String userId, Phase phase) {}
