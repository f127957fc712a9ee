package com.sapiens.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.model.Actor;
import com.sapiens.orchestrator.model.ConversationEntry;
import com.sapiens.orchestrator.model.Phase;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConversationEntryResponse(
        Long    sequence,
        Actor   actor,
        String  agentName,
        String  payload,
        Phase   stateAtTime,
        String  requestId,
        Instant timestamp
) {
    public static ConversationEntryResponse from(ConversationEntry e) {
        return new ConversationEntryResponse(e.getSequence(), e.getActor(), e.getAgentName(),
                e.getPayload(), e.getStateAtTime(), e.getRequestId(), e.getCreatedAt());
    }
}
