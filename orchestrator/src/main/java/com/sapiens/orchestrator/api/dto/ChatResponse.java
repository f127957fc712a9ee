package com.sapiens.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.service.ChatReply;

/**
 * Response body for POST /api/chat.
 * {@code outcome} is RETRY when the request's agent call failed and nothing changed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChatResponse(
        String            userId,
        String            responseText,
        Phase             currentState,
        ChatReply.Outcome outcome
) {
    public static ChatResponse from(ChatReply reply) {
        return new ChatResponse(reply.userId(), reply.text(), reply.phase(), reply.outcome());
    }
}
