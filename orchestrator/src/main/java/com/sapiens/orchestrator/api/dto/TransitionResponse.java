package com.sapiens.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.model.StateTransition;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransitionResponse(
        Long    id,
        Phase   fromState,
        Phase   toState,
        boolean accepted,
        String  reason,
        String  requestId,
        Instant timestamp
) {
    public static TransitionResponse from(StateTransition t) {
        return new TransitionResponse(t.getId(), t.getFromState(), t.getToState(), t.isAccepted(),
                t.getReason(), t.getRequestId(), t.getCreatedAt());
    }
}
