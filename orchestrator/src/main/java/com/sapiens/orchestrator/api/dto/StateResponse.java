package com.sapiens.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.model.UserState;
import com.sapiens.orchestrator.service.JourneyQueryService;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Response body for GET /api/state/{userId} and POST /api/users. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StateResponse(
        String               userId,
        Phase                currentState,
        Phase                previousState,
        Instant              stateEnteredAt,
        Instant              lastActivityAt,
        String               targetRole,
        String               targetDomain,
        String               projectId,
        String               problemId,
        String               solutionId,
        String               milestonePlanId,
        String               reviewId,
        String               resumeId,
        boolean              projectApproved,
        boolean              problemApproved,
        boolean              solutionApproved,
        int                  milestonesCompleted,
        int                  totalMilestones,
        int                  consecutiveRevisions,
        Map<String, Integer> revisionCounters,
        List<Phase>          validTargets
) {
    public static StateResponse from(JourneyQueryService.Snapshot snapshot) {
        return from(snapshot.state(), snapshot.validTargets());
    }

    public static StateResponse from(UserState s, List<Phase> validTargets) {
        Map<String, Integer> counters = new LinkedHashMap<>();
        s.getRevisionCounters().forEach((phase, n) -> counters.put(phase.wireName(), n));
        return new StateResponse(
                s.getUserId(),
                s.getCurrentState(),
                s.getPreviousState(),
                s.getStateEnteredAt(),
                s.getLastActivityAt(),
                s.getTargetRole(),
                s.getTargetDomain(),
                s.getProjectId(),
                s.getProblemId(),
                s.getSolutionId(),
                s.getMilestonePlanId(),
                s.getReviewId(),
                s.getResumeId(),
                s.isProjectApproved(),
                s.isProblemApproved(),
                s.isSolutionApproved(),
                s.getMilestonesCompleted(),
                s.getTotalMilestones(),
                s.getConsecutiveRevisions(),
                counters,
                validTargets
        );
    }
}
