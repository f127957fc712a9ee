package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Milestone(
        String milestoneId,
        int order,
        String title,
        String description,
        String deliverable,
        double estimatedDays,
        MilestoneStatus status
) {
    public Milestone {
        status = status == null ? MilestoneStatus.NOT_STARTED : status;
    }

    public Milestone withStatus(MilestoneStatus newStatus) {
        return new Milestone(milestoneId, order, title, description, deliverable, estimatedDays, newStatus);
    }
}
