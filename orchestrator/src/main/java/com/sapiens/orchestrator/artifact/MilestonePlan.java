package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered milestones for the execution phase plus the single next action the
 * user should take. Progress is recorded by storing a new plan revision via
 * {@link #withMilestoneStatus}; a plan is never edited in place.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MilestonePlan(List<Milestone> milestones, double totalEstimatedDays, String nextAction) {

    public MilestonePlan {
        milestones = milestones == null ? List.of()
                : milestones.stream().sorted(Comparator.comparingInt(Milestone::order)).toList();
    }

    @JsonIgnore
    public int completedCount() {
        return (int) milestones.stream().filter(m -> m.status().isDone()).count();
    }

    /** First milestone, in order, that is not done yet. */
    @JsonIgnore
    public Optional<Milestone> currentMilestone() {
        return milestones.stream().filter(m -> !m.status().isDone()).findFirst();
    }

    public MilestonePlan withMilestoneStatus(String milestoneId, MilestoneStatus status, String newNextAction) {
        List<Milestone> updated = new ArrayList<>(milestones.size());
        for (Milestone m : milestones) {
            updated.add(m.milestoneId().equals(milestoneId) ? m.withStatus(status) : m);
        }
        return new MilestonePlan(updated, totalEstimatedDays, newNextAction);
    }
}
