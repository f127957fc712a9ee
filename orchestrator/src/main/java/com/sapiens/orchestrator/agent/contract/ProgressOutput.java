package com.sapiens.orchestrator.agent.contract;

import com.sapiens.orchestrator.artifact.MilestonePlan;
import com.sapiens.orchestrator.artifact.MilestoneStatus;

/**
 * Output of the progress tracker.
 *
 * PLAN mode: {@code plan} is the new plan; {@code milestoneId} and
 * {@code milestoneStatus} are null.
 * UPDATE mode: {@code plan} is the input plan with the current milestone's
 * status applied.
 * In both modes {@code nextAction} is exactly one actionable step.
 */
public record ProgressOutput(
        MilestonePlan plan,
        String feedback,
        String milestoneId,
        MilestoneStatus milestoneStatus,
        boolean stagnationDetected,
        String nextAction
) {}
