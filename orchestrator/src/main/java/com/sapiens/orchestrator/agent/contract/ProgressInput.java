package com.sapiens.orchestrator.agent.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.artifact.MilestonePlan;
import com.sapiens.orchestrator.artifact.ProblemDraft;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.artifact.SolutionDraft;

/**
 * Input to the progress tracker. In UPDATE mode {@code plan} and
 * {@code progressUpdate} are required.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProgressInput(
        ProgressMode mode,
        ProjectProposal project,
        ProblemDraft problem,
        SolutionDraft solution,
        MilestonePlan plan,
        String progressUpdate
) {
    public ProgressInput {
        if (mode == ProgressMode.UPDATE && (plan == null || progressUpdate == null)) {
            throw new IllegalArgumentException("update mode needs the current plan and the update text");
        }
    }

    public static ProgressInput plan(ProjectProposal project, ProblemDraft problem, SolutionDraft solution) {
        return new ProgressInput(ProgressMode.PLAN, project, problem, solution, null, null);
    }

    public static ProgressInput update(ProjectProposal project, MilestonePlan plan, String update) {
        return new ProgressInput(ProgressMode.UPDATE, project, null, null, plan, update);
    }
}
