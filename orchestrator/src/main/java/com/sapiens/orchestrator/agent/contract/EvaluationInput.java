package com.sapiens.orchestrator.agent.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.artifact.ProblemDraft;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.artifact.SolutionDraft;

/**
 * Input to the evaluator.
 *
 * PROBLEM lens: {@code problem} is the draft under evaluation, {@code solution} is null.
 * SOLUTION lens: {@code solution} is the draft under evaluation, {@code problem}
 * is the approved problem it must answer.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvaluationInput(
        EvaluationLens lens,
        ProjectProposal project,
        ProblemDraft problem,
        SolutionDraft solution,
        int attempt
) {
    public EvaluationInput {
        if (lens == null) {
            throw new IllegalArgumentException("lens is required");
        }
        if (lens == EvaluationLens.PROBLEM && problem == null) {
            throw new IllegalArgumentException("problem lens needs a problem draft");
        }
        if (lens == EvaluationLens.SOLUTION && solution == null) {
            throw new IllegalArgumentException("solution lens needs a solution draft");
        }
    }

    public static EvaluationInput ofProblem(ProjectProposal project, ProblemDraft draft, int attempt) {
        return new EvaluationInput(EvaluationLens.PROBLEM, project, draft, null, attempt);
    }

    public static EvaluationInput ofSolution(ProjectProposal project, ProblemDraft problem,
                                             SolutionDraft draft, int attempt) {
        return new EvaluationInput(EvaluationLens.SOLUTION, project, problem, draft, attempt);
    }
}
