package com.sapiens.orchestrator.service.handler;

import com.sapiens.orchestrator.agent.AgentResult;
import com.sapiens.orchestrator.agent.contract.EvaluationInput;
import com.sapiens.orchestrator.agent.contract.EvaluationLens;
import com.sapiens.orchestrator.agent.contract.ResponseIntent;
import com.sapiens.orchestrator.artifact.Evaluation;
import com.sapiens.orchestrator.artifact.ProblemDefinition;
import com.sapiens.orchestrator.artifact.ProblemDraft;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.artifact.SolutionDesign;
import com.sapiens.orchestrator.artifact.SolutionDraft;
import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.model.UserState;
import com.sapiens.orchestrator.service.extract.ParsedSubmission;
import com.sapiens.orchestrator.service.extract.SubmissionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Scores the solution design against the approved problem.
 *
 * An approved design moves on to execution. A rejected one stays here, until
 * the consecutive-rejection streak reaches the threshold: then the handler
 * unlocks the revision edge and sends the user back to problem_definition.
 */
@Component
public class SolutionDesignHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(SolutionDesignHandler.class);

    private final SubmissionParser parser;
    private final int revisionThreshold;

    public SolutionDesignHandler(SubmissionParser parser,
                                 @Value("${sapiens.journey.revision-threshold:3}") int revisionThreshold) {
        if (revisionThreshold < 1) {
            throw new IllegalArgumentException("sapiens.journey.revision-threshold must be >= 1");
        }
        this.parser            = parser;
        this.revisionThreshold = revisionThreshold;
    }

    @Override
    public Phase phase() {
        return Phase.SOLUTION_DESIGN;
    }

    @Override
    public HandlerOutcome handle(Turn turn) {
        UserState s = turn.state();
        ProjectProposal project = turn.artifacts().project(s.getProjectId()).orElse(null);
        ProblemDraft problem = turn.artifacts().problem(s.getProblemId())
                .map(ProblemDefinition::draft)
                .orElse(null);

        if (!s.isAwaitingFeedback()) {
            s.setAwaitingFeedback(true);
            return HandlerOutcome.stay(new ResponseIntent.SolutionPrompt(
                    problem == null ? null : problem.problemStatement()));
        }

        ParsedSubmission<SolutionDraft> parsed = parser.parseSolution(turn.message());
        if (!parsed.isComplete()) {
            return HandlerOutcome.stay(new ResponseIntent.IncompleteSubmission(EvaluationLens.SOLUTION, parsed.missing()));
        }

        int attempt = s.revisionsFor(Phase.SOLUTION_DESIGN) + 1;
        AgentResult<Evaluation> result = turn.agents().evaluate(
                EvaluationInput.ofSolution(project, problem, parsed.draft(), attempt));
        if (!(result instanceof AgentResult.Ok<Evaluation> ok)) {
            return HandlerOutcome.failed(AgentCapability.EVALUATOR, result);
        }

        Evaluation evaluation = ok.output();
        Artifact stored = turn.stage(ArtifactKind.SOLUTION_DESIGN,
                new SolutionDesign(s.getProblemId(), parsed.draft(), evaluation), attempt);
        s.setSolutionId(stored.getArtifactId());
        log.info("Solution attempt {} scored {} ({})", attempt, evaluation.verdict(), stored.getArtifactId());

        ResponseIntent feedback = new ResponseIntent.EvaluationFeedback(EvaluationLens.SOLUTION, evaluation, attempt);
        if (evaluation.approved()) {
            s.setSolutionApproved(true);
            s.setAwaitingFeedback(false);
            return HandlerOutcome.advance(Phase.EXECUTION, "solution_approved", feedback);
        }

        s.setSolutionApproved(false);
        s.recordRevision();
        int streak = s.getConsecutiveRevisions();
        if (streak < revisionThreshold) {
            return HandlerOutcome.stay(feedback);
        }

        log.info("Solution rejected {} times in a row, reopening the problem definition", streak);
        s.setUnlockedRevision(Phase.PROBLEM_DEFINITION);
        s.setProblemApproved(false);
        s.setAwaitingFeedback(true);
        return new HandlerOutcome.Advance(Phase.PROBLEM_DEFINITION, "revision_streak_" + streak,
                new ResponseIntent.RevisionEdgeTaken(evaluation, streak), feedback);
    }
}
