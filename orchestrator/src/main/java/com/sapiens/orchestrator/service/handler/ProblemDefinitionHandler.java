package com.sapiens.orchestrator.service.handler;

import com.sapiens.orchestrator.agent.AgentResult;
import com.sapiens.orchestrator.agent.contract.EvaluationInput;
import com.sapiens.orchestrator.agent.contract.EvaluationLens;
import com.sapiens.orchestrator.agent.contract.ResponseIntent;
import com.sapiens.orchestrator.artifact.Evaluation;
import com.sapiens.orchestrator.artifact.ProblemDefinition;
import com.sapiens.orchestrator.artifact.ProblemDraft;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.model.UserState;
import com.sapiens.orchestrator.service.extract.ParsedSubmission;
import com.sapiens.orchestrator.service.extract.SubmissionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Takes the user's problem definition, has it scored under the problem lens
 * and either approves it (→ solution_design) or asks for a revision.
 */
@Component
public class ProblemDefinitionHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(ProblemDefinitionHandler.class);

    private final SubmissionParser parser;

    public ProblemDefinitionHandler(SubmissionParser parser) {
        this.parser = parser;
    }

    @Override
    public Phase phase() {
        return Phase.PROBLEM_DEFINITION;
    }

    @Override
    public HandlerOutcome handle(Turn turn) {
        UserState s = turn.state();
        ProjectProposal project = turn.artifacts().project(s.getProjectId()).orElse(null);

        if (!s.isAwaitingFeedback()) {
            s.setAwaitingFeedback(true);
            return HandlerOutcome.stay(new ResponseIntent.ProblemPrompt(project == null ? null : project.title()));
        }

        ParsedSubmission<ProblemDraft> parsed = parser.parseProblem(turn.message());
        if (!parsed.isComplete()) {
            return HandlerOutcome.stay(new ResponseIntent.IncompleteSubmission(EvaluationLens.PROBLEM, parsed.missing()));
        }

        int attempt = s.revisionsFor(Phase.PROBLEM_DEFINITION) + 1;
        AgentResult<Evaluation> result = turn.agents().evaluate(EvaluationInput.ofProblem(project, parsed.draft(), attempt));
        if (!(result instanceof AgentResult.Ok<Evaluation> ok)) {
            return HandlerOutcome.failed(AgentCapability.EVALUATOR, result);
        }

        Evaluation evaluation = ok.output();
        Artifact stored = turn.stage(ArtifactKind.PROBLEM_DEFINITION,
                new ProblemDefinition(s.getProjectId(), parsed.draft(), evaluation), attempt);
        s.setProblemId(stored.getArtifactId());
        log.info("Problem attempt {} scored {} ({})", attempt, evaluation.verdict(), stored.getArtifactId());

        ResponseIntent feedback = new ResponseIntent.EvaluationFeedback(EvaluationLens.PROBLEM, evaluation, attempt);
        if (evaluation.approved()) {
            s.setProblemApproved(true);
            // Next message is the solution submission.
            s.setAwaitingFeedback(true);
            return HandlerOutcome.advance(Phase.SOLUTION_DESIGN, "problem_approved", feedback);
        }

        s.setProblemApproved(false);
        s.recordRevision();
        return HandlerOutcome.stay(feedback);
    }
}
