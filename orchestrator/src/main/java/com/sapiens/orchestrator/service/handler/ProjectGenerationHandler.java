package com.sapiens.orchestrator.service.handler;

import com.sapiens.orchestrator.agent.AgentResult;
import com.sapiens.orchestrator.agent.contract.GeneratorInput;
import com.sapiens.orchestrator.agent.contract.GeneratorOutput;
import com.sapiens.orchestrator.agent.contract.ResponseIntent;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.model.UserState;
import com.sapiens.orchestrator.service.extract.ApprovalClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Waits for the user's verdict on the proposed project.
 *
 * yes → approve and move to problem_definition;
 * no  → generate a different project (revision +1);
 * anything else → ask again.
 */
@Component
public class ProjectGenerationHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(ProjectGenerationHandler.class);

    static final String APPROVAL_QUESTION = "Does this project work for you?";

    private final ApprovalClassifier classifier;

    public ProjectGenerationHandler(ApprovalClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public Phase phase() {
        return Phase.PROJECT_GENERATION;
    }

    @Override
    public HandlerOutcome handle(Turn turn) {
        return switch (classifier.classify(turn.message())) {
            case YES     -> approve(turn);
            case NO      -> regenerate(turn);
            case UNCLEAR -> HandlerOutcome.stay(new ResponseIntent.ClarifyApproval(APPROVAL_QUESTION));
        };
    }

    private HandlerOutcome approve(Turn turn) {
        UserState s = turn.state();
        s.setProjectApproved(true);
        // The problem prompt goes out with this reply.
        s.setAwaitingFeedback(true);

        String title = turn.artifacts().project(s.getProjectId()).map(ProjectProposal::title).orElse(null);
        return HandlerOutcome.advance(Phase.PROBLEM_DEFINITION, "project_approved",
                new ResponseIntent.ProblemPrompt(title));
    }

    private HandlerOutcome regenerate(Turn turn) {
        UserState s = turn.state();
        List<String> rejected = turn.artifacts().proposedTitles(s.getUserId());
        GeneratorInput input = new GeneratorInput(
                s.getTargetRole(), s.getTargetDomain(),
                blankToNull(s.getBackground()), blankToNull(s.getInterests()), rejected);

        AgentResult<GeneratorOutput> result = turn.agents().generateProject(input);
        if (!(result instanceof AgentResult.Ok<GeneratorOutput> ok)) {
            return HandlerOutcome.failed(AgentCapability.GENERATOR, result);
        }

        int revision = s.revisionsFor(Phase.PROJECT_GENERATION) + 2;   // revision 1 came from onboarding
        s.recordRevision();
        ProjectProposal proposal = ok.output().proposal();
        Artifact stored = turn.stage(ArtifactKind.PROJECT, proposal, revision);
        s.setProjectId(stored.getArtifactId());
        s.setProjectApproved(false);
        s.setAwaitingFeedback(true);
        log.info("Regenerated project after {} rejection(s): '{}'", rejected.size(), proposal.title());

        return HandlerOutcome.stay(new ResponseIntent.PresentProposal(proposal, true));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
