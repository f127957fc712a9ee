package com.sapiens.orchestrator.service.handler;

import com.sapiens.orchestrator.agent.AgentResult;
import com.sapiens.orchestrator.agent.contract.ResponseIntent;
import com.sapiens.orchestrator.agent.contract.ReviewInput;
import com.sapiens.orchestrator.agent.contract.ReviewOutput;
import com.sapiens.orchestrator.artifact.ArtifactReview;
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
import java.util.Optional;

/**
 * Two steps: review the submitted artifacts, then (once the user accepts the
 * review) turn it into a resume package and complete the journey.
 *
 * Declining the review discards it and asks for a resubmission.
 */
@Component
public class ReviewHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(ReviewHandler.class);

    static final int    MIN_SUBMISSION_CHARS = 30;
    static final String RESUME_QUESTION = "Shall I turn this into resume bullets?";

    private final ApprovalClassifier classifier;

    public ReviewHandler(ApprovalClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public Phase phase() {
        return Phase.REVIEW;
    }

    @Override
    public HandlerOutcome handle(Turn turn) {
        UserState s = turn.state();
        ProjectProposal project = turn.artifacts().project(s.getProjectId()).orElse(null);

        Optional<ArtifactReview> review = turn.artifacts().review(s.getReviewId());
        if (review.isEmpty()) {
            return reviewSubmission(turn, project);
        }

        return switch (classifier.classify(turn.message())) {
            case YES     -> buildResume(turn, project, review.get());
            case NO      -> {
                s.recordRevision();
                s.setReviewId(null);
                s.setAwaitingFeedback(true);
                yield HandlerOutcome.stay(new ResponseIntent.ResubmitPrompt());
            }
            case UNCLEAR -> HandlerOutcome.stay(new ResponseIntent.ClarifyApproval(RESUME_QUESTION));
        };
    }

    private HandlerOutcome reviewSubmission(Turn turn, ProjectProposal project) {
        UserState s = turn.state();
        String submission = turn.message().strip();
        if (submission.length() < MIN_SUBMISSION_CHARS) {
            s.setAwaitingFeedback(true);
            return HandlerOutcome.stay(new ResponseIntent.ReviewRequest(
                    project == null ? null : project.title(),
                    project == null ? List.of() : project.evaluationCriteria()));
        }

        AgentResult<ReviewOutput> result = turn.agents().review(ReviewInput.review(project, submission));
        if (!(result instanceof AgentResult.Ok<ReviewOutput> ok)) {
            return HandlerOutcome.failed(AgentCapability.REVIEWER, result);
        }

        ArtifactReview review = ok.output().review();
        Artifact stored = turn.stage(ArtifactKind.ARTIFACT_REVIEW, review, s.revisionsFor(Phase.REVIEW) + 1);
        s.setReviewId(stored.getArtifactId());
        s.setAwaitingFeedback(true);
        log.info("Reviewed submission ({} chars), overall score {}", submission.length(), review.overallScore());
        return HandlerOutcome.stay(new ResponseIntent.ReviewResult(review));
    }

    private HandlerOutcome buildResume(Turn turn, ProjectProposal project, ArtifactReview review) {
        UserState s = turn.state();
        AgentResult<ReviewOutput> result = turn.agents().review(ReviewInput.resume(project, review));
        if (!(result instanceof AgentResult.Ok<ReviewOutput> ok)) {
            return HandlerOutcome.failed(AgentCapability.REVIEWER, result);
        }

        ReviewOutput out = ok.output();
        Artifact stored = turn.stage(ArtifactKind.RESUME_PACKAGE, out.resume(), 1);
        s.setResumeId(stored.getArtifactId());
        s.setAwaitingFeedback(false);
        if (out.discardedBullets() > 0) {
            log.info("Dropped {} resume bullet(s) without evidence in the submission", out.discardedBullets());
        }
        return HandlerOutcome.advance(Phase.COMPLETED, "resume_generated",
                new ResponseIntent.ResumeReady(out.resume(), out.discardedBullets()));
    }
}
