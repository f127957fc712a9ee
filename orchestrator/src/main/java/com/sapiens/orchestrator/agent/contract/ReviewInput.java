package com.sapiens.orchestrator.agent.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.artifact.ArtifactReview;
import com.sapiens.orchestrator.artifact.ProjectProposal;

/**
 * Input to the review agent. RESUME mode requires the earlier review, whose
 * submitted text is the only admissible evidence for resume claims.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReviewInput(
        ReviewMode mode,
        ProjectProposal project,
        String submittedText,
        ArtifactReview review
) {
    public ReviewInput {
        if (mode == ReviewMode.REVIEW && (submittedText == null || submittedText.isBlank())) {
            throw new IllegalArgumentException("review mode needs submitted text");
        }
        if (mode == ReviewMode.RESUME && review == null) {
            throw new IllegalArgumentException("resume mode needs the artifact review");
        }
    }

    public static ReviewInput review(ProjectProposal project, String submittedText) {
        return new ReviewInput(ReviewMode.REVIEW, project, submittedText, null);
    }

    public static ReviewInput resume(ProjectProposal project, ArtifactReview review) {
        return new ReviewInput(ReviewMode.RESUME, project, review.submittedText(), review);
    }
}
