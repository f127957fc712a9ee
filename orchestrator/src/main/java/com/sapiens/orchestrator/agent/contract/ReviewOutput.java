package com.sapiens.orchestrator.agent.contract;

import com.sapiens.orchestrator.artifact.ArtifactReview;
import com.sapiens.orchestrator.artifact.ResumePackage;

/**
 * REVIEW mode fills {@code review}; RESUME mode fills {@code resume} and
 * reports how many proposed bullets were dropped for lack of evidence.
 */
public record ReviewOutput(ArtifactReview review, ResumePackage resume, int discardedBullets) {

    public static ReviewOutput ofReview(ArtifactReview review) {
        return new ReviewOutput(review, null, 0);
    }

    public static ReviewOutput ofResume(ResumePackage resume, int discarded) {
        return new ReviewOutput(null, resume, discarded);
    }
}
