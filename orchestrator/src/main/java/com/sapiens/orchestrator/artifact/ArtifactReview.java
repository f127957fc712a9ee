package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Objective review of the user's final work against the project's
 * evaluation criteria. {@code submittedText} is kept verbatim because resume
 * bullets must later cite evidence from it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArtifactReview(
        String submittedText,
        double overallScore,
        String overallFeedback,
        Map<String, Double> criterionScores,
        List<String> strengths,
        List<String> areasForImprovement,
        String recruiterAppeal,
        List<String> skillsDemonstrated
) {
    public ArtifactReview {
        criterionScores     = criterionScores == null ? Map.of() : Map.copyOf(criterionScores);
        strengths           = strengths == null ? List.of() : List.copyOf(strengths);
        areasForImprovement = areasForImprovement == null ? List.of() : List.copyOf(areasForImprovement);
        skillsDemonstrated  = skillsDemonstrated == null ? List.of() : List.copyOf(skillsDemonstrated);
    }
}
