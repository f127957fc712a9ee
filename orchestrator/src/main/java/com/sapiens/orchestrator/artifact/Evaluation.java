package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scored assessment of a user's draft.
 *
 * {@code scores} is keyed by sub-score name (e.g. "market_relevance") and
 * kept in insertion order. {@code verdict} is always derived from the scores
 * by the pass rule, never copied from model output.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Evaluation(
        Map<String, Double> scores,
        Verdict verdict,
        String feedback,
        List<String> strengths,
        List<String> improvementSuggestions,
        String nextSteps
) {
    public Evaluation {
        scores                 = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        strengths              = strengths == null ? List.of() : List.copyOf(strengths);
        improvementSuggestions = improvementSuggestions == null ? List.of() : List.copyOf(improvementSuggestions);
    }

    public boolean approved() {
        return verdict == Verdict.APPROVED;
    }
}
