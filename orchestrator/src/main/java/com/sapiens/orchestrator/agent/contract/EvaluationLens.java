package com.sapiens.orchestrator.agent.contract;

import java.util.List;

/**
 * The two ways the evaluator looks at a draft. Each lens has a fixed set of
 * named sub-scores, all of which must be present in a valid evaluation.
 */
public enum EvaluationLens {

    // Market / research view of a problem definition.
    PROBLEM(List.of("market_relevance", "clarity", "feasibility")),

    // Practitioner / investor view of a solution design.
    SOLUTION(List.of("logical_coherence", "innovation", "implementation_feasibility", "impact_potential"));

    private final List<String> subScores;

    EvaluationLens(List<String> subScores) {
        this.subScores = subScores;
    }

    public List<String> subScores() {
        return subScores;
    }
}
