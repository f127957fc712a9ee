package com.sapiens.orchestrator.agent.contract;

import com.sapiens.orchestrator.artifact.Verdict;

import java.util.Collection;

/**
 * Fixed approval rule for evaluations: the mean of all sub-scores must be at
 * least 7.0 and no single sub-score may fall below 6.0.
 */
public final class PassRule {

    public static final double MIN_MEAN  = 7.0;
    public static final double MIN_SCORE = 6.0;

    private PassRule() {}

    public static Verdict verdictFor(Collection<Double> scores) {
        if (scores.isEmpty()) {
            return Verdict.NEEDS_REVISION;
        }
        double sum = 0;
        double min = Double.MAX_VALUE;
        for (double s : scores) {
            sum += s;
            min = Math.min(min, s);
        }
        double mean = sum / scores.size();
        return mean >= MIN_MEAN && min >= MIN_SCORE ? Verdict.APPROVED : Verdict.NEEDS_REVISION;
    }
}
