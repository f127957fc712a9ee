package com.sapiens.orchestrator.agent.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.agent.AgentOutputException;
import com.sapiens.orchestrator.agent.StructuredAgent;
import com.sapiens.orchestrator.agent.SystemPrompts;
import com.sapiens.orchestrator.agent.contract.EvaluationInput;
import com.sapiens.orchestrator.agent.contract.EvaluationLens;
import com.sapiens.orchestrator.agent.contract.PassRule;
import com.sapiens.orchestrator.artifact.Evaluation;
import com.sapiens.orchestrator.llm.GenerationConstraints;
import com.sapiens.orchestrator.llm.TextGenerationBackend;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores problem definitions and solution designs.
 *
 * The model only supplies sub-scores and feedback. The verdict is always
 * computed here with {@link PassRule}; any verdict the model volunteers is
 * ignored.
 */
@Component
public class EvaluatorAgent extends StructuredAgent<EvaluationInput, Evaluation, EvaluatorAgent.RawEvaluation> {

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RawEvaluation(
            Map<String, Double> scores,
            String feedback,
            List<String> strengths,
            List<String> improvementSuggestions,
            String nextSteps
    ) {}

    public EvaluatorAgent(TextGenerationBackend backend, ObjectMapper objectMapper) {
        super(backend, objectMapper, RawEvaluation.class);
    }

    @Override
    protected String systemPrompt(EvaluationInput input) {
        return input.lens() == EvaluationLens.PROBLEM
                ? SystemPrompts.PROBLEM_EVALUATOR
                : SystemPrompts.SOLUTION_EVALUATOR;
    }

    @Override
    protected GenerationConstraints constraints(EvaluationInput input) {
        return GenerationConstraints.SCORING;
    }

    @Override
    protected Evaluation validate(EvaluationInput input, RawEvaluation raw) {
        if (raw.scores() == null) {
            throw new AgentOutputException("missing scores");
        }
        // Keep only this lens's sub-scores, in the lens's order.
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String name : input.lens().subScores()) {
            scores.put(name, requireScore(raw.scores().get(name), name));
        }
        String feedback = requireText(raw.feedback(), "feedback");

        return new Evaluation(
                scores,
                PassRule.verdictFor(scores.values()),
                feedback,
                raw.strengths(),
                raw.improvementSuggestions(),
                raw.nextSteps());
    }
}
