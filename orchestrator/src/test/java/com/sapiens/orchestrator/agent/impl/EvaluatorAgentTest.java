package com.sapiens.orchestrator.agent.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sapiens.orchestrator.agent.AgentContext;
import com.sapiens.orchestrator.agent.AgentOutputException;
import com.sapiens.orchestrator.agent.SystemPrompts;
import com.sapiens.orchestrator.agent.contract.EvaluationInput;
import com.sapiens.orchestrator.artifact.Evaluation;
import com.sapiens.orchestrator.artifact.ProblemDraft;
import com.sapiens.orchestrator.artifact.SolutionDraft;
import com.sapiens.orchestrator.artifact.Verdict;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.support.ScriptedBackend;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluatorAgentTest {

    static final AgentContext CTX = new AgentContext("r1", "u1", Phase.PROBLEM_DEFINITION);
    static final ProblemDraft PROBLEM = new ProblemDraft(
            "Small retailers cannot predict churn", "shop owners", null, List.of());

    ScriptedBackend backend = new ScriptedBackend();
    EvaluatorAgent  agent   = new EvaluatorAgent(backend, new ObjectMapper());

    @Test
    void generate_problemLens_passRuleApproves() {
        backend.result("""
                {"scores": {"market_relevance": 8, "clarity": 7, "feasibility": 6},
                 "feedback": "Clear and relevant.", "strengths": ["focused"], "verdict": "NEEDS_REVISION"}
                """);

        Evaluation e = agent.generate(EvaluationInput.ofProblem(null, PROBLEM, 1), CTX);

        // The model's own verdict is ignored.
        assertThat(e.verdict()).isEqualTo(Verdict.APPROVED);
        assertThat(e.scores()).containsOnlyKeys("market_relevance", "clarity", "feasibility");
        assertThat(e.strengths()).containsExactly("focused");
        assertThat(backend.systemPrompts()).containsExactly(SystemPrompts.PROBLEM_EVALUATOR);
    }

    @Test
    void generate_problemLens_lowScoreNeedsRevision() {
        backend.result("""
                {"scores": {"market_relevance": 5, "clarity": 7, "feasibility": 8}, "feedback": "Weak market case."}
                """);

        Evaluation e = agent.generate(EvaluationInput.ofProblem(null, PROBLEM, 1), CTX);

        assertThat(e.verdict()).isEqualTo(Verdict.NEEDS_REVISION);
        assertThat(e.approved()).isFalse();
    }

    @Test
    void generate_solutionLens_requiresAllFourSubScores() {
        backend.result("""
                {"scores": {"logical_coherence": 8, "innovation": 8, "implementation_feasibility": 8},
                 "feedback": "ok"}
                """);
        SolutionDraft draft = new SolutionDraft("Build a churn model", List.of("model"), null, List.of(), null);

        assertThatThrownBy(() -> agent.generate(EvaluationInput.ofSolution(null, PROBLEM, draft, 1), CTX))
                .isInstanceOf(AgentOutputException.class)
                .hasMessageContaining("impact_potential");
    }

    @Test
    void generate_scoreOutOfRange_isMalformed() {
        backend.result("""
                {"scores": {"market_relevance": 11, "clarity": 7, "feasibility": 6}, "feedback": "x"}
                """);

        assertThatThrownBy(() -> agent.generate(EvaluationInput.ofProblem(null, PROBLEM, 1), CTX))
                .isInstanceOf(AgentOutputException.class);
    }

    @Test
    void generate_noResultBlock_isMalformed() {
        backend.reply("I think this problem is great!");

        assertThatThrownBy(() -> agent.generate(EvaluationInput.ofProblem(null, PROBLEM, 1), CTX))
                .isInstanceOf(AgentOutputException.class);
    }
}
