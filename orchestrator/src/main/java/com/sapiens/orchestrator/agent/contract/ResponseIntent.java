package com.sapiens.orchestrator.agent.contract;

import com.sapiens.orchestrator.artifact.*;
import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.FieldName;
import com.sapiens.orchestrator.model.Phase;

import java.util.List;
import java.util.Set;

/**
 * What the orchestrator wants to tell the user, before it is turned into
 * text by the relay agent. Handlers decide the intent; the relay only
 * renders it.
 */
public sealed interface ResponseIntent {

    // ------------------------------------------------------------------
    // Onboarding
    // ------------------------------------------------------------------

    /** First contact: explain the journey and ask for the target role. */
    record Welcome() implements ResponseIntent {}

    /** Ask for the next onboarding answer; {@code skippable} adds a "say skip" hint. */
    record AskProfile(String question, boolean skippable, String acknowledged) implements ResponseIntent {}

    // ------------------------------------------------------------------
    // Project generation
    // ------------------------------------------------------------------

    record PresentProposal(ProjectProposal proposal, boolean regenerated) implements ResponseIntent {}

    /** The reply to a yes/no question could not be classified. */
    record ClarifyApproval(String question) implements ResponseIntent {}

    // ------------------------------------------------------------------
    // Problem / solution
    // ------------------------------------------------------------------

    record ProblemPrompt(String projectTitle) implements ResponseIntent {}

    record SolutionPrompt(String problemStatement) implements ResponseIntent {}

    /** A submission was too thin to evaluate; lists what is missing. */
    record IncompleteSubmission(EvaluationLens lens, List<String> missingSections) implements ResponseIntent {}

    record EvaluationFeedback(EvaluationLens lens, Evaluation evaluation, int attempt) implements ResponseIntent {}

    /** Repeated solution rejections sent the user back to the problem definition. */
    record RevisionEdgeTaken(Evaluation evaluation, int streak) implements ResponseIntent {}

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    record PresentPlan(MilestonePlan plan) implements ResponseIntent {}

    record ProgressFeedback(String feedback, String milestoneTitle, MilestoneStatus status,
                            boolean stagnation, String nextAction,
                            int completed, int total) implements ResponseIntent {}

    // ------------------------------------------------------------------
    // Review / completion
    // ------------------------------------------------------------------

    record ReviewRequest(String projectTitle, List<String> evaluationCriteria) implements ResponseIntent {}

    record ReviewResult(ArtifactReview review) implements ResponseIntent {}

    record ResubmitPrompt() implements ResponseIntent {}

    record ResumeReady(ResumePackage resume, int discardedBullets) implements ResponseIntent {}

    record Completed(String projectTitle) implements ResponseIntent {}

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    /** The one agent call of this request failed twice; nothing changed. */
    record AgentRetry(AgentCapability capability) implements ResponseIntent {}

    /** A proposed transition was rejected by the state machine. */
    record MissingFields(Phase phase, Set<FieldName> missing) implements ResponseIntent {}
}
