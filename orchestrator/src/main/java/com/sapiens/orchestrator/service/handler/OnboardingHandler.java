package com.sapiens.orchestrator.service.handler;

import com.sapiens.orchestrator.agent.AgentResult;
import com.sapiens.orchestrator.agent.contract.GeneratorInput;
import com.sapiens.orchestrator.agent.contract.GeneratorOutput;
import com.sapiens.orchestrator.agent.contract.ResponseIntent;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.model.UserState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Collects the profile one answer per message:
 * role → domain → background (skippable) → interests (skippable).
 *
 * The message that completes the profile also triggers the first project
 * proposal, and the handler proposes moving on to project_generation.
 */
@Component
public class OnboardingHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(OnboardingHandler.class);

    static final String ASK_DOMAIN     = "Which domain or industry interests you?";
    static final String ASK_BACKGROUND = "Tell me briefly about your background and experience.";
    static final String ASK_INTERESTS  = "Any specific interests or topics you'd like the project to touch on?";

    private static final Pattern GREETING = Pattern.compile(
            "^(hi|hello|hey|hiya|howdy|yo|start|begin|get started|let'?s start|good (morning|afternoon|evening))( there)?[!.,\\s]*$",
            Pattern.CASE_INSENSITIVE
    );

    private static final List<String> SKIP_WORDS = List.of("skip", "none", "n/a", "na", "pass", "no", "nothing");

    @Override
    public Phase phase() {
        return Phase.ONBOARDING;
    }

    @Override
    public HandlerOutcome handle(Turn turn) {
        UserState s = turn.state();
        String answer = turn.message().strip();

        if (s.getTargetRole() == null) {
            if (GREETING.matcher(answer).matches()) {
                s.setAwaitingFeedback(true);
                return HandlerOutcome.stay(new ResponseIntent.Welcome());
            }
            s.setTargetRole(answer);
            s.setAwaitingFeedback(true);
            return HandlerOutcome.stay(new ResponseIntent.AskProfile(ASK_DOMAIN, false, "you're targeting " + answer));
        }
        if (s.getTargetDomain() == null) {
            s.setTargetDomain(answer);
            return HandlerOutcome.stay(new ResponseIntent.AskProfile(ASK_BACKGROUND, true, null));
        }
        if (s.getBackground() == null) {
            s.setBackground(optional(answer));
            return HandlerOutcome.stay(new ResponseIntent.AskProfile(ASK_INTERESTS, true, null));
        }

        // Interests answer completes the profile.
        s.setInterests(optional(answer));
        return proposeFirstProject(turn);
    }

    private HandlerOutcome proposeFirstProject(Turn turn) {
        UserState s = turn.state();
        GeneratorInput input = new GeneratorInput(
                s.getTargetRole(), s.getTargetDomain(),
                emptyToNull(s.getBackground()), emptyToNull(s.getInterests()), List.of());

        AgentResult<GeneratorOutput> result = turn.agents().generateProject(input);
        if (!(result instanceof AgentResult.Ok<GeneratorOutput> ok)) {
            return HandlerOutcome.failed(AgentCapability.GENERATOR, result);
        }

        ProjectProposal proposal = ok.output().proposal();
        Artifact stored = turn.stage(ArtifactKind.PROJECT, proposal, 1);
        s.setProjectId(stored.getArtifactId());
        s.setProjectApproved(false);
        s.setAwaitingFeedback(true);
        log.info("Proposed first project '{}' ({})", proposal.title(), stored.getArtifactId());

        return HandlerOutcome.advance(Phase.PROJECT_GENERATION, "profile_complete",
                new ResponseIntent.PresentProposal(proposal, false));
    }

    /** Skipped answers are stored as "" so "asked and skipped" differs from "not asked yet". */
    static String optional(String answer) {
        String a = answer.strip();
        return SKIP_WORDS.contains(a.toLowerCase(Locale.ROOT).replaceAll("[.!]+$", "")) ? "" : a;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
