package com.sapiens.orchestrator.agent.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.agent.AgentOutputException;
import com.sapiens.orchestrator.agent.StructuredAgent;
import com.sapiens.orchestrator.agent.SystemPrompts;
import com.sapiens.orchestrator.agent.contract.ProgressInput;
import com.sapiens.orchestrator.agent.contract.ProgressMode;
import com.sapiens.orchestrator.agent.contract.ProgressOutput;
import com.sapiens.orchestrator.artifact.Milestone;
import com.sapiens.orchestrator.artifact.MilestonePlan;
import com.sapiens.orchestrator.artifact.MilestoneStatus;
import com.sapiens.orchestrator.llm.TextGenerationBackend;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds the milestone plan and reacts to progress updates.
 *
 * Whatever the mode, the output must carry exactly one next action: a
 * blank action, or one that spells out several steps, is malformed.
 */
@Component
public class ProgressTrackerAgent
        extends StructuredAgent<ProgressInput, ProgressOutput, ProgressTrackerAgent.RawProgress> {

    static final int MIN_MILESTONES = 3;
    static final int MAX_MILESTONES = 6;

    // "1. do x 2. do y", "(2) do y", "step 2"
    private static final Pattern SECOND_STEP = Pattern.compile(
            "(^|\\s)\\(?2[.)]\\s+\\S|\\bstep\\s*2\\b",
            Pattern.CASE_INSENSITIVE
    );

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RawMilestone(String title, String description, String deliverable, Double estimatedDays) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RawProgress(
            List<RawMilestone> milestones,
            String feedback,
            MilestoneStatus milestoneStatus,
            Boolean stagnationDetected,
            String nextAction
    ) {}

    public ProgressTrackerAgent(TextGenerationBackend backend, ObjectMapper objectMapper) {
        super(backend, objectMapper, RawProgress.class);
    }

    @Override
    protected String systemPrompt(ProgressInput input) {
        return input.mode() == ProgressMode.PLAN ? SystemPrompts.PROGRESS_PLAN : SystemPrompts.PROGRESS_UPDATE;
    }

    @Override
    protected ProgressOutput validate(ProgressInput input, RawProgress raw) {
        String nextAction = requireSingleAction(raw.nextAction());
        return input.mode() == ProgressMode.PLAN
                ? validatePlan(raw, nextAction)
                : validateUpdate(input, raw, nextAction);
    }

    // ------------------------------------------------------------------
    // Modes
    // ------------------------------------------------------------------

    private ProgressOutput validatePlan(RawProgress raw, String nextAction) {
        List<RawMilestone> rawMilestones = raw.milestones() == null ? List.of() : raw.milestones();
        if (rawMilestones.size() < MIN_MILESTONES || rawMilestones.size() > MAX_MILESTONES) {
            throw new AgentOutputException("expected " + MIN_MILESTONES + "-" + MAX_MILESTONES
                    + " milestones, got " + rawMilestones.size());
        }

        List<Milestone> milestones = new ArrayList<>();
        double total = 0;
        for (int i = 0; i < rawMilestones.size(); i++) {
            RawMilestone m = rawMilestones.get(i);
            String title = requireText(m.title(), "milestones[" + i + "].title");
            double days = m.estimatedDays() == null || m.estimatedDays() <= 0 ? 1.0 : m.estimatedDays();
            total += days;
            milestones.add(new Milestone("m" + (i + 1), i + 1, title,
                    m.description(), m.deliverable(), days, MilestoneStatus.NOT_STARTED));
        }

        MilestonePlan plan = new MilestonePlan(milestones, total, nextAction);
        return new ProgressOutput(plan, raw.feedback(), null, null, false, nextAction);
    }

    private ProgressOutput validateUpdate(ProgressInput input, RawProgress raw, String nextAction) {
        Milestone current = input.plan().currentMilestone()
                .orElseThrow(() -> new AgentOutputException("plan has no open milestone"));
        if (raw.milestoneStatus() == null) {
            throw new AgentOutputException("missing or unknown milestone_status");
        }
        String feedback = requireText(raw.feedback(), "feedback");

        MilestonePlan updated = input.plan().withMilestoneStatus(current.milestoneId(), raw.milestoneStatus(), nextAction);
        return new ProgressOutput(updated, feedback, current.milestoneId(), raw.milestoneStatus(),
                Boolean.TRUE.equals(raw.stagnationDetected()), nextAction);
    }

    // ------------------------------------------------------------------
    // Next-action check
    // ------------------------------------------------------------------

    static String requireSingleAction(String value) {
        String action = requireText(value, "next_action");
        if (!isSingleAction(action)) {
            throw new AgentOutputException("next_action must be a single step: '" + action + "'");
        }
        return action;
    }

    static boolean isSingleAction(String action) {
        if (action == null || action.isBlank()) {
            return false;
        }
        long lines = action.lines().filter(l -> !l.isBlank()).count();
        return lines == 1 && !SECOND_STEP.matcher(action).find();
    }
}
