package com.sapiens.orchestrator.service.handler;

import com.sapiens.orchestrator.agent.AgentResult;
import com.sapiens.orchestrator.agent.contract.ProgressInput;
import com.sapiens.orchestrator.agent.contract.ProgressOutput;
import com.sapiens.orchestrator.agent.contract.ResponseIntent;
import com.sapiens.orchestrator.artifact.Milestone;
import com.sapiens.orchestrator.artifact.MilestonePlan;
import com.sapiens.orchestrator.artifact.ProblemDefinition;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.artifact.SolutionDesign;
import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.Artifact;
import com.sapiens.orchestrator.model.ArtifactKind;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.model.UserState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * First message in execution builds the milestone plan; every later message
 * is a progress update against the current milestone. Once every milestone
 * is done the user moves on to review.
 */
@Component
public class ExecutionHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHandler.class);

    @Override
    public Phase phase() {
        return Phase.EXECUTION;
    }

    @Override
    public HandlerOutcome handle(Turn turn) {
        UserState s = turn.state();
        ProjectProposal project = turn.artifacts().project(s.getProjectId()).orElse(null);

        Optional<Artifact> planRow = turn.artifacts().find(s.getMilestonePlanId());
        if (planRow.isEmpty()) {
            return createPlan(turn, project);
        }
        MilestonePlan plan = turn.artifacts().read(planRow.get(), MilestonePlan.class);
        return recordProgress(turn, project, plan, planRow.get().getRevision());
    }

    private HandlerOutcome createPlan(Turn turn, ProjectProposal project) {
        UserState s = turn.state();
        ProgressInput input = ProgressInput.plan(project,
                turn.artifacts().problem(s.getProblemId()).map(ProblemDefinition::draft).orElse(null),
                turn.artifacts().solution(s.getSolutionId()).map(SolutionDesign::draft).orElse(null));

        AgentResult<ProgressOutput> result = turn.agents().trackProgress(input);
        if (!(result instanceof AgentResult.Ok<ProgressOutput> ok)) {
            return HandlerOutcome.failed(AgentCapability.PROGRESS_TRACKER, result);
        }

        MilestonePlan plan = ok.output().plan();
        Artifact stored = turn.stage(ArtifactKind.MILESTONE_PLAN, plan, 1);
        s.setMilestonePlanId(stored.getArtifactId());
        s.setTotalMilestones(plan.milestones().size());
        s.setMilestonesCompleted(0);
        s.setAwaitingFeedback(true);
        log.info("Created milestone plan {} with {} milestones", stored.getArtifactId(), plan.milestones().size());
        return HandlerOutcome.stay(new ResponseIntent.PresentPlan(plan));
    }

    private HandlerOutcome recordProgress(Turn turn, ProjectProposal project, MilestonePlan plan, int planRevision) {
        UserState s = turn.state();
        String milestoneTitle = plan.currentMilestone().map(Milestone::title).orElse(null);

        AgentResult<ProgressOutput> result = turn.agents().trackProgress(
                ProgressInput.update(project, plan, turn.message()));
        if (!(result instanceof AgentResult.Ok<ProgressOutput> ok)) {
            return HandlerOutcome.failed(AgentCapability.PROGRESS_TRACKER, result);
        }

        ProgressOutput out = ok.output();
        MilestonePlan updated = out.plan();
        Artifact stored = turn.stage(ArtifactKind.MILESTONE_PLAN, updated, planRevision + 1);
        s.setMilestonePlanId(stored.getArtifactId());
        s.setTotalMilestones(updated.milestones().size());
        s.setMilestonesCompleted(updated.completedCount());
        if (out.stagnationDetected()) {
            log.info("Stagnation reported on milestone {}", out.milestoneId());
        }

        if (updated.currentMilestone().isEmpty()) {
            s.setAwaitingFeedback(true);
            return HandlerOutcome.advance(Phase.REVIEW, "milestones_completed",
                    new ResponseIntent.ReviewRequest(project == null ? null : project.title(),
                            project == null ? List.of() : project.evaluationCriteria()));
        }

        return HandlerOutcome.stay(new ResponseIntent.ProgressFeedback(
                out.feedback(), milestoneTitle, out.milestoneStatus(), out.stagnationDetected(),
                out.nextAction(), updated.completedCount(), updated.milestones().size()));
    }
}
