package com.sapiens.orchestrator.service.handler;

import com.sapiens.orchestrator.agent.contract.ResponseIntent;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.model.Phase;
import org.springframework.stereotype.Component;

/** Terminal phase: no agent calls, just a pointer to what was produced. */
@Component
public class CompletedHandler implements PhaseHandler {

    @Override
    public Phase phase() {
        return Phase.COMPLETED;
    }

    @Override
    public HandlerOutcome handle(Turn turn) {
        String title = turn.artifacts().project(turn.state().getProjectId())
                .map(ProjectProposal::title)
                .orElse(null);
        return HandlerOutcome.stay(new ResponseIntent.Completed(title));
    }
}
