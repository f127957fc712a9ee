package com.sapiens.orchestrator.agent.contract;

import com.sapiens.orchestrator.artifact.ProjectProposal;

import java.util.List;

public record GeneratorOutput(ProjectProposal proposal, String reasoning, List<String> alternativeOptions) {
    public GeneratorOutput {
        alternativeOptions = alternativeOptions == null ? List.of() : List.copyOf(alternativeOptions);
    }
}
