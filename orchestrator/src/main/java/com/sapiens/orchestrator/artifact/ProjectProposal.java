package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A portfolio project proposed by the generator agent.
 *
 * The evaluation criteria listed here are reused by the review agent when
 * the user submits final artifacts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectProposal(
        String title,
        ProjectType projectType,
        String description,
        String whyRelevant,
        List<Deliverable> deliverables,
        List<String> roadmap,
        double estimatedDurationWeeks,
        List<String> skillsDemonstrated,
        String recruiterAppeal,
        List<String> evaluationCriteria
) {
    public ProjectProposal {
        deliverables       = deliverables == null ? List.of() : List.copyOf(deliverables);
        roadmap            = roadmap == null ? List.of() : List.copyOf(roadmap);
        skillsDemonstrated = skillsDemonstrated == null ? List.of() : List.copyOf(skillsDemonstrated);
        evaluationCriteria = evaluationCriteria == null ? List.of() : List.copyOf(evaluationCriteria);
    }
}
