package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResumePackage(
        String projectTitle,
        String oneLiner,
        List<ResumeBullet> bullets,
        String projectDescription,
        List<String> suggestedSkills,
        List<String> interviewTalkingPoints
) {
    public ResumePackage {
        bullets                = bullets == null ? List.of() : List.copyOf(bullets);
        suggestedSkills        = suggestedSkills == null ? List.of() : List.copyOf(suggestedSkills);
        interviewTalkingPoints = interviewTalkingPoints == null ? List.of() : List.copyOf(interviewTalkingPoints);
    }

    public ResumePackage withBullets(List<ResumeBullet> kept) {
        return new ResumePackage(projectTitle, oneLiner, kept, projectDescription,
                suggestedSkills, interviewTalkingPoints);
    }
}
