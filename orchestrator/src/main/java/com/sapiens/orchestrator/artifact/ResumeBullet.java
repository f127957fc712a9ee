package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * One resume claim. {@code evidence} is a span quoted from the submitted
 * artifact text that supports the claim.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResumeBullet(String text, String evidence, List<String> skills, String bulletType) {
    public ResumeBullet {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
