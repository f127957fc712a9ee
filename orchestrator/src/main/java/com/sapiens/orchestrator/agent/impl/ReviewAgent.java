package com.sapiens.orchestrator.agent.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.agent.AgentOutputException;
import com.sapiens.orchestrator.agent.StructuredAgent;
import com.sapiens.orchestrator.agent.SystemPrompts;
import com.sapiens.orchestrator.agent.contract.ReviewInput;
import com.sapiens.orchestrator.agent.contract.ReviewMode;
import com.sapiens.orchestrator.agent.contract.ReviewOutput;
import com.sapiens.orchestrator.artifact.ArtifactReview;
import com.sapiens.orchestrator.artifact.ResumeBullet;
import com.sapiens.orchestrator.artifact.ResumePackage;
import com.sapiens.orchestrator.llm.TextGenerationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reviews the user's final work, then writes resume content from it.
 *
 * Resume claims are checked against the submitted text: a bullet survives
 * only if its evidence span actually occurs there (case and whitespace
 * insensitive). A resume with no surviving bullet is malformed.
 */
@Component
public class ReviewAgent extends StructuredAgent<ReviewInput, ReviewOutput, JsonNode> {

    private static final Logger log = LoggerFactory.getLogger(ReviewAgent.class);

    static final int MAX_BULLETS = 5;
    // Shorter spans match almost any text.
    static final int MIN_EVIDENCE_CHARS = 12;

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RawReview(
            Double overallScore,
            String overallFeedback,
            Map<String, Double> criterionScores,
            List<String> strengths,
            List<String> areasForImprovement,
            String recruiterAppeal,
            List<String> skillsDemonstrated
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RawResume(
            String projectTitle,
            String oneLiner,
            List<ResumeBullet> bullets,
            String projectDescription,
            List<String> suggestedSkills,
            List<String> interviewTalkingPoints
    ) {}

    public ReviewAgent(TextGenerationBackend backend, ObjectMapper objectMapper) {
        super(backend, objectMapper, JsonNode.class);
    }

    @Override
    protected String systemPrompt(ReviewInput input) {
        return input.mode() == ReviewMode.REVIEW ? SystemPrompts.ARTIFACT_REVIEW : SystemPrompts.RESUME;
    }

    @Override
    protected ReviewOutput validate(ReviewInput input, JsonNode raw) {
        return input.mode() == ReviewMode.REVIEW
                ? validateReview(input, convert(raw, RawReview.class))
                : validateResume(input, convert(raw, RawResume.class));
    }

    // ------------------------------------------------------------------
    // Review mode
    // ------------------------------------------------------------------

    private ReviewOutput validateReview(ReviewInput input, RawReview raw) {
        double overall = requireScore(raw.overallScore(), "overall_score");
        String feedback = requireText(raw.overallFeedback(), "overall_feedback");

        Map<String, Double> criteria = new LinkedHashMap<>();
        if (raw.criterionScores() != null) {
            raw.criterionScores().forEach((name, score) -> criteria.put(name, requireScore(score, name)));
        }

        ArtifactReview review = new ArtifactReview(
                input.submittedText(), overall, feedback, criteria,
                raw.strengths(), raw.areasForImprovement(),
                raw.recruiterAppeal(), raw.skillsDemonstrated());
        return ReviewOutput.ofReview(review);
    }

    // ------------------------------------------------------------------
    // Resume mode
    // ------------------------------------------------------------------

    private ReviewOutput validateResume(ReviewInput input, RawResume raw) {
        List<ResumeBullet> proposed = raw.bullets() == null ? List.of() : raw.bullets();
        String evidenceBase = normalize(input.review().submittedText());

        List<ResumeBullet> kept = new ArrayList<>();
        for (ResumeBullet b : proposed) {
            if (kept.size() == MAX_BULLETS) {
                break;
            }
            if (isSupported(b, evidenceBase)) {
                kept.add(b);
            }
        }
        int discarded = proposed.size() - kept.size();
        if (discarded > 0) {
            log.info("Discarded {} of {} resume bullets without supporting evidence",
                    discarded, proposed.size());
        }
        if (kept.isEmpty()) {
            throw new AgentOutputException("no resume bullet is supported by the submitted text");
        }

        String title = raw.projectTitle() != null && !raw.projectTitle().isBlank()
                ? raw.projectTitle()
                : input.project() == null ? null : input.project().title();
        ResumePackage resume = new ResumePackage(title, raw.oneLiner(), kept,
                raw.projectDescription(), raw.suggestedSkills(), raw.interviewTalkingPoints());
        return ReviewOutput.ofResume(resume, discarded);
    }

    static boolean isSupported(ResumeBullet bullet, String normalizedSubmission) {
        if (bullet == null || bullet.text() == null || bullet.text().isBlank()) {
            return false;
        }
        String evidence = normalize(bullet.evidence());
        return evidence.length() >= MIN_EVIDENCE_CHARS && normalizedSubmission.contains(evidence);
    }

    /** Lower-case, collapse whitespace, drop surrounding quotes and ellipses. */
    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String s = text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").strip();
        s = s.replaceAll("^[\"'“”‘’.…\\s]+", "").replaceAll("[\"'“”‘’.…\\s]+$", "");
        return s;
    }

    private <T> T convert(JsonNode raw, Class<T> type) {
        try {
            return json.treeToValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new AgentOutputException("result does not match " + type.getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }
}
