package com.sapiens.orchestrator.agent.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sapiens.orchestrator.agent.AgentOutputException;
import com.sapiens.orchestrator.agent.StructuredAgent;
import com.sapiens.orchestrator.agent.SystemPrompts;
import com.sapiens.orchestrator.agent.contract.GeneratorInput;
import com.sapiens.orchestrator.agent.contract.GeneratorOutput;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.knowledge.KnowledgeRetriever;
import com.sapiens.orchestrator.knowledge.Snippet;
import com.sapiens.orchestrator.llm.TextGenerationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Proposes a portfolio project for the user's role and domain.
 *
 * Domain context comes from the knowledge retriever and is passed to the
 * model alongside the profile; an empty result simply means no context.
 */
@Component
public class ProjectGeneratorAgent
        extends StructuredAgent<GeneratorInput, GeneratorOutput, ProjectGeneratorAgent.RawResult> {

    private static final Logger log = LoggerFactory.getLogger(ProjectGeneratorAgent.class);

    static final int CONTEXT_SNIPPETS = 3;

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RawResult(ProjectProposal proposal, String reasoning, List<String> alternativeOptions) {}

    private final KnowledgeRetriever knowledge;

    public ProjectGeneratorAgent(TextGenerationBackend backend, ObjectMapper objectMapper,
                                 KnowledgeRetriever knowledge) {
        super(backend, objectMapper, RawResult.class);
        this.knowledge = knowledge;
    }

    @Override
    protected String systemPrompt(GeneratorInput input) {
        return SystemPrompts.PROJECT_GENERATOR;
    }

    @Override
    protected Object payloadFor(GeneratorInput input) {
        String query = input.targetRole() + " portfolio project in " + input.targetDomain();
        List<Snippet> snippets = knowledge.search(query, input.targetDomain(), CONTEXT_SNIPPETS);
        log.debug("Retrieved {} domain snippets for '{}'", snippets.size(), query);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("target_role",     input.targetRole());
        payload.put("target_domain",   input.targetDomain());
        payload.put("background",      input.background());
        payload.put("interests",       input.interests());
        payload.put("rejected_titles", input.rejectedTitles());
        payload.put("domain_context",  snippets);
        return payload;
    }

    @Override
    protected GeneratorOutput validate(GeneratorInput input, RawResult raw) {
        ProjectProposal p = raw.proposal();
        if (p == null) {
            throw new AgentOutputException("missing proposal");
        }
        String title = requireText(p.title(), "proposal.title");
        requireText(p.description(), "proposal.description");

        boolean repeated = input.rejectedTitles().stream().anyMatch(t -> t.equalsIgnoreCase(title));
        if (repeated) {
            throw new AgentOutputException("proposal repeats rejected title '" + title + "'");
        }

        // Keep the duration inside the 2-3 week window the prompt asks for.
        double weeks = p.estimatedDurationWeeks() <= 0 ? 2.5
                : Math.max(2.0, Math.min(3.0, p.estimatedDurationWeeks()));

        ProjectProposal normalized = new ProjectProposal(
                title, p.projectType(), p.description().strip(), p.whyRelevant(),
                p.deliverables(), p.roadmap(), weeks,
                p.skillsDemonstrated(), p.recruiterAppeal(), p.evaluationCriteria());
        return new GeneratorOutput(normalized, raw.reasoning(), raw.alternativeOptions());
    }
}
