package com.sapiens.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sapiens.orchestrator.llm.GenerationConstraints;
import com.sapiens.orchestrator.llm.TextGenerationBackend;

/**
 * Base for agents backed by the text-generation service.
 *
 * <pre>
 *   typed input → JSON payload → backend → &lt;result&gt; JSON → raw DTO → validate → typed output
 * </pre>
 *
 * Subclasses supply the system prompt, the raw DTO type the model is asked
 * to produce, and the validation that turns it into the contract output.
 *
 * @param <I> typed input
 * @param <O> typed output
 * @param <R> raw DTO parsed from the model's result block
 */
public abstract class StructuredAgent<I, O, R> implements Agent<I, O> {

    protected final TextGenerationBackend backend;
    protected final ObjectMapper          json;
    private   final Class<R>              rawType;

    protected StructuredAgent(TextGenerationBackend backend, ObjectMapper json, Class<R> rawType) {
        this.backend = backend;
        this.json    = json;
        this.rawType = rawType;
    }

    @Override
    public final O generate(I input, AgentContext ctx) {
        String payload;
        try {
            payload = json.writeValueAsString(payloadFor(input));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize agent input", e);
        }

        String reply = backend.generate(systemPrompt(input), payload, constraints(input));

        String resultJson = ResponseParser.extractStructured(reply)
                .orElseThrow(() -> new AgentOutputException("reply has no <result> block"));
        R raw;
        try {
            raw = json.readValue(resultJson, rawType);
        } catch (JsonProcessingException e) {
            throw new AgentOutputException("result is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (raw == null) {
            throw new AgentOutputException("result is empty");
        }
        return validate(input, raw);
    }

    protected abstract String systemPrompt(I input);

    /** What gets serialized as the user payload. Defaults to the input itself. */
    protected Object payloadFor(I input) {
        return input;
    }

    protected GenerationConstraints constraints(I input) {
        return GenerationConstraints.DEFAULT;
    }

    /**
     * @throws AgentOutputException when the raw result violates the contract
     */
    protected abstract O validate(I input, R raw);

    // ------------------------------------------------------------------
    // Shared validation helpers
    // ------------------------------------------------------------------

    protected static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new AgentOutputException("missing " + field);
        }
        return value.strip();
    }

    protected static double requireScore(Double value, String field) {
        if (value == null) {
            throw new AgentOutputException("missing score " + field);
        }
        if (value.isNaN() || value < 0.0 || value > 10.0) {
            throw new AgentOutputException("score " + field + " out of range: " + value);
        }
        return value;
    }
}
