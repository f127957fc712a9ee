package com.sapiens.orchestrator.llm;

/**
 * The external text-generation service, seen as a black box.
 *
 * Implementations block until the reply is available. Callers bound the
 * wait themselves (see {@link com.sapiens.orchestrator.agent.AgentInvoker}).
 */
public interface TextGenerationBackend {

    /**
     * @param systemInstructions role and output-format instructions
     * @param userPayload        the typed agent input, serialized
     * @return the raw text reply
     * @throws BackendException on transport or API errors
     */
    String generate(String systemInstructions, String userPayload, GenerationConstraints constraints);
}
