package com.sapiens.orchestrator.llm;

/** Per-call sampling limits passed to the backend. */
public record GenerationConstraints(int maxTokens, double temperature) {

    public static final GenerationConstraints DEFAULT  = new GenerationConstraints(4096, 0.7);
    // Scoring should be stable across retries.
    public static final GenerationConstraints SCORING  = new GenerationConstraints(2048, 0.2);

    public GenerationConstraints {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }
}
