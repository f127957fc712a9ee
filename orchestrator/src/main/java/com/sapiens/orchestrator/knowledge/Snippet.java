package com.sapiens.orchestrator.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One ranked piece of domain context, with where it came from. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Snippet(String content, String source, double score) {}
