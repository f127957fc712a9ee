package com.sapiens.orchestrator.knowledge;

import java.util.List;

/** Used when no knowledge service is configured. */
public class NoOpKnowledgeRetriever implements KnowledgeRetriever {

    @Override
    public List<Snippet> search(String query, String domainFilter, int topK) {
        return List.of();
    }
}
