package com.sapiens.orchestrator.knowledge;

import java.util.List;

/**
 * Supplies contextual snippets to agents.
 *
 * Retrieval is best-effort: implementations return an empty list rather
 * than fail, so a knowledge outage never fails a user request.
 */
public interface KnowledgeRetriever {

    /**
     * @param domainFilter optional domain to restrict the search to; may be null
     * @return snippets ordered by descending relevance, at most {@code topK}
     */
    List<Snippet> search(String query, String domainFilter, int topK);
}
