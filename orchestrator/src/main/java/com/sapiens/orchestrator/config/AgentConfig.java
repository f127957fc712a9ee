package com.sapiens.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sapiens.orchestrator.agent.AgentGatewayFactory;
import com.sapiens.orchestrator.agent.impl.EvaluatorAgent;
import com.sapiens.orchestrator.agent.impl.ProgressTrackerAgent;
import com.sapiens.orchestrator.agent.impl.ProjectGeneratorAgent;
import com.sapiens.orchestrator.agent.impl.ReviewAgent;
import com.sapiens.orchestrator.knowledge.HttpKnowledgeRetriever;
import com.sapiens.orchestrator.knowledge.KnowledgeRetriever;
import com.sapiens.orchestrator.knowledge.NoOpKnowledgeRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Agent wiring: the worker pool, the agent set and the knowledge retriever. */
@Configuration
public class AgentConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentConfig.class);

    /**
     * Worker pool for agent calls. The request thread waits on the future
     * with a timeout, so a hung backend call occupies a worker, never a
     * request thread.
     */
    @Bean(name = "agentExecutor", destroyMethod = "shutdownNow")
    public ExecutorService agentExecutor(@Value("${sapiens.agents.max-concurrent-calls:8}") int maxConcurrentCalls) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "agent-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(maxConcurrentCalls, threads);
    }

    @Bean
    public AgentGatewayFactory.Agents agents(ProjectGeneratorAgent generator,
                                             EvaluatorAgent evaluator,
                                             ProgressTrackerAgent progressTracker,
                                             ReviewAgent reviewer) {
        return new AgentGatewayFactory.Agents(generator, evaluator, progressTracker, reviewer);
    }

    /** HTTP retrieval when a base URL is configured, otherwise no domain context. */
    @Bean
    public KnowledgeRetriever knowledgeRetriever(@Value("${sapiens.knowledge.base-url:}") String baseUrl,
                                                 @Value("${sapiens.knowledge.timeout:5s}") Duration timeout,
                                                 ObjectMapper objectMapper) {
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("sapiens.knowledge.base-url not set, project generation runs without domain context");
            return new NoOpKnowledgeRetriever();
        }
        log.info("Knowledge retrieval at {}", baseUrl);
        return new HttpKnowledgeRetriever(baseUrl, timeout, objectMapper);
    }
}
