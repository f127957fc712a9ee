package com.sapiens.orchestrator.agent;

import com.sapiens.orchestrator.model.AgentCapability;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.*;

/**
 * Runs one agent call on the bounded agent pool with a per-attempt timeout,
 * retrying a timed-out or malformed attempt up to the configured maximum.
 *
 * A timed-out attempt is cancelled and its future is never read again, so a
 * reply that arrives late cannot affect the request.
 *
 * Every attempt is timed and counted:
 * <pre>
 *   sapiens.agent.calls{capability, status="ok|timeout|malformed|error"}
 *   sapiens.agent.duration{capability}
 * </pre>
 */
@Component
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);

    private final ExecutorService executor;
    private final MeterRegistry   meterRegistry;
    private final Duration        timeout;
    private final int             maxAttempts;

    public AgentInvoker(@Qualifier("agentExecutor") ExecutorService executor,
                        MeterRegistry meterRegistry,
                        @Value("${sapiens.agents.timeout:30s}") Duration timeout,
                        @Value("${sapiens.agents.max-attempts:2}") int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts must be at least 1");
        }
        this.executor      = executor;
        this.meterRegistry = meterRegistry;
        this.timeout       = timeout;
        this.maxAttempts   = maxAttempts;
    }

    public <I, O> AgentResult<O> invoke(AgentCapability capability, Agent<I, O> agent,
                                        I input, AgentContext ctx) {
        AgentResult<O> last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            last = attempt(capability, agent, input, ctx);
            if (last.isOk()) {
                if (attempt > 1) {
                    log.info("Agent '{}' succeeded on attempt {}", capability.agentName(), attempt);
                }
                return last;
            }
            log.warn("Agent '{}' attempt {}/{} failed: {}",
                    capability.agentName(), attempt, maxAttempts, last.describe());
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
        }
        return last;
    }

    // ------------------------------------------------------------------
    // One attempt
    // ------------------------------------------------------------------

    private <I, O> AgentResult<O> attempt(AgentCapability capability, Agent<I, O> agent,
                                          I input, AgentContext ctx) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Callable<O> task = () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return agent.generate(input, ctx);
            } finally {
                MDC.clear();
            }
        };

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "ok";
        Future<O> future = null;
        try {
            future = executor.submit(task);
            O output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (output == null) {
                status = "malformed";
                return new AgentResult.Malformed<>("agent returned no output");
            }
            return new AgentResult.Ok<>(output);
        } catch (TimeoutException e) {
            status = "timeout";
            future.cancel(true);
            return new AgentResult.TimedOut<>(timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AgentOutputException) {
                status = "malformed";
                return new AgentResult.Malformed<>(cause.getMessage());
            }
            // Backend transport/API errors are retried like malformed output.
            status = "error";
            log.warn("Agent '{}' raised {}", capability.agentName(), cause.toString());
            return new AgentResult.Malformed<>("backend failure: " + cause.getMessage());
        } catch (RejectedExecutionException e) {
            status = "error";
            return new AgentResult.Malformed<>("agent pool rejected the call");
        } catch (InterruptedException e) {
            status = "timeout";
            if (future != null) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            return new AgentResult.TimedOut<>(timeout);
        } finally {
            sample.stop(meterRegistry.timer("sapiens.agent.duration",
                    "capability", capability.agentName()));
            meterRegistry.counter("sapiens.agent.calls",
                    "capability", capability.agentName(), "status", status).increment();
        }
    }
}
