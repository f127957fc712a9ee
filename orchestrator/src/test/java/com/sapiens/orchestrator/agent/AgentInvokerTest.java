package com.sapiens.orchestrator.agent;

import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.Phase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AgentInvoker against a real thread pool and a SimpleMeterRegistry.
 * Timeouts are kept short so the suite stays fast.
 */
class AgentInvokerTest {

    static final AgentContext CTX = new AgentContext("req-1", "u1", Phase.PROBLEM_DEFINITION);

    ExecutorService     pool;
    SimpleMeterRegistry meters;
    AgentInvoker        invoker;

    @BeforeEach
    void setUp() {
        pool    = Executors.newFixedThreadPool(4);
        meters  = new SimpleMeterRegistry();
        invoker = new AgentInvoker(pool, meters, Duration.ofMillis(150), 2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        MDC.clear();
    }

    // ------------------------------------------------------------------
    // Results
    // ------------------------------------------------------------------

    @Test
    void invoke_firstAttemptOk_returnsOutputOnce() {
        AtomicInteger calls = new AtomicInteger();
        Agent<String, String> agent = (in, ctx) -> {
            calls.incrementAndGet();
            return in.toUpperCase();
        };

        AgentResult<String> result = invoker.invoke(AgentCapability.EVALUATOR, agent, "ok", CTX);

        assertThat(result).isEqualTo(new AgentResult.Ok<>("OK"));
        assertThat(calls).hasValue(1);
        assertThat(meters.counter("sapiens.agent.calls", "capability", "evaluator", "status", "ok").count())
                .isEqualTo(1.0);
        assertThat(meters.timer("sapiens.agent.duration", "capability", "evaluator").count()).isEqualTo(1);
    }

    @Test
    void invoke_malformedThenOk_retriesOnce() {
        AtomicInteger calls = new AtomicInteger();
        Agent<String, String> agent = (in, ctx) -> {
            if (calls.incrementAndGet() == 1) {
                throw new AgentOutputException("missing sub-score 'clarity'");
            }
            return "fine";
        };

        AgentResult<String> result = invoker.invoke(AgentCapability.EVALUATOR, agent, "x", CTX);

        assertThat(result.isOk()).isTrue();
        assertThat(calls).hasValue(2);
        assertThat(meters.counter("sapiens.agent.calls", "capability", "evaluator", "status", "malformed").count())
                .isEqualTo(1.0);
    }

    @Test
    void invoke_timesOutTwice_returnsTimedOut() {
        AtomicInteger calls = new AtomicInteger();
        Agent<String, String> agent = (in, ctx) -> {
            calls.incrementAndGet();
            sleep(2_000);
            return "too late";
        };

        AgentResult<String> result = invoker.invoke(AgentCapability.GENERATOR, agent, "x", CTX);

        assertThat(result).isInstanceOf(AgentResult.TimedOut.class);
        assertThat(result.describe()).startsWith("timed out after 150");
        assertThat(calls).hasValue(2);
        assertThat(meters.counter("sapiens.agent.calls", "capability", "project_generator", "status", "timeout").count())
                .isEqualTo(2.0);
    }

    @Test
    void invoke_timedOutAttempt_isCancelledAndLateResultIgnored() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        Agent<String, String> agent = (in, ctx) -> {
            if (calls.incrementAndGet() == 1) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return "late";
            }
            return "second";
        };

        AgentResult<String> result = invoker.invoke(AgentCapability.REVIEWER, agent, "x", CTX);

        assertThat(result).isEqualTo(new AgentResult.Ok<>("second"));
        assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void invoke_backendError_isReportedAsMalformed() {
        Agent<String, String> agent = (in, ctx) -> {
            throw new IllegalStateException("HTTP 529 overloaded");
        };

        AgentResult<String> result = invoker.invoke(AgentCapability.PROGRESS_TRACKER, agent, "x", CTX);

        assertThat(result).isInstanceOfSatisfying(AgentResult.Malformed.class,
                m -> assertThat(m.reason()).contains("backend failure").contains("529"));
        assertThat(meters.counter("sapiens.agent.calls", "capability", "progress_tracker", "status", "error").count())
                .isEqualTo(2.0);
    }

    @Test
    void invoke_nullOutput_isMalformed() {
        Agent<String, String> agent = (in, ctx) -> null;

        assertThat(invoker.invoke(AgentCapability.EVALUATOR, agent, "x", CTX))
                .isInstanceOf(AgentResult.Malformed.class);
    }

    @Test
    void invoke_copiesCallerMdcToWorkerThread() {
        MDC.put("requestId", "req-1");
        AtomicReference<String> seen = new AtomicReference<>();
        Agent<String, String> agent = (in, ctx) -> {
            seen.set(MDC.get("requestId"));
            return "ok";
        };

        invoker.invoke(AgentCapability.EVALUATOR, agent, "x", CTX);

        assertThat(seen).hasValue("req-1");
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
