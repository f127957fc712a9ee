package com.sapiens.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes chat requests per user.
 *
 * <ul>
 *   <li>Identical in-flight requests (same user, same message) are coalesced:
 *       the first one does the work, the others wait for and share its reply.</li>
 *   <li>Distinct requests for the same user queue on a fair per-user lock and
 *       run one at a time, in arrival order. A request that cannot get the
 *       lock within the configured wait fails with BUSY.</li>
 *   <li>Requests for different users never block each other.</li>
 * </ul>
 *
 * Per-user locks are reference-counted and dropped once no request holds or
 * waits for them.
 */
@Component
public class UserRequestGate {

    private static final Logger log = LoggerFactory.getLogger(UserRequestGate.class);

    record FlightKey(String userId, String message) {}

    private static final class InFlight {
        final CompletableFuture<ChatReply> future = new CompletableFuture<>();
    }

    private static final class UserLock {
        final ReentrantLock lock = new ReentrantLock(true);
        int refs;   // only touched inside ConcurrentHashMap.compute
    }

    private final ConcurrentHashMap<FlightKey, InFlight> flights = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, UserLock>    locks   = new ConcurrentHashMap<>();
    private final Duration wait;

    public UserRequestGate(@Value("${sapiens.single-flight.wait:65s}") Duration wait) {
        this.wait = wait;
    }

    public ChatReply execute(String userId, String message, Supplier<ChatReply> work) {
        FlightKey key = new FlightKey(userId, message);
        InFlight created = new InFlight();
        InFlight existing = flights.putIfAbsent(key, created);

        if (existing == null) {
            try {
                ChatReply reply = underUserLock(userId, work);
                created.future.complete(reply);
                return reply;
            } catch (RuntimeException | Error t) {
                created.future.completeExceptionally(t);
                throw t;
            } finally {
                flights.remove(key, created);
            }
        }

        log.info("Coalescing duplicate request for user {}", userId);
        return awaitLeader(existing);
    }

    /** Number of users that currently hold or wait for a lock. */
    int activeUsers() {
        return locks.size();
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private ChatReply underUserLock(String userId, Supplier<ChatReply> work) {
        UserLock userLock = locks.compute(userId, (k, v) -> {
            UserLock l = v == null ? new UserLock() : v;
            l.refs++;
            return l;
        });
        try {
            if (!userLock.lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("User {} still busy after {} ms", userId, wait.toMillis());
                throw new OrchestrationException(OrchestrationException.Kind.BUSY,
                        "another request for this user is still running");
            }
            try {
                return work.get();
            } finally {
                userLock.lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException(OrchestrationException.Kind.BUSY,
                    "interrupted while waiting for this user's previous request");
        } finally {
            locks.computeIfPresent(userId, (k, v) -> --v.refs == 0 ? null : v);
        }
    }

    private ChatReply awaitLeader(InFlight leader) {
        try {
            return leader.future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new OrchestrationException(OrchestrationException.Kind.BUSY,
                    "identical request still running");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException(OrchestrationException.Kind.BUSY,
                    "interrupted while waiting for identical request");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            // The leader tags its own instance; each follower needs one of its own.
            if (cause instanceof OrchestrationException oe) {
                throw oe.copy();
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new OrchestrationException(OrchestrationException.Kind.INTERNAL_FAILURE,
                    "identical request failed", cause);
        }
    }
}
