package com.sapiens.orchestrator.service;

import com.sapiens.orchestrator.model.Phase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserRequestGateTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void identicalConcurrentRequests_runOnceAndShareTheReply() throws Exception {
        UserRequestGate gate = new UserRequestGate(Duration.ofSeconds(5));
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();

        Future<ChatReply> leader = pool.submit(() -> gate.execute("u1", "yes", blockingWork(runs, release, "first")));
        awaitRuns(runs, 1);
        Future<ChatReply> follower = pool.submit(() -> gate.execute("u1", "yes", blockingWork(runs, release, "second")));
        Thread.sleep(200);
        release.countDown();

        ChatReply a = leader.get(5, TimeUnit.SECONDS);
        ChatReply b = follower.get(5, TimeUnit.SECONDS);
        assertThat(runs.get()).isEqualTo(1);
        assertThat(b).isSameAs(a);
        assertThat(b.text()).isEqualTo("first");
    }

    @Test
    void differentMessagesForSameUser_runOneAtATime() throws Exception {
        UserRequestGate gate = new UserRequestGate(Duration.ofSeconds(5));
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();

        Future<ChatReply> first = pool.submit(() -> gate.execute("u1", "one", blockingWork(runs, release, "one")));
        awaitRuns(runs, 1);
        Future<ChatReply> second = pool.submit(() -> gate.execute("u1", "two", () -> {
            runs.incrementAndGet();
            return reply("two");
        }));

        Thread.sleep(200);
        assertThat(runs.get()).isEqualTo(1);
        assertThat(second.isDone()).isFalse();

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).text()).isEqualTo("one");
        assertThat(second.get(5, TimeUnit.SECONDS).text()).isEqualTo("two");
        assertThat(runs.get()).isEqualTo(2);
    }

    @Test
    void waitExpires_requestFailsWithBusy() throws Exception {
        UserRequestGate gate = new UserRequestGate(Duration.ofMillis(100));
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();

        Future<ChatReply> first = pool.submit(() -> gate.execute("u1", "one", blockingWork(runs, release, "one")));
        awaitRuns(runs, 1);

        assertThatThrownBy(() -> gate.execute("u1", "two", () -> reply("two")))
                .isInstanceOfSatisfying(OrchestrationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(OrchestrationException.Kind.BUSY));

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).text()).isEqualTo("one");
    }

    @Test
    void differentUsers_doNotBlockEachOther() throws Exception {
        UserRequestGate gate = new UserRequestGate(Duration.ofSeconds(5));
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();

        Future<ChatReply> slow = pool.submit(() -> gate.execute("u1", "hi", blockingWork(runs, release, "u1")));
        awaitRuns(runs, 1);

        ChatReply other = gate.execute("u2", "hi", () -> reply("u2"));
        assertThat(other.text()).isEqualTo("u2");
        assertThat(slow.isDone()).isFalse();

        release.countDown();
        slow.get(5, TimeUnit.SECONDS);
    }

    @Test
    void leaderFailure_isSeenByCoalescedFollower() throws Exception {
        UserRequestGate gate = new UserRequestGate(Duration.ofSeconds(5));
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();

        Future<ChatReply> leader = pool.submit(() -> gate.execute("u1", "yes", () -> {
            runs.incrementAndGet();
            awaitQuietly(release);
            throw new OrchestrationException(OrchestrationException.Kind.PERSISTENCE_FAILURE, "db down");
        }));
        awaitRuns(runs, 1);
        Future<ChatReply> follower = pool.submit(() -> gate.execute("u1", "yes", () -> reply("never")));
        Thread.sleep(200);
        release.countDown();

        OrchestrationException leaderFailure = failureOf(leader);
        OrchestrationException followerFailure = failureOf(follower);
        assertThat(runs.get()).isEqualTo(1);

        assertThat(followerFailure).isNotSameAs(leaderFailure);
        assertThat(followerFailure.getKind()).isEqualTo(OrchestrationException.Kind.PERSISTENCE_FAILURE);
        assertThat(followerFailure.getMessage()).isEqualTo(leaderFailure.getMessage());
        assertThat(followerFailure.getCause()).isSameAs(leaderFailure);

        // Tagging order between the two requests must not matter.
        followerFailure.attachRequestId("req-follower");
        leaderFailure.attachRequestId("req-leader");
        assertThat(leaderFailure.getRequestId()).isEqualTo("req-leader");
        assertThat(followerFailure.getRequestId()).isEqualTo("req-follower");
    }

    @Test
    void locksAreReleasedOnceIdle() {
        UserRequestGate gate = new UserRequestGate(Duration.ofSeconds(5));

        gate.execute("u1", "one", () -> reply("one"));
        assertThatThrownBy(() -> gate.execute("u1", "two", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(gate.activeUsers()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static OrchestrationException failureOf(Future<ChatReply> future) throws Exception {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(OrchestrationException.class);
            return (OrchestrationException) e.getCause();
        }
        throw new AssertionError("expected the request to fail");
    }

    private static Supplier<ChatReply> blockingWork(AtomicInteger runs, CountDownLatch release, String text) {
        return () -> {
            runs.incrementAndGet();
            awaitQuietly(release);
            return reply(text);
        };
    }

    private static ChatReply reply(String text) {
        return new ChatReply("u", text, Phase.ONBOARDING, ChatReply.Outcome.ANSWERED);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitRuns(AtomicInteger runs, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (runs.get() < expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(runs.get()).isEqualTo(expected);
    }
}
