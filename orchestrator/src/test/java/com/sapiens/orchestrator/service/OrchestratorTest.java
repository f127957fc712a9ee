package com.sapiens.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sapiens.orchestrator.agent.AgentGatewayFactory;
import com.sapiens.orchestrator.agent.AgentInvoker;
import com.sapiens.orchestrator.agent.impl.*;
import com.sapiens.orchestrator.artifact.ProblemDefinition;
import com.sapiens.orchestrator.artifact.ProblemDraft;
import com.sapiens.orchestrator.artifact.ProjectProposal;
import com.sapiens.orchestrator.knowledge.NoOpKnowledgeRetriever;
import com.sapiens.orchestrator.model.*;
import com.sapiens.orchestrator.service.extract.ApprovalClassifier;
import com.sapiens.orchestrator.service.extract.SubmissionParser;
import com.sapiens.orchestrator.service.handler.*;
import com.sapiens.orchestrator.statemachine.StateMachine;
import com.sapiens.orchestrator.support.InMemoryArtifactStore;
import com.sapiens.orchestrator.support.InMemoryAuditLog;
import com.sapiens.orchestrator.support.InMemoryUserStateStore;
import com.sapiens.orchestrator.support.ScriptedBackend;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Orchestrator wired with the real handlers, agents, state machine and
 * single-flight gate. Only the text backend and the stores are fakes.
 */
class OrchestratorTest {

    static final String PROPOSAL = """
            {"proposal": {"title": "Churn radar", "project_type": "product",
              "description": "Predict which customers of small shops will churn.",
              "estimated_duration_weeks": 3, "evaluation_criteria": ["impact", "rigor"]},
             "reasoning": "fits a PM in fintech"}
            """;

    static final String PROPOSAL_2 = """
            {"proposal": {"title": "Invoice nudger", "project_type": "product",
              "description": "Reduce late invoice payments for freelancers."}}
            """;

    static final String PROBLEM_TEXT = """
            Problem: Small retailers cannot predict customer churn early enough to act.
            Audience: independent shop owners
            """;

    static final String SOLUTION_TEXT = """
            Approach: Train a churn model on order history and alert owners every week.
            Key components: data pipeline; churn model; alert emails
            """;

    static final String PROBLEM_APPROVED  = scores("market_relevance", 8, "clarity", 7, "feasibility", 6);
    static final String PROBLEM_REJECTED  = scores("market_relevance", 5, "clarity", 7, "feasibility", 8);
    static final String SOLUTION_APPROVED = scores("logical_coherence", 8, "innovation", 7,
            "implementation_feasibility", 8, "impact_potential", 7);
    static final String SOLUTION_REJECTED = scores("logical_coherence", 5, "innovation", 5,
            "implementation_feasibility", 6, "impact_potential", 5);

    ExecutorService        pool;
    ScriptedBackend        backend;
    InMemoryUserStateStore states;
    InMemoryAuditLog       audit;
    InMemoryArtifactStore  artifactStore;
    JourneyArtifacts       artifacts;
    SimpleMeterRegistry    meters;
    Clock                  clock;

    @BeforeEach
    void setUp() {
        pool          = Executors.newFixedThreadPool(4);
        backend       = new ScriptedBackend();
        states        = new InMemoryUserStateStore();
        audit         = new InMemoryAuditLog();
        artifactStore = new InMemoryArtifactStore();
        artifacts     = new JourneyArtifacts(artifactStore, new ObjectMapper());
        meters        = new SimpleMeterRegistry();
        clock         = Clock.systemUTC();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    Orchestrator orchestrator(boolean autoCreate) {
        return orchestrator(autoCreate, Duration.ofMillis(300));
    }

    Orchestrator orchestrator(boolean autoCreate, Duration agentTimeout) {
        ObjectMapper json = new ObjectMapper();
        AgentGatewayFactory.Agents agents = new AgentGatewayFactory.Agents(
                new ProjectGeneratorAgent(backend, json, new NoOpKnowledgeRetriever()),
                new EvaluatorAgent(backend, json),
                new ProgressTrackerAgent(backend, json),
                new ReviewAgent(backend, json));
        AgentInvoker invoker = new AgentInvoker(pool, meters, agentTimeout, 2);
        ApprovalClassifier classifier = new ApprovalClassifier();
        SubmissionParser parser = new SubmissionParser();

        List<PhaseHandler> handlers = List.of(
                new OnboardingHandler(),
                new ProjectGenerationHandler(classifier),
                new ProblemDefinitionHandler(parser),
                new SolutionDesignHandler(parser, 3),
                new ExecutionHandler(),
                new ReviewHandler(classifier),
                new CompletedHandler());

        return new Orchestrator(
                new UserRequestGate(Duration.ofSeconds(5)),
                states,
                new StateMachine(clock),
                new AgentGatewayFactory(agents, invoker),
                new RelayAgent(),
                artifacts,
                new JourneyLedger(states, audit, artifactStore),
                handlers,
                meters,
                autoCreate,
                8000,
                clock);
    }

    Orchestrator orchestrator() {
        return orchestrator(true);
    }

    // ------------------------------------------------------------------
    // Onboarding
    // ------------------------------------------------------------------

    @Test
    void chat_firstMessageIsRole_storesRoleAndAsksForDomain() {
        ChatReply reply = orchestrator().chat("u1", "Product Manager");

        assertThat(reply.phase()).isEqualTo(Phase.ONBOARDING);
        assertThat(reply.outcome()).isEqualTo(ChatReply.Outcome.ANSWERED);
        assertThat(reply.text()).contains("domain");

        UserState s = states.find("u1").orElseThrow();
        assertThat(s.getCurrentState()).isEqualTo(Phase.ONBOARDING);
        assertThat(s.getTargetRole()).isEqualTo("Product Manager");
        assertThat(backend.calls()).isZero();
    }

    @Test
    void chat_greetingOnFirstContact_returnsWelcomeWithoutStoringRole() {
        ChatReply reply = orchestrator().chat("u1", "Hello!");

        assertThat(reply.text()).contains("Welcome");
        assertThat(states.find("u1").orElseThrow().getTargetRole()).isNull();
    }

    @Test
    void chat_entriesAreStoredBeforeReplyReturns() {
        ChatReply reply = orchestrator().chat("u1", "Product Manager");

        List<ConversationEntry> entries = audit.entries("u1");
        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).getActor()).isEqualTo(Actor.USER);
        assertThat(entries.get(0).getPayload()).isEqualTo("Product Manager");
        assertThat(entries.get(1).getActor()).isEqualTo(Actor.AGENT);
        assertThat(entries.get(1).getAgentName()).isEqualTo("relay");
        assertThat(entries.get(1).getPayload()).isEqualTo(reply.text());
        assertThat(entries.get(0).getRequestId()).isEqualTo(entries.get(1).getRequestId());
    }

    // ------------------------------------------------------------------
    // Problem definition (scenarios B, C, D)
    // ------------------------------------------------------------------

    @Test
    void problemApproved_movesToSolutionDesign() {
        seedProblemPhase("u1");
        backend.result(PROBLEM_APPROVED);

        ChatReply reply = orchestrator().chat("u1", PROBLEM_TEXT);

        assertThat(reply.phase()).isEqualTo(Phase.SOLUTION_DESIGN);
        UserState s = states.find("u1").orElseThrow();
        assertThat(s.getCurrentState()).isEqualTo(Phase.SOLUTION_DESIGN);
        assertThat(s.getPreviousState()).isEqualTo(Phase.PROBLEM_DEFINITION);
        assertThat(s.isProblemApproved()).isTrue();
        assertThat(artifactStore.history("u1", ArtifactKind.PROBLEM_DEFINITION)).hasSize(1);

        List<StateTransition> transitions = audit.transitions("u1");
        assertThat(transitions).hasSize(1);
        assertThat(transitions.get(0).isAccepted()).isTrue();
        assertThat(transitions.get(0).getToState()).isEqualTo(Phase.SOLUTION_DESIGN);
        assertThat(meters.counter("sapiens.transitions",
                "from", "problem_definition", "to", "solution_design", "accepted", "true").count()).isEqualTo(1.0);
    }

    @Test
    void problemNeedsRevision_staysAndCountsRevision() {
        seedProblemPhase("u1");
        backend.result(PROBLEM_REJECTED);

        ChatReply reply = orchestrator().chat("u1", PROBLEM_TEXT);

        assertThat(reply.phase()).isEqualTo(Phase.PROBLEM_DEFINITION);
        UserState s = states.find("u1").orElseThrow();
        assertThat(s.getCurrentState()).isEqualTo(Phase.PROBLEM_DEFINITION);
        assertThat(s.revisionsFor(Phase.PROBLEM_DEFINITION)).isEqualTo(1);
        assertThat(s.isProblemApproved()).isFalse();
        assertThat(audit.transitions("u1")).isEmpty();
    }

    @Test
    void evaluatorTimesOutTwice_returnsRetryAndLeavesStateUnchanged() {
        seedProblemPhase("u1");
        UserState before = states.find("u1").orElseThrow();
        backend.hang(Duration.ofSeconds(5)).hang(Duration.ofSeconds(5));

        ChatReply reply = orchestrator().chat("u1", PROBLEM_TEXT);

        assertThat(reply.outcome()).isEqualTo(ChatReply.Outcome.RETRY);
        assertThat(reply.phase()).isEqualTo(Phase.PROBLEM_DEFINITION);
        UserState after = states.find("u1").orElseThrow();
        assertThat(after.getVersion()).isEqualTo(before.getVersion());
        assertThat(after.getProblemId()).isNull();

        List<ConversationEntry> entries = audit.entries("u1");
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getStateAtTime()).isEqualTo(Phase.PROBLEM_DEFINITION);
        assertThat(entries.get(0).getAgentName()).isEqualTo("evaluator");
        assertThat(entries.get(0).getPayload()).contains("timed out");
        assertThat(backend.calls()).isEqualTo(2);
    }

    @Test
    void thinSubmission_isRepromptedWithoutAgentCall() {
        seedProblemPhase("u1");

        ChatReply reply = orchestrator().chat("u1", "churn");

        assertThat(reply.phase()).isEqualTo(Phase.PROBLEM_DEFINITION);
        assertThat(backend.calls()).isZero();
    }

    // ------------------------------------------------------------------
    // Revision edge
    // ------------------------------------------------------------------

    @Test
    void thirdConsecutiveSolutionRejection_takesRevisionEdge() {
        seedSolutionPhase("u1");
        backend.result(SOLUTION_REJECTED).result(SOLUTION_REJECTED).result(SOLUTION_REJECTED);
        Orchestrator o = orchestrator();

        assertThat(o.chat("u1", SOLUTION_TEXT).phase()).isEqualTo(Phase.SOLUTION_DESIGN);
        assertThat(o.chat("u1", SOLUTION_TEXT + " v2").phase()).isEqualTo(Phase.SOLUTION_DESIGN);
        ChatReply third = o.chat("u1", SOLUTION_TEXT + " v3");

        assertThat(third.phase()).isEqualTo(Phase.PROBLEM_DEFINITION);
        UserState s = states.find("u1").orElseThrow();
        assertThat(s.getCurrentState()).isEqualTo(Phase.PROBLEM_DEFINITION);
        assertThat(s.isProblemApproved()).isFalse();
        assertThat(s.isSolutionApproved()).isFalse();
        assertThat(s.getUnlockedRevision()).isNull();
        assertThat(s.getConsecutiveRevisions()).isZero();
        assertThat(s.revisionsFor(Phase.SOLUTION_DESIGN)).isEqualTo(3);

        StateTransition t = audit.transitions("u1").get(0);
        assertThat(t.getFromState()).isEqualTo(Phase.SOLUTION_DESIGN);
        assertThat(t.getToState()).isEqualTo(Phase.PROBLEM_DEFINITION);
        assertThat(t.isAccepted()).isTrue();
    }

    // ------------------------------------------------------------------
    // Rejected transitions
    // ------------------------------------------------------------------

    @Test
    void approvalWithoutProject_isRejectedAndAudited() {
        UserState s = new UserState("u1");
        s.setCurrentState(Phase.PROJECT_GENERATION);
        s.setTargetRole("PM");
        s.setTargetDomain("Fintech");
        states.put(s);

        ChatReply reply = orchestrator().chat("u1", "yes");

        assertThat(reply.phase()).isEqualTo(Phase.PROJECT_GENERATION);
        assertThat(reply.text()).contains("project id");
        UserState after = states.find("u1").orElseThrow();
        assertThat(after.isProjectApproved()).isFalse();

        StateTransition t = audit.transitions("u1").get(0);
        assertThat(t.isAccepted()).isFalse();
        assertThat(t.getReason()).contains("project_id");
        assertThat(audit.entries("u1")).hasSize(2);
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void persistenceFailure_isFatalAndNothingIsLogged() {
        states.failSaves(true);

        assertThatThrownBy(() -> orchestrator().chat("u1", "Product Manager"))
                .isInstanceOfSatisfying(OrchestrationException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(OrchestrationException.Kind.PERSISTENCE_FAILURE);
                    assertThat(e.getRequestId()).isNotBlank();
                });
        assertThat(audit.entries("u1")).isEmpty();
    }

    @Test
    void invalidRequests_areRejectedBeforeTouchingState() {
        Orchestrator o = orchestrator();

        assertThatThrownBy(() -> o.chat(" ", "hi"))
                .isInstanceOfSatisfying(OrchestrationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(OrchestrationException.Kind.VALIDATION_FAILURE));
        assertThatThrownBy(() -> o.chat("u1", ""))
                .isInstanceOf(OrchestrationException.class);
        assertThatThrownBy(() -> o.chat("u1", "x".repeat(8001)))
                .isInstanceOf(OrchestrationException.class)
                .hasMessageContaining("8000");
        assertThat(states.exists("u1")).isFalse();
    }

    @Test
    void strictMode_unknownUser_isRefused() {
        assertThatThrownBy(() -> orchestrator(false).chat("ghost", "hi"))
                .isInstanceOfSatisfying(OrchestrationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(OrchestrationException.Kind.UNKNOWN_USER));
    }

    @Test
    void createUser_twice_secondIsRefused() {
        Orchestrator o = orchestrator();
        o.createUser("u1");

        assertThatThrownBy(() -> o.createUser("u1"))
                .isInstanceOfSatisfying(OrchestrationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(OrchestrationException.Kind.USER_EXISTS));
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void concurrentMessagesForOneUser_runStrictlyOneAtATime() throws Exception {
        seedProblemPhase("u1");
        for (int i = 0; i < 4; i++) {
            backend.then(() -> {
                pause(50);
                return "<result>" + PROBLEM_REJECTED + "</result>";
            });
        }
        Orchestrator o = orchestrator(true, Duration.ofSeconds(5));

        ExecutorService clients = Executors.newFixedThreadPool(4);
        try {
            List<Future<ChatReply>> replies = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String message = PROBLEM_TEXT + "Attempt " + i;
                replies.add(clients.submit(() -> o.chat("u1", message)));
            }
            for (Future<ChatReply> f : replies) {
                assertThat(f.get(10, TimeUnit.SECONDS).phase()).isEqualTo(Phase.PROBLEM_DEFINITION);
            }
        } finally {
            clients.shutdownNow();
        }

        assertThat(backend.maxConcurrentCalls()).isEqualTo(1);
        assertThat(backend.calls()).isEqualTo(4);
        assertThat(states.find("u1").orElseThrow().revisionsFor(Phase.PROBLEM_DEFINITION)).isEqualTo(4);

        // Each request's two entries are adjacent: no interleaving.
        List<ConversationEntry> entries = audit.entries("u1");
        assertThat(entries).hasSize(8);
        for (int i = 0; i < entries.size(); i += 2) {
            assertThat(entries.get(i).getActor()).isEqualTo(Actor.USER);
            assertThat(entries.get(i + 1).getRequestId()).isEqualTo(entries.get(i).getRequestId());
        }
    }

    @Test
    void duplicateSubmissionInFlight_producesOneTransition() throws Exception {
        seedProblemPhase("u1");
        CountDownLatch release = new CountDownLatch(1);
        backend.then(() -> {
            awaitQuietly(release);
            return "<result>" + PROBLEM_APPROVED + "</result>";
        });
        Orchestrator o = orchestrator(true, Duration.ofSeconds(5));

        ExecutorService clients = Executors.newFixedThreadPool(2);
        try {
            Future<ChatReply> first = clients.submit(() -> o.chat("u1", PROBLEM_TEXT));
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (backend.calls() == 0 && System.nanoTime() < deadline) {
                pause(10);
            }
            Future<ChatReply> second = clients.submit(() -> o.chat("u1", PROBLEM_TEXT));
            pause(200);
            release.countDown();

            ChatReply a = first.get(10, TimeUnit.SECONDS);
            ChatReply b = second.get(10, TimeUnit.SECONDS);
            assertThat(a.phase()).isEqualTo(Phase.SOLUTION_DESIGN);
            assertThat(b).isSameAs(a);
        } finally {
            clients.shutdownNow();
        }

        assertThat(backend.calls()).isEqualTo(1);
        assertThat(audit.transitions("u1")).hasSize(1);
        assertThat(audit.entries("u1")).hasSize(2);
    }

    // ------------------------------------------------------------------
    // Whole journey
    // ------------------------------------------------------------------

    @Test
    void fullJourney_onboardingToCompleted() {
        Orchestrator o = orchestrator();
        String submission = """
                I interviewed 12 shop owners and built a churn model with 74% precision.
                The dashboard now sends weekly alerts to three pilot stores.
                """;
        backend.result(PROPOSAL)
               .result(PROPOSAL_2)
               .result(PROBLEM_APPROVED)
               .result(SOLUTION_APPROVED)
               .result("""
                       {"milestones": [{"title": "Interviews"}, {"title": "Model"}, {"title": "Dashboard"}],
                        "next_action": "Book the first interview"}
                       """)
               .result(progress("Build the feature table"))
               .result(progress("Wire up the alerts"))
               .result(progress("Write the project summary"))
               .result("""
                       {"overall_score": 8, "overall_feedback": "Convincing results."}
                       """)
               .result("""
                       {"bullets": [{"text": "Built a churn model with 74% precision",
                                     "evidence": "built a churn model with 74% precision"}]}
                       """);

        o.chat("u1", "hi");
        o.chat("u1", "Product Manager");
        o.chat("u1", "Fintech");
        o.chat("u1", "skip");
        assertThat(o.chat("u1", "payments").phase()).isEqualTo(Phase.PROJECT_GENERATION);
        assertThat(o.chat("u1", "no, something else").text()).contains("Invoice nudger");
        assertThat(o.chat("u1", "yes").phase()).isEqualTo(Phase.PROBLEM_DEFINITION);
        assertThat(o.chat("u1", PROBLEM_TEXT).phase()).isEqualTo(Phase.SOLUTION_DESIGN);
        assertThat(o.chat("u1", SOLUTION_TEXT).phase()).isEqualTo(Phase.EXECUTION);
        assertThat(o.chat("u1", "ready to start").phase()).isEqualTo(Phase.EXECUTION);
        o.chat("u1", "interviews done");
        o.chat("u1", "model done");
        assertThat(o.chat("u1", "dashboard done").phase()).isEqualTo(Phase.REVIEW);
        assertThat(o.chat("u1", submission).phase()).isEqualTo(Phase.REVIEW);
        assertThat(o.chat("u1", "yes please").phase()).isEqualTo(Phase.COMPLETED);
        assertThat(o.chat("u1", "thanks").text()).contains("Invoice nudger");

        UserState s = states.find("u1").orElseThrow();
        assertThat(s.getBackground()).isEmpty();
        assertThat(s.getInterests()).isEqualTo("payments");
        assertThat(s.revisionsFor(Phase.PROJECT_GENERATION)).isEqualTo(1);
        assertThat(s.getMilestonesCompleted()).isEqualTo(3);
        assertThat(backend.calls()).isEqualTo(10);

        assertThat(audit.transitions("u1"))
                .allMatch(StateTransition::isAccepted)
                .extracting(StateTransition::getToState)
                .containsExactly(Phase.PROJECT_GENERATION, Phase.PROBLEM_DEFINITION, Phase.SOLUTION_DESIGN,
                        Phase.EXECUTION, Phase.REVIEW, Phase.COMPLETED);

        List<Artifact> projects = artifactStore.history("u1", ArtifactKind.PROJECT);
        assertThat(projects).hasSize(2);
        assertThat(projects.get(1).getSupersedesId()).isEqualTo(projects.get(0).getArtifactId());
        assertThat(projects.get(1).getRevision()).isEqualTo(2);
        assertThat(artifactStore.history("u1", ArtifactKind.MILESTONE_PLAN)).hasSize(4);
        assertThat(artifactStore.history("u1", ArtifactKind.RESUME_PACKAGE)).hasSize(1);
    }

    // ------------------------------------------------------------------
    // Review
    // ------------------------------------------------------------------

    @Test
    void declinedReview_allowsResubmissionThatSupersedesIt() {
        seedReviewPhase("u1");
        String first = "I built a churn model and a dashboard for three shops.";
        String second = """
                I interviewed 12 shop owners and built a churn model with 74% precision.
                Weekly alerts now reach three pilot stores.
                """;
        backend.result("""
                       {"overall_score": 5, "overall_feedback": "Thin on evidence."}
                       """)
               .result("""
                       {"overall_score": 8, "overall_feedback": "Convincing results."}
                       """)
               .result("""
                       {"bullets": [{"text": "Interviewed 12 shop owners to shape a churn model",
                                     "evidence": "interviewed 12 shop owners"}]}
                       """);
        Orchestrator o = orchestrator();

        assertThat(o.chat("u1", first).phase()).isEqualTo(Phase.REVIEW);
        assertThat(o.chat("u1", "no").phase()).isEqualTo(Phase.REVIEW);

        UserState afterDecline = states.find("u1").orElseThrow();
        assertThat(afterDecline.revisionsFor(Phase.REVIEW)).isEqualTo(1);
        assertThat(afterDecline.getReviewId()).isNull();

        assertThat(o.chat("u1", second).phase()).isEqualTo(Phase.REVIEW);
        assertThat(o.chat("u1", "yes").phase()).isEqualTo(Phase.COMPLETED);

        List<Artifact> reviews = artifactStore.history("u1", ArtifactKind.ARTIFACT_REVIEW);
        assertThat(reviews).hasSize(2);
        assertThat(reviews.get(1).getRevision()).isEqualTo(2);
        assertThat(reviews.get(1).getSupersedesId()).isEqualTo(reviews.get(0).getArtifactId());

        UserState done = states.find("u1").orElseThrow();
        assertThat(done.getReviewId()).isEqualTo(reviews.get(1).getArtifactId());
        assertThat(done.getResumeId()).isNotNull();
        assertThat(backend.calls()).isEqualTo(3);
    }

    // ------------------------------------------------------------------
    // Timestamps
    // ------------------------------------------------------------------

    @Test
    void timestamps_followTheInjectedClock() {
        Instant created = Instant.parse("2026-03-01T09:00:00Z");
        Instant later   = Instant.parse("2026-03-02T17:30:00Z");

        clock = Clock.fixed(created, ZoneOffset.UTC);
        orchestrator().createUser("u1");
        UserState fresh = states.find("u1").orElseThrow();
        assertThat(fresh.getCreatedAt()).isEqualTo(created);
        assertThat(fresh.getStateEnteredAt()).isEqualTo(created);
        assertThat(fresh.getLastActivityAt()).isEqualTo(created);

        clock = Clock.fixed(later, ZoneOffset.UTC);
        orchestrator().chat("u1", "hi");
        UserState active = states.find("u1").orElseThrow();
        assertThat(active.getLastActivityAt()).isEqualTo(later);
        assertThat(active.getCreatedAt()).isEqualTo(created);

        orchestrator().chat("u2", "hi");
        assertThat(states.find("u2").orElseThrow().getCreatedAt()).isEqualTo(later);
    }

    // ------------------------------------------------------------------
    // Fixtures
    // ------------------------------------------------------------------

    private void seedProblemPhase(String userId) {
        Artifact project = artifactStore.save(artifacts.prepare(userId, ArtifactKind.PROJECT,
                proposal(), 1, "seed"));
        UserState s = new UserState(userId);
        s.setCurrentState(Phase.PROBLEM_DEFINITION);
        s.setTargetRole("Product Manager");
        s.setTargetDomain("Fintech");
        s.setProjectId(project.getArtifactId());
        s.setProjectApproved(true);
        s.setAwaitingFeedback(true);
        states.put(s);
    }

    private void seedReviewPhase(String userId) {
        seedProblemPhase(userId);
        UserState s = states.find(userId).orElseThrow();
        s.setCurrentState(Phase.REVIEW);
        s.setPreviousState(Phase.EXECUTION);
        states.put(s);
    }

    private void seedSolutionPhase(String userId) {
        seedProblemPhase(userId);
        UserState s = states.find(userId).orElseThrow();
        Artifact problem = artifactStore.save(artifacts.prepare(userId, ArtifactKind.PROBLEM_DEFINITION,
                new ProblemDefinition(s.getProjectId(),
                        new ProblemDraft(
                                "Small retailers cannot predict churn", "shop owners", null, List.of()),
                        null),
                1, "seed"));
        s.setCurrentState(Phase.SOLUTION_DESIGN);
        s.setPreviousState(Phase.PROBLEM_DEFINITION);
        s.setProblemId(problem.getArtifactId());
        s.setProblemApproved(true);
        states.put(s);
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String scores(Object... kv) {
        StringBuilder sb = new StringBuilder("{\"scores\": {");
        for (int i = 0; i < kv.length; i += 2) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('"').append(kv[i]).append("\": ").append(kv[i + 1]);
        }
        return sb.append("}, \"feedback\": \"Scored against the rubric.\"}").toString();
    }

    private static String progress(String nextAction) {
        return "{\"milestone_status\": \"completed\", \"feedback\": \"Nice work.\", \"next_action\": \""
                + nextAction + "\"}";
    }

    private static ProjectProposal proposal() {
        try {
            ObjectMapper json = new ObjectMapper();
            return json.treeToValue(json.readTree(PROPOSAL).get("proposal"), ProjectProposal.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
