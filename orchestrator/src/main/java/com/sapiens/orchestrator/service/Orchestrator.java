package com.sapiens.orchestrator.service;

import com.sapiens.orchestrator.agent.AgentContext;
import com.sapiens.orchestrator.agent.AgentGatewayFactory;
import com.sapiens.orchestrator.agent.contract.ResponseIntent;
import com.sapiens.orchestrator.agent.impl.RelayAgent;
import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.ConversationEntry;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.model.StateTransition;
import com.sapiens.orchestrator.model.UserState;
import com.sapiens.orchestrator.service.handler.HandlerOutcome;
import com.sapiens.orchestrator.service.handler.PhaseHandler;
import com.sapiens.orchestrator.service.handler.Turn;
import com.sapiens.orchestrator.statemachine.InvalidTransitionException;
import com.sapiens.orchestrator.statemachine.StateMachine;
import com.sapiens.orchestrator.store.UserStateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Sole coordinator of a chat request.
 *
 * Per message:
 *  1. Validate the request shape
 *  2. Pass the per-user single-flight gate
 *  3. Load (or lazily create) the user's state
 *  4. Run the handler of the current phase on a working copy; the handler
 *     gets a gateway that allows at most one agent call
 *  5. Validate a proposed transition with the state machine
 *  6. Store state, transition, artifacts and conversation entries in one
 *     ledger commit, then return the rendered reply
 *
 * Nothing is returned to the caller before step 6 has succeeded.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final String MDC_USER    = "userId";
    static final String MDC_REQUEST = "requestId";
    static final String MDC_PHASE   = "phase";

    private final UserRequestGate      gate;
    private final UserStateStore       states;
    private final StateMachine         stateMachine;
    private final AgentGatewayFactory  gateways;
    private final RelayAgent           relay;
    private final JourneyArtifacts     artifacts;
    private final JourneyLedger        ledger;
    private final MeterRegistry        meters;
    private final Map<Phase, PhaseHandler> handlers = new EnumMap<>(Phase.class);
    private final boolean autoCreateUsers;
    private final int     maxMessageLength;
    private final Clock   clock;

    public Orchestrator(UserRequestGate gate,
                        UserStateStore states,
                        StateMachine stateMachine,
                        AgentGatewayFactory gateways,
                        RelayAgent relay,
                        JourneyArtifacts artifacts,
                        JourneyLedger ledger,
                        List<PhaseHandler> phaseHandlers,
                        MeterRegistry meters,
                        @Value("${sapiens.users.auto-create:true}") boolean autoCreateUsers,
                        @Value("${sapiens.chat.max-message-length:8000}") int maxMessageLength) {
        this(gate, states, stateMachine, gateways, relay, artifacts, ledger, phaseHandlers, meters,
                autoCreateUsers, maxMessageLength, Clock.systemUTC());
    }

    Orchestrator(UserRequestGate gate,
                 UserStateStore states,
                 StateMachine stateMachine,
                 AgentGatewayFactory gateways,
                 RelayAgent relay,
                 JourneyArtifacts artifacts,
                 JourneyLedger ledger,
                 List<PhaseHandler> phaseHandlers,
                 MeterRegistry meters,
                 boolean autoCreateUsers,
                 int maxMessageLength,
                 Clock clock) {
        this.gate             = gate;
        this.states           = states;
        this.stateMachine     = stateMachine;
        this.gateways         = gateways;
        this.relay            = relay;
        this.artifacts        = artifacts;
        this.ledger           = ledger;
        this.meters           = meters;
        this.autoCreateUsers  = autoCreateUsers;
        this.maxMessageLength = maxMessageLength;
        this.clock            = clock;

        for (PhaseHandler h : phaseHandlers) {
            PhaseHandler previous = handlers.put(h.phase(), h);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for phase " + h.phase().wireName() + ": "
                        + previous.getClass().getSimpleName() + ", " + h.getClass().getSimpleName());
            }
        }
        for (Phase p : Phase.values()) {
            if (!handlers.containsKey(p)) {
                throw new IllegalStateException("No handler for phase " + p.wireName());
            }
        }
    }

    // ------------------------------------------------------------------
    // Chat
    // ------------------------------------------------------------------

    public ChatReply chat(String userId, String message) {
        validate(userId, message);
        String requestId = UUID.randomUUID().toString();
        try {
            return gate.execute(userId, message, () -> process(userId, message, requestId));
        } catch (OrchestrationException e) {
            throw e.attachRequestId(requestId);
        }
    }

    /** Explicit registration; fails if the user already has state. */
    public UserState createUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new OrchestrationException(OrchestrationException.Kind.VALIDATION_FAILURE, "user_id is required");
        }
        try {
            if (states.exists(userId)) {
                throw new OrchestrationException(OrchestrationException.Kind.USER_EXISTS,
                        "user " + userId + " already exists");
            }
            UserState created = ledger.create(new UserState(userId, Instant.now(clock)));
            log.info("Created user {}", userId);
            return created;
        } catch (DataIntegrityViolationException e) {
            // Lost a creation race with another request for the same id.
            throw new OrchestrationException(OrchestrationException.Kind.USER_EXISTS,
                    "user " + userId + " already exists", e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Could not create user {}", userId, e);
            throw new OrchestrationException(OrchestrationException.Kind.PERSISTENCE_FAILURE,
                    "could not store the new user", e);
        }
    }

    // ------------------------------------------------------------------
    // Request processing
    // ------------------------------------------------------------------

    private void validate(String userId, String message) {
        if (userId == null || userId.isBlank()) {
            throw new OrchestrationException(OrchestrationException.Kind.VALIDATION_FAILURE, "user_id is required");
        }
        if (message == null || message.isBlank()) {
            throw new OrchestrationException(OrchestrationException.Kind.VALIDATION_FAILURE, "message is required");
        }
        if (message.length() > maxMessageLength) {
            throw new OrchestrationException(OrchestrationException.Kind.VALIDATION_FAILURE,
                    "message is longer than " + maxMessageLength + " characters");
        }
    }

    private ChatReply process(String userId, String message, String requestId) {
        MDC.put(MDC_USER, userId);
        MDC.put(MDC_REQUEST, requestId);
        try {
            UserState stored = loadOrCreate(userId);
            Phase phase = stored.getCurrentState();
            MDC.put(MDC_PHASE, phase.wireName());

            AgentContext ctx = new AgentContext(requestId, userId, phase);
            Turn turn = new Turn(requestId, message, stored.copy(), gateways.open(ctx), artifacts);
            HandlerOutcome outcome = runHandler(phase, turn);

            if (outcome instanceof HandlerOutcome.Stay stay) {
                return stay(turn, ctx, stay);
            }
            if (outcome instanceof HandlerOutcome.Advance advance) {
                return advance(turn, ctx, advance);
            }
            return agentFailed(ctx, (HandlerOutcome.AgentFailed) outcome);
        } finally {
            MDC.remove(MDC_PHASE);
            MDC.remove(MDC_REQUEST);
            MDC.remove(MDC_USER);
        }
    }

    private UserState loadOrCreate(String userId) {
        try {
            return states.find(userId).orElseGet(() -> {
                if (!autoCreateUsers) {
                    throw new OrchestrationException(OrchestrationException.Kind.UNKNOWN_USER,
                            "no journey for user " + userId);
                }
                log.info("First contact from {}, starting a new journey", userId);
                return new UserState(userId, Instant.now(clock));
            });
        } catch (DataAccessException e) {
            log.error("Could not load state for user {}", userId, e);
            throw new OrchestrationException(OrchestrationException.Kind.PERSISTENCE_FAILURE,
                    "could not load the user's state", e);
        }
    }

    private HandlerOutcome runHandler(Phase phase, Turn turn) {
        PhaseHandler handler = handlers.get(phase);
        try {
            return handler.handle(turn);
        } catch (OrchestrationException e) {
            throw e;
        } catch (DataAccessException e) {
            log.error("Storage read failed in {} handler", phase.wireName(), e);
            throw new OrchestrationException(OrchestrationException.Kind.PERSISTENCE_FAILURE,
                    "could not read the user's artifacts", e);
        } catch (RuntimeException e) {
            log.error("Handler {} failed unexpectedly", handler.getClass().getSimpleName(), e);
            throw new OrchestrationException(OrchestrationException.Kind.INTERNAL_FAILURE,
                    "unexpected failure in phase " + phase.wireName(), e);
        }
    }

    // ------------------------------------------------------------------
    // Outcomes
    // ------------------------------------------------------------------

    private ChatReply stay(Turn turn, AgentContext ctx, HandlerOutcome.Stay stay) {
        Phase phase = ctx.phase();
        UserState working = turn.state();
        working.setLastActivityAt(Instant.now(clock));

        String text = render(stay.reply(), ctx);
        commit(new JourneyLedger.Commit(working, null, turn.stagedArtifacts(), List.of(
                ConversationEntry.fromUser(ctx.userId(), turn.message(), phase, ctx.requestId()),
                ConversationEntry.fromAgent(ctx.userId(), AgentCapability.RELAY.agentName(), text, phase, ctx.requestId())
        )), ctx, null);
        return new ChatReply(ctx.userId(), text, phase, ChatReply.Outcome.ANSWERED);
    }

    private ChatReply advance(Turn turn, AgentContext ctx, HandlerOutcome.Advance advance) {
        Phase from = ctx.phase();
        Phase to   = advance.target();

        UserState next;
        try {
            next = stateMachine.apply(turn.state(), to);
        } catch (InvalidTransitionException e) {
            return rejected(turn, ctx, advance, e);
        }
        next.setLastActivityAt(Instant.now(clock));

        String text = render(advance.reply(), ctx);
        commit(new JourneyLedger.Commit(next,
                new StateTransition(ctx.userId(), from, to, true, advance.reason(), ctx.requestId()),
                turn.stagedArtifacts(),
                List.of(
                        ConversationEntry.fromUser(ctx.userId(), turn.message(), from, ctx.requestId()),
                        ConversationEntry.fromAgent(ctx.userId(), AgentCapability.RELAY.agentName(), text, to, ctx.requestId())
                )), ctx, to);

        countTransition(from, to, true);
        log.info("Transition {} -> {} ({})", from.wireName(), to.wireName(), advance.reason());
        return new ChatReply(ctx.userId(), text, to, ChatReply.Outcome.ANSWERED);
    }

    /** The state stays as stored; only the rejection and the exchange are recorded. */
    private ChatReply rejected(Turn turn, AgentContext ctx, HandlerOutcome.Advance advance,
                               InvalidTransitionException e) {
        Phase from = ctx.phase();
        log.warn("Transition {} -> {} rejected: {}", from.wireName(), advance.target().wireName(), e.auditReason());

        ResponseIntent fallback = advance.fallback() != null
                ? advance.fallback()
                : new ResponseIntent.MissingFields(from, e.getMissingFields());
        String text = render(fallback, ctx);
        commit(new JourneyLedger.Commit(null,
                new StateTransition(ctx.userId(), from, advance.target(), false, e.auditReason(), ctx.requestId()),
                List.of(),
                List.of(
                        ConversationEntry.fromUser(ctx.userId(), turn.message(), from, ctx.requestId()),
                        ConversationEntry.fromAgent(ctx.userId(), AgentCapability.RELAY.agentName(), text, from, ctx.requestId())
                )), ctx, advance.target());

        countTransition(from, advance.target(), false);
        return new ChatReply(ctx.userId(), text, from, ChatReply.Outcome.ANSWERED);
    }

    /** One entry records the failure; the state is not touched. */
    private ChatReply agentFailed(AgentContext ctx, HandlerOutcome.AgentFailed failed) {
        log.warn("Agent {} failed for this request: {}", failed.capability().agentName(), failed.detail());
        commit(new JourneyLedger.Commit(null, null, List.of(), List.of(
                ConversationEntry.fromAgent(ctx.userId(), failed.capability().agentName(),
                        "agent_failure: " + failed.detail(), ctx.phase(), ctx.requestId())
        )), ctx, null);

        String text = render(new ResponseIntent.AgentRetry(failed.capability()), ctx);
        return new ChatReply(ctx.userId(), text, ctx.phase(), ChatReply.Outcome.RETRY);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String render(ResponseIntent intent, AgentContext ctx) {
        try {
            return relay.generate(intent, ctx);
        } catch (RuntimeException e) {
            log.error("No rendering for {}", intent.getClass().getSimpleName(), e);
            throw new OrchestrationException(OrchestrationException.Kind.INTERNAL_FAILURE,
                    "could not render the reply", e);
        }
    }

    private void commit(JourneyLedger.Commit commit, AgentContext ctx, Phase intendedTarget) {
        try {
            ledger.commit(commit);
        } catch (DataAccessException | TransactionException e) {
            log.error("Persistence failure: user={} request={} phase={} intended={}",
                    ctx.userId(), ctx.requestId(), ctx.phase().wireName(),
                    intendedTarget == null ? "none" : intendedTarget.wireName(), e);
            throw new OrchestrationException(OrchestrationException.Kind.PERSISTENCE_FAILURE,
                    "could not store the outcome of this request", e);
        }
    }

    private void countTransition(Phase from, Phase to, boolean accepted) {
        Counter.builder("sapiens.transitions")
                .tag("from", from.wireName())
                .tag("to", to.wireName())
                .tag("accepted", String.valueOf(accepted))
                .register(meters)
                .increment();
    }
}
