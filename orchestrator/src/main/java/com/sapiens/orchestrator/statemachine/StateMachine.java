package com.sapiens.orchestrator.statemachine;

import com.sapiens.orchestrator.model.FieldName;
import com.sapiens.orchestrator.model.Phase;
import com.sapiens.orchestrator.model.UserState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

import static com.sapiens.orchestrator.model.FieldName.*;

/**
 * Pure decision logic for phase transitions.
 *
 * <pre>
 *   onboarding → project_generation → problem_definition → solution_design
 *     → execution → review → completed
 *
 *   revision edge: solution_design → problem_definition
 *                  (only after a NEEDS_REVISION verdict has unlocked it)
 * </pre>
 *
 * No I/O and no shared mutable state; every method is safe to call from any
 * thread. {@link #apply} works on a copy and never touches its argument.
 */
@Component
public class StateMachine {

    private static final Map<Phase, Set<FieldName>> REQUIRED = new EnumMap<>(Phase.class);
    private static final Map<Phase, Phase> REVISION_EDGES = new EnumMap<>(Phase.class);

    static {
        REQUIRED.put(Phase.ONBOARDING,         EnumSet.of(TARGET_ROLE, TARGET_DOMAIN));
        REQUIRED.put(Phase.PROJECT_GENERATION, EnumSet.of(PROJECT_ID, PROJECT_APPROVED));
        REQUIRED.put(Phase.PROBLEM_DEFINITION, EnumSet.of(PROBLEM_ID, PROBLEM_APPROVED));
        REQUIRED.put(Phase.SOLUTION_DESIGN,    EnumSet.of(SOLUTION_ID, SOLUTION_APPROVED));
        REQUIRED.put(Phase.EXECUTION,          EnumSet.of(MILESTONE_PLAN_ID, MILESTONES_COMPLETED));
        REQUIRED.put(Phase.REVIEW,             EnumSet.of(REVIEW_ID, RESUME_ID));
        REQUIRED.put(Phase.COMPLETED,          EnumSet.noneOf(FieldName.class));

        REVISION_EDGES.put(Phase.SOLUTION_DESIGN, Phase.PROBLEM_DEFINITION);
    }

    private final Clock clock;

    public StateMachine() {
        this(Clock.systemUTC());
    }

    public StateMachine(Clock clock) {
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Graph queries
    // ------------------------------------------------------------------

    public Set<FieldName> requiredFields(Phase phase) {
        return Collections.unmodifiableSet(REQUIRED.get(phase));
    }

    /** The phase after {@code phase} in the forward sequence; empty for COMPLETED. */
    public Optional<Phase> nextPhase(Phase phase) {
        if (phase.isTerminal()) {
            return Optional.empty();
        }
        return Optional.of(Phase.values()[phase.ordinal() + 1]);
    }

    /** The declared revision target of {@code phase}, if it has one. */
    public Optional<Phase> revisionTarget(Phase phase) {
        return Optional.ofNullable(REVISION_EDGES.get(phase));
    }

    public boolean isForwardEdge(Phase from, Phase to) {
        return nextPhase(from).map(to::equals).orElse(false);
    }

    public boolean isRevisionEdge(Phase from, Phase to) {
        return to == REVISION_EDGES.get(from);
    }

    /**
     * Edge check without a record: only forward edges qualify, since a
     * revision edge is legal only once a record has it unlocked.
     */
    public boolean canTransition(Phase from, Phase to) {
        return isForwardEdge(from, to);
    }

    /** Edge check against a record: forward edges, plus its unlocked revision edge. */
    public boolean canTransition(UserState state, Phase to) {
        Phase from = state.getCurrentState();
        return isForwardEdge(from, to)
                || (isRevisionEdge(from, to) && state.getUnlockedRevision() == to);
    }

    /** Required fields of the record's current phase that are not yet populated. */
    public Set<FieldName> missingFields(UserState state) {
        Set<FieldName> missing = EnumSet.noneOf(FieldName.class);
        for (FieldName f : REQUIRED.get(state.getCurrentState())) {
            if (!state.isPopulated(f)) {
                missing.add(f);
            }
        }
        return missing;
    }

    /** Targets {@link #apply} would accept for this record right now. */
    public List<Phase> validTargets(UserState state) {
        List<Phase> targets = new ArrayList<>();
        Phase from = state.getCurrentState();
        nextPhase(from).filter(n -> missingFields(state).isEmpty()).ifPresent(targets::add);
        revisionTarget(from).filter(r -> state.getUnlockedRevision() == r).ifPresent(targets::add);
        return targets;
    }

    // ------------------------------------------------------------------
    // Apply
    // ------------------------------------------------------------------

    /**
     * Move a copy of {@code state} to {@code to}.
     *
     * Forward edges require every field of the current phase to be populated;
     * revision edges require the record to have that edge unlocked. On success
     * the copy has previous/current state and entered-at updated, the
     * consecutive-revision streak reset and the unlocked edge cleared.
     *
     * @throws InvalidTransitionException if the edge is not allowed
     */
    public UserState apply(UserState state, Phase to) {
        Phase from = state.getCurrentState();

        if (isForwardEdge(from, to)) {
            Set<FieldName> missing = missingFields(state);
            if (!missing.isEmpty()) {
                throw new InvalidTransitionException(from, to,
                        InvalidTransitionException.Reason.MISSING_FIELDS, missing);
            }
        } else if (isRevisionEdge(from, to)) {
            if (state.getUnlockedRevision() != to) {
                throw new InvalidTransitionException(from, to,
                        InvalidTransitionException.Reason.REVISION_LOCKED, Set.of());
            }
        } else {
            throw new InvalidTransitionException(from, to,
                    InvalidTransitionException.Reason.NOT_AN_EDGE, Set.of());
        }

        UserState next = state.copy();
        next.setPreviousState(from);
        next.setCurrentState(to);
        next.setStateEnteredAt(Instant.now(clock));
        next.setConsecutiveRevisions(0);
        next.setUnlockedRevision(null);
        return next;
    }
}
