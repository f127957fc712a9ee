package com.sapiens.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * The single source of truth for one user's progress.
 *
 * Only the orchestrator mutates a UserState, and it always does so on a
 * {@link #copy()} so the loaded snapshot stays untouched until the ledger
 * commits. Agents never see this class.
 *
 * DB table: user_states  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "user_states")
public class UserState {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_state", nullable = false)
    private Phase currentState = Phase.ONBOARDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_state")
    private Phase previousState;

    @Column(name = "state_entered_at", nullable = false)
    private Instant stateEnteredAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // Onboarding profile. An empty string means the user skipped the question.
    @Column(name = "target_role", columnDefinition = "TEXT")
    private String targetRole;

    @Column(name = "target_domain", columnDefinition = "TEXT")
    private String targetDomain;

    @Column(columnDefinition = "TEXT")
    private String background;

    @Column(columnDefinition = "TEXT")
    private String interests;

    // Ids of the active (latest) artifact of each kind.
    @Column(name = "project_id")
    private String projectId;

    @Column(name = "problem_id")
    private String problemId;

    @Column(name = "solution_id")
    private String solutionId;

    @Column(name = "milestone_plan_id")
    private String milestonePlanId;

    @Column(name = "review_id")
    private String reviewId;

    @Column(name = "resume_id")
    private String resumeId;

    @Column(name = "project_approved", nullable = false)
    private boolean projectApproved;

    @Column(name = "problem_approved", nullable = false)
    private boolean problemApproved;

    @Column(name = "solution_approved", nullable = false)
    private boolean solutionApproved;

    // True once we have shown a prompt or proposal and wait for the user's answer.
    @Column(name = "awaiting_feedback", nullable = false)
    private boolean awaitingFeedback;

    @Column(name = "milestones_completed", nullable = false)
    private int milestonesCompleted;

    @Column(name = "total_milestones", nullable = false)
    private int totalMilestones;

    // NEEDS_REVISION verdicts (or rejected proposals) per phase, never reset.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_state_revisions", joinColumns = @JoinColumn(name = "user_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "phase")
    @Column(name = "revisions", nullable = false)
    private Map<Phase, Integer> revisionCounters = new HashMap<>();

    // NEEDS_REVISION verdicts in a row since the current phase was entered.
    @Column(name = "consecutive_revisions", nullable = false)
    private int consecutiveRevisions;

    // Target of the revision edge a NEEDS_REVISION verdict has unlocked, if any.
    @Enumerated(EnumType.STRING)
    @Column(name = "unlocked_revision")
    private Phase unlockedRevision;

    @Version
    private Long version;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected UserState() {}   // required by JPA

    public UserState(String userId) {
        this(userId, Instant.now());
    }

    /** A fresh journey in onboarding, with every timestamp set to {@code now}. */
    public UserState(String userId, Instant now) {
        this.userId         = userId;
        this.stateEnteredAt = now;
        this.lastActivityAt = now;
        this.createdAt      = now;
    }

    /**
     * Detached field-by-field copy, including the optimistic-lock version so
     * that saving the copy updates the original row.
     */
    public UserState copy() {
        UserState c = new UserState(userId);
        c.currentState         = currentState;
        c.previousState        = previousState;
        c.stateEnteredAt       = stateEnteredAt;
        c.lastActivityAt       = lastActivityAt;
        c.createdAt            = createdAt;
        c.targetRole           = targetRole;
        c.targetDomain         = targetDomain;
        c.background           = background;
        c.interests            = interests;
        c.projectId            = projectId;
        c.problemId            = problemId;
        c.solutionId           = solutionId;
        c.milestonePlanId      = milestonePlanId;
        c.reviewId             = reviewId;
        c.resumeId             = resumeId;
        c.projectApproved      = projectApproved;
        c.problemApproved      = problemApproved;
        c.solutionApproved     = solutionApproved;
        c.awaitingFeedback     = awaitingFeedback;
        c.milestonesCompleted  = milestonesCompleted;
        c.totalMilestones      = totalMilestones;
        c.revisionCounters     = new HashMap<>(revisionCounters);
        c.consecutiveRevisions = consecutiveRevisions;
        c.unlockedRevision     = unlockedRevision;
        c.version              = version;
        return c;
    }

    /** Whether a required field counts as set for the state machine. */
    public boolean isPopulated(FieldName field) {
        return switch (field) {
            case TARGET_ROLE          -> hasText(targetRole);
            case TARGET_DOMAIN        -> hasText(targetDomain);
            case PROJECT_ID           -> projectId != null;
            case PROJECT_APPROVED     -> projectApproved;
            case PROBLEM_ID           -> problemId != null;
            case PROBLEM_APPROVED     -> problemApproved;
            case SOLUTION_ID          -> solutionId != null;
            case SOLUTION_APPROVED    -> solutionApproved;
            case MILESTONE_PLAN_ID    -> milestonePlanId != null;
            case MILESTONES_COMPLETED -> totalMilestones > 0 && milestonesCompleted >= totalMilestones;
            case REVIEW_ID            -> reviewId != null;
            case RESUME_ID            -> resumeId != null;
        };
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    // ------------------------------------------------------------------
    // Revision bookkeeping
    // ------------------------------------------------------------------

    public int revisionsFor(Phase phase) {
        return revisionCounters.getOrDefault(phase, 0);
    }

    /** Count one more revision in the current phase and extend the streak. */
    public void recordRevision() {
        revisionCounters.merge(currentState, 1, Integer::sum);
        consecutiveRevisions++;
    }

    public Map<Phase, Integer> getRevisionCounters() {
        Map<Phase, Integer> view = new EnumMap<>(Phase.class);
        view.putAll(revisionCounters);
        return view;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String  getUserId()               { return userId; }
    public Phase   getCurrentState()         { return currentState; }
    public Phase   getPreviousState()        { return previousState; }
    public Instant getStateEnteredAt()       { return stateEnteredAt; }
    public Instant getLastActivityAt()       { return lastActivityAt; }
    public Instant getCreatedAt()            { return createdAt; }
    public Long    getVersion()              { return version; }

    public void setCurrentState(Phase currentState)     { this.currentState = currentState; }
    public void setPreviousState(Phase previousState)   { this.previousState = previousState; }
    public void setStateEnteredAt(Instant v)            { this.stateEnteredAt = v; }
    public void setLastActivityAt(Instant v)            { this.lastActivityAt = v; }
    public void setVersion(Long version)                { this.version = version; }

    public String getTargetRole()                       { return targetRole; }
    public void setTargetRole(String v)                 { this.targetRole = v; }
    public String getTargetDomain()                     { return targetDomain; }
    public void setTargetDomain(String v)               { this.targetDomain = v; }
    public String getBackground()                       { return background; }
    public void setBackground(String v)                 { this.background = v; }
    public String getInterests()                        { return interests; }
    public void setInterests(String v)                  { this.interests = v; }

    public String getProjectId()                        { return projectId; }
    public void setProjectId(String v)                  { this.projectId = v; }
    public String getProblemId()                        { return problemId; }
    public void setProblemId(String v)                  { this.problemId = v; }
    public String getSolutionId()                       { return solutionId; }
    public void setSolutionId(String v)                 { this.solutionId = v; }
    public String getMilestonePlanId()                  { return milestonePlanId; }
    public void setMilestonePlanId(String v)            { this.milestonePlanId = v; }
    public String getReviewId()                         { return reviewId; }
    public void setReviewId(String v)                   { this.reviewId = v; }
    public String getResumeId()                         { return resumeId; }
    public void setResumeId(String v)                   { this.resumeId = v; }

    public boolean isProjectApproved()                  { return projectApproved; }
    public void setProjectApproved(boolean v)           { this.projectApproved = v; }
    public boolean isProblemApproved()                  { return problemApproved; }
    public void setProblemApproved(boolean v)           { this.problemApproved = v; }
    public boolean isSolutionApproved()                 { return solutionApproved; }
    public void setSolutionApproved(boolean v)          { this.solutionApproved = v; }
    public boolean isAwaitingFeedback()                 { return awaitingFeedback; }
    public void setAwaitingFeedback(boolean v)          { this.awaitingFeedback = v; }

    public int  getMilestonesCompleted()                { return milestonesCompleted; }
    public void setMilestonesCompleted(int v)           { this.milestonesCompleted = v; }
    public int  getTotalMilestones()                    { return totalMilestones; }
    public void setTotalMilestones(int v)               { this.totalMilestones = v; }

    public int  getConsecutiveRevisions()               { return consecutiveRevisions; }
    public void setConsecutiveRevisions(int v)          { this.consecutiveRevisions = v; }
    public Phase getUnlockedRevision()                  { return unlockedRevision; }
    public void setUnlockedRevision(Phase v)            { this.unlockedRevision = v; }
}
