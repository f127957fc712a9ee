package com.sapiens.orchestrator.agent.impl;

import com.sapiens.orchestrator.agent.Agent;
import com.sapiens.orchestrator.agent.AgentContext;
import com.sapiens.orchestrator.agent.contract.EvaluationLens;
import com.sapiens.orchestrator.agent.contract.ResponseIntent;
import com.sapiens.orchestrator.agent.contract.ResponseIntent.*;
import com.sapiens.orchestrator.artifact.*;
import com.sapiens.orchestrator.model.FieldName;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a {@link ResponseIntent} into the text the user sees.
 *
 * Pure templating: no decisions, no state, no backend call. It is the only
 * component that writes user-facing prose.
 */
@Component
public class RelayAgent implements Agent<ResponseIntent, String> {

    @Override
    public String generate(ResponseIntent intent, AgentContext ctx) {
        if (intent instanceof Welcome)                  return welcome();
        if (intent instanceof AskProfile a)             return askProfile(a);
        if (intent instanceof PresentProposal p)        return proposal(p);
        if (intent instanceof ClarifyApproval c)        return clarify(c);
        if (intent instanceof ProblemPrompt p)          return problemPrompt(p);
        if (intent instanceof SolutionPrompt s)         return solutionPrompt(s);
        if (intent instanceof IncompleteSubmission i)   return incomplete(i);
        if (intent instanceof EvaluationFeedback f)     return evaluationFeedback(f);
        if (intent instanceof RevisionEdgeTaken r)      return revisionEdge(r);
        if (intent instanceof PresentPlan p)            return plan(p.plan());
        if (intent instanceof ProgressFeedback p)       return progress(p);
        if (intent instanceof ReviewRequest r)          return reviewRequest(r);
        if (intent instanceof ReviewResult r)           return reviewResult(r.review());
        if (intent instanceof ResubmitPrompt)           return resubmit();
        if (intent instanceof ResumeReady r)            return resume(r);
        if (intent instanceof Completed c)              return completed(c);
        if (intent instanceof AgentRetry)               return retry();
        if (intent instanceof MissingFields m)          return missingFields(m);
        throw new IllegalArgumentException("No template for " + intent.getClass().getSimpleName());
    }

    // ------------------------------------------------------------------
    // Onboarding
    // ------------------------------------------------------------------

    private String welcome() {
        return """
                Welcome to Sapiens! I'll guide you through building a portfolio project that recruiters notice.

                Over the next 2-3 weeks we will:
                1. Design a project tailored to your target role
                2. Define a meaningful problem to solve
                3. Design your solution
                4. Execute it milestone by milestone
                5. Turn the finished work into resume-ready content

                **What role are you targeting?** (e.g. Product Manager, Data Analyst, Marketing Associate)""";
    }

    private String askProfile(AskProfile a) {
        StringBuilder sb = new StringBuilder();
        if (a.acknowledged() != null && !a.acknowledged().isBlank()) {
            sb.append("Got it: ").append(a.acknowledged()).append(".\n\n");
        }
        sb.append("**").append(a.question()).append("**");
        if (a.skippable()) {
            sb.append(" (optional, reply \"skip\" to move on)");
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Project
    // ------------------------------------------------------------------

    private String proposal(PresentProposal p) {
        ProjectProposal proposal = p.proposal();
        StringBuilder sb = new StringBuilder();
        sb.append(p.regenerated()
                ? "Here's a different direction for you:\n\n"
                : "I've designed a project specifically for you:\n\n");
        sb.append("# ").append(proposal.title()).append("\n\n");
        sb.append("**Project Type:** ").append(proposal.projectType()).append("\n\n");
        if (proposal.whyRelevant() != null) {
            sb.append("**Why This Project:**\n").append(proposal.whyRelevant()).append("\n\n");
        }
        sb.append("**What You'll Build:**\n").append(proposal.description()).append("\n");

        if (!proposal.deliverables().isEmpty()) {
            sb.append("\n**Deliverables:**\n");
            int i = 1;
            for (Deliverable d : proposal.deliverables()) {
                sb.append(i++).append(". **").append(d.name()).append("**: ").append(d.description()).append("\n");
            }
        }
        if (!proposal.skillsDemonstrated().isEmpty()) {
            sb.append("\n**Skills You'll Demonstrate:**\n").append(bullets(proposal.skillsDemonstrated()));
        }
        sb.append("\n**Estimated Time:** ").append(proposal.estimatedDurationWeeks()).append(" weeks\n");
        if (proposal.recruiterAppeal() != null) {
            sb.append("\n**Why Recruiters Will Like It:**\n").append(proposal.recruiterAppeal()).append("\n");
        }
        sb.append("\n---\n\nDoes this project work for you? (yes / no)");
        return sb.toString();
    }

    private String clarify(ClarifyApproval c) {
        return "Sorry, I didn't catch that. " + c.question() + " Please answer **yes** or **no**.";
    }

    // ------------------------------------------------------------------
    // Problem / solution
    // ------------------------------------------------------------------

    private String problemPrompt(ProblemPrompt p) {
        String lead = p.projectTitle() == null
                ? "Now let's define the problem your project addresses."
                : "Now let's define the problem \"" + p.projectTitle() + "\" addresses.";
        return lead + """


                Please answer with these labelled sections:

                **Problem Statement:** what specific problem are you solving? (1-2 sentences)
                **Target Audience:** who experiences this problem?
                **Context:** why does it matter, and what is the situation today?
                **Success Metrics:** how will you know you've addressed it? (one per line)""";
    }

    private String solutionPrompt(SolutionPrompt s) {
        String lead = "Great! Now let's design your solution";
        if (s.problemStatement() != null) {
            lead += " to:\n> " + s.problemStatement();
        } else {
            lead += ".";
        }
        return lead + """


                Please answer with these labelled sections:

                **Approach:** your high-level approach (2-3 sentences)
                **Key Components:** the main parts of the solution (one per line)
                **Methodology:** methods, frameworks or processes you'll use
                **Expected Outcomes:** what the solution should achieve (one per line)
                **Resources:** tools, data or resources you need (optional)""";
    }

    private String incomplete(IncompleteSubmission i) {
        String what = i.lens() == EvaluationLens.PROBLEM ? "problem definition" : "solution design";
        return "Your " + what + " is missing a few parts I need before I can evaluate it:\n"
                + bullets(i.missingSections())
                + "\nPlease send it again with each section labelled.";
    }

    private String evaluationFeedback(EvaluationFeedback f) {
        Evaluation e = f.evaluation();
        String what = f.lens() == EvaluationLens.PROBLEM ? "problem definition" : "solution design";
        StringBuilder sb = new StringBuilder();
        if (e.approved()) {
            sb.append("Excellent! Your ").append(what).append(" is strong.\n\n");
        } else {
            sb.append("Good start! Your ").append(what).append(" needs some refinement.\n\n");
        }
        sb.append(e.feedback()).append("\n");
        if (!e.strengths().isEmpty()) {
            sb.append("\n**Strengths:**\n").append(bullets(e.strengths()));
        }
        if (!e.approved() && !e.improvementSuggestions().isEmpty()) {
            sb.append("\n**Suggestions:**\n").append(bullets(e.improvementSuggestions()));
        }
        sb.append("\n**Scores:**\n").append(scores(e.scores()));

        if (e.approved()) {
            sb.append("\n").append(f.lens() == EvaluationLens.PROBLEM
                    ? solutionPrompt(new SolutionPrompt(null))
                    : "You're ready to start execution! Send me any message and I'll build your milestone plan.");
        } else {
            sb.append("\nPlease revise your ").append(what).append(" and send it again (attempt ")
              .append(f.attempt() + 1).append(").");
        }
        return sb.toString();
    }

    private String revisionEdge(RevisionEdgeTaken r) {
        return "Your solution has needed revision " + r.streak() + " times in a row. "
                + "That usually means the problem itself needs sharpening, so let's go back to it.\n\n"
                + r.evaluation().feedback() + "\n\n"
                + problemPrompt(new ProblemPrompt(null));
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    private String plan(MilestonePlan plan) {
        StringBuilder sb = new StringBuilder("Here's your execution plan:\n");
        for (Milestone m : plan.milestones()) {
            sb.append("\n### ").append(m.order()).append(". ").append(m.title()).append("\n");
            if (m.description() != null) {
                sb.append("- **Goal:** ").append(m.description()).append("\n");
            }
            if (m.deliverable() != null) {
                sb.append("- **Deliverable:** ").append(m.deliverable()).append("\n");
            }
            sb.append("- **Estimated Time:** ").append(m.estimatedDays()).append(" days\n");
        }
        sb.append("\n**Total Estimated Time:** ").append(plan.totalEstimatedDays()).append(" days\n");
        sb.append("\n**Your next action:** ").append(plan.nextAction()).append("\n");
        sb.append("\nWhen you make progress, send me an update.");
        return sb.toString();
    }

    private String progress(ProgressFeedback p) {
        StringBuilder sb = new StringBuilder(p.feedback()).append("\n");
        if (p.stagnation()) {
            sb.append("\nIt looks like you might be stuck. Let's get you moving again.\n");
        }
        sb.append("\n**").append(p.milestoneTitle()).append(":** ").append(label(p.status().name())).append("\n");
        sb.append("**Progress:** ").append(p.completed()).append("/").append(p.total()).append(" milestones done\n");
        if (p.completed() < p.total()) {
            sb.append("\n**Your next action:** ").append(p.nextAction());
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Review / completion
    // ------------------------------------------------------------------

    private String reviewRequest(ReviewRequest r) {
        StringBuilder sb = new StringBuilder("Congratulations on finishing your milestones! Time for the final review.\n\n");
        sb.append("Please describe your final work");
        if (r.projectTitle() != null) {
            sb.append(" for \"").append(r.projectTitle()).append("\"");
        }
        sb.append(": what you built, links, results and numbers. ");
        sb.append("Your resume content will only use what you write here.\n");
        if (!r.evaluationCriteria().isEmpty()) {
            sb.append("\nIt will be reviewed against:\n").append(bullets(r.evaluationCriteria()));
        }
        return sb.toString();
    }

    private String reviewResult(ArtifactReview review) {
        StringBuilder sb = new StringBuilder("Here's my review of your work.\n\n");
        sb.append("**Overall Score:** ").append(score(review.overallScore())).append("/10\n\n");
        sb.append(review.overallFeedback()).append("\n");
        if (!review.criterionScores().isEmpty()) {
            sb.append("\n**By Criterion:**\n").append(scores(review.criterionScores()));
        }
        if (!review.strengths().isEmpty()) {
            sb.append("\n**Strengths:**\n").append(bullets(review.strengths()));
        }
        if (!review.areasForImprovement().isEmpty()) {
            sb.append("\n**Could Be Improved:**\n").append(bullets(review.areasForImprovement()));
        }
        sb.append("\nShall I generate your resume content from this work? (yes / no)");
        return sb.toString();
    }

    private String resubmit() {
        return "No problem. Improve your work and send me an updated description when you're ready.";
    }

    private String resume(ResumeReady r) {
        ResumePackage p = r.resume();
        StringBuilder sb = new StringBuilder("Your resume content is ready.\n\n");
        sb.append("**").append(p.projectTitle()).append("**");
        if (p.oneLiner() != null) {
            sb.append(": ").append(p.oneLiner());
        }
        sb.append("\n\n");
        for (ResumeBullet b : p.bullets()) {
            sb.append("- ").append(b.text()).append("\n");
        }
        if (!p.suggestedSkills().isEmpty()) {
            sb.append("\n**Skills to list:** ").append(String.join(", ", p.suggestedSkills())).append("\n");
        }
        if (!p.interviewTalkingPoints().isEmpty()) {
            sb.append("\n**Interview talking points:**\n").append(bullets(p.interviewTalkingPoints()));
        }
        if (r.discardedBullets() > 0) {
            sb.append("\n(").append(r.discardedBullets())
              .append(" suggested bullet(s) were left out because your submission didn't back them up.)\n");
        }
        return sb.toString();
    }

    private String completed(Completed c) {
        String what = c.projectTitle() == null ? "your project" : "\"" + c.projectTitle() + "\"";
        return "You've completed " + what + ". Your project, review and resume content are saved. "
                + "Good luck with your applications!";
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    private String retry() {
        return "Sorry, I couldn't finish that just now. Nothing was lost. Please send your last message again.";
    }

    private String missingFields(MissingFields m) {
        String fields = m.missing().stream()
                .map(FieldName::label)
                .sorted()
                .map(l -> l.replace('_', ' '))
                .collect(Collectors.joining(", "));
        return "We can't move on from " + m.phase().wireName().replace('_', ' ')
                + " yet. Still needed: " + fields + ".";
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String bullets(List<String> items) {
        return items.stream().map(s -> "- " + s + "\n").collect(Collectors.joining());
    }

    private static String scores(Map<String, Double> scores) {
        return scores.entrySet().stream()
                .map(e -> "- " + label(e.getKey()) + ": " + score(e.getValue()) + "/10\n")
                .collect(Collectors.joining());
    }

    private static String score(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.format(Locale.ROOT, "%.1f", value);
    }

    /** "market_relevance" → "Market Relevance" */
    private static String label(String snake) {
        String[] words = snake.toLowerCase(Locale.ROOT).split("_");
        StringBuilder sb = new StringBuilder();
        for (String w : words) {
            if (w.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1));
        }
        return sb.toString();
    }
}
