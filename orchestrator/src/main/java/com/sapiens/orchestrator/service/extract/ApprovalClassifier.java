package com.sapiens.orchestrator.service.extract;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies a reply to a yes/no question.
 *
 * Short replies are matched exactly first; longer ones by keyword. A reply
 * with both affirmative and negative keywords ("yes but no...") is UNCLEAR.
 */
@Component
public class ApprovalClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "yes", "y", "yeah", "yep", "yup", "ok", "okay", "sure", "correct",
            "absolutely", "definitely", "approve", "approved", "proceed", "go ahead",
            "sounds good", "looks good", "let's go", "lets go", "let's do it", "i like it"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "n", "nope", "nah", "reject", "rejected", "not really", "no thanks",
            "no thank you", "something else", "try again", "another one"
    );

    private static final Pattern AFFIRMATIVE = Pattern.compile(
            "\\b(yes|yeah|yep|yup|ok|okay|sure|approve|approved|proceed|looks good|sounds good|love it|like it|go ahead|let'?s do it)\\b"
    );

    private static final Pattern NEGATIVE = Pattern.compile(
            "\\b(no|nope|nah|not|don'?t|reject|different|another|something else|change|instead)\\b"
    );

    public Approval classify(String reply) {
        if (reply == null || reply.isBlank()) {
            return Approval.UNCLEAR;
        }
        String normalized = reply.strip().toLowerCase(Locale.ROOT).replaceAll("[.!?]+$", "").strip();

        if (AFFIRMATIVE_EXACT.contains(normalized)) {
            return Approval.YES;
        }
        if (NEGATIVE_EXACT.contains(normalized)) {
            return Approval.NO;
        }

        boolean yes = AFFIRMATIVE.matcher(normalized).find();
        boolean no  = NEGATIVE.matcher(normalized).find();
        if (yes && !no) {
            return Approval.YES;
        }
        if (no && !yes) {
            return Approval.NO;
        }
        return Approval.UNCLEAR;
    }
}
