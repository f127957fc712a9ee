package com.sapiens.orchestrator.service.extract;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ApprovalClassifierTest {

    ApprovalClassifier classifier = new ApprovalClassifier();

    @ParameterizedTest
    @ValueSource(strings = {"yes", "Yes!", "  ok ", "sounds good", "Looks good, let's do it", "I like it."})
    void classify_affirmative_yes(String reply) {
        assertThat(classifier.classify(reply)).isEqualTo(Approval.YES);
    }

    @ParameterizedTest
    @ValueSource(strings = {"no", "Nope.", "something else", "I'd prefer a different project", "not for me"})
    void classify_negative_no(String reply) {
        assertThat(classifier.classify(reply)).isEqualTo(Approval.NO);
    }

    @ParameterizedTest
    @ValueSource(strings = {"maybe", "what does the roadmap look like?", "yes but not this one", ""})
    void classify_ambiguous_unclear(String reply) {
        assertThat(classifier.classify(reply)).isEqualTo(Approval.UNCLEAR);
    }

    @Test
    void classify_null_unclear() {
        assertThat(classifier.classify(null)).isEqualTo(Approval.UNCLEAR);
    }
}
