package com.sapiens.orchestrator.service.handler;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class OnboardingHandlerTest {

    @ParameterizedTest
    @ValueSource(strings = {"skip", "Skip.", "none", "N/A", "nothing!", "  pass  "})
    void optional_skipWords_storeEmptyAnswer(String answer) {
        assertThat(OnboardingHandler.optional(answer)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"payments", "No-code tools", "nothing fancy, mostly SQL"})
    void optional_realAnswers_areKeptStripped(String answer) {
        assertThat(OnboardingHandler.optional("  " + answer + " ")).isEqualTo(answer);
    }
}
