package com.sapiens.orchestrator.agent;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ResponseParser.
 *
 * Static helpers only: no Spring context, no mocks.
 */
class ResponseParserTest {

    // ------------------------------------------------------------------
    // extractResult
    // ------------------------------------------------------------------

    @Test
    void extractResult_withTag_returnsContent() {
        String response = """
                Here is my evaluation.
                <result>{"feedback": "clear problem"}</result>
                """;
        Optional<String> result = ResponseParser.extractResult(response);
        assertThat(result).contains("{\"feedback\": \"clear problem\"}");
    }

    @Test
    void extractResult_multiline_returnsFullJson() {
        String response = """
                <result>
                {
                  "milestones": [],
                  "next_action": "Draft the survey"
                }
                </result>
                """;
        assertThat(ResponseParser.extractResult(response)).isPresent()
                .get().asString().contains("next_action").startsWith("{").endsWith("}");
    }

    @Test
    void extractResult_noTag_returnsEmpty() {
        assertThat(ResponseParser.extractResult("I am thinking about it.")).isEmpty();
        assertThat(ResponseParser.extractResult(null)).isEmpty();
    }

    @Test
    void extractResult_twoTags_returnsFirst() {
        String response = "<result>{\"a\":1}</result> and <result>{\"b\":2}</result>";
        assertThat(ResponseParser.extractResult(response)).contains("{\"a\":1}");
    }

    // ------------------------------------------------------------------
    // extractStructured
    // ------------------------------------------------------------------

    @Test
    void extractStructured_fencedJsonOnly_fallsBackToBlock() {
        String response = """
                Sure:
                ```json
                {"title": "Churn dashboard"}
                ```
                """;
        assertThat(ResponseParser.extractStructured(response)).contains("{\"title\": \"Churn dashboard\"}");
    }

    @Test
    void extractStructured_tagAndBlock_prefersTag() {
        String response = """
                ```json
                {"from": "block"}
                ```
                <result>{"from": "tag"}</result>
                """;
        assertThat(ResponseParser.extractStructured(response)).contains("{\"from\": \"tag\"}");
    }
}
