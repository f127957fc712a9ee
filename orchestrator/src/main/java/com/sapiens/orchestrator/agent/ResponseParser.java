package com.sapiens.orchestrator.agent;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the structured part out of a backend reply.
 *
 * Agents are told to wrap their JSON answer in {@code <result>...</result>}.
 * Models sometimes answer with a fenced ```json block instead; that is
 * accepted as a fallback.
 */
public class ResponseParser {

    // Matches <result>...</result>
    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    // Matches ```json ... ``` or ``` ... ``` (with optional language label)
    private static final Pattern JSON_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Extract the content of the first <result>...</result> tag.
     *
     * Example reply:
     *   "Here is my evaluation:
     *    <result>{"scores": {"clarity": 7}, "feedback": "..."}</result>"
     */
    public static Optional<String> extractResult(String response) {
        if (response == null) {
            return Optional.empty();
        }
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /** Extract the first fenced JSON block. */
    public static Optional<String> extractJsonBlock(String response) {
        if (response == null) {
            return Optional.empty();
        }
        Matcher m = JSON_BLOCK.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /** Result tag first, fenced JSON block second. */
    public static Optional<String> extractStructured(String response) {
        return extractResult(response).or(() -> extractJsonBlock(response));
    }
}
