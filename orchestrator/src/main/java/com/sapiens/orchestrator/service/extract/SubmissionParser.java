package com.sapiens.orchestrator.service.extract;

import com.sapiens.orchestrator.artifact.ProblemDraft;
import com.sapiens.orchestrator.artifact.SolutionDraft;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a free-text problem or solution submission into labelled sections.
 *
 * A section starts at a line such as {@code "Target Audience: ..."},
 * {@code "**Approach**: ..."} or {@code "2. Methodology - ..."} and runs until
 * the next recognised label. Text before the first label counts as the
 * leading section (problem statement / approach).
 *
 * Only the leading section and one supporting section are required; the
 * rest are optional.
 */
@Component
public class SubmissionParser {

    static final int MIN_LEAD_CHARS = 20;

    // Section name → accepted labels (lower case).
    private static final Map<String, List<String>> PROBLEM_LABELS = orderedMap(
            "problem statement", List.of("problem statement", "problem", "statement"),
            "target audience",   List.of("target audience", "audience", "target users", "who"),
            "context",           List.of("context", "problem context", "why it matters", "background"),
            "success metrics",   List.of("success metrics", "metrics", "success criteria", "kpis")
    );

    private static final Map<String, List<String>> SOLUTION_LABELS = orderedMap(
            "approach",          List.of("solution approach", "approach", "solution"),
            "key components",    List.of("key components", "components"),
            "methodology",       List.of("methodology", "methods", "method"),
            "expected outcomes", List.of("expected outcomes", "outcomes", "results"),
            "resources",         List.of("resource requirements", "resources", "tools")
    );

    private static final Pattern LABEL_LINE = Pattern.compile(
            "^\\s*(?:[-*•]\\s*)?(?:\\d+[.)]\\s*)?(?:\\*\\*|__)?\\s*([A-Za-z][A-Za-z' ]{1,40}?)\\s*(?:\\*\\*|__)?\\s*(?:\\([^)]*\\))?\\s*[:\\-–—]\\s*(?:\\*\\*|__)?\\s*(.*)$"
    );

    // Bullet and number markers first so "\n- item" is consumed as one separator.
    private static final Pattern LIST_SPLIT = Pattern.compile("(?:^|\\s)[-*•]\\s+|(?:^|\\s)\\d+[.)]\\s+|\\n|;");

    public ParsedSubmission<ProblemDraft> parseProblem(String text) {
        Map<String, String> sections = split(text, PROBLEM_LABELS, "problem statement");
        ProblemDraft draft = new ProblemDraft(
                sections.get("problem statement"),
                sections.get("target audience"),
                sections.get("context"),
                toList(sections.get("success metrics")));

        List<String> missing = new ArrayList<>();
        if (tooShort(draft.problemStatement())) missing.add("problem statement");
        if (isBlank(draft.targetAudience()))    missing.add("target audience");
        return new ParsedSubmission<>(draft, missing);
    }

    public ParsedSubmission<SolutionDraft> parseSolution(String text) {
        Map<String, String> sections = split(text, SOLUTION_LABELS, "approach");
        SolutionDraft draft = new SolutionDraft(
                sections.get("approach"),
                toList(sections.get("key components")),
                sections.get("methodology"),
                toList(sections.get("expected outcomes")),
                sections.get("resources"));

        List<String> missing = new ArrayList<>();
        if (tooShort(draft.solutionApproach())) missing.add("approach");
        if (draft.keyComponents().isEmpty())    missing.add("key components");
        return new ParsedSubmission<>(draft, missing);
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private Map<String, String> split(String text, Map<String, List<String>> labels, String leadSection) {
        Map<String, StringBuilder> acc = new LinkedHashMap<>();
        String current = leadSection;

        for (String line : text.split("\\R")) {
            Matcher m = LABEL_LINE.matcher(line);
            String section = m.matches() ? sectionFor(m.group(1), labels) : null;
            if (section != null) {
                current = section;
                append(acc, current, m.group(2));
            } else {
                append(acc, current, line);
            }
        }

        Map<String, String> out = new HashMap<>();
        acc.forEach((k, v) -> {
            String s = v.toString().strip();
            if (!s.isEmpty()) {
                out.put(k, s);
            }
        });
        return out;
    }

    private static String sectionFor(String rawLabel, Map<String, List<String>> labels) {
        String label = rawLabel.strip().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> e : labels.entrySet()) {
            if (e.getValue().contains(label)) {
                return e.getKey();
            }
        }
        return null;
    }

    private static void append(Map<String, StringBuilder> acc, String section, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        StringBuilder sb = acc.computeIfAbsent(section, k -> new StringBuilder());
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(text.strip());
    }

    static List<String> toList(String section) {
        if (section == null || section.isBlank()) {
            return List.of();
        }
        return Arrays.stream(LIST_SPLIT.split(section))
                .map(String::strip)
                .map(s -> s.replaceAll("^[,.]+|[,.]+$", "").strip())
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static boolean tooShort(String s) {
        return s == null || s.strip().length() < MIN_LEAD_CHARS;
    }

    private static Map<String, List<String>> orderedMap(Object... kv) {
        Map<String, List<String>> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> v = (List<String>) kv[i + 1];
            m.put((String) kv[i], v);
        }
        return Collections.unmodifiableMap(m);
    }
}
