package com.sapiens.orchestrator.service.extract;

import java.util.List;

/**
 * A user submission split into a typed draft. {@code missing} names the
 * required sections that were absent or too thin; the draft is only worth
 * evaluating when it is empty.
 */
public record ParsedSubmission<T>(T draft, List<String> missing) {

    public ParsedSubmission {
        missing = List.copyOf(missing);
    }

    public boolean isComplete() {
        return missing.isEmpty();
    }
}
