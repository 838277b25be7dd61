package com.phillippitts.callcopilot.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * End-of-call summary produced from the full transcript.
 *
 * @param issue        what the caller wanted
 * @param resolution   what was done
 * @param nextSteps    follow-up actions
 * @param dispositions taxonomy codes, never empty
 * @param confidence   overall confidence in [0.0, 1.0]
 */
public record DispositionSummary(String issue, String resolution, String nextSteps,
                                 List<Disposition> dispositions, double confidence) {

    static final String NO_NOTES = "No notes generated.";

    public DispositionSummary {
        issue = issue == null ? "" : issue;
        resolution = resolution == null ? "" : resolution;
        nextSteps = nextSteps == null ? "" : nextSteps;
        Objects.requireNonNull(dispositions, "Dispositions must not be null");
        dispositions = dispositions.isEmpty()
                ? List.of(new Disposition(Disposition.GENERAL_INQUIRY, 0.5, null))
                : List.copyOf(dispositions);
        confidence = Math.min(1.0, Math.max(0.0, confidence));
    }

    /**
     * Summary used when analysis is impossible: low confidence, review manually.
     */
    public static DispositionSummary fallback() {
        return new DispositionSummary(
                "Unable to analyze transcript.",
                "Please review the call transcript manually.",
                "Review call details and assign appropriate disposition.",
                List.of(new Disposition(Disposition.GENERAL_INQUIRY, 0.1, null)),
                0.1);
    }

    /**
     * Agent notes: the non-blank sections separated by blank lines.
     */
    public String notes() {
        List<String> parts = new ArrayList<>(3);
        for (String part : List.of(issue, resolution, nextSteps)) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts.isEmpty() ? NO_NOTES : String.join("\n\n", parts);
    }
}
