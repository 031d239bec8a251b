package com.williamcallahan.facesearch.domain;

import java.util.List;

/**
 * Summary of a regeneration run.
 *
 * <p>{@code success + failed == total}, where {@code total} counts the candidates actually
 * processed (fewer than selected when the run was interrupted).</p>
 *
 * @param total candidates processed
 * @param success candidates that ended with an extracted descriptor
 * @param failed candidates stored as pending or that raised an error
 * @param errors one message per failure category
 * @param interrupted whether the run stopped before its last batch
 */
public record RegenerationReport(int total, int success, int failed, List<String> errors, boolean interrupted) {

    public RegenerationReport {
        if (success + failed != total) {
            throw new IllegalArgumentException(
                    "Inconsistent regeneration counts: " + success + " + " + failed + " != " + total);
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** Report for a run with nothing to process. */
    public static RegenerationReport empty() {
        return new RegenerationReport(0, 0, 0, List.of(), false);
    }
}
