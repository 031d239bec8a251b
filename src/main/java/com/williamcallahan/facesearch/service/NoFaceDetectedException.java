package com.williamcallahan.facesearch.service;

import com.williamcallahan.facesearch.domain.FailureCategory;
import java.util.Objects;

/**
 * Signals that no descriptor could be extracted from a search query image.
 *
 * <p>Distinguishes "nothing to search for" from "no matches found".</p>
 */
public class NoFaceDetectedException extends RuntimeException {

    private final FailureCategory category;

    /**
     * Creates an exception for a failed query extraction.
     *
     * @param category why the backend could not extract a descriptor
     * @param detail sanitized backend detail
     */
    public NoFaceDetectedException(FailureCategory category, String detail) {
        super(formatMessage(category, detail));
        this.category = Objects.requireNonNull(category, "category");
    }

    /**
     * Returns why extraction failed.
     */
    public FailureCategory category() {
        return category;
    }

    private static String formatMessage(FailureCategory category, String detail) {
        String base = "Could not detect a face in the query image (" + category + ")";
        return detail == null || detail.isBlank() ? base : base + ": " + detail;
    }
}
