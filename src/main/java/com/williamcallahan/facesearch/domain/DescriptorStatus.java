package com.williamcallahan.facesearch.domain;

import java.util.Locale;

/**
 * Lifecycle state of a stored face descriptor.
 *
 * <p>{@code NONE -> EXTRACTED | PENDING}; {@code PENDING -> EXTRACTED} on a later successful
 * extraction. There is no terminal failure state.</p>
 */
public enum DescriptorStatus {
    EXTRACTED,
    PENDING,
    NONE;

    /** Returns the lower-case value stored in the database. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored status value.
     *
     * @param rawValue stored value
     * @return matching status
     */
    public static DescriptorStatus fromValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return NONE;
        }
        return valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
    }
}
