package com.williamcallahan.facesearch.domain;

/**
 * Selects which entities a regeneration run processes.
 */
public enum RegenerationScope {
    /** Every entity with a registered photo. */
    ALL,
    /** Entities without a usable descriptor for the active provider type. */
    NEEDING_DESCRIPTOR
}
