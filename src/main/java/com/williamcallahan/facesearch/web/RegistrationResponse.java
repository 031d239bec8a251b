package com.williamcallahan.facesearch.web;

import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.RegistrationOutcome;

/**
 * Result of registering one entity photo.
 *
 * @param status fixed "success"; a pending placeholder is still a successful request
 * @param entityId relationship id
 * @param descriptorStatus stored status ({@code extracted} or {@code pending})
 * @param failureCategory why the record is pending, null when extracted
 * @param advisory operator-facing explanation, null when extracted
 */
public record RegistrationResponse(
        String status, String entityId, String descriptorStatus, String failureCategory, String advisory)
        implements ApiResponse {

    public static RegistrationResponse from(RegistrationOutcome outcome) {
        return new RegistrationResponse(
                "success",
                outcome.entityId(),
                outcome.status().value(),
                outcome.failure().map(FailureCategory::name).orElse(null),
                outcome.failure().map(FailureCategory::advisory).orElse(null));
    }
}
