package com.williamcallahan.facesearch.web;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

/**
 * Face search request body.
 *
 * @param image data URI, http(s) URL or raw base64 image
 * @param threshold optional minimum similarity overriding the provider default
 */
public record FaceSearchRequest(
        @NotBlank(message = "image is required") String image,
        @DecimalMin(value = "0.0", message = "threshold must be at least 0")
        @DecimalMax(value = "1.0", message = "threshold must be at most 1")
        Double threshold) {}
