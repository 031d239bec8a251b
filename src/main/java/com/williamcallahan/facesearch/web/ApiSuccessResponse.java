package com.williamcallahan.facesearch.web;

/**
 * Represents a standardized JSON success payload returned by API endpoints.
 *
 * @param status fixed status indicator (typically "success")
 * @param message user-facing success message
 */
public record ApiSuccessResponse(String status, String message) implements ApiResponse {

    public static ApiSuccessResponse success(String message) {
        return new ApiSuccessResponse("success", message);
    }
}
