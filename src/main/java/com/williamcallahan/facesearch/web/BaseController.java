package com.williamcallahan.facesearch.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Base controller class providing common error handling patterns.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles a missing resource with a not found response.
     *
     * @param message description of what was not found
     * @return Not found error response
     */
    protected ResponseEntity<ApiResponse> handleNotFound(String message) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, message);
    }

    /**
     * Creates a standardized success response.
     *
     * @param message Success message
     * @return Success response
     */
    protected ResponseEntity<ApiResponse> createSuccessResponse(String message) {
        return exceptionBuilder.buildSuccessResponse(message);
    }
}
