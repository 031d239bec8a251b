package com.williamcallahan.facesearch.web;

import com.williamcallahan.facesearch.service.NoFaceDetectedException;
import com.williamcallahan.facesearch.support.ProviderErrorClassifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Builds a standardized success response with a simple message.
     *
     * @param message The success message
     * @return ResponseEntity with success details
     */
    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Describes an exception for clients without leaking stack traces or provider payloads.
     *
     * @param exception exception to describe
     * @return formatted exception details or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        if (exception instanceof NoFaceDetectedException noFaceDetected) {
            return "category=" + noFaceDetected.category().name();
        }
        String message = ProviderErrorClassifier.sanitize(exception.getMessage());
        String exceptionName = exception.getClass().getSimpleName();
        return message.isBlank() ? exceptionName : exceptionName + ": " + message;
    }
}
