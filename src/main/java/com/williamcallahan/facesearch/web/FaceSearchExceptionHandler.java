package com.williamcallahan.facesearch.web;

import com.williamcallahan.facesearch.service.DescriptorPersistenceException;
import com.williamcallahan.facesearch.service.FaceProviderUnavailableException;
import com.williamcallahan.facesearch.service.NoFaceDetectedException;
import com.williamcallahan.facesearch.service.RegenerationInProgressException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps face search failures to HTTP statuses with the shared error payload.
 */
@RestControllerAdvice
public class FaceSearchExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(FaceSearchExceptionHandler.class);

    private final ExceptionResponseBuilder exceptionBuilder;

    public FaceSearchExceptionHandler(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(FaceProviderUnavailableException.class)
    public ResponseEntity<ApiResponse> handleProviderUnavailable(FaceProviderUnavailableException exception) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, exception.getMessage());
    }

    @ExceptionHandler(NoFaceDetectedException.class)
    public ResponseEntity<ApiResponse> handleNoFaceDetected(NoFaceDetectedException exception) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.UNPROCESSABLE_ENTITY, "Could not detect a face in the query image", exception);
    }

    @ExceptionHandler(RegenerationInProgressException.class)
    public ResponseEntity<ApiResponse> handleRegenerationInProgress(RegenerationInProgressException exception) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.CONFLICT, exception.getMessage());
    }

    @ExceptionHandler(DescriptorPersistenceException.class)
    public ResponseEntity<ApiResponse> handlePersistenceFailure(DescriptorPersistenceException exception) {
        log.error("[FACE-EMBEDDING] Descriptor store failure: {}", exception.getMessage(), exception);
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to access face descriptors", exception);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleInvalidBody(MethodArgumentNotValidException exception) {
        String violations = exception.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid request: " + violations);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse> handleUnreadableRequest(Exception exception) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request", exception);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException exception) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, exception.getMessage());
    }
}
