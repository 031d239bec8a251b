package com.williamcallahan.facesearch.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.service.NoFaceDetectedException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Verifies exception descriptions stay short and never echo provider payloads verbatim.
 */
class ExceptionResponseBuilderTest {
    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void describeException_reportsOnlyCategoryForFaceDetectionFailures() {
        NoFaceDetectedException exception =
                new NoFaceDetectedException(FailureCategory.AUTHORIZATION_REQUIRED, "secret vendor body");

        assertEquals("category=AUTHORIZATION_REQUIRED", builder.describeException(exception));
    }

    @Test
    void describeException_truncatesLongMessagesToSingleLine() {
        String details = builder.describeException(new IllegalStateException("line one\nline two " + "x".repeat(2000)));

        assertTrue(details.startsWith("IllegalStateException: line one line two"), details);
        assertTrue(details.endsWith("..."), details);
        assertTrue(details.length() < 600, details);
    }

    @Test
    void describeException_handlesMissingException() {
        assertNull(builder.describeException(null));
        assertEquals("IllegalStateException", builder.describeException(new IllegalStateException()));
    }

    @Test
    void buildErrorResponse_setsStatusAndPayload() {
        ResponseEntity<ApiResponse> response = builder.buildErrorResponse(HttpStatus.CONFLICT, "busy");

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        ApiErrorResponse body = assertInstanceOf(ApiErrorResponse.class, response.getBody());
        assertEquals("error", body.status());
        assertEquals("busy", body.message());
        assertNull(body.details());
    }
}
