package com.williamcallahan.facesearch.support;

import com.williamcallahan.facesearch.domain.FailureCategory;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Classifies recognition backend failures and sanitizes provider error payloads before they are
 * logged or returned as diagnostic detail.
 */
public final class ProviderErrorClassifier {
    private static final int MAX_ERROR_SNIPPET = 512;

    private ProviderErrorClassifier() {}

    /**
     * Determines a stable failure category from the exception chain.
     *
     * @param error failure raised while calling a backend
     * @return failure category, {@link FailureCategory#PROVIDER_ERROR} when nothing more specific matches
     */
    public static FailureCategory classify(Throwable error) {
        StringBuilder messageBuilder = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException) {
                return FailureCategory.TIMEOUT;
            }
            String currentMessage = current.getMessage();
            if (currentMessage != null && !currentMessage.isBlank()) {
                if (messageBuilder.length() > 0) {
                    messageBuilder.append(' ');
                }
                messageBuilder.append(currentMessage);
            }
            current = current.getCause();
        }

        String message = messageBuilder.toString().toLowerCase(Locale.ROOT);
        if (message.contains("unsupportedfeature")) {
            return FailureCategory.AUTHORIZATION_REQUIRED;
        } else if (message.contains("timed out") || message.contains("timeout")) {
            return FailureCategory.TIMEOUT;
        }
        return FailureCategory.PROVIDER_ERROR;
    }

    /**
     * Collapses line breaks and truncates a provider message to a loggable snippet.
     *
     * @param message raw message or response body
     * @return sanitized snippet, empty when the message is blank
     */
    public static String sanitize(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }
}
