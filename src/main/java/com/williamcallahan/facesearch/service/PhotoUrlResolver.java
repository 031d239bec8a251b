package com.williamcallahan.facesearch.service;

import com.williamcallahan.facesearch.config.AppProperties;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Turns a stored photo reference into a URL a backend can fetch.
 *
 * <p>Absolute {@code http(s)} and {@code data:} references pass through; storage paths are
 * prefixed with {@code app.search.photo-base-url}.</p>
 */
@Component
public class PhotoUrlResolver {

    private final String photoBaseUrl;

    public PhotoUrlResolver(AppProperties appProperties) {
        this.photoBaseUrl = appProperties.getSearch().getPhotoBaseUrl();
    }

    public String resolve(String photoReference) {
        if (photoReference == null || photoReference.isBlank()) {
            throw new IllegalArgumentException("Photo reference is required");
        }
        String trimmed = photoReference.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://") || lower.startsWith("data:")
                || photoBaseUrl.isBlank()) {
            return trimmed;
        }
        String base = photoBaseUrl.endsWith("/") ? photoBaseUrl : photoBaseUrl + "/";
        String path = trimmed.startsWith("/") ? trimmed.substring(1) : trimmed;
        return base + path;
    }
}
