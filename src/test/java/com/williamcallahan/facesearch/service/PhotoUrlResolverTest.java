package com.williamcallahan.facesearch.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.facesearch.config.AppProperties;
import org.junit.jupiter.api.Test;

/**
 * Verifies resolution of stored photo references into fetchable URLs.
 */
class PhotoUrlResolverTest {

    @Test
    void prefixesStoragePathsWithBaseUrl() {
        PhotoUrlResolver resolver = resolverWithBase("https://storage.example/photos");

        assertEquals("https://storage.example/photos/partners/a.jpg", resolver.resolve("partners/a.jpg"));
        assertEquals("https://storage.example/photos/partners/a.jpg", resolver.resolve("/partners/a.jpg"));
    }

    @Test
    void passesThroughAbsoluteAndDataReferences() {
        PhotoUrlResolver resolver = resolverWithBase("https://storage.example/photos/");

        assertEquals("https://cdn.example/x.jpg", resolver.resolve("https://cdn.example/x.jpg"));
        assertEquals("data:image/png;base64,AAAA", resolver.resolve(" data:image/png;base64,AAAA "));
    }

    @Test
    void leavesPathsUntouchedWithoutBaseUrl() {
        assertEquals("partners/a.jpg", resolverWithBase("").resolve("partners/a.jpg"));
    }

    @Test
    void rejectsBlankReference() {
        assertThrows(IllegalArgumentException.class, () -> resolverWithBase("").resolve(" "));
    }

    private static PhotoUrlResolver resolverWithBase(String baseUrl) {
        AppProperties appProperties = new AppProperties();
        appProperties.getSearch().setPhotoBaseUrl(baseUrl);
        return new PhotoUrlResolver(appProperties);
    }
}
