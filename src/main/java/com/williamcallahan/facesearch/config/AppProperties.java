package com.williamcallahan.facesearch.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Provider provider = new Provider();
    private Search search = new Search();
    private Regeneration regeneration = new Regeneration();
    private Http http = new Http();
    private LocalHash localHash = new LocalHash();

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Regeneration getRegeneration() {
        return regeneration;
    }

    public void setRegeneration(Regeneration regeneration) {
        this.regeneration = regeneration;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public LocalHash getLocalHash() {
        return localHash;
    }

    public void setLocalHash(LocalHash localHash) {
        this.localHash = localHash;
    }

    /**
     * Rejects settings that would break batching, fan-out or caching.
     *
     * @throws IllegalArgumentException when a size or duration is not positive
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive(provider.getCacheTtl(), "app.provider.cache-ttl");
        requirePositive(search.getConcurrency(), "app.search.concurrency");
        requirePositive(search.getCandidateTimeout(), "app.search.candidate-timeout");
        requirePositive(regeneration.getBatchSize(), "app.regeneration.batch-size");
        requireNotNegative(regeneration.getBatchDelay(), "app.regeneration.batch-delay");
        requirePositive(regeneration.getCandidateTimeout(), "app.regeneration.candidate-timeout");
        requirePositive(http.getConnectTimeout(), "app.http.connect-timeout");
        requirePositive(http.getReadTimeout(), "app.http.read-timeout");
        requirePositive(localHash.getSampleLength(), "app.local-hash.sample-length");
    }

    private static void requirePositive(int value, String key) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive but was " + value);
        }
    }

    private static void requirePositive(Duration value, String key) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(key + " must be a positive duration but was " + value);
        }
    }

    private static void requireNotNegative(Duration value, String key) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(key + " must not be negative but was " + value);
        }
    }

    public static class Provider {
        private Duration cacheTtl = Duration.ofMinutes(5);

        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
    }

    public static class Search {
        private int concurrency = 4;
        private Duration candidateTimeout = Duration.ofSeconds(30);
        private boolean persistRefreshedDescriptors = true;
        private String photoBaseUrl = "";

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

        public Duration getCandidateTimeout() { return candidateTimeout; }
        public void setCandidateTimeout(Duration candidateTimeout) { this.candidateTimeout = candidateTimeout; }

        public boolean isPersistRefreshedDescriptors() { return persistRefreshedDescriptors; }
        public void setPersistRefreshedDescriptors(boolean persistRefreshedDescriptors) {
            this.persistRefreshedDescriptors = persistRefreshedDescriptors;
        }

        public String getPhotoBaseUrl() { return photoBaseUrl; }
        public void setPhotoBaseUrl(String photoBaseUrl) {
            this.photoBaseUrl = photoBaseUrl == null ? "" : photoBaseUrl;
        }
    }

    public static class Regeneration {
        private int batchSize = 5;
        private Duration batchDelay = Duration.ofSeconds(1);
        private Duration candidateTimeout = Duration.ofSeconds(60);

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public Duration getBatchDelay() { return batchDelay; }
        public void setBatchDelay(Duration batchDelay) { this.batchDelay = batchDelay; }

        public Duration getCandidateTimeout() { return candidateTimeout; }
        public void setCandidateTimeout(Duration candidateTimeout) { this.candidateTimeout = candidateTimeout; }
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    public static class LocalHash {
        private int sampleLength = 1000;

        public int getSampleLength() { return sampleLength; }
        public void setSampleLength(int sampleLength) { this.sampleLength = sampleLength; }
    }
}
