package com.williamcallahan.facesearch.service.recognition;

import com.williamcallahan.facesearch.config.AppProperties;
import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.ProviderType;
import com.williamcallahan.facesearch.domain.SimilarityScore;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Dependency-free fallback that fingerprints the leading bytes of an image.
 *
 * <p>The fingerprint is a 32-bit rolling hash over a prefix of the base64 encoding, so only
 * near byte-identical uploads ever score high. It keeps the pipeline operational without any
 * recognition vendor; it is not face recognition.</p>
 */
@Component
public class LocalHashRecognitionBackend implements RecognitionBackend {
    private static final Logger log = LoggerFactory.getLogger(LocalHashRecognitionBackend.class);

    static final String DESCRIPTOR_PREFIX = "local_";
    static final double IDENTICAL_SCORE = 0.95;
    static final double SIMILARITY_WEIGHT = 0.8;
    static final double MAX_NON_IDENTICAL_SCORE = 0.7;

    private final ImageLoader imageLoader;
    private final int sampleLength;

    /**
     * Creates the fallback backend.
     *
     * @param imageLoader loader for remote and inline images
     * @param appProperties application configuration providing the hashed prefix length
     */
    public LocalHashRecognitionBackend(ImageLoader imageLoader, AppProperties appProperties) {
        this.imageLoader = Objects.requireNonNull(imageLoader, "imageLoader");
        this.sampleLength = appProperties.getLocalHash().getSampleLength();
    }

    @Override
    public ProviderType providerType() {
        return ProviderType.LOCAL_FALLBACK;
    }

    @Override
    public ExtractionOutcome extract(ProviderConfig provider, ImageSource image) {
        String encodedImage;
        try {
            encodedImage = imageLoader.loadBase64(image);
        } catch (ProviderRequestException loadFailure) {
            return ExtractionOutcome.unavailable(loadFailure.category(), loadFailure.getMessage());
        }
        String sample = encodedImage.length() > sampleLength ? encodedImage.substring(0, sampleLength) : encodedImage;
        return ExtractionOutcome.extracted(DESCRIPTOR_PREFIX + fingerprint(sample));
    }

    @Override
    public SimilarityScore compare(
            ProviderConfig provider, String descriptorA, String descriptorB, ImageSource imageB) {
        if (descriptorA == null
                || descriptorB == null
                || !descriptorA.startsWith(DESCRIPTOR_PREFIX)
                || !descriptorB.startsWith(DESCRIPTOR_PREFIX)) {
            log.debug("[FACE-LOCAL] Refusing to compare descriptors without the local prefix");
            return SimilarityScore.of(0.0);
        }
        String hashA = descriptorA.substring(DESCRIPTOR_PREFIX.length());
        String hashB = descriptorB.substring(DESCRIPTOR_PREFIX.length());
        if (hashA.equals(hashB)) {
            return SimilarityScore.of(IDENTICAL_SCORE);
        }
        int longestLength = Math.max(hashA.length(), hashB.length());
        double editSimilarity = 1.0 - (double) levenshtein(hashA, hashB) / longestLength;
        return SimilarityScore.of(Math.max(0.0, Math.min(MAX_NON_IDENTICAL_SCORE, editSimilarity * SIMILARITY_WEIGHT)));
    }

    /**
     * Folds the sample through {@code h = 31 * h + c} in 32-bit arithmetic and renders {@code |h|} in base 36.
     */
    static String fingerprint(String sample) {
        int hash = 0;
        for (int charIndex = 0; charIndex < sample.length(); charIndex++) {
            hash = 31 * hash + sample.charAt(charIndex);
        }
        return Long.toString(Math.abs((long) hash), 36);
    }

    static int levenshtein(String left, String right) {
        int[] previousRow = new int[right.length() + 1];
        int[] currentRow = new int[right.length() + 1];
        for (int column = 0; column <= right.length(); column++) {
            previousRow[column] = column;
        }
        for (int row = 1; row <= left.length(); row++) {
            currentRow[0] = row;
            for (int column = 1; column <= right.length(); column++) {
                int substitutionCost = left.charAt(row - 1) == right.charAt(column - 1) ? 0 : 1;
                currentRow[column] = Math.min(
                        Math.min(previousRow[column] + 1, currentRow[column - 1] + 1),
                        previousRow[column - 1] + substitutionCost);
            }
            int[] swap = previousRow;
            previousRow = currentRow;
            currentRow = swap;
        }
        return previousRow[right.length()];
    }
}
