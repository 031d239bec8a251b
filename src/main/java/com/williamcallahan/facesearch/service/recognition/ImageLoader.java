package com.williamcallahan.facesearch.service.recognition;

import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.support.ProviderErrorClassifier;
import java.util.Base64;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Resolves an {@link ImageSource} into raw bytes, fetching remote images over HTTP.
 */
@Component
public class ImageLoader {
    private static final Logger log = LoggerFactory.getLogger(ImageLoader.class);

    private final RestTemplate restTemplate;

    /**
     * Creates a loader that fetches remote images with the shared provider RestTemplate.
     *
     * @param restTemplate RestTemplate configured with connect and read timeouts
     */
    public ImageLoader(RestTemplate restTemplate) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
    }

    /**
     * Returns the image bytes.
     *
     * @param image image to load
     * @return raw bytes, never empty
     * @throws ProviderRequestException with {@link FailureCategory#IMAGE_UNAVAILABLE} when a remote
     *     image cannot be fetched
     */
    public byte[] load(ImageSource image) {
        Objects.requireNonNull(image, "image");
        if (image instanceof ImageSource.InlineImage inlineImage) {
            return inlineImage.bytes();
        }
        ImageSource.RemoteImage remoteImage = (ImageSource.RemoteImage) image;
        byte[] imageBytes;
        try {
            imageBytes = restTemplate.getForObject(remoteImage.url(), byte[].class);
        } catch (RestClientException fetchException) {
            log.debug("[FACE-IMAGE] Fetch failed for {}", remoteImage.url(), fetchException);
            FailureCategory category = ProviderErrorClassifier.classify(fetchException) == FailureCategory.TIMEOUT
                    ? FailureCategory.TIMEOUT
                    : FailureCategory.IMAGE_UNAVAILABLE;
            throw new ProviderRequestException(
                    category,
                    "Could not fetch image: " + ProviderErrorClassifier.sanitize(fetchException.getMessage()),
                    fetchException);
        }
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ProviderRequestException(FailureCategory.IMAGE_UNAVAILABLE, "Image response was empty");
        }
        return imageBytes;
    }

    /**
     * Returns the image bytes as standard base64.
     */
    public String loadBase64(ImageSource image) {
        return Base64.getEncoder().encodeToString(load(image));
    }
}
