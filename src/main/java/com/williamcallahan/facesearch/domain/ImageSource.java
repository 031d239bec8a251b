package com.williamcallahan.facesearch.domain;

import java.net.URI;
import java.util.Arrays;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;

/**
 * Image handed to a recognition backend: a fetchable remote URL or inline bytes.
 */
public sealed interface ImageSource permits ImageSource.RemoteImage, ImageSource.InlineImage {

    String DEFAULT_MEDIA_TYPE = "application/octet-stream";

    /**
     * Parses a data URI, an {@code http(s)} URL, or a raw base64 payload.
     *
     * @param rawImage image reference supplied by a caller
     * @return parsed image source
     * @throws IllegalArgumentException when the value is blank or not valid base64
     */
    static ImageSource parse(String rawImage) {
        if (rawImage == null || rawImage.isBlank()) {
            throw new IllegalArgumentException("Image is required");
        }
        String trimmed = rawImage.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return new RemoteImage(URI.create(trimmed));
        }
        if (lower.startsWith("data:")) {
            return parseDataUri(trimmed);
        }
        return new InlineImage(decodeBase64(trimmed), DEFAULT_MEDIA_TYPE);
    }

    private static InlineImage parseDataUri(String dataUri) {
        int commaIndex = dataUri.indexOf(',');
        if (commaIndex < 0) {
            throw new IllegalArgumentException("Malformed data URI: missing payload separator");
        }
        String header = dataUri.substring("data:".length(), commaIndex);
        String payload = dataUri.substring(commaIndex + 1);
        if (!header.toLowerCase(Locale.ROOT).endsWith(";base64")) {
            throw new IllegalArgumentException("Only base64 data URIs are supported");
        }
        String mediaType = header.substring(0, header.length() - ";base64".length());
        return new InlineImage(decodeBase64(payload), mediaType.isBlank() ? DEFAULT_MEDIA_TYPE : mediaType);
    }

    private static byte[] decodeBase64(String payload) {
        try {
            return Base64.getMimeDecoder().decode(payload);
        } catch (IllegalArgumentException decodeFailure) {
            throw new IllegalArgumentException("Image payload is not valid base64", decodeFailure);
        }
    }

    /**
     * Image fetched over HTTP when a backend needs its bytes.
     *
     * @param url absolute image URL
     */
    record RemoteImage(URI url) implements ImageSource {
        public RemoteImage {
            Objects.requireNonNull(url, "url");
        }
    }

    /**
     * Image bytes supplied directly by the caller.
     *
     * @param bytes raw image bytes
     * @param mediaType declared media type
     */
    record InlineImage(byte[] bytes, String mediaType) implements ImageSource {
        public InlineImage {
            Objects.requireNonNull(bytes, "bytes");
            if (bytes.length == 0) {
                throw new IllegalArgumentException("Image payload is empty");
            }
            bytes = bytes.clone();
            mediaType = mediaType == null || mediaType.isBlank() ? DEFAULT_MEDIA_TYPE : mediaType;
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof InlineImage that
                    && Arrays.equals(bytes, that.bytes)
                    && mediaType.equals(that.mediaType);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(bytes) + mediaType.hashCode();
        }

        @Override
        public String toString() {
            return "InlineImage[mediaType=" + mediaType + ", length=" + bytes.length + "]";
        }
    }
}
