package com.phillippitts.windowanalysis.domain;

import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opaque handle to the photograph being analyzed.
 *
 * <p>The image is carried as base64 text because every provider wire format embeds it that way.
 * Decoding, resizing and re-encoding happen upstream; this type only strips a {@code data:} URL
 * prefix when one is present. An explicit media type wins over the one named in the prefix.
 *
 * @param base64Data base64-encoded image bytes without any data URL prefix
 * @param mediaType  MIME type of the image (e.g., {@code image/jpeg})
 */
public record ImagePayload(String base64Data, String mediaType) {

    private static final Pattern DATA_URL_PREFIX = Pattern.compile("^data:(image/[a-zA-Z+.-]+);base64,");

    /** Media type assumed when the caller does not state one. */
    public static final String DEFAULT_MEDIA_TYPE = "image/jpeg";

    public ImagePayload {
        Objects.requireNonNull(base64Data, "base64Data");
        String prefixMediaType = null;
        Matcher prefix = DATA_URL_PREFIX.matcher(base64Data.trim());
        if (prefix.find()) {
            prefixMediaType = prefix.group(1).toLowerCase(Locale.ROOT);
            base64Data = base64Data.trim().substring(prefix.end());
        } else {
            base64Data = base64Data.trim();
        }
        if (base64Data.isEmpty()) {
            throw new IllegalArgumentException("Image payload must not be empty");
        }
        if (mediaType == null || mediaType.isBlank()) {
            mediaType = prefixMediaType != null ? prefixMediaType : DEFAULT_MEDIA_TYPE;
        }
    }

    public static ImagePayload ofBytes(byte[] bytes, String mediaType) {
        Objects.requireNonNull(bytes, "bytes");
        return new ImagePayload(Base64.getEncoder().encodeToString(bytes), mediaType);
    }

    /**
     * Approximate decoded size in bytes, computed without decoding.
     */
    public long approximateSizeBytes() {
        return (base64Data.length() * 3L) / 4L;
    }

    /**
     * Renders the payload as a {@code data:} URL, the envelope OpenAI-style APIs expect.
     */
    public String toDataUrl() {
        return "data:" + mediaType + ";base64," + base64Data;
    }

    @Override
    public String toString() {
        return "ImagePayload[mediaType=" + mediaType + ", approxBytes=" + approximateSizeBytes() + "]";
    }
}
