package com.phillippitts.windowanalysis.testutil;

import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.domain.ImagePayload;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Canned analysis requests.
 */
public final class TestRequests {

    /** A few bytes of "image", enough to pass payload validation. */
    public static final ImagePayload IMAGE = ImagePayload.ofBytes(new byte[]{1, 2, 3, 4, 5, 6}, "image/jpeg");

    private TestRequests() {
    }

    public static AnalysisRequest request(String id, String... providers) {
        return AnalysisRequest.builder()
                .id(id)
                .payload(IMAGE)
                .providers(List.of(providers))
                .timeout(Duration.ofSeconds(5))
                .build();
    }

    public static AnalysisRequest request(String id, Instant createdAt, Duration timeout, String... providers) {
        return AnalysisRequest.builder()
                .id(id)
                .payload(IMAGE)
                .providers(List.of(providers))
                .createdAt(createdAt)
                .timeout(timeout)
                .build();
    }
}
