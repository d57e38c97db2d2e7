package com.phillippitts.windowanalysis.service.offline;

import com.phillippitts.windowanalysis.domain.SynthesizedResult;

import java.util.Objects;

/**
 * Answer to a submission: either the synthesized result or a note that the request was queued.
 *
 * @param requestId submitted request id
 * @param result    synthesized result, {@code null} when queued
 */
public record SubmissionResult(String requestId, SynthesizedResult result) {

    public SubmissionResult {
        Objects.requireNonNull(requestId, "requestId");
    }

    public static SubmissionResult completed(SynthesizedResult result) {
        return new SubmissionResult(result.requestId(), result);
    }

    public static SubmissionResult queued(String requestId) {
        return new SubmissionResult(requestId, null);
    }

    public boolean isQueued() {
        return result == null;
    }
}
