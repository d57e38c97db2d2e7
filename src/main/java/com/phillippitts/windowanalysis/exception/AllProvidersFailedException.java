package com.phillippitts.windowanalysis.exception;

import com.phillippitts.windowanalysis.domain.FailureReason;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when no requested provider contributed to a request.
 * This is the only failure that aborts a whole analysis.
 */
public class AllProvidersFailedException extends WindowAnalysisException {

    private final String requestId;
    private final Map<String, FailureReason> failures;

    public AllProvidersFailedException(String requestId, Map<String, FailureReason> failures) {
        super("All providers failed for request " + requestId + ": " + failures);
        this.requestId = requestId;
        this.failures = new LinkedHashMap<>(failures);
    }

    public String getRequestId() {
        return requestId;
    }

    public Map<String, FailureReason> getFailures() {
        return Map.copyOf(failures);
    }

    /**
     * True if at least one provider failed for a reason that may clear up on resubmission.
     */
    public boolean isRetryable() {
        return failures.values().stream().anyMatch(FailureReason::isRetryable);
    }
}
