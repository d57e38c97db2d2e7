package com.phillippitts.windowanalysis.exception;

/**
 * Thrown when no analysis (pending or resolved) is known for a request id.
 */
public class AnalysisNotFoundException extends WindowAnalysisException {

    private final String requestId;

    public AnalysisNotFoundException(String requestId) {
        super("No analysis found for request id: " + requestId);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
