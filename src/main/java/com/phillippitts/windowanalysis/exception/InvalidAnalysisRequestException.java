package com.phillippitts.windowanalysis.exception;

/**
 * Thrown when a submitted analysis request is malformed (missing image, oversized payload,
 * no providers).
 */
public class InvalidAnalysisRequestException extends WindowAnalysisException {

    private final String reason;

    public InvalidAnalysisRequestException(String reason) {
        super("Invalid analysis request: " + reason);
        this.reason = reason;
    }

    public InvalidAnalysisRequestException(String reason, Throwable cause) {
        super("Invalid analysis request: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
