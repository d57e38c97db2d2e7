package com.phillippitts.windowanalysis.exception;

/**
 * Thrown when a call to one analysis provider fails.
 * The {@link FailureKind} decides whether the retry executor tries again.
 */
public class ProviderException extends WindowAnalysisException {

    private final String providerId;
    private final FailureKind kind;

    public ProviderException(String message, String providerId, FailureKind kind) {
        super(message + " (provider: " + providerId + ")");
        this.providerId = providerId;
        this.kind = kind;
    }

    public ProviderException(String message, String providerId, FailureKind kind, Throwable cause) {
        super(message + " (provider: " + providerId + ")", cause);
        this.providerId = providerId;
        this.kind = kind;
    }

    public String getProviderId() {
        return providerId;
    }

    public FailureKind getKind() {
        return kind;
    }
}
