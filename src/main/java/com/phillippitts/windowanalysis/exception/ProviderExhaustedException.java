package com.phillippitts.windowanalysis.exception;

/**
 * Thrown when a provider failed transiently on every allowed attempt.
 */
public class ProviderExhaustedException extends ProviderException {

    private final int attempts;

    public ProviderExhaustedException(String providerId, int attempts, Throwable lastFailure) {
        super("Retries exhausted after " + attempts + " attempts", providerId, FailureKind.EXHAUSTED, lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
