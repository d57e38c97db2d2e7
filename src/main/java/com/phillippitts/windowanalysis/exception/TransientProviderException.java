package com.phillippitts.windowanalysis.exception;

/**
 * Provider failure expected to resolve on retry: timeout, overload, provider-side rate limiting.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String message, String providerId) {
        super(message, providerId, FailureKind.TRANSIENT);
    }

    public TransientProviderException(String message, String providerId, Throwable cause) {
        super(message, providerId, FailureKind.TRANSIENT, cause);
    }
}
