package com.phillippitts.windowanalysis.exception;

/**
 * Provider failure that will not resolve on retry: bad credentials, malformed request,
 * unsupported payload.
 */
public class PermanentProviderException extends ProviderException {

    public PermanentProviderException(String message, String providerId) {
        super(message, providerId, FailureKind.PERMANENT);
    }

    public PermanentProviderException(String message, String providerId, Throwable cause) {
        super(message, providerId, FailureKind.PERMANENT, cause);
    }
}
