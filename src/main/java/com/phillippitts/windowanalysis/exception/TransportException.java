package com.phillippitts.windowanalysis.exception;

/**
 * Raised by the provider transport when a call does not produce a successful HTTP response.
 *
 * <p>{@code statusCode} is {@code -1} when no response arrived (connection failure or timeout).
 */
public class TransportException extends WindowAnalysisException {

    public static final int NO_STATUS = -1;

    private final String providerId;
    private final int statusCode;
    private final boolean timeout;
    private final String responseBody;

    public TransportException(String message, String providerId, int statusCode, String responseBody) {
        super(message);
        this.providerId = providerId;
        this.statusCode = statusCode;
        this.timeout = false;
        this.responseBody = responseBody;
    }

    public TransportException(String message, String providerId, boolean timeout, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.statusCode = NO_STATUS;
        this.timeout = timeout;
        this.responseBody = null;
    }

    public String getProviderId() {
        return providerId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatus() {
        return statusCode != NO_STATUS;
    }

    public boolean isTimeout() {
        return timeout;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
