package com.phillippitts.windowanalysis.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for provider exceptions with contextual details in the message.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ProviderExceptionBuilder.create("Provider returned an error")
 *         .provider("anthropic")
 *         .retryable()
 *         .statusCode(529)
 *         .metadata("errorType", "overloaded_error")
 *         .build();
 *
 * throw ProviderExceptionBuilder.create("Credential rejected")
 *         .provider("openai")
 *         .statusCode(401)
 *         .cause(transportException)
 *         .build();
 * </pre>
 *
 * <p>Exceptions are permanent unless {@link #retryable()} is called.
 */
public final class ProviderExceptionBuilder {

    private final String message;
    private String providerId;
    private Throwable cause;
    private boolean transientFailure;
    private Integer statusCode;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ProviderExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderExceptionBuilder(message);
    }

    public ProviderExceptionBuilder provider(String providerId) {
        this.providerId = providerId;
        return this;
    }

    public ProviderExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Marks the failure as transient so the retry executor will try again.
     *
     * @return this builder for chaining
     */
    public ProviderExceptionBuilder retryable() {
        this.transientFailure = true;
        return this;
    }

    public ProviderExceptionBuilder retryableIf(boolean transientFailure) {
        this.transientFailure = transientFailure;
        return this;
    }

    public ProviderExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ProviderExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (status={code}, {key1}={val1}, ...) (provider: {id})
     * </pre>
     *
     * @return transient or permanent provider exception
     */
    public ProviderException build() {
        String detailedMessage = buildDetailedMessage();
        String provider = providerId != null ? providerId : "unknown";

        if (transientFailure) {
            return cause != null
                    ? new TransientProviderException(detailedMessage, provider, cause)
                    : new TransientProviderException(detailedMessage, provider);
        }
        return cause != null
                ? new PermanentProviderException(detailedMessage, provider, cause)
                : new PermanentProviderException(detailedMessage, provider);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = statusCode != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (statusCode != null) {
            sb.append("status=").append(statusCode);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
