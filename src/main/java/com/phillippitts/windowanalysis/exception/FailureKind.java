package com.phillippitts.windowanalysis.exception;

/**
 * Classification of a single provider failure.
 */
public enum FailureKind {
    /** Timeout, provider-reported rate limit or server error. Retried. */
    TRANSIENT,
    /** Bad credentials, malformed request or unsupported payload. Never retried. */
    PERMANENT,
    /** Transient failures on every allowed attempt. */
    EXHAUSTED
}
