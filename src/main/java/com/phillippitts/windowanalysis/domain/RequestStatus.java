package com.phillippitts.windowanalysis.domain;

/**
 * Lifecycle status reported by {@code getStatus(requestId)}.
 */
public enum RequestStatus {
    PENDING,
    RESOLVED,
    FAILED
}
