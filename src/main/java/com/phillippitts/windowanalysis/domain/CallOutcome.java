package com.phillippitts.windowanalysis.domain;

/**
 * Outcome of a single provider call attempt.
 */
public enum CallOutcome {
    SUCCESS,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE,
    TIMEOUT
}
