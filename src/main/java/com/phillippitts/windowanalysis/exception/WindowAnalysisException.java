package com.phillippitts.windowanalysis.exception;

/**
 * Base exception for all window-analysis application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class WindowAnalysisException extends RuntimeException {

    public WindowAnalysisException(String message) {
        super(message);
    }

    public WindowAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
