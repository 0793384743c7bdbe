package com.phillippitts.navguide.exception;

/**
 * Base exception for all nav-guide application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class NavGuideException extends RuntimeException {

    public NavGuideException(String message) {
        super(message);
    }

    public NavGuideException(String message, Throwable cause) {
        super(message, cause);
    }

    public NavGuideException(Throwable cause) {
        super(cause);
    }
}
