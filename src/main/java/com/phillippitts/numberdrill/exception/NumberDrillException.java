package com.phillippitts.numberdrill.exception;

/**
 * Base exception for all NumberDrill application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class NumberDrillException extends RuntimeException {

    public NumberDrillException(String message) {
        super(message);
    }

    public NumberDrillException(String message, Throwable cause) {
        super(message, cause);
    }
}
