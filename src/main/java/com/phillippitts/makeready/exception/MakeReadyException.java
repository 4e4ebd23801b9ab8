package com.phillippitts.makeready.exception;

/**
 * Base exception for all make-ready engine errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class MakeReadyException extends RuntimeException {

    public MakeReadyException(String message) {
        super(message);
    }

    public MakeReadyException(String message, Throwable cause) {
        super(message, cause);
    }

    public MakeReadyException(Throwable cause) {
        super(cause);
    }
}
