package com.phillippitts.callengine.exception;

/**
 * Base exception for all call-engine specific errors.
 * Domain exceptions extend this class so callers can catch one type at collaborator boundaries.
 */
public class CallEngineException extends RuntimeException {

    public CallEngineException(String message) {
        super(message);
    }

    public CallEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public CallEngineException(Throwable cause) {
        super(cause);
    }
}
