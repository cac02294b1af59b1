package com.phillippitts.callengine.exception;

/**
 * Thrown when a telephony provider operation (participant query, hang-up, recognition start) fails.
 * Always treated as best-effort by the engine: caught, logged, never propagated out of a handler.
 */
public class TelephonyProviderException extends CallEngineException {

    private final String operation;

    public TelephonyProviderException(String message, String operation) {
        super(message + " (operation: " + operation + ")");
        this.operation = operation;
    }

    public TelephonyProviderException(String message, String operation, Throwable cause) {
        super(message + " (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
