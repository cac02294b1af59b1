package com.phillippitts.callengine.exception;

/**
 * Thrown when the session state store cannot be reached or a session cannot be persisted.
 */
public class SessionStoreException extends CallEngineException {

    private final String callConnectionId;

    public SessionStoreException(String message, String callConnectionId) {
        super(message + " (call: " + callConnectionId + ")");
        this.callConnectionId = callConnectionId;
    }

    public SessionStoreException(String message, String callConnectionId, Throwable cause) {
        super(message + " (call: " + callConnectionId + ")", cause);
        this.callConnectionId = callConnectionId;
    }

    public String getCallConnectionId() {
        return callConnectionId;
    }
}
