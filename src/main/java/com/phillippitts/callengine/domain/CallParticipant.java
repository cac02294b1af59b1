package com.phillippitts.callengine.domain;

/**
 * One participant of a call connection.
 */
public record CallParticipant(ParticipantIdentifier identifier, boolean muted) {

    public IdentifierKind kind() {
        return identifier == null ? IdentifierKind.UNKNOWN : identifier.kind();
    }
}
