package com.phillippitts.callengine.domain;

/**
 * Identifier of one leg in a call.
 *
 * @param kind identifier kind
 * @param rawId provider raw id (e.g. "4:+14255550123")
 * @param value display value, the E.164 number for phone participants
 */
public record ParticipantIdentifier(IdentifierKind kind, String rawId, String value) {

    public ParticipantIdentifier {
        kind = kind == null ? IdentifierKind.UNKNOWN : kind;
    }

    public static ParticipantIdentifier phoneNumber(String number) {
        return new ParticipantIdentifier(IdentifierKind.PHONE_NUMBER, "4:" + number, number);
    }

    public static ParticipantIdentifier communicationUser(String rawId) {
        return new ParticipantIdentifier(IdentifierKind.COMMUNICATION_USER, rawId, rawId);
    }
}
