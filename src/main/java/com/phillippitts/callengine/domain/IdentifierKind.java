package com.phillippitts.callengine.domain;

import java.util.Locale;

/**
 * Kind of a call participant identifier as reported by the telephony provider.
 */
public enum IdentifierKind {
    PHONE_NUMBER,
    COMMUNICATION_USER,
    UNKNOWN;

    /**
     * Maps provider wire names ("phone_number", "phoneNumber", "communicationUser") to a kind.
     */
    public static IdentifierKind fromWire(String kind) {
        if (kind == null) {
            return UNKNOWN;
        }
        String k = kind.trim().toLowerCase(Locale.ROOT).replace("_", "");
        return switch (k) {
            case "phonenumber" -> PHONE_NUMBER;
            case "communicationuser" -> COMMUNICATION_USER;
            default -> UNKNOWN;
        };
    }
}
