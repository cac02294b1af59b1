package com.phillippitts.callengine.service.events.payload;

/**
 * Failure details carried by *Failed provider events.
 */
public record ResultInformationPayload(Integer code, Integer subCode, String message) implements CallEventPayload {

    public static final ResultInformationPayload EMPTY = new ResultInformationPayload(null, null, null);

    public String describe() {
        if (code == null && subCode == null && message == null) {
            return "{}";
        }
        return "code=" + code + ", subCode=" + subCode + ", message=" + message;
    }
}
