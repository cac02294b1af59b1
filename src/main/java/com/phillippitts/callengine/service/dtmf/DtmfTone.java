package com.phillippitts.callengine.service.dtmf;

import java.util.Locale;
import java.util.Map;

/**
 * Maps raw tone tokens to the canonical DTMF alphabet {@code 0-9 * #}.
 */
public final class DtmfTone {

    public static final String STAR = "*";
    public static final String POUND = "#";

    private static final Map<String, String> WORDS = Map.ofEntries(
            Map.entry("zero", "0"),
            Map.entry("one", "1"),
            Map.entry("two", "2"),
            Map.entry("three", "3"),
            Map.entry("four", "4"),
            Map.entry("five", "5"),
            Map.entry("six", "6"),
            Map.entry("seven", "7"),
            Map.entry("eight", "8"),
            Map.entry("nine", "9"),
            Map.entry("star", STAR),
            Map.entry("asterisk", STAR),
            Map.entry("pound", POUND),
            Map.entry("hash", POUND));

    private DtmfTone() {}

    /**
     * @param raw tone as delivered by the provider, a symbol or a word in any case
     * @return the canonical tone, or null when the token is not a DTMF tone
     */
    public static String normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        String token = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (token.length() == 1) {
            char c = token.charAt(0);
            if ((c >= '0' && c <= '9') || c == '*' || c == '#') {
                return token;
            }
            return null;
        }
        return WORDS.get(token);
    }
}
