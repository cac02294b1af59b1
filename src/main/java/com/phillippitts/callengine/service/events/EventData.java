package com.phillippitts.callengine.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Total decoding of event payloads and typed field access over the decoded maps.
 *
 * <p>{@link #toMap(Object)} is total: it accepts a {@link Map}, a JSON string, UTF-8 JSON bytes,
 * a {@link JSONObject} or any bean with getters, and returns an empty map on any failure. It never throws.
 */
public final class EventData {

    private static final Logger LOG = LogManager.getLogger(EventData.class);

    private EventData() {}

    /**
     * Decodes an opaque payload into a unmodifiable string-keyed map.
     *
     * @param data payload in any supported shape (may be null)
     * @return decoded map, empty on null or undecodable input
     */
    public static Map<String, Object> toMap(Object data) {
        if (data == null) {
            return Map.of();
        }
        try {
            if (data instanceof Map<?, ?> map) {
                Map<String, Object> copy = new LinkedHashMap<>();
                map.forEach((k, v) -> copy.put(String.valueOf(k), normalize(v)));
                return Collections.unmodifiableMap(copy);
            }
            if (data instanceof JSONObject json) {
                return Collections.unmodifiableMap(json.toMap());
            }
            if (data instanceof CharSequence text) {
                return fromJson(text.toString());
            }
            if (data instanceof byte[] bytes) {
                return fromJson(new String(bytes, StandardCharsets.UTF_8));
            }
            return Collections.unmodifiableMap(new JSONObject(data).toMap());
        } catch (Exception e) {
            LOG.debug("Undecodable event payload of type {}: {}", data.getClass().getSimpleName(), e.getMessage());
            return Map.of();
        }
    }

    private static Map<String, Object> fromJson(String json) {
        if (json.isBlank()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new JSONObject(json).toMap());
    }

    private static Object normalize(Object value) {
        if (value instanceof JSONObject json) {
            return json.toMap();
        }
        if (value instanceof JSONArray array) {
            return array.toList();
        }
        return value;
    }

    /** Returns the value as a string, or null when absent or blank. */
    public static String string(Map<String, Object> data, String key) {
        if (data == null) {
            return null;
        }
        Object v = data.get(key);
        if (v == null) {
            return null;
        }
        String s = String.valueOf(v);
        return s.isBlank() ? null : s;
    }

    /** Returns the value as an Integer when it is numeric, otherwise null. */
    public static Integer integer(Map<String, Object> data, String key) {
        if (data == null) {
            return null;
        }
        Object v = data.get(key);
        if (v instanceof Number n) {
            return n.intValue();
        }
        if (v instanceof String s) {
            try {
                return Integer.valueOf(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** Returns a nested object as a string-keyed copy, or an empty map. */
    public static Map<String, Object> object(Map<String, Object> data, String key) {
        if (data == null) {
            return Map.of();
        }
        return asMap(data.get(key));
    }

    /** Returns a nested array as a copy, or an empty list. */
    public static List<Object> list(Map<String, Object> data, String key) {
        if (data == null) {
            return List.of();
        }
        Object v = data.get(key);
        if (v instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (v instanceof JSONArray array) {
            return array.toList();
        }
        return List.of();
    }

    /**
     * Copies a decoded nested value into a string-keyed map, or returns an empty map when the
     * value is not an object.
     */
    public static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        if (value instanceof JSONObject json) {
            return json.toMap();
        }
        return Map.of();
    }

    public static boolean bool(Map<String, Object> data, String key, boolean defaultValue) {
        if (data == null) {
            return defaultValue;
        }
        Object v = data.get(key);
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }
}
