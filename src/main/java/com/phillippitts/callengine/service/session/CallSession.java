package com.phillippitts.callengine.service.session;

import com.phillippitts.callengine.exception.SessionStoreException;

import java.util.Map;

/**
 * Handle on the durable state of one call.
 *
 * <p>Writes are staged on the handle and become durable only on {@link #persist()}; a handler
 * that fails before persisting leaves the stored session untouched. Reads see staged writes
 * first, then the state loaded when the handle was opened.
 */
public interface CallSession {

    String callConnectionId();

    /**
     * Returns the value for {@code key}, or {@code defaultValue} when absent.
     */
    Object get(String key, Object defaultValue);

    /**
     * Stages a single write. A null value removes the key on persist.
     */
    void set(String key, Object value);

    /**
     * Stages several writes that persist together.
     */
    void update(Map<String, Object> values);

    /**
     * Makes all staged writes durable in one step.
     *
     * @throws SessionStoreException when the store rejects the write
     */
    void persist();

    default boolean getBoolean(String key, boolean defaultValue) {
        Object v = get(key, null);
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }

    default String getString(String key, String defaultValue) {
        Object v = get(key, null);
        return v == null ? defaultValue : String.valueOf(v);
    }
}
