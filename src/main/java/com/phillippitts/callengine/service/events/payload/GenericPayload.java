package com.phillippitts.callengine.service.events.payload;

import java.util.Map;

/**
 * Fallback for event kinds without a dedicated payload record.
 */
public record GenericPayload(Map<String, Object> fields) implements CallEventPayload {

    public GenericPayload {
        fields = fields == null ? Map.of() : fields;
    }
}
