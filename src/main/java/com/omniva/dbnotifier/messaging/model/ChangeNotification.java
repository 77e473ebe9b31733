package com.omniva.dbnotifier.messaging.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Notification published to a channel when a subscribed row event fires.
 * <p>
 * Wire format:
 * {
 * "name": "note_chan1",
 * "table": "test_notifs",
 * "event": "UPDATE",
 * "timestamp": "2024-03-01T15:47:03.280+00:00",
 * "data": {"id": 4, "col1": 44}
 * }
 */
@Data
@Builder
@Jacksonized
@JsonPropertyOrder({"name", "table", "event", "timestamp", "data"})
public class ChangeNotification {

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String name;

    private String table;

    private ChangeType event;

    private OffsetDateTime timestamp;

    @JsonProperty("data")
    private Map<String, Object> data;

    /**
     * Check if the payload carries the given column (a null value still counts)
     */
    public boolean hasField(String column) {
        return data != null && data.containsKey(column);
    }

    /**
     * Get a payload value with type casting
     */
    @SuppressWarnings("unchecked")
    public <T> T getFieldValue(String column, Class<T> type) {
        Object value = data == null ? null : data.get(column);
        if (type.isInstance(value)) {
            return (T) value;
        }
        return null;
    }
}
