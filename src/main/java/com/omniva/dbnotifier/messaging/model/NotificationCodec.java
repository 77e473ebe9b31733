package com.omniva.dbnotifier.messaging.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.omniva.dbnotifier.engine.fault.DbNotifierFatalError;
import com.omniva.dbnotifier.engine.fault.MalformedNotificationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encode {@link ChangeNotification}s to the JSON payload delivered on a channel and
 * decode them back on the listening side.
 */
@RequiredArgsConstructor
public class NotificationCodec {
    private static final Logger log = LoggerFactory.getLogger(NotificationCodec.class);

    private final ObjectMapper objectMapper;

    /**
     * Mapper used when the application context does not provide one
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public String encode(ChangeNotification notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            // Row values come from the engine's own row images, so this is a defect
            throw new DbNotifierFatalError("Unable to serialize notification for table " + notification.getTable(), e);
        }
    }

    public ChangeNotification decode(String channel, String payload) {
        if (payload == null || payload.trim().isEmpty()) {
            throw new MalformedNotificationException(channel, new IllegalArgumentException("Payload is empty"));
        }

        try {
            JsonNode jsonNode = objectMapper.readTree(payload);
            requireField(jsonNode, "table");
            requireField(jsonNode, "event");
            requireField(jsonNode, "data");
            return objectMapper.treeToValue(jsonNode, ChangeNotification.class);

        } catch (JsonProcessingException e) {
            log.error("JSON parsing failed for payload on channel {}: {}", channel, e.getOriginalMessage());
            throw new MalformedNotificationException(channel, e);

        } catch (IllegalArgumentException e) {
            log.error("Invalid notification on channel {}: {}", channel, e.getMessage());
            throw new MalformedNotificationException(channel, e);
        }
    }

    private void requireField(JsonNode jsonNode, String fieldName) {
        JsonNode fieldNode = jsonNode.path(fieldName);
        if (fieldNode.isMissingNode() || fieldNode.isNull()) {
            throw new IllegalArgumentException(fieldName + " is required but missing");
        }
    }
}
