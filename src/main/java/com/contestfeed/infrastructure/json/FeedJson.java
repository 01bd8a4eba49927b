package com.contestfeed.infrastructure.json;

import com.contestfeed.domain.model.FeedEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson setup for feed payloads and the NDJSON event feed.
 */
public final class FeedJson {

    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private FeedJson() {
    }

    public static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }

    /**
     * Serializes an event as one self-contained NDJSON record, including the trailing newline.
     */
    public static String toJsonLine(FeedEvent event) {
        try {
            return OBJECT_MAPPER.writeValueAsString(event) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize event " + event.token(), e);
        }
    }
}
