package com.contestfeed.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Event feed object types and the payload class carried by each.
 */
public enum EventType {
    SUBMISSIONS("submissions", Submission.class),
    JUDGEMENTS("judgements", Judgement.class);

    private final String wireName;
    private final Class<?> payloadType;

    EventType(String wireName, Class<?> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public Class<?> getPayloadType() {
        return payloadType;
    }

    public static EventType fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(wireName))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + wireName));
    }
}
