package com.contestfeed.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventOp {
    CREATE("create"),
    UPDATE("update");

    private final String wireName;

    EventOp(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static EventOp fromWireName(String wireName) {
        for (EventOp op : values()) {
            if (op.wireName.equals(wireName)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown event op: " + wireName);
    }
}
