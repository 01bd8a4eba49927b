package com.contestfeed.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

/**
 * One entry of the append-only event log. Never mutated once written.
 *
 * @param token position in the feed, contiguous from 1; a string on the wire
 * @param id    identifier of the referenced entity
 * @param data  {@link Submission} or {@link Judgement} snapshot, matching {@code type}
 */
@JsonPropertyOrder({"token", "id", "type", "op", "data"})
public record FeedEvent(
    @JsonSerialize(using = ToStringSerializer.class) long token,
    String id,
    EventType type,
    EventOp op,
    Object data
) {
}
