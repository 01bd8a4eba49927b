package com.contestfeed.infrastructure.persistence;

import com.contestfeed.domain.model.EventOp;
import com.contestfeed.domain.model.EventType;
import com.contestfeed.domain.model.FeedEvent;
import com.contestfeed.infrastructure.json.FeedJson;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.Document;

import java.util.Map;

/**
 * Converts feed events and entity payloads to and from MongoDB documents.
 * Events are keyed by token, projections by entity id.
 */
public class FeedDocumentMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public FeedDocumentMapper() {
        this(FeedJson.objectMapper());
    }

    public FeedDocumentMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Document toEventDocument(FeedEvent event) {
        return new Document("_id", event.token())
            .append("id", event.id())
            .append("type", event.type().getWireName())
            .append("op", event.op().getWireName())
            .append("data", toPayloadDocument(event.data()));
    }

    public FeedEvent fromEventDocument(Document document) {
        EventType type = EventType.fromWireName(document.getString("type"));
        Object data = objectMapper.convertValue(document.get("data", Document.class), type.getPayloadType());
        return new FeedEvent(
            ((Number) document.get("_id")).longValue(),
            document.getString("id"),
            type,
            EventOp.fromWireName(document.getString("op")),
            data
        );
    }

    public Document toProjectionDocument(String id, Object payload) {
        Document document = toPayloadDocument(payload);
        document.put("_id", id);
        return document;
    }

    public <T> T fromProjectionDocument(Document document, Class<T> type) {
        // _id is dropped as an unknown property
        return objectMapper.convertValue(document, type);
    }

    private Document toPayloadDocument(Object payload) {
        Map<String, Object> map = objectMapper.convertValue(payload, MAP_TYPE);
        return new Document(map);
    }
}
