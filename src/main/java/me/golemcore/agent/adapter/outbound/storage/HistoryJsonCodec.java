package me.golemcore.agent.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.agent.domain.history.ConversationHistory;
import me.golemcore.agent.domain.model.Message;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link ConversationHistory}. Summary markers and container
 * flags live in message metadata and survive the round trip, so a reloaded
 * conversation reduces from the same boundary as before.
 */
public class HistoryJsonCodec {

    private final ObjectMapper objectMapper;

    public HistoryJsonCodec() {
        this(defaultObjectMapper());
    }

    public HistoryJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public String encode(ConversationHistory history) {
        Snapshot snapshot = new Snapshot(history.getId(), history.getMessages(), history.getMetadata(),
                history.getCreatedAt(), history.getLastActivity());
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize conversation " + history.getId(), e);
        }
    }

    public ConversationHistory decode(String json) {
        try {
            Snapshot snapshot = objectMapper.readValue(json, Snapshot.class);
            return new ConversationHistory(snapshot.id(), snapshot.messages(), snapshot.metadata(),
                    snapshot.createdAt(), snapshot.lastActivity());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse conversation history", e);
        }
    }

    public record Snapshot(String id, List<Message> messages, Map<String, String> metadata, Instant createdAt,
            Instant lastActivity) {
    }
}
