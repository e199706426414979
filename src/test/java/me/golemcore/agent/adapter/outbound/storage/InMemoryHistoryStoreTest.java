package me.golemcore.agent.adapter.outbound.storage;

import me.golemcore.agent.domain.history.ConversationHistory;
import me.golemcore.agent.domain.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryHistoryStoreTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    private InMemoryHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryHistoryStore(new HistoryJsonCodec(), Clock.fixed(NOW, ZoneId.of("UTC")));
    }

    private static Message user(String content) {
        return Message.builder().role(Message.ROLE_USER).content(content).timestamp(NOW).build();
    }

    @Test
    void shouldReturnEmptyForUnknownConversation() {
        assertTrue(store.load("missing").isEmpty());
    }

    @Test
    void shouldIsolateLoadedCopiesFromStore() {
        ConversationHistory history = new ConversationHistory("conv-1", NOW);
        history.addMessages(List.of(user("one")), NOW);
        store.save(history);

        ConversationHistory loaded = store.load("conv-1").orElseThrow();
        loaded.addMessages(List.of(user("two")), NOW);

        assertEquals(1, store.load("conv-1").orElseThrow().size());
        store.save(loaded);
        assertEquals(2, store.load("conv-1").orElseThrow().size());
    }

    @Test
    void shouldCreateConversationOnAppend() {
        store.append("conv-1", List.of(user("one")));
        store.append("conv-1", List.of(user("two"), user("three")));

        ConversationHistory loaded = store.load("conv-1").orElseThrow();
        assertEquals(3, loaded.size());
        assertEquals(NOW, loaded.getCreatedAt());
        assertEquals("three", loaded.getMessages().get(2).getContent());
    }

    @Test
    void shouldClearConversation() {
        store.append("conv-1", List.of(user("one")));

        store.clear("conv-1");
        store.clear("never-existed");

        assertTrue(store.load("conv-1").isEmpty());
    }
}
