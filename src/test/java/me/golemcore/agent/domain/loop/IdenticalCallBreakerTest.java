package me.golemcore.agent.domain.loop;

import me.golemcore.agent.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdenticalCallBreakerTest {

    private static List<Message.ToolCall> calls(String name, Map<String, Object> arguments) {
        return List.of(Message.ToolCall.builder().id("x").name(name).arguments(arguments).build());
    }

    @Test
    void shouldTripWhenNextCallWouldReachThreshold() {
        IdenticalCallBreaker breaker = new IdenticalCallBreaker(3);
        List<Message.ToolCall> batch = calls("read", Map.of("path", "a.txt"));

        assertTrue(breaker.check(batch).isEmpty());
        breaker.record(batch);
        assertTrue(breaker.check(batch).isEmpty());
        breaker.record(batch);
        Optional<IdenticalCallBreaker.Trip> trip = breaker.check(batch);

        assertTrue(trip.isPresent());
        assertEquals("read", trip.get().toolName());
        assertEquals(3, trip.get().consecutiveCalls());
    }

    @Test
    void shouldResetWhenArgumentsChange() {
        IdenticalCallBreaker breaker = new IdenticalCallBreaker(3);
        breaker.record(calls("read", Map.of("path", "a.txt")));
        breaker.record(calls("read", Map.of("path", "a.txt")));
        breaker.record(calls("read", Map.of("path", "b.txt")));

        assertTrue(breaker.check(calls("read", Map.of("path", "b.txt"))).isEmpty());
    }

    @Test
    void shouldIgnoreArgumentOrder() {
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("a", 1);
        forward.put("b", 2);
        Map<String, Object> reversed = new LinkedHashMap<>();
        reversed.put("b", 2);
        reversed.put("a", 1);

        assertEquals(IdenticalCallBreaker.signature(calls("f", forward).get(0)),
                IdenticalCallBreaker.signature(calls("f", reversed).get(0)));
    }

    @Test
    void shouldTrackFunctionsIndependently() {
        IdenticalCallBreaker breaker = new IdenticalCallBreaker(2);
        breaker.record(calls("read", Map.of("path", "a.txt")));

        assertTrue(breaker.check(calls("write", Map.of("path", "a.txt"))).isEmpty());
        assertTrue(breaker.check(calls("read", Map.of("path", "a.txt"))).isPresent());
    }

    @Test
    void shouldBeDisabledWithZeroThreshold() {
        IdenticalCallBreaker breaker = new IdenticalCallBreaker(0);
        List<Message.ToolCall> batch = calls("read", Map.of());
        for (int i = 0; i < 10; i++) {
            breaker.record(batch);
        }

        assertTrue(breaker.check(batch).isEmpty());
    }

    @Test
    void shouldUseRawArgumentsWhenUnparsed() {
        Message.ToolCall raw = Message.ToolCall.builder().id("x").name("f").rawArguments("{oops").build();

        assertEquals("f:{oops", IdenticalCallBreaker.signature(raw));
    }
}
