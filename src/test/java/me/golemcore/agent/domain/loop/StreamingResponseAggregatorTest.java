package me.golemcore.agent.domain.loop;

import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class StreamingResponseAggregatorTest {

    @Test
    void shouldConcatenateTextAndReasoning() {
        Flux<LlmChunk> chunks = Flux.just(
                LlmChunk.builder().reasoning("Think").build(),
                LlmChunk.builder().reasoning("ing").text("Hello").build(),
                LlmChunk.builder().text(", world").usage(LlmUsage.of(7, 3)).finishReason("stop").done(true).build());

        StepVerifier.create(StreamingResponseAggregator.aggregate(chunks))
                .assertNext(response -> {
                    assertEquals("Hello, world", response.getContent());
                    assertEquals("Thinking", response.getReasoning());
                    assertEquals(10, response.getUsage().getTotalTokens());
                    assertEquals("stop", response.getFinishReason());
                    assertNull(response.getToolCalls());
                })
                .verifyComplete();
    }

    @Test
    void shouldCollectToolCallsByIdInArrivalOrder() {
        Message.ToolCall first = Message.ToolCall.builder().id("a").name("search").arguments(Map.of()).build();
        Message.ToolCall second = Message.ToolCall.builder().id("b").name("read").arguments(Map.of()).build();
        Message.ToolCall firstComplete = Message.ToolCall.builder().id("a").name("search")
                .arguments(Map.of("q", "java")).build();
        Flux<LlmChunk> chunks = Flux.just(
                LlmChunk.builder().toolCalls(List.of(first)).build(),
                LlmChunk.builder().toolCalls(List.of(second)).build(),
                LlmChunk.builder().toolCalls(List.of(firstComplete)).finishReason("tool_calls").build());

        StepVerifier.create(StreamingResponseAggregator.aggregate(chunks))
                .assertNext(response -> {
                    assertEquals(2, response.getToolCalls().size());
                    assertEquals("a", response.getToolCalls().get(0).getId());
                    assertEquals(Map.of("q", "java"), response.getToolCalls().get(0).getArguments());
                    assertEquals("b", response.getToolCalls().get(1).getId());
                    assertNull(response.getContent());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateStreamError() {
        Flux<LlmChunk> chunks = Flux.concat(
                Flux.just(LlmChunk.builder().text("partial").build()),
                Flux.error(new IllegalStateException("stream reset")));

        StepVerifier.create(StreamingResponseAggregator.aggregate(chunks))
                .expectErrorMessage("stream reset")
                .verify();
    }
}
