package me.golemcore.agent.domain.loop;

import me.golemcore.agent.adapter.outbound.registry.InMemoryFunctionRegistry;
import me.golemcore.agent.domain.event.AgentEvent;
import me.golemcore.agent.domain.event.CoordinationKind;
import me.golemcore.agent.domain.event.CoordinationRequest;
import me.golemcore.agent.domain.event.CoordinationResponse;
import me.golemcore.agent.domain.event.DefaultEventCoordinator;
import me.golemcore.agent.domain.event.ModelRetryEvent;
import me.golemcore.agent.domain.event.TurnCompletedEvent;
import me.golemcore.agent.domain.history.DefaultContextManager;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RunCancellation;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.retry.DefaultErrorClassifier;
import me.golemcore.agent.domain.retry.ErrorCategory;
import me.golemcore.agent.domain.retry.ProviderException;
import me.golemcore.agent.domain.retry.RetryEngine;
import me.golemcore.agent.domain.retry.RetryExecutor;
import me.golemcore.agent.domain.retry.RetryPolicy;
import me.golemcore.agent.domain.tools.DefaultToolCallScheduler;
import me.golemcore.agent.domain.tools.PermissionAdmissionCheck;
import me.golemcore.agent.infrastructure.config.AgentEngineProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultAgentLoopTest {

    private static final String MODEL = "test-model";
    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    @Mock
    private LlmPort llmPort;

    private final AtomicInteger echoCalls = new AtomicInteger();
    private final List<AgentEvent> events = new CopyOnWriteArrayList<>();
    private final RunCancellation runToStop = RunCancellation.create();

    private AgentEngineProperties.LoopProperties loopSettings;
    private AgentEngineProperties.ModelProperties modelSettings;
    private AgentEngineProperties.ToolsProperties toolsSettings;
    private AgentEngineProperties.HistoryProperties historySettings;
    private InMemoryFunctionRegistry registry;
    private DefaultEventCoordinator coordinator;
    private ExecutorService executor;
    private Clock clock;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(llmPort.isAvailable()).thenReturn(true);

        loopSettings = new AgentEngineProperties.LoopProperties();
        modelSettings = new AgentEngineProperties.ModelProperties();
        modelSettings.setName(MODEL);
        toolsSettings = new AgentEngineProperties.ToolsProperties();
        toolsSettings.setCallTimeout(Duration.ofSeconds(5));
        historySettings = new AgentEngineProperties.HistoryProperties();
        clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        executor = Executors.newFixedThreadPool(4);
        coordinator = new DefaultEventCoordinator();
        coordinator.addListener(events::add);

        registry = InMemoryFunctionRegistry.builder()
                .register(ToolDefinition.simple("echo", "Echo text"), invocation -> {
                    echoCalls.incrementAndGet();
                    return CompletableFuture.completedFuture(
                            ToolResult.success("echo:" + invocation.stringArgument("text")));
                })
                .register(ToolDefinition.simple("broken", "Always fails"),
                        invocation -> CompletableFuture.completedFuture(ToolResult.failure("disk full")))
                .register(ToolDefinition.simple("stop", "Cancels the run"), invocation -> {
                    runToStop.cancel();
                    return CompletableFuture.completedFuture(ToolResult.success("stopping"));
                })
                .registerContainer(ToolDefinition.container("git", "Git operations"))
                .registerMember("git", ToolDefinition.simple("git_status", "Working tree status"),
                        invocation -> CompletableFuture.completedFuture(ToolResult.success("clean")))
                .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        coordinator.close();
    }

    private DefaultAgentLoop loop() {
        RetryPolicy fast = RetryPolicy.builder()
                .maxRetries(2)
                .initialDelay(Duration.ofMillis(1))
                .maxDelay(Duration.ofMillis(5))
                .jitterFactor(0)
                .build();
        RetryPolicy noRetry = fast.toBuilder().maxRetries(0).build();
        RetryExecutor modelRetry = new RetryExecutor(new RetryEngine(fast, new DefaultErrorClassifier()));
        RetryExecutor toolRetry = new RetryExecutor(new RetryEngine(noRetry, new DefaultErrorClassifier()));
        DefaultToolCallScheduler scheduler = new DefaultToolCallScheduler(registry,
                List.of(new PermissionAdmissionCheck(new AgentEngineProperties.CoordinationProperties())),
                toolRetry, executor, toolsSettings);
        DefaultContextManager contextManager = new DefaultContextManager(historySettings, null, List.of(), null,
                clock);
        return new DefaultAgentLoop(llmPort, registry, scheduler, contextManager, modelRetry, coordinator,
                new DefaultHistoryWriter(clock), loopSettings, modelSettings);
    }

    private static LlmResponse text(String content) {
        return LlmResponse.builder().content(content).usage(LlmUsage.of(10, 5)).finishReason("stop").build();
    }

    private static LlmResponse toolRound(Message.ToolCall... calls) {
        return LlmResponse.builder().toolCalls(List.of(calls)).usage(LlmUsage.of(10, 5)).finishReason("tool_calls")
                .build();
    }

    private static Message.ToolCall call(String id, String name, Map<String, Object> arguments) {
        return Message.ToolCall.builder().id(id).name(name).arguments(arguments).build();
    }

    /**
     * Answers model calls in order; the last response repeats.
     */
    private void respondWith(LlmResponse... responses) {
        Deque<LlmResponse> queue = new ArrayDeque<>(List.of(responses));
        when(llmPort.chat(any())).thenAnswer(invocation -> CompletableFuture.completedFuture(
                queue.size() > 1 ? queue.poll() : queue.peek()));
    }

    private void respondWithFreshEchoCalls() {
        AtomicInteger counter = new AtomicInteger();
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            int n = counter.incrementAndGet();
            return CompletableFuture.completedFuture(
                    toolRound(call("c" + n, "echo", Map.of("text", "round " + n))));
        });
    }

    private AgentRunResult run(int maxIterations) {
        return loop().run(List.of(), List.of(Message.user("hello")), maxIterations);
    }

    private List<LlmRequest> capturedRequests(int count) {
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(count)).chat(captor.capture());
        return captor.getAllValues();
    }

    private <T extends AgentEvent> T awaitEvent(Class<T> type) {
        long deadline = System.currentTimeMillis() + 2000;
        while (System.currentTimeMillis() < deadline) {
            for (AgentEvent event : events) {
                if (type.isInstance(event)) {
                    return type.cast(event);
                }
            }
            Thread.onSpinWait();
        }
        throw new AssertionError("No " + type.getSimpleName() + " emitted");
    }

    // ==================== Completion ====================

    @Test
    void shouldCompleteWhenModelAnswersWithoutTools() {
        respondWith(text("Hi there"));

        AgentRunResult result = run(5);

        assertEquals(AgentRunStatus.COMPLETED, result.status());
        assertEquals("Hi there", result.finalText());
        assertEquals(1, result.iterations());
        assertEquals(1, result.newMessages().size());
        Message answer = result.newMessages().get(0);
        assertTrue(answer.isAssistantMessage());
        assertEquals(5, answer.getMetadata().get("outputTokens"));
        assertEquals(NOW, answer.getTimestamp());

        LlmRequest request = capturedRequests(1).get(0);
        assertEquals(MODEL, request.getModel());
        assertEquals("hello", request.getMessages().get(0).getContent());
        assertFalse(request.isStream());
        assertEquals("COMPLETED", awaitEvent(TurnCompletedEvent.class).status());
    }

    @Test
    void shouldFeedToolResultsBackToModel() {
        respondWith(toolRound(call("c1", "echo", Map.of("text", "ping"))), text("Got pong"));

        AgentRunResult result = run(5);

        assertEquals(AgentRunStatus.COMPLETED, result.status());
        assertEquals(2, result.iterations());
        assertEquals(3, result.newMessages().size());
        assertTrue(result.newMessages().get(0).hasToolCalls());
        assertEquals("c1", result.newMessages().get(1).getToolCallId());
        assertEquals("echo:ping", result.newMessages().get(1).getContent());
        assertEquals(20, result.usage().getInputTokens());
        assertEquals(10, result.usage().getOutputTokens());

        List<Message> secondPrompt = capturedRequests(2).get(1).getMessages();
        assertEquals(3, secondPrompt.size());
        assertEquals("echo:ping", secondPrompt.get(2).getContent());
    }

    @Test
    void shouldNotCallModelWithZeroIterations() {
        AgentRunResult result = run(0);

        assertEquals(AgentRunStatus.ITERATION_LIMIT, result.status());
        assertEquals(0, result.iterations());
        assertNull(result.finalResponse());
        assertTrue(result.newMessages().isEmpty());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldStopAtIterationLimit() {
        respondWithFreshEchoCalls();

        AgentRunResult result = run(3);

        assertEquals(AgentRunStatus.ITERATION_LIMIT, result.status());
        assertEquals(3, result.iterations());
        assertEquals(6, result.newMessages().size());
        assertEquals(3, echoCalls.get());
        verify(llmPort, times(3)).chat(any());
    }

    // ==================== Unknown functions ====================

    @Test
    void shouldLetModelRecoverFromUnknownFunction() {
        respondWith(toolRound(call("c1", "nope", Map.of())), text("Sorry, done"));

        AgentRunResult result = run(5);

        assertEquals(AgentRunStatus.COMPLETED, result.status());
        assertTrue(result.newMessages().get(1).getContent().startsWith("Error: Unknown function 'nope'"));
        assertEquals("UNKNOWN_FUNCTION", result.newMessages().get(1).getMetadata().get("failureKind"));
    }

    @Test
    void shouldFailRunOnUnknownFunctionWhenConfigured() {
        toolsSettings.setTerminateOnUnknownCalls(true);
        respondWith(toolRound(call("c1", "nope", Map.of())));

        AgentRunException error = assertThrows(AgentRunException.class, () -> run(5));

        assertEquals(AgentFailureReason.UNKNOWN_FUNCTION, error.getReason());
        assertTrue(error.getPartialTurnHistory().isEmpty());
    }

    // ==================== Failures ====================

    @Test
    void shouldKeepPartialHistoryWhenModelFails() {
        AtomicInteger calls = new AtomicInteger();
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.completedFuture(toolRound(call("c1", "echo", Map.of("text", "a"))));
            }
            return CompletableFuture.failedFuture(new ProviderException(400, "Bad request"));
        });

        AgentRunException error = assertThrows(AgentRunException.class, () -> run(5));

        assertEquals(AgentFailureReason.MODEL_FAILURE, error.getReason());
        assertEquals(2, error.getPartialTurnHistory().size());
        assertEquals("c1", error.getPartialTurnHistory().get(1).getToolCallId());
        verify(llmPort, times(2)).chat(any());
    }

    @Test
    void shouldRetryTransientModelFailure() {
        AtomicInteger calls = new AtomicInteger();
        when(llmPort.chat(any())).thenAnswer(invocation -> calls.incrementAndGet() == 1
                ? CompletableFuture.failedFuture(new IOException("Connection reset"))
                : CompletableFuture.completedFuture(text("Recovered")));

        AgentRunResult result = run(5);

        assertEquals(AgentRunStatus.COMPLETED, result.status());
        assertEquals("Recovered", result.finalText());
        ModelRetryEvent retry = awaitEvent(ModelRetryEvent.class);
        assertEquals(1, retry.attempt());
        assertEquals(ErrorCategory.TRANSIENT, retry.category());
    }

    @Test
    void shouldAbortAfterConsecutiveToolErrors() {
        AtomicInteger counter = new AtomicInteger();
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            int n = counter.incrementAndGet();
            return CompletableFuture.completedFuture(toolRound(call("c" + n, "broken", Map.of("n", n))));
        });

        AgentRunException error = assertThrows(AgentRunException.class, () -> run(10));

        assertEquals(AgentFailureReason.TOOL_ERROR_LIMIT, error.getReason());
        assertEquals(6, error.getPartialTurnHistory().size());
        verify(llmPort, times(3)).chat(any());
    }

    @Test
    void shouldResetErrorCountAfterSuccessfulRound() {
        respondWith(
                toolRound(call("c1", "broken", Map.of("n", 1))),
                toolRound(call("c2", "broken", Map.of("n", 2))),
                toolRound(call("c3", "echo", Map.of("text", "ok"))),
                toolRound(call("c4", "broken", Map.of("n", 4))),
                text("done"));

        AgentRunResult result = run(10);

        assertEquals(AgentRunStatus.COMPLETED, result.status());
    }

    @Test
    void shouldStopRepeatedIdenticalCalls() {
        respondWith(toolRound(call("c1", "echo", Map.of("text", "same"))));

        AgentRunResult result = run(10);

        assertEquals(AgentRunStatus.CIRCUIT_BREAKER, result.status());
        assertEquals(3, result.iterations());
        assertEquals(2, echoCalls.get());
        assertEquals(6, result.newMessages().size());
        assertTrue(result.newMessages().get(5).getContent().contains("called 3 times in a row"));
    }

    @Test
    void shouldFailWhenCancelledBeforeStart() {
        RunCancellation cancellation = RunCancellation.create();
        cancellation.cancel();

        AgentRunException error = assertThrows(AgentRunException.class,
                () -> loop().run(List.of(), List.of(Message.user("hello")), 5, cancellation));

        assertEquals(AgentFailureReason.CANCELLED, error.getReason());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldKeepCompletedRoundWhenCancelledMidRun() {
        respondWith(toolRound(call("c1", "stop", Map.of())), text("never"));

        AgentRunException error = assertThrows(AgentRunException.class,
                () -> loop().run(List.of(), List.of(Message.user("hello")), 5, runToStop));

        assertEquals(AgentFailureReason.CANCELLED, error.getReason());
        assertEquals(2, error.getPartialTurnHistory().size());
        verify(llmPort, times(1)).chat(any());
    }

    // ==================== Containers and streaming ====================

    @Test
    void shouldStripContainerExpansionFromPersistedMessages() {
        respondWith(
                toolRound(call("c1", "git", Map.of())),
                toolRound(call("c2", "git_status", Map.of())),
                text("Tree is clean"));

        AgentRunResult result = run(5);

        assertEquals(AgentRunStatus.COMPLETED, result.status());
        assertEquals(3, result.newMessages().size());
        assertEquals("c2", result.newMessages().get(0).getToolCalls().get(0).getId());
        assertTrue(result.newMessages().stream().noneMatch(Message::isContainerResult));

        List<LlmRequest> requests = capturedRequests(3);
        assertTrue(requests.get(0).getTools().stream().noneMatch(tool -> "git_status".equals(tool.getName())));
        assertTrue(requests.get(1).getTools().stream().anyMatch(tool -> "git_status".equals(tool.getName())));
        assertTrue(requests.get(1).getMessages().stream().anyMatch(message -> message.getContent() != null
                && message.getContent().startsWith("git expanded successfully")));
    }

    @Test
    void shouldAggregateStreamedResponse() {
        loopSettings.setStreaming(true);
        when(llmPort.supportsStreaming()).thenReturn(true);
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                LlmChunk.builder().text("Hel").build(),
                LlmChunk.builder().text("lo").usage(LlmUsage.of(3, 2)).finishReason("stop").done(true).build()));

        AgentRunResult result = run(5);

        assertEquals("Hello", result.finalText());
        assertEquals(5, result.usage().getTotalTokens());
        verify(llmPort, never()).chat(any());
    }

    // ==================== Continuation ====================

    @Test
    void shouldExtendIterationsWhenContinuationApproved() {
        loopSettings.getContinuation().setEnabled(true);
        loopSettings.getContinuation().setExtension(2);
        coordinator.addListener(event -> {
            if (event instanceof CoordinationRequest request && request.kind() == CoordinationKind.CONTINUATION) {
                coordinator.resolve(request.id(), CoordinationResponse.approve(request.id()));
            }
        });
        respondWith(toolRound(call("c1", "echo", Map.of("text", "a"))), text("Finished"));

        AgentRunResult result = run(1);

        assertEquals(AgentRunStatus.COMPLETED, result.status());
        assertEquals(2, result.iterations());
    }

    @Test
    void shouldStopAtLimitWhenContinuationDenied() {
        loopSettings.getContinuation().setEnabled(true);
        coordinator.addListener(event -> {
            if (event instanceof CoordinationRequest request && request.kind() == CoordinationKind.CONTINUATION) {
                coordinator.resolve(request.id(), CoordinationResponse.deny(request.id()));
            }
        });
        respondWith(toolRound(call("c1", "echo", Map.of("text", "a"))), text("Finished"));

        AgentRunResult result = run(1);

        assertEquals(AgentRunStatus.ITERATION_LIMIT, result.status());
        verify(llmPort, times(1)).chat(any());
    }
}
