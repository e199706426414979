package me.golemcore.agent.domain.loop;

import me.golemcore.agent.adapter.outbound.registry.InMemoryFunctionRegistry;
import me.golemcore.agent.domain.event.AmbientEventCoordinator;
import me.golemcore.agent.domain.event.CoordinationKind;
import me.golemcore.agent.domain.event.CoordinationRequest;
import me.golemcore.agent.domain.event.CoordinationResponse;
import me.golemcore.agent.domain.event.DefaultEventCoordinator;
import me.golemcore.agent.domain.history.DefaultContextManager;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RunCancellation;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolInvocation;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.retry.DefaultErrorClassifier;
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

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubAgentFunctionTest {

    @Mock
    private AgentLoop innerLoop;

    @Mock
    private LlmPort innerModel;

    private DefaultEventCoordinator outerCoordinator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        outerCoordinator = new DefaultEventCoordinator();
    }

    @AfterEach
    void tearDown() {
        outerCoordinator.close();
    }

    private static ToolInvocation invocation(Map<String, Object> arguments) {
        return new ToolInvocation("call-1", "researcher", arguments, RunCancellation.create());
    }

    private static AgentRunResult result(AgentRunStatus status, String text) {
        return new AgentRunResult("inner", status, LlmResponse.builder().content(text).build(), List.of(), 1, null);
    }

    @Test
    void shouldDeclareRequiredTaskParameter() {
        ToolDefinition definition = SubAgentFunction.definition("researcher", "Researches a topic");

        assertEquals(List.of("task"), definition.requiredParameters());
    }

    @Test
    void shouldReturnInnerFinalAnswer() {
        when(innerLoop.run(anyList(), anyList(), anyInt(), any(RunCancellation.class)))
                .thenReturn(result(AgentRunStatus.COMPLETED, "Found three papers"));
        SubAgentFunction function = new SubAgentFunction(innerLoop, "You research things.", 4);

        ToolResult toolResult = function.invoke(invocation(Map.of("task", "find papers"))).join();

        assertTrue(toolResult.isSuccess());
        assertEquals("Found three papers", toolResult.getOutput());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> history = ArgumentCaptor.forClass(List.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> incoming = ArgumentCaptor.forClass(List.class);
        verify(innerLoop).run(history.capture(), incoming.capture(), eq(4), any(RunCancellation.class));
        assertEquals("You research things.", history.getValue().get(0).getContent());
        assertEquals("find papers", incoming.getValue().get(0).getContent());
    }

    @Test
    void shouldRejectMissingTask() {
        SubAgentFunction function = new SubAgentFunction(innerLoop, null, 4);

        ToolResult toolResult = function.invoke(invocation(Map.of())).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, toolResult.getFailureKind());
        verify(innerLoop, never()).run(anyList(), anyList(), anyInt(), any(RunCancellation.class));
    }

    @Test
    void shouldReportUnfinishedInnerRun() {
        when(innerLoop.run(anyList(), anyList(), anyInt(), any(RunCancellation.class)))
                .thenReturn(result(AgentRunStatus.ITERATION_LIMIT, null));
        SubAgentFunction function = new SubAgentFunction(innerLoop, null, 4);

        ToolResult toolResult = function.invoke(invocation(Map.of("task", "x"))).join();

        assertFalse(toolResult.isSuccess());
        assertTrue(toolResult.getError().contains("ITERATION_LIMIT"));
    }

    @Test
    void shouldReportFailedInnerRun() {
        when(innerLoop.run(anyList(), anyList(), anyInt(), any(RunCancellation.class)))
                .thenThrow(new AgentRunException(AgentFailureReason.MODEL_FAILURE, "provider down", List.of(), null));
        SubAgentFunction function = new SubAgentFunction(innerLoop, null, 4);

        ToolResult toolResult = function.invoke(invocation(Map.of("task", "x"))).join();

        assertFalse(toolResult.isSuccess());
        assertEquals("Sub-agent failed (MODEL_FAILURE): provider down", toolResult.getError());
    }

    @Test
    void shouldBubbleNestedPermissionRequestToOuterCoordinator() {
        List<CoordinationRequest> seen = new CopyOnWriteArrayList<>();
        outerCoordinator.addListener(event -> {
            if (event instanceof CoordinationRequest request && request.kind() == CoordinationKind.PERMISSION) {
                seen.add(request);
                outerCoordinator.resolve(request.id(), CoordinationResponse.approve(request.id()));
            }
        });

        AtomicInteger deletions = new AtomicInteger();
        InMemoryFunctionRegistry innerRegistry = InMemoryFunctionRegistry.builder()
                .register(ToolDefinition.simple("delete_file", "Deletes a file").toBuilder()
                        .requiresPermission(true).build(), inner -> {
                            deletions.incrementAndGet();
                            return CompletableFuture.completedFuture(ToolResult.success("deleted"));
                        })
                .build();
        AtomicInteger modelCalls = new AtomicInteger();
        when(innerModel.chat(any())).thenAnswer(call -> CompletableFuture.completedFuture(
                modelCalls.incrementAndGet() == 1
                        ? LlmResponse.builder().toolCalls(List.of(Message.ToolCall.builder()
                                .id("inner-1").name("delete_file").arguments(Map.of("path", "/tmp/a")).build()))
                                .build()
                        : LlmResponse.builder().content("Deleted it").build()));

        DefaultEventCoordinator unusedRoot = new DefaultEventCoordinator();
        SubAgentFunction function = new SubAgentFunction(realLoop(innerRegistry, unusedRoot), null, 4);

        ToolResult toolResult;
        try (AmbientEventCoordinator.Scope ignored = AmbientEventCoordinator.open(outerCoordinator)) {
            toolResult = function.invoke(invocation(Map.of("task", "clean up"))).join();
        } finally {
            unusedRoot.close();
        }

        assertTrue(toolResult.isSuccess());
        assertEquals("Deleted it", toolResult.getOutput());
        assertEquals(1, deletions.get());
        assertEquals(1, seen.size());
        assertEquals("delete_file", seen.get(0).source());
    }

    private DefaultAgentLoop realLoop(InMemoryFunctionRegistry registry, DefaultEventCoordinator root) {
        RetryPolicy policy = RetryPolicy.builder().maxRetries(0).initialDelay(Duration.ofMillis(1)).build();
        RetryExecutor retry = new RetryExecutor(new RetryEngine(policy, new DefaultErrorClassifier()));
        Clock clock = Clock.systemUTC();
        DefaultToolCallScheduler scheduler = new DefaultToolCallScheduler(registry,
                List.of(new PermissionAdmissionCheck(new AgentEngineProperties.CoordinationProperties())), retry,
                null, new AgentEngineProperties.ToolsProperties());
        return new DefaultAgentLoop(innerModel, registry, scheduler,
                new DefaultContextManager(new AgentEngineProperties.HistoryProperties(), null, List.of(), null, clock),
                retry, root, new DefaultHistoryWriter(clock), new AgentEngineProperties.LoopProperties(),
                new AgentEngineProperties.ModelProperties());
    }
}
