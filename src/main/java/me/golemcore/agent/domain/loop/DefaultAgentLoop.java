package me.golemcore.agent.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agent.domain.event.AmbientEventCoordinator;
import me.golemcore.agent.domain.event.CircuitBreakerTriggeredEvent;
import me.golemcore.agent.domain.event.CoordinationOutcome;
import me.golemcore.agent.domain.event.CoordinationRequest;
import me.golemcore.agent.domain.event.ErrorEvent;
import me.golemcore.agent.domain.event.EventCoordinator;
import me.golemcore.agent.domain.event.HistoryReducedEvent;
import me.golemcore.agent.domain.event.IterationCompletedEvent;
import me.golemcore.agent.domain.event.IterationStartedEvent;
import me.golemcore.agent.domain.event.ModelRetryEvent;
import me.golemcore.agent.domain.event.TurnCompletedEvent;
import me.golemcore.agent.domain.event.TurnStartedEvent;
import me.golemcore.agent.domain.history.ContextManager;
import me.golemcore.agent.domain.history.ReductionResult;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RunCancellation;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.retry.NonRetryableException;
import me.golemcore.agent.domain.retry.RetryExecutor;
import me.golemcore.agent.domain.retry.RetryExhaustedException;
import me.golemcore.agent.domain.retry.RetryState;
import me.golemcore.agent.domain.tools.ToolCallScheduler;
import me.golemcore.agent.domain.tools.ToolExecutionOutcome;
import me.golemcore.agent.domain.tools.UnknownFunctionException;
import me.golemcore.agent.infrastructure.config.AgentEngineProperties;
import me.golemcore.agent.port.outbound.FunctionRegistryPort;
import me.golemcore.agent.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Agent loop orchestrator.
 *
 * <p>
 * Each iteration refreshes the tool list, shrinks the window if needed, calls
 * the model under the retry executor and either finishes (no tool calls) or
 * hands the calls to the scheduler and appends the results. The run ends with
 * {@link AgentRunStatus#COMPLETED}, {@link AgentRunStatus#ITERATION_LIMIT} or
 * {@link AgentRunStatus#CIRCUIT_BREAKER}, or fails with
 * {@link AgentRunException}.
 *
 * <p>
 * A run started while another run's coordinator is ambient (a sub-agent inside
 * a function body) uses a child of that coordinator, so its events and human
 * requests reach the outer transport.
 */
public class DefaultAgentLoop implements AgentLoop {

    private static final Logger log = LoggerFactory.getLogger(DefaultAgentLoop.class);

    private final LlmPort llmPort;
    private final FunctionRegistryPort registry;
    private final ToolCallScheduler scheduler;
    private final ContextManager contextManager;
    private final RetryExecutor modelRetry;
    private final EventCoordinator rootCoordinator;
    private final HistoryWriter historyWriter;
    private final AgentEngineProperties.LoopProperties settings;
    private final AgentEngineProperties.ModelProperties model;

    public DefaultAgentLoop(LlmPort llmPort, FunctionRegistryPort registry, ToolCallScheduler scheduler,
            ContextManager contextManager, RetryExecutor modelRetry, EventCoordinator rootCoordinator,
            HistoryWriter historyWriter, AgentEngineProperties.LoopProperties settings,
            AgentEngineProperties.ModelProperties model) {
        this.llmPort = llmPort;
        this.registry = registry;
        this.scheduler = scheduler;
        this.contextManager = contextManager;
        this.modelRetry = modelRetry;
        this.rootCoordinator = rootCoordinator;
        this.historyWriter = historyWriter;
        this.settings = settings;
        this.model = model;
    }

    @Override
    public AgentRunResult run(AgentRunRequest request) {
        Optional<EventCoordinator> outer = AmbientEventCoordinator.current();
        EventCoordinator coordinator = outer.isPresent() ? outer.get().child() : rootCoordinator;
        try (AmbientEventCoordinator.Scope ignored = AmbientEventCoordinator.open(coordinator)) {
            return runInScope(request, coordinator);
        }
    }

    private AgentRunResult runInScope(AgentRunRequest request, EventCoordinator coordinator) {
        String runId = request.getRunId() != null ? request.getRunId() : UUID.randomUUID().toString();
        TurnContext context = TurnContext.builder()
                .runId(runId)
                .messages(new ArrayList<>(contextManager.prepareEffectiveMessages(request.getHistory(),
                        request.getNewMessages())))
                .maxIterations(request.getMaxIterations())
                .identicalCallBreaker(new IdenticalCallBreaker(settings.getMaxConsecutiveIdenticalCalls()))
                .cancellation(request.getCancellation())
                .permissionMemory(request.getPermissionMemory())
                .build();

        coordinator.emit(new TurnStartedEvent(runId, context.getMessages().size(), request.getMaxIterations()));
        log.debug("[Loop] Run {} started with {} messages, max {} iterations", runId, context.getMessages().size(),
                request.getMaxIterations());

        try {
            return iterate(context, coordinator);
        } catch (AgentRunException e) {
            coordinator.emit(new ErrorEvent(runId, e.getReason().name(), e.getMessage()));
            throw e;
        } catch (CancellationException e) {
            log.info("[Loop] Run {} cancelled at iteration {}", runId, context.getIteration());
            coordinator.emit(new ErrorEvent(runId, AgentFailureReason.CANCELLED.name(), "Run cancelled"));
            throw new AgentRunException(AgentFailureReason.CANCELLED, "Run cancelled", context.getTurnHistory(), e);
        }
    }

    private AgentRunResult iterate(TurnContext context, EventCoordinator coordinator) {
        String runId = context.getRunId();
        int limit = context.getMaxIterations();
        int extensions = 0;
        LlmResponse last = null;
        LlmUsage usage = null;

        while (true) {
            if (context.getIteration() >= limit) {
                if (last != null && askForMoreIterations(context, coordinator, extensions)) {
                    extensions++;
                    limit += settings.getContinuation().getExtension();
                    log.info("[Loop] Run {} extended to {} iterations", runId, limit);
                    continue;
                }
                log.info("[Loop] Run {} stopped at iteration limit ({})", runId, limit);
                return finish(context, coordinator, AgentRunStatus.ITERATION_LIMIT, last, usage);
            }
            context.getCancellation().throwIfCancelled();

            int iteration = context.getIteration();
            coordinator.emit(new IterationStartedEvent(runId, iteration));
            context.setAvailableTools(registry.listAvailable(context.getExpandedContainers()));
            reduceIfNeeded(context, coordinator);

            LlmResponse response = callModel(context, coordinator);
            last = response;
            usage = LlmUsage.add(usage, response.getUsage());

            if (!response.hasToolCalls()) {
                historyWriter.appendFinalAssistantAnswer(context, response);
                coordinator.emit(new IterationCompletedEvent(runId, iteration, 0));
                context.setIteration(iteration + 1);
                return finish(context, coordinator, AgentRunStatus.COMPLETED, response, usage);
            }

            List<Message.ToolCall> toolCalls = response.getToolCalls();
            Optional<IdenticalCallBreaker.Trip> trip = context.getIdenticalCallBreaker().check(toolCalls);
            if (trip.isPresent()) {
                return stopOnCircuitBreaker(context, coordinator, response, trip.get(), usage);
            }

            List<ToolExecutionOutcome> outcomes;
            try {
                outcomes = scheduler.executeBatch(context, toolCalls);
            } catch (UnknownFunctionException e) {
                throw new AgentRunException(AgentFailureReason.UNKNOWN_FUNCTION, e.getMessage(),
                        context.getTurnHistory(), e);
            }
            historyWriter.appendToolRound(context, response, outcomes);
            context.getIdenticalCallBreaker().record(toolCalls);
            coordinator.emit(new IterationCompletedEvent(runId, iteration, toolCalls.size()));
            context.setIteration(iteration + 1);

            checkConsecutiveErrors(context, outcomes);
        }
    }

    private void reduceIfNeeded(TurnContext context, EventCoordinator coordinator) {
        ReductionResult reduction = contextManager.reduceIfNeeded(context.getMessages());
        if (reduction.isReduced()) {
            context.setMessages(new ArrayList<>(reduction.messages()));
            coordinator.emit(new HistoryReducedEvent(context.getRunId(), reduction.strategy().name(),
                    reduction.removedCount(), reduction.messages().size()));
        }
    }

    private LlmResponse callModel(TurnContext context, EventCoordinator coordinator) {
        LlmRequest request = buildRequest(context);
        String runId = context.getRunId();
        try {
            LlmResponse response = modelRetry.execute("llm", () -> invokeModel(request, context.getCancellation()),
                    context.getCancellation(), attempt -> {
                        if (attempt.state() == RetryState.RETRYING) {
                            coordinator.emit(new ModelRetryEvent(runId, attempt.attempt(), attempt.category(),
                                    attempt.delay().toMillis(), attempt.errorMessage()));
                        }
                    });
            log.debug("[Loop] Run {} iteration {}: model returned {} tool call(s)", runId, context.getIteration(),
                    response.hasToolCalls() ? response.getToolCalls().size() : 0);
            return response;
        } catch (RetryExhaustedException | NonRetryableException e) {
            log.warn("[Loop] Run {} model call failed: {}", runId, e.getMessage());
            throw new AgentRunException(AgentFailureReason.MODEL_FAILURE, e.getMessage(), context.getTurnHistory(),
                    e);
        }
    }

    private LlmResponse invokeModel(LlmRequest request, RunCancellation cancellation) throws Exception {
        CompletableFuture<LlmResponse> future;
        if (request.isStream()) {
            future = StreamingResponseAggregator.aggregate(llmPort.chatStream(request)).toFuture();
        } else {
            future = llmPort.chat(request);
        }
        LlmResponse response = cancellation.await(future, positiveOrNull(settings.getModelTimeout()));
        if (response == null) {
            throw new IllegalStateException("Model returned no response");
        }
        return response;
    }

    private LlmRequest buildRequest(TurnContext context) {
        return LlmRequest.builder()
                .model(model.getName())
                .messages(List.copyOf(context.getMessages()))
                .tools(context.getAvailableTools())
                .temperature(model.getTemperature())
                .maxTokens(model.getMaxTokens())
                .stream(settings.isStreaming() && llmPort.supportsStreaming())
                .runId(context.getRunId())
                .build();
    }

    private void checkConsecutiveErrors(TurnContext context, List<ToolExecutionOutcome> outcomes) {
        boolean anyFailed = outcomes.stream().anyMatch(outcome -> !outcome.isSuccess());
        if (!anyFailed) {
            context.setConsecutiveToolErrors(0);
            return;
        }
        int errors = context.getConsecutiveToolErrors() + 1;
        context.setConsecutiveToolErrors(errors);
        int max = settings.getMaxConsecutiveToolErrors();
        if (max > 0 && errors >= max) {
            log.warn("[Loop] Run {} aborted after {} consecutive iterations with tool errors", context.getRunId(),
                    errors);
            throw new AgentRunException(AgentFailureReason.TOOL_ERROR_LIMIT,
                    "Tool calls failed in " + errors + " consecutive iterations", context.getTurnHistory(), null);
        }
    }

    private boolean askForMoreIterations(TurnContext context, EventCoordinator coordinator, int extensions) {
        AgentEngineProperties.ContinuationProperties continuation = settings.getContinuation();
        if (!continuation.isEnabled() || extensions >= continuation.getMaxExtensions()
                || continuation.getExtension() <= 0) {
            return false;
        }
        CoordinationRequest request = CoordinationRequest.continuation(context.getRunId(), context.getIteration(),
                continuation.getExtension());
        CoordinationOutcome outcome = coordinator.emitAndAwait(request, continuation.getTimeout(),
                context.getCancellation());
        if (outcome.isCancelled()) {
            throw new CancellationException("Run cancelled while asking to continue");
        }
        return outcome.isApproved();
    }

    /**
     * Answers every pending call with a synthetic result so the history keeps its
     * request/result pairing, then ends the run.
     */
    private AgentRunResult stopOnCircuitBreaker(TurnContext context, EventCoordinator coordinator,
            LlmResponse response, IdenticalCallBreaker.Trip trip, LlmUsage usage) {
        log.warn("[Loop] Run {} stopped: '{}' would repeat {} times with identical arguments", context.getRunId(),
                trip.toolName(), trip.consecutiveCalls());
        coordinator.emit(new CircuitBreakerTriggeredEvent(context.getRunId(), trip.toolName(),
                trip.consecutiveCalls()));
        String reason = "Agent loop stopped: '" + trip.toolName() + "' called " + trip.consecutiveCalls()
                + " times in a row with identical arguments";
        List<ToolExecutionOutcome> skipped = response.getToolCalls().stream()
                .map(toolCall -> ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED, reason))
                .toList();
        historyWriter.appendToolRound(context, response, skipped);
        context.setIteration(context.getIteration() + 1);
        return finish(context, coordinator, AgentRunStatus.CIRCUIT_BREAKER, response, usage);
    }

    private AgentRunResult finish(TurnContext context, EventCoordinator coordinator, AgentRunStatus status,
            LlmResponse last, LlmUsage usage) {
        coordinator.emit(new TurnCompletedEvent(context.getRunId(), status.name(), context.getIteration()));
        log.debug("[Loop] Run {} finished: {} after {} iteration(s)", context.getRunId(), status,
                context.getIteration());
        return new AgentRunResult(context.getRunId(), status, last, List.copyOf(context.getTurnHistory()),
                context.getIteration(), usage);
    }

    private static Duration positiveOrNull(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return null;
        }
        return duration;
    }
}
