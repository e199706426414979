package me.golemcore.agent.domain.tools;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.event.AmbientEventCoordinator;
import me.golemcore.agent.domain.event.AgentEvent;
import me.golemcore.agent.domain.event.ToolCallCompletedEvent;
import me.golemcore.agent.domain.event.ToolCallStartedEvent;
import me.golemcore.agent.domain.loop.TurnContext;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RunCancellation;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolInvocation;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.retry.NonRetryableException;
import me.golemcore.agent.domain.retry.RetryExecutor;
import me.golemcore.agent.domain.retry.RetryExhaustedException;
import me.golemcore.agent.infrastructure.config.AgentEngineProperties;
import me.golemcore.agent.port.outbound.FunctionRegistryPort;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Default scheduler. Each call goes through, in order: descriptor lookup,
 * container handling, argument validation, admission checks, and invocation
 * under the tool retry executor with the per-call deadline. Every failure on
 * that path becomes a structured result the model can react to.
 *
 * <p>
 * Batches with more than one call fan out on the worker pool when parallel
 * execution is on. A batch raised from inside a worker (a nested agent) runs
 * sequentially on that worker so nested runs never wait on their own pool.
 */
@Slf4j
public class DefaultToolCallScheduler implements ToolCallScheduler {

    private static final int MAX_LISTED_MEMBERS = 5;
    private static final ThreadLocal<Boolean> ON_WORKER = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final FunctionRegistryPort registry;
    private final List<AdmissionCheck> admissionChecks;
    private final RetryExecutor toolRetry;
    private final ExecutorService executor;
    private final ExecutorService callExecutor;
    private final AgentEngineProperties.ToolsProperties settings;

    /**
     * Creates a scheduler that invokes functions on the calling thread. The
     * per-call deadline then only bounds the future a function returns, not
     * work it does before returning.
     */
    public DefaultToolCallScheduler(FunctionRegistryPort registry, List<AdmissionCheck> admissionChecks,
            RetryExecutor toolRetry, ExecutorService executor, AgentEngineProperties.ToolsProperties settings) {
        this(registry, admissionChecks, toolRetry, executor, null, settings);
    }

    /**
     * @param callExecutor
     *            runs function bodies so the per-call deadline covers them;
     *            must not be bounded by the batch pool size
     */
    public DefaultToolCallScheduler(FunctionRegistryPort registry, List<AdmissionCheck> admissionChecks,
            RetryExecutor toolRetry, ExecutorService executor, ExecutorService callExecutor,
            AgentEngineProperties.ToolsProperties settings) {
        this.registry = registry;
        this.admissionChecks = admissionChecks != null ? List.copyOf(admissionChecks) : List.of();
        this.toolRetry = toolRetry;
        this.executor = executor;
        this.callExecutor = callExecutor;
        this.settings = settings;
    }

    @Override
    public List<ToolExecutionOutcome> executeBatch(TurnContext context, List<Message.ToolCall> toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return List.of();
        }
        if (settings.isTerminateOnUnknownCalls()) {
            rejectUnknownCalls(toolCalls);
        }

        boolean parallel = settings.isParallel() && toolCalls.size() > 1 && executor != null
                && !ON_WORKER.get();
        if (!parallel) {
            List<ToolExecutionOutcome> outcomes = new ArrayList<>(toolCalls.size());
            for (Message.ToolCall toolCall : toolCalls) {
                outcomes.add(executeOne(context, toolCall));
            }
            return outcomes;
        }

        log.debug("[Tools] Running {} calls in parallel", toolCalls.size());
        List<CompletableFuture<ToolExecutionOutcome>> futures = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            futures.add(CompletableFuture.supplyAsync(
                    AmbientEventCoordinator.wrapSupplier(() -> runOnWorker(context, toolCall)), executor));
        }

        List<ToolExecutionOutcome> outcomes = new ArrayList<>(toolCalls.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(joinOutcome(futures.get(i), toolCalls.get(i)));
        }
        return outcomes;
    }

    private ToolExecutionOutcome runOnWorker(TurnContext context, Message.ToolCall toolCall) {
        ON_WORKER.set(Boolean.TRUE);
        try {
            return executeOne(context, toolCall);
        } finally {
            ON_WORKER.remove();
        }
    }

    private ToolExecutionOutcome joinOutcome(CompletableFuture<ToolExecutionOutcome> future,
            Message.ToolCall toolCall) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            log.error("[Tools] Worker failed for '{}'", toolCall.getName(), e);
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private void rejectUnknownCalls(List<Message.ToolCall> toolCalls) {
        List<String> unknown = toolCalls.stream()
                .map(toolCall -> sanitizeToolName(toolCall.getName()))
                .filter(name -> name == null || registry.find(name).isEmpty())
                .map(String::valueOf)
                .toList();
        if (!unknown.isEmpty()) {
            log.warn("[Tools] Rejecting batch with unknown function(s): {}", unknown);
            throw new UnknownFunctionException(unknown, availableNames(null));
        }
    }

    ToolExecutionOutcome executeOne(TurnContext context, Message.ToolCall toolCall) {
        String runId = context.getRunId();
        emit(new ToolCallStartedEvent(runId, toolCall.getId(), toolCall.getName()));
        long start = System.nanoTime();

        ToolExecutionOutcome outcome;
        try {
            context.getCancellation().throwIfCancelled();
            outcome = dispatch(context, toolCall);
        } catch (CancellationException e) {
            outcome = ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.CANCELLED, "Tool call cancelled");
        } catch (RuntimeException e) {
            log.error("[Tools] Unexpected failure in '{}'", toolCall.getName(), e);
            outcome = ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        emit(new ToolCallCompletedEvent(runId, toolCall.getId(), toolCall.getName(), outcome.isSuccess(),
                outcome.failureKind(), durationMs));
        return outcome;
    }

    private ToolExecutionOutcome dispatch(TurnContext context, Message.ToolCall toolCall) {
        String name = sanitizeToolName(toolCall.getName());
        Optional<ToolDefinition> found = name != null ? registry.find(name) : Optional.empty();
        if (found.isEmpty()) {
            log.warn("[Tools] Unknown function requested: {}", toolCall.getName());
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.UNKNOWN_FUNCTION,
                    "Unknown function '" + toolCall.getName() + "'. Available functions: "
                            + String.join(", ", availableNames(context)));
        }
        ToolDefinition definition = found.get();

        String parent = definition.getParentContainer();
        if (parent != null && !context.getExpandedContainers().contains(parent)) {
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.UNKNOWN_FUNCTION,
                    "Function '" + name + "' is not available yet. Call '" + parent
                            + "' with no arguments to expand it first.");
        }

        if (definition.isContainer()) {
            return handleContainer(context, definition, toolCall);
        }

        String argumentError = ArgumentValidator.validate(definition, toolCall);
        if (argumentError != null) {
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.INVALID_ARGUMENTS, argumentError);
        }

        for (AdmissionCheck check : admissionChecks) {
            AdmissionDecision decision = check.check(context, definition, toolCall);
            if (!decision.admitted()) {
                log.info("[Tools] '{}' not admitted: {}", name, decision.reason());
                return ToolExecutionOutcome.synthetic(toolCall, decision.failureKind(), decision.reason());
            }
        }

        return invoke(context, definition, toolCall);
    }

    private ToolExecutionOutcome handleContainer(TurnContext context, ToolDefinition container,
            Message.ToolCall toolCall) {
        List<String> members = registry.membersOf(container.getName()).stream()
                .map(ToolDefinition::getName)
                .toList();

        boolean hasArguments = toolCall.getArguments() != null && !toolCall.getArguments().isEmpty()
                || toolCall.hasUnparsableArguments();
        if (hasArguments) {
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.CONTAINER_MISUSE,
                    containerMisuseMessage(container.getName(), members));
        }

        context.getExpandedContainers().add(container.getName());
        log.debug("[Tools] Expanded container '{}' ({} functions)", container.getName(), members.size());
        String content = container.getName() + " expanded successfully. Available functions: "
                + String.join(", ", members);
        ToolResult result = ToolResult.success(content);
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, content, false, true, 0);
    }

    static String containerMisuseMessage(String containerName, List<String> members) {
        StringBuilder sb = new StringBuilder();
        sb.append('\'').append(containerName)
                .append("' is a container and cannot be called with parameters. ")
                .append("Make TWO separate tool calls: First call '").append(containerName)
                .append("' with NO arguments to expand it, then call one of its functions with your parameters.");
        if (!members.isEmpty()) {
            String listed = members.stream().limit(MAX_LISTED_MEMBERS).collect(Collectors.joining(", "));
            sb.append(" Available functions: ").append(listed);
            if (members.size() > MAX_LISTED_MEMBERS) {
                sb.append(", ...");
            }
        }
        return sb.toString();
    }

    private ToolExecutionOutcome invoke(TurnContext context, ToolDefinition definition, Message.ToolCall toolCall) {
        String name = definition.getName();
        AtomicInteger attempts = new AtomicInteger();
        ToolResult result;
        try {
            result = toolRetry.execute("tool:" + name, () -> {
                attempts.incrementAndGet();
                return invokeOnce(context, name, toolCall);
            }, context.getCancellation());
        } catch (RetryExhaustedException | NonRetryableException e) {
            Throwable cause = e.getCause();
            ToolFailureKind kind = cause instanceof TimeoutException
                    ? ToolFailureKind.TIMEOUT
                    : ToolFailureKind.EXECUTION_FAILED;
            String reason = kind == ToolFailureKind.TIMEOUT
                    ? "Tool '" + name + "' timed out after " + settings.getCallTimeout().toMillis() + "ms"
                    : "Tool execution failed: " + safeCauseMessage(cause);
            log.warn("[Tools] '{}' failed after {} attempt(s): {}", name, attempts.get(), reason);
            ToolResult failure = ToolResult.failure(kind, reason);
            return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), failure,
                    truncateToolResult("Error: " + reason, name), false, false, attempts.get());
        }

        if (result == null) {
            result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Function returned no result");
        } else if (!result.isSuccess() && result.getFailureKind() == null) {
            result.setFailureKind(ToolFailureKind.EXECUTION_FAILED);
        }
        String content = truncateToolResult(buildToolMessageContent(result), name);
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, content, false, false,
                attempts.get());
    }

    private ToolResult invokeOnce(TurnContext context, String name, Message.ToolCall toolCall)
            throws ExecutionException, TimeoutException {
        RunCancellation runCancellation = context.getCancellation();
        runCancellation.throwIfCancelled();
        RunCancellation callCancellation = RunCancellation.create();
        ToolInvocation invocation = new ToolInvocation(toolCall.getId(), name, toolCall.getArguments(),
                callCancellation);
        Duration timeout = settings.getCallTimeout();
        Duration deadline = timeout != null && !timeout.isZero() && !timeout.isNegative() ? timeout : null;

        try (RunCancellation.Registration ignored = runCancellation.onCancel(callCancellation::cancel)) {
            CompletableFuture<ToolResult> result = new CompletableFuture<>();
            Future<?> task = start(invocation, result);
            try {
                return runCancellation.await(result, deadline);
            } catch (TimeoutException | CancellationException e) {
                callCancellation.cancel();
                if (task != null) {
                    task.cancel(true);
                }
                throw e;
            }
        }
    }

    private Future<?> start(ToolInvocation invocation, CompletableFuture<ToolResult> result) {
        Runnable body = () -> {
            CompletableFuture<ToolResult> future;
            try {
                future = registry.invoke(invocation);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            if (future == null) {
                future = CompletableFuture.failedFuture(
                        new IllegalStateException("Function " + invocation.name() + " returned no result"));
            }
            future.whenComplete((value, error) -> {
                if (error == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error);
                }
            });
        };
        if (callExecutor == null) {
            body.run();
            return null;
        }
        return callExecutor.submit(AmbientEventCoordinator.wrap(() -> {
            ON_WORKER.set(Boolean.TRUE);
            try {
                body.run();
            } finally {
                ON_WORKER.remove();
            }
        }));
    }

    private List<String> availableNames(TurnContext context) {
        if (context != null && context.getAvailableTools() != null && !context.getAvailableTools().isEmpty()) {
            return context.getAvailableTools().stream().map(ToolDefinition::getName).toList();
        }
        return registry.listAvailable(context != null ? context.getExpandedContainers() : Set.of())
                .stream()
                .map(ToolDefinition::getName)
                .toList();
    }

    private void emit(AgentEvent event) {
        AmbientEventCoordinator.current().ifPresent(coordinator -> coordinator.emit(event));
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_.-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private String buildToolMessageContent(ToolResult result) {
        if (result.isSuccess()) {
            return result.getOutput();
        }
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            return result.getOutput();
        }
        return "Error: " + result.getError();
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        int maxChars = settings.getMaxResultChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. The full result is too large for the context window."
                + " Try a more specific query, use filtering/pagination, or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }
}
