package me.golemcore.agent.domain.tools;

import me.golemcore.agent.domain.model.ToolInvocation;
import me.golemcore.agent.domain.model.ToolResult;

import java.util.concurrent.CompletableFuture;

/**
 * Body of a registered function. Long-running work should complete the future
 * asynchronously so the per-call deadline can be enforced.
 */
@FunctionalInterface
public interface FunctionInvoker {

    CompletableFuture<ToolResult> invoke(ToolInvocation invocation);
}
