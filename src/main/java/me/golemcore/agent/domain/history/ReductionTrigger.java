package me.golemcore.agent.domain.history;

import me.golemcore.agent.domain.model.Message;

import java.util.List;

/**
 * Custom reduction trigger. When configured it takes precedence over the token
 * and count thresholds.
 */
@FunctionalInterface
public interface ReductionTrigger {

    /**
     * @param sinceLastSummary
     *            messages after the most recent summary marker (or all of them)
     */
    boolean shouldReduce(List<Message> sinceLastSummary);
}
