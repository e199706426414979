package me.golemcore.agent.domain.retry;

@FunctionalInterface
public interface RetryListener {

    RetryListener NOOP = attempt -> {
    };

    void onAttempt(RetryAttempt attempt);
}
