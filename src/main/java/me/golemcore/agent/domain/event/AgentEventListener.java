package me.golemcore.agent.domain.event;

/**
 * Receives events on the coordinator's drain thread. Listeners must not block
 * for long; answering a {@link CoordinationRequest} is done by calling
 * {@link EventCoordinator#resolve} from any thread.
 */
@FunctionalInterface
public interface AgentEventListener {

    void onEvent(AgentEvent event);
}
