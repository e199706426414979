package me.golemcore.agent.domain.event;

/**
 * Marker for everything that flows through an {@link EventCoordinator}.
 */
public interface AgentEvent {

    default String type() {
        return getClass().getSimpleName();
    }
}
