package me.golemcore.agent.domain.event;

/**
 * Emitted when a coordination request stops waiting without an answer, so the
 * transport can withdraw the prompt it showed.
 */
public record CoordinationClosedEvent(String requestId, CoordinationOutcome.Status status) implements AgentEvent {
}
