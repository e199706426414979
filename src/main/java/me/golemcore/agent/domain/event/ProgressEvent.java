package me.golemcore.agent.domain.event;

/**
 * Free-form progress note, emitted by functions through the ambient coordinator.
 */
public record ProgressEvent(String source, String message) implements AgentEvent {
}
