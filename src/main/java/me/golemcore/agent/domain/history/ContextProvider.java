package me.golemcore.agent.domain.history;

import me.golemcore.agent.domain.model.Message;

import java.util.List;

/**
 * Supplies extra context (retrieved documents, user profile, environment
 * facts) injected into the model-facing messages of a run. Injected messages
 * are never persisted.
 */
@FunctionalInterface
public interface ContextProvider {

    List<Message> provide(List<Message> history, List<Message> newMessages);
}
