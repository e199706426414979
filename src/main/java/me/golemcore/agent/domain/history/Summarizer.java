package me.golemcore.agent.domain.history;

import me.golemcore.agent.domain.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Produces a summary of a span of messages.
 */
public interface Summarizer {

    /**
     * @return summary text, or empty when summarization is not possible right now
     */
    Optional<String> summarize(List<Message> messages);
}
