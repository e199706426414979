package me.golemcore.agent.domain.history;

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

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessageMetadata;

import java.util.List;
import java.util.Map;

/**
 * Approximate token counting. Provider-recorded counts win; everything else is
 * estimated from character length.
 */
public class TokenEstimator {

    private static final int MESSAGE_OVERHEAD_TOKENS = 4;

    private final double charsPerToken;

    public TokenEstimator(double charsPerToken) {
        this.charsPerToken = charsPerToken > 0 ? charsPerToken : 3.5;
    }

    public int estimate(List<Message> messages) {
        int total = 0;
        for (Message message : messages) {
            total += estimate(message);
        }
        return total;
    }

    public int estimate(Message message) {
        Integer recorded = recordedTokens(message);
        if (recorded != null) {
            return recorded + MESSAGE_OVERHEAD_TOKENS;
        }
        int chars = length(message.getContent()) + length(message.getReasoning());
        if (message.hasToolCalls()) {
            for (Message.ToolCall toolCall : message.getToolCalls()) {
                chars += length(toolCall.getName());
                chars += toolCall.getArguments() != null ? toolCall.getArguments().toString().length()
                        : length(toolCall.getRawArguments());
            }
        }
        return (int) Math.ceil(chars / charsPerToken) + MESSAGE_OVERHEAD_TOKENS;
    }

    /**
     * Output tokens recorded on assistant messages describe exactly that
     * message's text.
     */
    private Integer recordedTokens(Message message) {
        Map<String, Object> metadata = message.getMetadata();
        if (metadata == null || !message.isAssistantMessage()) {
            return null;
        }
        Object value = metadata.get(MessageMetadata.OUTPUT_TOKENS);
        if (value instanceof Number number && number.intValue() > 0) {
            return number.intValue();
        }
        return null;
    }

    private static int length(String text) {
        return text != null ? text.length() : 0;
    }
}
