package me.golemcore.agent.domain.tools;

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
import me.golemcore.agent.domain.model.ToolDefinition;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Checks arguments against what the schema requires before anything runs.
 */
final class ArgumentValidator {

    private ArgumentValidator() {
    }

    /**
     * @return corrective message, or {@code null} when the arguments are usable
     */
    static String validate(ToolDefinition definition, Message.ToolCall toolCall) {
        if (toolCall.hasUnparsableArguments()) {
            return "Arguments for '" + definition.getName() + "' are not valid JSON: "
                    + abbreviate(toolCall.getRawArguments())
                    + ". Send the arguments as a JSON object matching the function schema.";
        }
        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        List<String> missing = definition.requiredParameters().stream()
                .filter(name -> arguments.get(name) == null)
                .toList();
        if (!missing.isEmpty()) {
            return "Missing required parameter(s) for '" + definition.getName() + "': "
                    + missing.stream().collect(Collectors.joining(", "))
                    + ". Call the function again with all required parameters.";
        }
        return null;
    }

    private static String abbreviate(String raw) {
        if (raw.length() <= 200) {
            return raw;
        }
        return raw.substring(0, 200) + "...";
    }
}
