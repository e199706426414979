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

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a batch names functions the registry does not know and the
 * scheduler is configured to reject such batches outright.
 */
@Getter
public class UnknownFunctionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> unknownNames;

    public UnknownFunctionException(List<String> unknownNames, List<String> availableNames) {
        super("Unknown function(s): " + String.join(", ", unknownNames) + ". Available functions: "
                + String.join(", ", availableNames));
        this.unknownNames = List.copyOf(unknownNames);
    }
}
