package me.golemcore.agent.domain.retry;

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

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies provider failures by walking the cause chain. Looks at, in order:
 * structured {@link ProviderException}s, langchain4j exception types (matched by
 * class name so any langchain4j release works), HTTP status accessors, and
 * finally the message text.
 */
@Slf4j
public class DefaultErrorClassifier implements ErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNSUPPORTED_FEATURE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnsupportedFeatureException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";

    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile(
            "(?:retry[- ]after|try again in)[:\\s]*(\\d+(?:\\.\\d+)?)\\s*(ms|milliseconds?|s|secs?|seconds?)?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS_PATTERN = Pattern.compile(
            "\\b(?:status(?:\\s*code)?|http)[:\\s=]*(\\d{3})\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public ErrorDetails classify(Throwable error) {
        if (error == null) {
            return ErrorDetails.of(ErrorCategory.UNKNOWN, null);
        }

        Duration hint = findRetryAfter(error);
        Set<Throwable> visited = new HashSet<>();
        Throwable current = error;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            ErrorDetails details = classifySingle(current);
            if (details != null) {
                if (details.retryAfter() == null && hint != null) {
                    details = details.withRetryAfter(hint);
                }
                log.debug("[Retry] Classified {} as {}", current.getClass().getSimpleName(), details.category());
                return details;
            }
            current = current.getCause();
        }
        return new ErrorDetails(ErrorCategory.UNKNOWN, null, null, error.getMessage(), hint);
    }

    private ErrorDetails classifySingle(Throwable throwable) {
        String message = throwable.getMessage();

        if (throwable instanceof ProviderException provider) {
            ErrorDetails byStatus = fromStatus(provider.getStatusCode(), provider.getErrorCode(), message);
            return provider.getRetryAfter() != null ? byStatus.withRetryAfter(provider.getRetryAfter()) : byStatus;
        }
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return ErrorDetails.of(ErrorCategory.UNKNOWN, "Request aborted");
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return ErrorDetails.of(ErrorCategory.TRANSIENT, message);
        }

        ErrorDetails byType = classifyLangchain4j(throwable, message);
        if (byType != null) {
            return byType;
        }

        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode != null) {
            return fromStatus(statusCode, null, message);
        }

        if (throwable instanceof IOException) {
            return ErrorDetails.of(ErrorCategory.TRANSIENT, message);
        }
        return classifyFromMessage(message);
    }

    private ErrorDetails classifyLangchain4j(Throwable throwable, String message) {
        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return null;
        }
        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            ErrorCategory category = isCreditExhausted(message)
                    ? ErrorCategory.RATE_LIMIT_TERMINAL
                    : ErrorCategory.RATE_LIMIT_RETRYABLE;
            return new ErrorDetails(category, 429, null, message, null);
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)
                || CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION.equals(className)
                || CLASS_RETRIABLE_EXCEPTION.equals(className)) {
            return ErrorDetails.of(ErrorCategory.TRANSIENT, message);
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)) {
            return ErrorDetails.of(ErrorCategory.AUTH_ERROR, message);
        }
        if (CLASS_INVALID_REQUEST_EXCEPTION.equals(className)) {
            return isContextOverflow(message)
                    ? ErrorDetails.of(ErrorCategory.CONTEXT_TOO_LARGE, message)
                    : ErrorDetails.of(ErrorCategory.CLIENT_ERROR, message);
        }
        if (CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)
                || CLASS_CONTENT_FILTERED_EXCEPTION.equals(className)
                || CLASS_UNSUPPORTED_FEATURE_EXCEPTION.equals(className)
                || CLASS_NON_RETRIABLE_EXCEPTION.equals(className)) {
            return ErrorDetails.of(ErrorCategory.CLIENT_ERROR, message);
        }
        if (CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)) {
            return ErrorDetails.of(ErrorCategory.SERVER_ERROR, message);
        }
        // HttpException and the LangChain4jException base fall through to status and
        // message checks
        return null;
    }

    static ErrorDetails fromStatus(int statusCode, String errorCode, String message) {
        ErrorCategory category;
        if (statusCode == 429) {
            category = isCreditExhausted(message) || isCreditExhausted(errorCode)
                    ? ErrorCategory.RATE_LIMIT_TERMINAL
                    : ErrorCategory.RATE_LIMIT_RETRYABLE;
        } else if (statusCode == 402) {
            category = ErrorCategory.RATE_LIMIT_TERMINAL;
        } else if (statusCode == 401 || statusCode == 403) {
            category = ErrorCategory.AUTH_ERROR;
        } else if (statusCode == 408 || statusCode == 504) {
            category = ErrorCategory.TRANSIENT;
        } else if (statusCode == 413) {
            category = ErrorCategory.CONTEXT_TOO_LARGE;
        } else if (statusCode >= 500) {
            category = ErrorCategory.SERVER_ERROR;
        } else if (statusCode >= 400) {
            category = isContextOverflow(message) ? ErrorCategory.CONTEXT_TOO_LARGE : ErrorCategory.CLIENT_ERROR;
        } else {
            category = ErrorCategory.UNKNOWN;
        }
        return new ErrorDetails(category, statusCode, errorCode, message, null);
    }

    private ErrorDetails classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        if (isContextOverflow(message)) {
            return ErrorDetails.of(ErrorCategory.CONTEXT_TOO_LARGE, message);
        }
        if (isCreditExhausted(message)) {
            return ErrorDetails.of(ErrorCategory.RATE_LIMIT_TERMINAL, message);
        }
        Matcher status = STATUS_PATTERN.matcher(message);
        if (status.find()) {
            return fromStatus(Integer.parseInt(status.group(1)), null, message);
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("rate limit") || normalized.contains("too many requests")) {
            return new ErrorDetails(ErrorCategory.RATE_LIMIT_RETRYABLE, 429, null, message, null);
        }
        return null;
    }

    static boolean isContextOverflow(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("context length")
                || normalized.contains("context_length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("token limit exceeded")
                || normalized.contains("prompt is too long");
    }

    static boolean isCreditExhausted(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("insufficient_credit")
                || normalized.contains("insufficient credit")
                || normalized.contains("insufficient_quota")
                || normalized.contains("credit balance")
                || normalized.contains("payment required");
    }

    /**
     * Parses "retry after 2.5s", "try again in 20 seconds" or "Retry-After: 3" out
     * of any message in the cause chain.
     */
    static Duration findRetryAfter(Throwable error) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = error;
        while (current != null && !visited.contains(current)) {
            visited.add(current);
            Duration parsed = parseRetryAfter(current.getMessage());
            if (parsed != null) {
                return parsed;
            }
            current = current.getCause();
        }
        return null;
    }

    static Duration parseRetryAfter(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        Matcher matcher = RETRY_AFTER_PATTERN.matcher(message);
        if (!matcher.find()) {
            return null;
        }
        double value = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2);
        if (unit != null && unit.toLowerCase(Locale.ROOT).startsWith("ms")
                || unit != null && unit.toLowerCase(Locale.ROOT).startsWith("milli")) {
            return Duration.ofMillis(Math.round(value));
        }
        return Duration.ofMillis(Math.round(value * 1000));
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer status) {
                return status;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return null;
        }
        return null;
    }
}
