package me.golemcore.conductor.domain.system;

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

import me.golemcore.conductor.domain.model.ModelApiException;

import java.net.SocketTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Stable error codes for model-provider failures, plus the user-facing text
 * shown when a turn ends on one of them.
 */
public final class ModelErrorClassifier {

    public static final String RATE_LIMIT = "llm.rate_limit";
    public static final String AUTHENTICATION = "llm.authentication";
    public static final String SERVER_BUSY = "llm.server_busy";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String NETWORK = "llm.network";
    public static final String INVALID_REQUEST = "llm.invalid_request";
    public static final String UNKNOWN = "llm.error.unknown";

    private ModelErrorClassifier() {
    }

    public static String classifyStatus(int status) {
        if (status == 0) {
            return NETWORK;
        }
        if (status == 429) {
            return RATE_LIMIT;
        }
        if (status == 401 || status == 403) {
            return AUTHENTICATION;
        }
        if (status == 408) {
            return REQUEST_TIMEOUT;
        }
        if (status >= 500) {
            return SERVER_BUSY;
        }
        if (status >= 400) {
            return INVALID_REQUEST;
        }
        return UNKNOWN;
    }

    /**
     * Walks the cause chain and returns the first recognizable code.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof ModelApiException apiException) {
                return classifyStatus(apiException.getStatus());
            }
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return REQUEST_ABORTED;
            }
            if (current instanceof SocketTimeoutException || current instanceof TimeoutException) {
                return REQUEST_TIMEOUT;
            }
            current = current.getCause();
        }
        return UNKNOWN;
    }

    public static String userMessage(Throwable throwable) {
        String code = classifyFromThrowable(throwable);
        switch (code) {
        case RATE_LIMIT:
            return "Too many requests. Please wait 60 seconds.";
        case AUTHENTICATION:
            return "Invalid API key. Please check your configuration in Settings.";
        case SERVER_BUSY:
            return "AI service is busy. Retrying automatically...";
        case REQUEST_TIMEOUT:
            return "Operation timed out after 120s. The file may be too large.";
        default:
            return "Sorry, I encountered an error: " + rootMessage(throwable);
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof ModelApiException || current.getCause() == null) {
                return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
            }
            current = current.getCause();
        }
        return "unknown error";
    }
}
