package me.golemcore.conductor.port.outbound;

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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.conductor.domain.model.CallOutcome;

import java.time.Duration;
import java.util.Map;

/**
 * Port for calling capabilities owned by the host application. The transport
 * underneath is an asynchronous message channel; {@link #call} hides that and
 * blocks until the host answers or the timeout elapses.
 */
public interface HostBridgePort {

    /**
     * Sends a {@code native_tool} request to the host and waits for its answer.
     *
     * @return {@code OK} with the verbatim {@code result} node, {@code FAILED}
     *         with the host's error message and code, or {@code TIMED_OUT}
     */
    CallOutcome<JsonNode> call(String tool, Map<String, Object> args, Duration timeout);

    /**
     * Fire-and-forget progress/log message. Never blocks, expects no reply.
     *
     * @param progress
     *            completion fraction in [0, 1], or null
     */
    void log(String message, String level, Double progress);

    /**
     * Fire-and-forget notification carrying no correlation id.
     */
    void notify(String method, Map<String, Object> params);
}
