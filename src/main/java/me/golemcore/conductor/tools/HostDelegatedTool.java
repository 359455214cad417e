package me.golemcore.conductor.tools;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.component.ToolComponent;
import me.golemcore.conductor.domain.model.CallOutcome;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.ToolExecutionContext;
import me.golemcore.conductor.domain.model.ToolFailureKind;
import me.golemcore.conductor.domain.model.ToolResult;
import me.golemcore.conductor.port.outbound.HostBridgePort;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A tool whose work happens on the host. Arguments are forwarded over the
 * bridge as a {@code native_tool} request and the three-way outcome is mapped
 * onto a {@link ToolResult}.
 */
@Slf4j
public class HostDelegatedTool implements ToolComponent {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ToolDefinition definition;
    private final String hostMethod;
    private final double timeoutMultiplier;
    private final boolean requiresAccessToken;
    private final HostBridgePort hostBridge;
    private final ObjectMapper objectMapper;

    public HostDelegatedTool(ToolDefinition definition, String hostMethod, double timeoutMultiplier,
            boolean requiresAccessToken, HostBridgePort hostBridge, ObjectMapper objectMapper) {
        this.definition = definition;
        this.hostMethod = hostMethod != null ? hostMethod : definition.getName();
        this.timeoutMultiplier = timeoutMultiplier;
        this.requiresAccessToken = requiresAccessToken;
        this.hostBridge = hostBridge;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public double getTimeoutMultiplier() {
        return timeoutMultiplier;
    }

    @Override
    public boolean requiresAccessToken() {
        return requiresAccessToken;
    }

    public String getHostMethod() {
        return hostMethod;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            CallOutcome<JsonNode> outcome = hostBridge.call(hostMethod, parameters, context.getTimeout());
            return toToolResult(outcome);
        });
    }

    private ToolResult toToolResult(CallOutcome<JsonNode> outcome) {
        switch (outcome.getStatus()) {
        case OK:
            return success(outcome.getValue());
        case TIMED_OUT:
            log.warn("[Tools] Host tool {} timed out: {}", hostMethod, outcome.getMessage());
            return ToolResult.failure(ToolFailureKind.TIMEOUT, outcome.getMessage());
        default:
            log.info("[Tools] Host tool {} failed ({}): {}", hostMethod, outcome.getCode(), outcome.getMessage());
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    outcome.getMessage() + " (code " + outcome.getCode() + ")");
        }
    }

    private ToolResult success(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return ToolResult.success("Done");
        }
        if (value.isValueNode()) {
            return ToolResult.success(value.asText());
        }
        try {
            String rendered = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            Object data = value.isObject() ? objectMapper.convertValue(value, MAP_TYPE) : null;
            return ToolResult.success(rendered, data);
        } catch (JsonProcessingException e) {
            return ToolResult.success(value.toString());
        }
    }
}
