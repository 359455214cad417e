package me.golemcore.conductor.adapter.inbound.rpc;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.TurnRequest;
import me.golemcore.conductor.domain.model.TurnResult;
import me.golemcore.conductor.domain.service.CredentialStore;
import me.golemcore.conductor.domain.service.PromptImprovementService;
import me.golemcore.conductor.domain.service.SessionService;
import me.golemcore.conductor.domain.system.conductor.Conductor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control-plane entry point. Parses one JSON-RPC 2.0 request, routes it to the
 * matching operation and serializes the response.
 *
 * <p>
 * Methods: {@code process_query}, {@code apply_delta}, {@code set_api_key},
 * {@code set_access_token}, {@code self_improve}.
 */
@Component
@Slf4j
public class JsonRpcDispatcher {

    private static final String JSONRPC_VERSION = "2.0";

    private final Conductor conductor;
    private final SessionService sessionService;
    private final CredentialStore credentials;
    private final PromptImprovementService promptImprovementService;
    private final ObjectMapper objectMapper;

    public JsonRpcDispatcher(Conductor conductor, SessionService sessionService, CredentialStore credentials,
            PromptImprovementService promptImprovementService, ObjectMapper objectMapper) {
        this.conductor = conductor;
        this.sessionService = sessionService;
        this.credentials = credentials;
        this.promptImprovementService = promptImprovementService;
        this.objectMapper = objectMapper;
    }

    public String handle(String requestJson) {
        JsonNode request;
        try {
            request = objectMapper.readTree(requestJson);
        } catch (JsonProcessingException e) {
            log.warn("[Rpc] Unparseable request: {}", e.getOriginalMessage());
            return serialize(error(null, JsonRpcException.PARSE_ERROR, "Parse error: " + e.getOriginalMessage()));
        }
        if (request == null || !request.isObject()) {
            return serialize(error(null, JsonRpcException.PARSE_ERROR, "Parse error: request is not a JSON object"));
        }

        JsonNode id = request.get("id");
        String method = request.path("method").asText(null);
        JsonNode params = request.path("params");
        try {
            Object result = dispatch(method, params);
            return serialize(success(id, result));
        } catch (JsonRpcException e) {
            log.warn("[Rpc] {} failed with {}: {}", method, e.getCode(), e.getMessage());
            return serialize(error(id, e.getCode(), e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.warn("[Rpc] {} rejected: {}", method, e.getMessage());
            return serialize(error(id, JsonRpcException.INVALID_PARAMS, "Invalid params: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[Rpc] {} failed", method, e);
            return serialize(error(id, JsonRpcException.INTERNAL_ERROR, "Internal error: " + e.getMessage()));
        }
    }

    Object dispatch(String method, JsonNode params) {
        if (method == null) {
            throw new JsonRpcException(JsonRpcException.METHOD_NOT_FOUND, "Method not found: null");
        }
        log.debug("[Rpc] Dispatching {}", method);
        return switch (method) {
        case "process_query" -> processQuery(params);
        case "apply_delta" -> {
            sessionService.applyDelta(params);
            yield successFlag();
        }
        case "set_api_key" -> {
            credentials.setApiKey(params.path("api_key").asText(""));
            yield successFlag();
        }
        case "set_access_token" -> {
            credentials.setAccessToken(params.path("access_token").asText(""));
            yield successFlag();
        }
        case "self_improve" -> selfImprove(params);
        default -> throw new JsonRpcException(JsonRpcException.METHOD_NOT_FOUND, "Method not found: " + method);
        };
    }

    private Map<String, Object> processQuery(JsonNode params) {
        TurnResult result = conductor.processQuery(toTurnRequest(params));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", result.getContent());
        if (result.isError()) {
            body.put("error", true);
        }
        if (result.getCreatedFiles() != null && !result.getCreatedFiles().isEmpty()) {
            body.put("created_files", result.getCreatedFiles());
        }
        return body;
    }

    TurnRequest toTurnRequest(JsonNode params) {
        JsonNode context = params.path("context");
        List<String> files = new ArrayList<>();
        JsonNode filesNode = params.path("files");
        if (!filesNode.isMissingNode() && !filesNode.isNull() && !filesNode.isArray()) {
            throw new IllegalArgumentException("files must be an array");
        }
        for (JsonNode file : filesNode) {
            if (file.isTextual() && !file.asText().isBlank()) {
                files.add(file.asText());
            }
        }
        return TurnRequest.builder()
                .userQuery(params.path("user_query").asText(""))
                .files(files)
                .preferredModel(text(context, "preferred_model"))
                .costPercentUsed(context.hasNonNull("cost_percent_used")
                        ? context.get("cost_percent_used").asDouble()
                        : null)
                .maxIterations(integer(context, "max_iterations"))
                .maxToolCalls(integer(context, "max_tool_calls"))
                .maxTokens(integer(context, "max_tokens"))
                .systemPrompt(text(context, "system_prompt"))
                .outputDir(text(context, "output_dir"))
                .toolTimeoutMs(context.hasNonNull("tool_timeout_ms") ? context.get("tool_timeout_ms").asLong()
                        : null)
                .build();
    }

    private Map<String, Object> selfImprove(JsonNode params) {
        List<Message> conversation = new ArrayList<>();
        for (JsonNode entry : params.path("conversation")) {
            conversation.add(Message.builder()
                    .role(entry.path("role").asText("unknown"))
                    .content(entry.path("content").asText(""))
                    .build());
        }
        return promptImprovementService.improve(conversation, params.path("current_prompt").asText(""),
                text(params, "api_key"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return value.asInt();
    }

    private static Map<String, Object> successFlag() {
        return Map.of("success", true);
    }

    private ObjectNode success(JsonNode id, Object result) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.set("id", id);
        response.set("result", objectMapper.valueToTree(result));
        return response;
    }

    private ObjectNode error(JsonNode id, int code, String message) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.set("id", id);
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return response;
    }

    private String serialize(ObjectNode response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON-RPC response", e);
        }
    }
}
