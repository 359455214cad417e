package me.golemcore.conductor.adapter.outbound.llm;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.ContentBlock;
import me.golemcore.conductor.domain.model.LlmRequest;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.LlmUsage;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ModelApiException;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.service.CredentialStore;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.port.outbound.LlmPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Model client for the Anthropic Messages API.
 *
 * <p>
 * Retry policy:
 * <ul>
 * <li>429 - waits for {@code retry-after} seconds (or the configured default)
 * and retries</li>
 * <li>500/502/503 - exponential backoff from {@code initial-backoff-ms}</li>
 * <li>timeouts and other transport failures - fixed delay</li>
 * <li>anything else, 401 included - fails at once</li>
 * </ul>
 * A call retries at most {@code max-retries} times in total. Exhausted or fatal
 * failures surface as {@link ModelApiException}.
 */
@Component
@Slf4j
public class AnthropicModelClient implements LlmPort {

    private static final String PROVIDER_ID = "anthropic";
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final ConductorProperties.LlmProperties settings;
    private final CredentialStore credentials;

    public AnthropicModelClient(OkHttpClient okHttpClient, ObjectMapper objectMapper,
            ConductorProperties properties, CredentialStore credentials) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getLlm();
        this.credentials = credentials;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return credentials.hasApiKey();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> send(request));
    }

    LlmResponse send(LlmRequest request) {
        String apiKey = request.getApiKey() != null ? request.getApiKey() : credentials.getApiKey().orElse(null);
        if (apiKey == null) {
            throw new ModelApiException("No API key configured", 401);
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(buildRequest(request));
        } catch (JsonProcessingException e) {
            throw new ModelApiException("Could not serialize model request: " + e.getOriginalMessage(), 400, e);
        }

        Request httpRequest = new Request.Builder()
                .url(settings.getApiUrl())
                .header("x-api-key", apiKey)
                .header("anthropic-version", settings.getAnthropicVersion())
                .post(RequestBody.create(payload, JSON))
                .build();

        long timeoutMs = request.getTimeoutMs() != null ? request.getTimeoutMs() : settings.getRequestTimeoutMs();
        OkHttpClient client = okHttpClient.newBuilder()
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();

        long startTime = System.currentTimeMillis();
        String body = executeWithRetry(client, httpRequest);
        LlmResponse response = parseResponse(body);
        if (response.getUsage() != null) {
            response.getUsage().setLatency(Duration.ofMillis(System.currentTimeMillis() - startTime));
        }
        log.debug("[ModelClient] {} answered with stop_reason={} in {}ms", response.getModel(),
                response.getStopReason(), System.currentTimeMillis() - startTime);
        return response;
    }

    protected void sleepBeforeRetry(long backoffMs) throws InterruptedException {
        Thread.sleep(backoffMs);
    }

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    private String executeWithRetry(OkHttpClient client, Request request) {
        int retries = 0;
        while (true) {
            long waitMs;
            try (Response response = client.newCall(request).execute()) {
                ResponseBody body = response.body();
                String text = body != null ? body.string() : "";
                if (response.isSuccessful()) {
                    return text;
                }

                int code = response.code();
                String message = extractErrorMessage(code, text);
                if (retries >= settings.getMaxRetries()) {
                    throw new ModelApiException(message, code);
                }
                if (code == 429) {
                    waitMs = retryAfterMillis(response.header("retry-after"));
                } else if (code == 500 || code == 502 || code == 503) {
                    waitMs = settings.getInitialBackoffMs() * (1L << retries);
                } else {
                    throw new ModelApiException(message, code);
                }
                log.info("[ModelClient] HTTP {} (attempt {}/{}), retrying in {}ms", code, retries + 1,
                        settings.getMaxRetries() + 1, waitMs);
            } catch (IOException e) {
                if (retries >= settings.getMaxRetries()) {
                    log.warn("[ModelClient] Network failure after {} attempts: {}", retries + 1, e.getMessage());
                    throw new ModelApiException("Network error: " + e.getMessage(), 0, e);
                }
                waitMs = settings.getNetworkRetryDelayMs();
                log.info("[ModelClient] Network failure (attempt {}/{}): {}, retrying in {}ms", retries + 1,
                        settings.getMaxRetries() + 1, e.getMessage(), waitMs);
            }

            retries++;
            try {
                sleepBeforeRetry(waitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ModelApiException("Model request interrupted", 0, e);
            }
        }
    }

    private long retryAfterMillis(String header) {
        if (header != null) {
            try {
                return Math.max(0, (long) (Double.parseDouble(header.trim()) * 1000));
            } catch (NumberFormatException e) {
                log.debug("[ModelClient] Unparseable retry-after '{}', using default", header);
            }
        }
        return settings.getDefaultRetryAfterSeconds() * 1000;
    }

    private String extractErrorMessage(int code, String body) {
        if (body != null && !body.isBlank()) {
            try {
                ErrorEnvelope envelope = objectMapper.readValue(body, ErrorEnvelope.class);
                if (envelope.getError() != null && envelope.getError().getMessage() != null) {
                    return envelope.getError().getMessage();
                }
            } catch (JsonProcessingException e) {
                log.debug("[ModelClient] Non-JSON error body for HTTP {}", code);
            }
        }
        return "HTTP " + code;
    }

    // ==================== Request mapping ====================

    private MessagesRequest buildRequest(LlmRequest request) {
        StringBuilder system = new StringBuilder();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            system.append(request.getSystemPrompt());
        }

        List<ApiMessage> messages = new ArrayList<>();
        for (Message message : request.getMessages()) {
            if (message.isSystemMessage()) {
                // The Messages API takes system text only in the top-level field.
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.getContent());
                continue;
            }
            messages.add(toApiMessage(message));
        }

        MessagesRequest body = new MessagesRequest();
        body.setModel(request.getModel());
        body.setMaxTokens(request.getMaxTokens() != null ? request.getMaxTokens() : 4096);
        body.setSystem(system.length() > 0 ? system.toString() : null);
        body.setMessages(messages);
        body.setTemperature(request.getTemperature());
        if (request.getThinkingBudget() != null) {
            body.setThinking(new ThinkingConfig("enabled", request.getThinkingBudget()));
        }
        if (request.getTools() != null && !request.getTools().isEmpty()) {
            List<ApiTool> tools = new ArrayList<>();
            for (ToolDefinition tool : request.getTools()) {
                tools.add(new ApiTool(tool.getName(), tool.getDescription(), tool.getInputSchema()));
            }
            body.setTools(tools);
        }
        return body;
    }

    private ApiMessage toApiMessage(Message message) {
        String role = message.isAssistantMessage() ? Message.ROLE_ASSISTANT : Message.ROLE_USER;
        if (!message.hasBlocks()) {
            return new ApiMessage(role, message.getContent() != null ? message.getContent() : "");
        }
        List<Map<String, Object>> content = new ArrayList<>();
        for (ContentBlock block : message.getBlocks()) {
            Map<String, Object> part = new LinkedHashMap<>();
            switch (block.getType()) {
            case TEXT -> {
                part.put("type", "text");
                part.put("text", block.getText());
            }
            case TOOL_USE -> {
                part.put("type", "tool_use");
                part.put("id", block.getId());
                part.put("name", block.getName());
                part.put("input", block.getInput() != null ? block.getInput() : Map.of());
            }
            case TOOL_RESULT -> {
                part.put("type", "tool_result");
                part.put("tool_use_id", block.getToolUseId());
                part.put("content", block.getText() != null ? block.getText() : "");
                if (block.isError()) {
                    part.put("is_error", true);
                }
            }
            }
            content.add(part);
        }
        return new ApiMessage(role, content);
    }

    // ==================== Response mapping ====================

    private LlmResponse parseResponse(String body) {
        MessagesResponse apiResponse;
        try {
            apiResponse = objectMapper.readValue(body, MessagesResponse.class);
        } catch (JsonProcessingException e) {
            throw new ModelApiException("Malformed model response: " + e.getOriginalMessage(), 502, e);
        }

        List<ContentBlock> blocks = new ArrayList<>();
        if (apiResponse.getContent() != null) {
            for (ApiContentBlock block : apiResponse.getContent()) {
                if ("text".equals(block.getType())) {
                    blocks.add(ContentBlock.text(block.getText()));
                } else if ("tool_use".equals(block.getType())) {
                    blocks.add(ContentBlock.builder()
                            .type(ContentBlock.Type.TOOL_USE)
                            .id(block.getId())
                            .name(block.getName())
                            .input(block.getInput() != null ? block.getInput() : new LinkedHashMap<>())
                            .build());
                }
            }
        }

        LlmUsage usage = null;
        if (apiResponse.getUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(apiResponse.getUsage().getInputTokens())
                    .outputTokens(apiResponse.getUsage().getOutputTokens())
                    .model(apiResponse.getModel())
                    .timestamp(Instant.now())
                    .build();
        }

        return LlmResponse.builder()
                .id(apiResponse.getId())
                .model(apiResponse.getModel())
                .stopReason(apiResponse.getStopReason())
                .blocks(blocks)
                .usage(usage)
                .build();
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MessagesRequest {
        private String model;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        private String system;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private Double temperature;
        private ThinkingConfig thinking;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class ApiMessage {
        private String role;
        private Object content;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class ApiTool {
        private String name;
        private String description;
        @JsonProperty("input_schema")
        private Map<String, Object> inputSchema;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class ThinkingConfig {
        private String type;
        @JsonProperty("budget_tokens")
        private int budgetTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessagesResponse {
        private String id;
        private String model;
        @JsonProperty("stop_reason")
        private String stopReason;
        private List<ApiContentBlock> content;
        private ApiUsage usage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiContentBlock {
        private String type;
        private String text;
        private String id;
        private String name;
        private Map<String, Object> input;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiUsage {
        @JsonProperty("input_tokens")
        private int inputTokens;
        @JsonProperty("output_tokens")
        private int outputTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorEnvelope {
        private ApiError error;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiError {
        private String type;
        private String message;
    }
}
