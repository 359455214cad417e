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
package me.golemcore.conductor.domain.service;

import me.golemcore.conductor.domain.model.LlmRequest;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ModelApiException;
import me.golemcore.conductor.domain.model.ModelTier;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.system.conductor.ToolExecutorPort;
import me.golemcore.conductor.port.outbound.HostBridgePort;
import me.golemcore.conductor.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InterruptedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Rewrites the system prompt from a finished conversation.
 *
 * <p>
 * One model call with extended thinking reviews the transcript against the
 * current prompt and the tool catalog and returns a refined prompt. Failures are
 * reported in the result map, never thrown.
 */
public class PromptImprovementService {

    private static final Logger log = LoggerFactory.getLogger(PromptImprovementService.class);

    static final int MAX_TOKENS = 16000;
    static final int THINKING_BUDGET = 10000;
    static final long TIMEOUT_MS = 180_000;

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final ModelTierRouter router;
    private final CredentialStore credentials;
    private final HostBridgePort hostBridge;

    public PromptImprovementService(LlmPort llmPort, ToolExecutorPort toolExecutor, ModelTierRouter router,
            CredentialStore credentials, HostBridgePort hostBridge) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.router = router;
        this.credentials = credentials;
        this.hostBridge = hostBridge;
    }

    public Map<String, Object> improve(List<Message> conversation, String currentPrompt, String apiKey) {
        String key = apiKey != null && !apiKey.isBlank() ? apiKey : credentials.getApiKey().orElse(null);
        if (key == null) {
            return failure("API key not configured");
        }
        if (conversation == null || conversation.isEmpty()) {
            return failure("No conversation to analyze");
        }

        progress("Analyzing conversation for self-improvement...", "info");
        LlmRequest request = LlmRequest.builder()
                .model(router.modelFor(ModelTier.ADVANCED))
                .apiKey(key)
                .messages(List.of(Message.user(buildMetaPrompt(conversation, currentPrompt))))
                .maxTokens(MAX_TOKENS)
                .thinkingBudget(THINKING_BUDGET)
                .temperature(1.0)
                .timeoutMs(TIMEOUT_MS)
                .build();

        LlmResponse response;
        try {
            progress("Calling Claude with extended thinking...", "info");
            response = llmPort.chat(request).join();
        } catch (CompletionException e) {
            return failure(describeFailure(e.getCause() != null ? e.getCause() : e));
        } catch (RuntimeException e) {
            return failure(describeFailure(e));
        }

        String improved = response != null ? response.text().strip() : "";
        if (improved.isEmpty()) {
            progress("Self-improve returned empty response", "warn");
            return failure("No improved prompt generated");
        }
        progress("System prompt improved successfully", "info");
        log.info("[Conductor] Generated improved system prompt ({} chars)", improved.length());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("improved_prompt", improved);
        return result;
    }

    String buildMetaPrompt(List<Message> conversation, String currentPrompt) {
        String tools = toolExecutor.availableTools().stream()
                .map(ToolDefinition::getName)
                .collect(Collectors.joining(", "));
        StringBuilder transcript = new StringBuilder();
        for (Message message : conversation) {
            transcript.append('[').append(capitalize(message.getRole())).append("]: ")
                    .append(message.getContent() != null ? message.getContent() : "")
                    .append("\n\n");
        }
        return """
                You are analyzing a conversation between a user and an on-device AI assistant.
                Your task is to improve the system prompt that guides the assistant's behavior.

                CURRENT SYSTEM PROMPT:
                ---
                %s
                ---

                AVAILABLE TOOLS (the assistant has these tools via the API; the system prompt should reference them by name):
                %s

                CONVERSATION:
                ---
                %s---

                Analyze the conversation carefully:
                1. What did the assistant do well?
                2. Where did the assistant fail, get confused, or could have been better?
                3. What specific tools did the assistant misuse, fail to use, or use incorrectly?
                4. What patterns, preferences, or needs does the user have?
                5. What instructions could help the assistant handle similar situations better next time?

                Now write an IMPROVED system prompt that:
                - Keeps all working parts of the current prompt (especially the AVAILABLE TOOLS section)
                - Adds specific instructions to fix the exact failures you observed in the conversation
                - References tools BY NAME (e.g. "use google_calendar for calendar queries", not just "access calendar")
                - Adds error-handling guidance for any errors that occurred
                - Incorporates user preferences and patterns you noticed
                - Stays concise, this runs on a mobile device
                - Does NOT remove any tool names or capability descriptions from the current prompt

                Output ONLY the improved system prompt text, nothing else. No preamble, no explanation.
                """.formatted(currentPrompt != null ? currentPrompt : "", tools, transcript);
    }

    private String describeFailure(Throwable error) {
        log.warn("[Conductor] Self-improve call failed: {}", error.getMessage());
        if (error instanceof ModelApiException apiException && apiException.getStatus() == 0) {
            if (apiException.getCause() instanceof InterruptedIOException) {
                progress("Self-improve timed out", "error");
                return "Request timed out (180s). Try with a shorter conversation.";
            }
            Throwable cause = apiException.getCause();
            String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : error.getMessage();
            progress("Self-improve network error: " + detail, "error");
            return "Network error: " + detail;
        }
        if (error instanceof ModelApiException) {
            progress("Self-improve API error: " + error.getMessage(), "error");
            return "API error: " + error.getMessage();
        }
        progress("Self-improve exception: " + error.getMessage(), "error");
        return "Unexpected error: " + error.getMessage();
    }

    private void progress(String message, String level) {
        try {
            hostBridge.log(message, level, null);
        } catch (RuntimeException e) {
            log.debug("[Conductor] Progress report failed: {}", e.getMessage());
        }
    }

    private static Map<String, Object> failure(String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("error", true);
        result.put("message", message);
        return result;
    }

    private static String capitalize(String role) {
        if (role == null || role.isEmpty()) {
            return "Unknown";
        }
        return role.substring(0, 1).toUpperCase(Locale.ROOT) + role.substring(1).toLowerCase(Locale.ROOT);
    }
}
