package me.golemcore.conductor.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties
 * under the {@code conductor.*} prefix.
 *
 * <ul>
 * <li>{@link LlmProperties} - model provider endpoint and retry policy</li>
 * <li>{@link RouterProperties} - model tiers and routing heuristics</li>
 * <li>{@link TurnProperties} - per-turn budgets</li>
 * <li>{@link ToolsProperties} - dispatch timeouts and result truncation</li>
 * <li>{@link BridgeProperties} - host bridge defaults</li>
 * <li>{@link SandboxProperties} - sandboxed executor limits</li>
 * <li>{@link HttpProperties} - OkHttp client</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "conductor")
@Data
public class ConductorProperties {

    private LlmProperties llm = new LlmProperties();
    private RouterProperties router = new RouterProperties();
    private TurnProperties turn = new TurnProperties();
    private ToolsProperties tools = new ToolsProperties();
    private BridgeProperties bridge = new BridgeProperties();
    private SandboxProperties sandbox = new SandboxProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== MODEL PROVIDER ====================

    @Data
    public static class LlmProperties {
        private String apiUrl = "https://api.anthropic.com/v1/messages";
        private String anthropicVersion = "2023-06-01";

        /** Retries after the first attempt. */
        private int maxRetries = 2;

        /** Base of the exponential backoff for 5xx answers. */
        private long initialBackoffMs = 1000;

        /** Used when a 429 carries no usable retry-after header. */
        private long defaultRetryAfterSeconds = 5;

        private long networkRetryDelayMs = 1000;

        /** Read timeout for ordinary model calls. */
        private long requestTimeoutMs = 120000;
    }

    // ==================== MODEL ROUTER ====================

    @Data
    public static class RouterProperties {
        private String fastModel = "claude-haiku-4-5-20251001";
        private String balancedModel = "claude-sonnet-4-20250514";
        private String advancedModel = "claude-opus-4-20250514";

        /** Cost usage (percent of budget) at which turns are forced to the fast tier. */
        private double costThresholdPercent = 80;

        /** Queries of at most this many words containing '?' count as short questions. */
        private int shortQuestionMaxWords = 5;

        private List<String> complexPatterns = new ArrayList<>(List.of(
                "analyze", "explain in detail", "compare and contrast", "write code", "debug",
                "implement", "design", "create a plan", "step by step", "research", "investigate"));

        private List<String> simplePatterns = new ArrayList<>(List.of(
                "what time", "what day", "what date", "convert", "format", "translate to",
                "is this", "yes or no", "true or false", "classify", "categorize", "extract",
                "list the", "count the", "how many", "summarize briefly"));
    }

    // ==================== TURN BUDGET ====================

    @Data
    public static class TurnProperties {
        private int maxIterations = 50;
        private int maxToolCalls = 50;
        private int maxTokens = 16384;
        private int maxContextTokens = 150000;
        private String systemPrompt = "You are a helpful on-device assistant. Use the available tools when they help "
                + "answer the request, and explain results concisely.";
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private long defaultTimeoutMs = 30000;
        private int maxResultLength = 10000;
        private int truncateHeadLength = 5000;
        private int truncateTailLength = 2000;
        private String outputDir;
        private String catalogResource = "host-tools.json";
    }

    // ==================== HOST BRIDGE ====================

    @Data
    public static class BridgeProperties {
        private long defaultTimeoutMs = 30000;
    }

    // ==================== SANDBOX ====================

    @Data
    public static class SandboxProperties {
        private boolean enabled = true;
        private int timeoutSeconds = 30;
        private int maxOutputLength = 50000;
        private int maxResultLength = 10000;
        private boolean warmUp = false;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
