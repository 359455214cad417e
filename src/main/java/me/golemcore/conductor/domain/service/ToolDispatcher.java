package me.golemcore.conductor.domain.service;

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
import me.golemcore.conductor.domain.component.ToolComponent;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.ToolExecutionContext;
import me.golemcore.conductor.domain.model.ToolFailureKind;
import me.golemcore.conductor.domain.model.ToolInvocation;
import me.golemcore.conductor.domain.model.ToolResult;
import me.golemcore.conductor.domain.system.conductor.DispatchScope;
import me.golemcore.conductor.domain.system.conductor.ToolExecutionOutcome;
import me.golemcore.conductor.domain.system.conductor.ToolExecutorPort;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.tools.HostToolCatalog;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes tool invocations by name to in-process or host-delegated tools.
 *
 * <p>
 * Handles name sanitizing, argument resolution, required-parameter checks,
 * per-tool timeouts and result truncation. Every failure comes back as a
 * failed {@link ToolResult}; nothing here mutates conversation history.
 */
@Service
@Slf4j
public class ToolDispatcher implements ToolExecutorPort {

    private static final Duration COMPLETION_GRACE = Duration.ofSeconds(5);
    private static final String TRUNCATION_MARKER = "\n\n[Output truncated...]\n\n";

    private final Map<String, ToolComponent> toolRegistry = new TreeMap<>();
    private final ToolArgumentResolver argumentResolver;
    private final CredentialStore credentials;
    private final ConductorProperties.ToolsProperties settings;

    public ToolDispatcher(List<ToolComponent> inProcessTools, HostToolCatalog hostToolCatalog,
            ToolArgumentResolver argumentResolver, CredentialStore credentials, ConductorProperties properties) {
        this.argumentResolver = argumentResolver;
        this.credentials = credentials;
        this.settings = properties.getTools();
        register(inProcessTools);
        register(hostToolCatalog.getTools());
        log.info("[Tools] Registered {} tools: {}", toolRegistry.size(), toolRegistry.keySet());
    }

    private void register(Collection<ToolComponent> tools) {
        for (ToolComponent tool : tools) {
            ToolComponent previous = toolRegistry.put(tool.getToolName(), tool);
            if (previous != null) {
                log.warn("[Tools] Tool '{}' registered twice, keeping the later one", tool.getToolName());
            }
        }
    }

    public ToolComponent getTool(String name) {
        return toolRegistry.get(name);
    }

    @Override
    public List<ToolDefinition> availableTools() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : toolRegistry.values()) {
            if (tool.isEnabled()) {
                definitions.add(tool.getDefinition());
            }
        }
        return definitions;
    }

    @Override
    public ToolExecutionOutcome execute(ToolInvocation invocation, DispatchScope scope) {
        long start = System.currentTimeMillis();
        ToolResult result = executeToolCall(invocation, scope);
        String content = truncate(buildToolMessageContent(result), invocation.getName());
        log.info("[Tools] {} finished in {}ms: {}", invocation.getName(), System.currentTimeMillis() - start,
                result.isSuccess() ? "ok" : result.getFailureKind());
        return new ToolExecutionOutcome(invocation.getId(), invocation.getName(), result, content, false);
    }

    private ToolResult executeToolCall(ToolInvocation invocation, DispatchScope scope) {
        String toolName = sanitizeToolName(invocation.getName());
        ToolComponent tool = toolName != null ? toolRegistry.get(toolName) : null;

        if (tool == null) {
            String available = String.join(", ", toolRegistry.keySet());
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Unknown tool: " + toolName + ". Available tools: " + available);
        }
        if (!tool.isEnabled()) {
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Tool is disabled: " + toolName);
        }

        String accessToken = null;
        if (tool.requiresAccessToken()) {
            accessToken = credentials.getAccessToken().orElse(null);
            if (accessToken == null) {
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                        "Google account not connected. Please sign in with Google in Settings to use " + toolName
                                + ".");
            }
        }

        Map<String, Object> arguments = argumentResolver.resolve(invocation.getInput(), scope.fileMap(),
                scope.outputDir(), accessToken);

        List<String> missing = new ArrayList<>();
        for (String required : tool.getDefinition().requiredParameters()) {
            Object value = arguments.get(required);
            if (value == null || value instanceof String s && s.isBlank()) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Missing required parameter(s) for " + toolName + ": " + String.join(", ", missing));
        }

        Duration timeout = scaledTimeout(scope.baseTimeout(), tool.getTimeoutMultiplier());
        ToolExecutionContext context = ToolExecutionContext.builder()
                .timeout(timeout)
                .outputDir(scope.outputDir())
                .allowedPaths(attachedPaths(scope.fileMap()))
                .build();

        CompletableFuture<ToolResult> future = null;
        try {
            future = tool.execute(arguments, context);
            ToolResult result = future.get(timeout.plus(COMPLETION_GRACE).toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ToolResult.failure("Tool returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] {} did not complete within {}ms", toolName, timeout.toMillis());
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Tool " + toolName + " timed out after " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private Duration scaledTimeout(Duration base, double multiplier) {
        Duration effective = base != null ? base : Duration.ofMillis(settings.getDefaultTimeoutMs());
        return Duration.ofMillis(Math.round(effective.toMillis() * multiplier));
    }

    private static List<Path> attachedPaths(Map<String, String> fileMap) {
        List<Path> paths = new ArrayList<>();
        if (fileMap != null) {
            for (String path : fileMap.values()) {
                paths.add(Path.of(path).toAbsolutePath().normalize());
            }
        }
        return paths;
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens and garbage some models leak into tool names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private String buildToolMessageContent(ToolResult result) {
        if (result.isSuccess()) {
            return result.getOutput() != null ? result.getOutput() : "";
        }
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            return result.getOutput();
        }
        return "Error: " + result.getError();
    }

    /**
     * Keeps the head and the tail of oversized results so the model still sees
     * how the output ends.
     */
    String truncate(String content, String toolName) {
        int max = settings.getMaxResultLength();
        if (content == null || max <= 0 || content.length() <= max) {
            return content;
        }
        int head = Math.min(settings.getTruncateHeadLength(), content.length());
        int tail = Math.min(settings.getTruncateTailLength(), content.length() - head);
        log.warn("[Tools] Truncating '{}' result: {} chars -> {} chars", toolName, content.length(),
                head + tail + TRUNCATION_MARKER.length());
        return content.substring(0, head) + TRUNCATION_MARKER + content.substring(content.length() - tail);
    }
}
