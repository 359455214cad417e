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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.component.ToolComponent;
import me.golemcore.conductor.domain.model.ExecutionRequest;
import me.golemcore.conductor.domain.model.ExecutionResult;
import me.golemcore.conductor.domain.model.SandboxFailureKind;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.ToolExecutionContext;
import me.golemcore.conductor.domain.model.ToolFailureKind;
import me.golemcore.conductor.domain.model.ToolResult;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.port.outbound.CodeExecutorPort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs model-written JavaScript in the sandboxed executor.
 *
 * <p>
 * The script may read only files attached to the conversation (optionally
 * narrowed by {@code file_paths}) and write only under the output directory.
 * Figures registered through the {@code figures} module come back as created
 * files.
 */
@Component
@Slf4j
public class JavaScriptExecuteTool implements ToolComponent {

    public static final String TOOL_NAME = "javascript_execute";

    private static final String DESCRIPTION = """
            Execute JavaScript in a secure sandbox. Use this for:
            - Data processing and analysis (JSON, CSV text, arrays of records)
            - Mathematical calculations and algorithms
            - Statistics (require('stats'): sum, mean, median, min, max, variance, stdev)
            - Charts (require('figures'): lineChart, barChart, svg; figures are saved as SVG files and returned)
            - Text manipulation, parsing and encoding (require('encoding'))

            Available modules: files, figures, encoding, stats.
            FORBIDDEN: child_process, fs, net, http, https, os, process, vm, worker_threads, eval, Function, Java.
            To read attached files use require('files').readText(path) or open(path, 'r').
            An OUTPUT_DIR variable is available for saving files explicitly.

            The code runs with a 30-second timeout. console.log output and the value of the last expression \
            are captured and returned.""";

    private final CodeExecutorPort executor;
    private final ConductorProperties.SandboxProperties settings;

    public JavaScriptExecuteTool(CodeExecutorPort executor, ConductorProperties properties) {
        this.executor = executor;
        this.settings = properties.getSandbox();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description(DESCRIPTION)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "code", Map.of(
                                        "type", "string",
                                        "description",
                                        "JavaScript code to execute. Use console.log() for output."),
                                "file_paths", Map.of(
                                        "type", "array",
                                        "items", Map.of("type", "string"),
                                        "description",
                                        "Optional list of attached files the code is allowed to read")),
                        "required", List.of("code")))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return settings.isEnabled();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object code = parameters.get("code");
            if (!(code instanceof String source) || source.isBlank()) {
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Missing required parameter: code");
            }

            ExecutionRequest request = ExecutionRequest.builder()
                    .code(source)
                    .allowedPaths(readablePaths(parameters.get("file_paths"), context.getAllowedPaths()))
                    .outputDir(context.getOutputDir())
                    .timeout(sandboxTimeout(context.getTimeout()))
                    .build();
            ExecutionResult result = executor.execute(request);
            return toToolResult(result);
        });
    }

    private Duration sandboxTimeout(Duration requested) {
        Duration configured = Duration.ofSeconds(settings.getTimeoutSeconds());
        if (requested == null || requested.compareTo(configured) > 0) {
            return configured;
        }
        return requested;
    }

    private List<Path> readablePaths(Object filePaths, List<Path> attached) {
        if (!(filePaths instanceof List<?> requested) || requested.isEmpty()) {
            return attached;
        }
        List<Path> narrowed = new ArrayList<>();
        for (Object item : requested) {
            if (item == null) {
                continue;
            }
            Path candidate = Path.of(item.toString()).toAbsolutePath().normalize();
            if (attached.contains(candidate)) {
                narrowed.add(candidate);
            } else {
                log.debug("[Tools] Ignoring unattached file_path: {}", candidate);
            }
        }
        return narrowed;
    }

    private ToolResult toToolResult(ExecutionResult result) {
        if (result.isSuccess()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("stdout", result.getOutput());
            data.put("result", result.getResult());
            if (!result.getArtifacts().isEmpty()) {
                data.put("output_paths", List.copyOf(result.getArtifacts()));
            }
            return ToolResult.success(renderSuccess(result), data);
        }

        if (result.isTimedOut()) {
            return ToolResult.failure(ToolFailureKind.TIMEOUT, result.getError());
        }
        if (result.getFailureKind() == SandboxFailureKind.SECURITY_VIOLATION) {
            return ToolResult.failure(ToolFailureKind.SECURITY_VIOLATION, "Security violation: " + result.getError());
        }

        StringBuilder output = new StringBuilder("Error: ").append(result.getError());
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            output.append("\n\nOutput before error:\n").append(result.getOutput());
        }
        return ToolResult.builder()
                .success(false)
                .failureKind(ToolFailureKind.EXECUTION_FAILED)
                .error(result.getError())
                .output(output.toString())
                .build();
    }

    private String renderSuccess(ExecutionResult result) {
        StringBuilder sb = new StringBuilder();
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            sb.append(result.getOutput().stripTrailing());
        }
        if (result.getResult() != null) {
            appendSection(sb, "Result: " + result.getResult());
        }
        if (result.getErrorOutput() != null && !result.getErrorOutput().isBlank()) {
            appendSection(sb, "Stderr:\n" + result.getErrorOutput().stripTrailing());
        }
        if (!result.getArtifacts().isEmpty()) {
            appendSection(sb, "Created files: " + String.join(", ", result.getArtifacts()));
        }
        if (sb.length() == 0) {
            return "Code executed successfully (no output)";
        }
        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, String section) {
        if (sb.length() > 0) {
            sb.append("\n\n");
        }
        sb.append(section);
    }
}
