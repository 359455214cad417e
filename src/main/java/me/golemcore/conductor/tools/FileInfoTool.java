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

import me.golemcore.conductor.domain.component.ToolComponent;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.ToolExecutionContext;
import me.golemcore.conductor.domain.model.ToolFailureKind;
import me.golemcore.conductor.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reports name, size and extension of an attached or produced file.
 */
@Component
public class FileInfoTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("file_info")
                .description("Get file metadata (size, name, extension). Use this instead of reading a file "
                        + "just to learn its size.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "file_path", Map.of(
                                        "type", "string",
                                        "description", "Path to the file")),
                        "required", List.of("file_path")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Path path = Path.of(String.valueOf(parameters.get("file_path"))).toAbsolutePath().normalize();
            if (!isVisible(path, context)) {
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                        "Access denied: " + path + " is not an attached or produced file");
            }
            if (!Files.isRegularFile(path)) {
                return ToolResult.failure("File not found: " + path);
            }
            try {
                long size = Files.size(path);
                String name = path.getFileName().toString();
                int dot = name.lastIndexOf('.');

                Map<String, Object> data = new LinkedHashMap<>();
                data.put("name", name);
                data.put("path", path.toString());
                data.put("size_bytes", size);
                data.put("size_mb", Math.round(size / (1024.0 * 1024.0) * 100.0) / 100.0);
                data.put("extension", dot >= 0 ? name.substring(dot + 1) : "");
                String summary = String.format(Locale.ROOT, "%s: %d bytes (%.2f MB), extension '%s'", name, size,
                        (double) data.get("size_mb"), data.get("extension"));
                return ToolResult.success(summary, data);
            } catch (IOException e) {
                return ToolResult.failure("Failed to read file info: " + e.getMessage());
            }
        });
    }

    private boolean isVisible(Path path, ToolExecutionContext context) {
        if (context.getAllowedPaths().contains(path)) {
            return true;
        }
        Path outputDir = context.getOutputDir();
        return outputDir != null && path.startsWith(outputDir.toAbsolutePath().normalize());
    }
}
