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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.ToolExecutionContext;
import me.golemcore.conductor.domain.model.ToolFailureKind;
import me.golemcore.conductor.domain.model.ToolResult;
import me.golemcore.conductor.port.outbound.HostBridgePort;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Host-delegated PDF text extraction that rejects bad page selections locally,
 * before the request crosses the bridge.
 */
public class ReadPdfTool extends HostDelegatedTool {

    public static final String TOOL_NAME = "read_pdf";

    public ReadPdfTool(ToolDefinition definition, String hostMethod, double timeoutMultiplier,
            HostBridgePort hostBridge, ObjectMapper objectMapper) {
        super(definition, hostMethod, timeoutMultiplier, false, hostBridge, objectMapper);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        Object pages = parameters.get("pages");
        if (pages != null) {
            Optional<String> problem = PageRangeValidator.validate(pages.toString());
            if (problem.isPresent()) {
                return CompletableFuture.completedFuture(
                        ToolResult.failure(ToolFailureKind.POLICY_DENIED, problem.get()));
            }
        }
        return super.execute(parameters, context);
    }
}
