package me.golemcore.conductor.domain.system.conductor;

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

import me.golemcore.conductor.domain.model.ToolFailureKind;
import me.golemcore.conductor.domain.model.ToolInvocation;
import me.golemcore.conductor.domain.model.ToolResult;

/**
 * Result of one tool invocation plus the text that goes back to the model.
 * Synthetic outcomes are produced by the loop itself for invocations that were
 * never dispatched.
 */
public record ToolExecutionOutcome(String toolUseId, String toolName, ToolResult toolResult,
        String messageContent, boolean synthetic) {

    public static ToolExecutionOutcome synthetic(ToolInvocation invocation, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(invocation.getId(), invocation.getName(), ToolResult.failure(kind, reason),
                reason, true);
    }

    public boolean isError() {
        return toolResult == null || !toolResult.isSuccess();
    }
}
