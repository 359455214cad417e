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

import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.ToolInvocation;

import java.util.List;

/**
 * Executes a single tool invocation. Implementations never throw for tool
 * failures; they return an outcome whose result is marked as failed.
 */
public interface ToolExecutorPort {

    ToolExecutionOutcome execute(ToolInvocation invocation, DispatchScope scope);

    /**
     * Definitions of all enabled tools, sorted by name, as sent to the model.
     */
    List<ToolDefinition> availableTools();
}
