package me.golemcore.conductor.domain.component;

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
import me.golemcore.conductor.domain.model.ToolExecutionContext;
import me.golemcore.conductor.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An executable tool the model can invoke. Tools expose a JSON Schema
 * definition and implement execution, either in-process or by delegating to
 * the host over the bridge.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    ToolDefinition getDefinition();

    /**
     * Executes the tool. Parameters have already been resolved (file basenames,
     * output paths, credentials) and checked against the required list of the
     * schema.
     *
     * @param parameters
     *            resolved arguments
     * @param context
     *            timeout and file scope of this call
     * @return a future with the tool result; failures are returned, not thrown
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context);

    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Factor applied to the base tool timeout. Long-running media tools use more
     * than 1.
     */
    default double getTimeoutMultiplier() {
        return 1.0;
    }

    /**
     * Whether the stored access token must be passed as {@code access_token}.
     */
    default boolean requiresAccessToken() {
        return false;
    }
}
