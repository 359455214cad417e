package me.golemcore.conductor.domain.model;

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

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Iteration, tool-call and token counters for one turn. Owned by the turn's
 * thread; not shared.
 */
public class TurnBudget {

    private final int maxIterations;
    private final int maxToolCalls;

    private int iterations;
    private int toolCalls;
    private long inputTokens;
    private long outputTokens;
    private boolean toolCallRefused;
    private final Set<String> toolsUsed = new TreeSet<>();

    public TurnBudget(int maxIterations, int maxToolCalls) {
        this.maxIterations = maxIterations;
        this.maxToolCalls = maxToolCalls;
    }

    public boolean hasIterationsLeft() {
        return iterations < maxIterations;
    }

    public int startIteration() {
        return ++iterations;
    }

    /**
     * Reserves one tool call. Returns false, without counting, once the ceiling
     * is reached.
     */
    public boolean tryReserveToolCall(String toolName) {
        if (toolCalls >= maxToolCalls) {
            toolCallRefused = true;
            return false;
        }
        toolCalls++;
        if (toolName != null) {
            toolsUsed.add(toolName);
        }
        return true;
    }

    public void recordUsage(LlmUsage usage) {
        if (usage == null) {
            return;
        }
        inputTokens += usage.getInputTokens();
        outputTokens += usage.getOutputTokens();
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getMaxToolCalls() {
        return maxToolCalls;
    }

    public int getIterations() {
        return iterations;
    }

    public int getToolCalls() {
        return toolCalls;
    }

    public long getInputTokens() {
        return inputTokens;
    }

    public long getOutputTokens() {
        return outputTokens;
    }

    public boolean isToolCallRefused() {
        return toolCallRefused;
    }

    /** Distinct names of dispatched tools, sorted. */
    public List<String> getToolsUsed() {
        return List.copyOf(toolsUsed);
    }
}
