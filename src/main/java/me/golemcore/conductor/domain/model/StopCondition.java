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

/**
 * Why the model stopped generating, as classified from the provider's raw
 * stop reason.
 */
public enum StopCondition {
    COMPLETED, TOOL_USE, LENGTH_CAPPED, UNEXPECTED;

    public static StopCondition fromProvider(String stopReason) {
        if (stopReason == null) {
            return UNEXPECTED;
        }
        return switch (stopReason) {
        case "end_turn", "stop_sequence" -> COMPLETED;
        case "tool_use" -> TOOL_USE;
        case "max_tokens" -> LENGTH_CAPPED;
        default -> UNEXPECTED;
        };
    }
}
