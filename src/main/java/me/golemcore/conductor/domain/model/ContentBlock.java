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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * One typed block of structured message content: plain text, a tool invocation
 * requested by the model, or the result of a tool invocation.
 */
@Data
@Builder
public class ContentBlock {

    public enum Type {
        TEXT, TOOL_USE, TOOL_RESULT
    }

    private Type type;
    private String text;

    // TOOL_USE: id/name/input. TOOL_RESULT: toolUseId/text/error.
    private String id;
    private String name;
    private Map<String, Object> input;
    private String toolUseId;
    private boolean error;

    public static ContentBlock text(String text) {
        return ContentBlock.builder()
                .type(Type.TEXT)
                .text(text)
                .build();
    }

    public static ContentBlock toolUse(ToolInvocation invocation) {
        return ContentBlock.builder()
                .type(Type.TOOL_USE)
                .id(invocation.getId())
                .name(invocation.getName())
                .input(invocation.getInput())
                .build();
    }

    public static ContentBlock toolResult(String toolUseId, String content, boolean error) {
        return ContentBlock.builder()
                .type(Type.TOOL_RESULT)
                .toolUseId(toolUseId)
                .text(content)
                .error(error)
                .build();
    }

    public boolean isText() {
        return type == Type.TEXT;
    }

    public boolean isToolUse() {
        return type == Type.TOOL_USE;
    }

    public boolean isToolResult() {
        return type == Type.TOOL_RESULT;
    }
}
