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

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed model response. {@code blocks} keeps the provider's content in order
 * (text interleaved with tool invocations).
 */
@Data
@Builder
public class LlmResponse {

    private String id;
    private String model;
    private String stopReason;

    @Builder.Default
    private List<ContentBlock> blocks = new ArrayList<>();

    private LlmUsage usage;

    public StopCondition stopCondition() {
        return StopCondition.fromProvider(stopReason);
    }

    /**
     * Concatenated text blocks, or an empty string.
     */
    public String text() {
        StringBuilder sb = new StringBuilder();
        if (blocks != null) {
            for (ContentBlock block : blocks) {
                if (block.isText() && block.getText() != null) {
                    sb.append(block.getText());
                }
            }
        }
        return sb.toString();
    }

    public List<ToolInvocation> toolInvocations() {
        List<ToolInvocation> invocations = new ArrayList<>();
        if (blocks != null) {
            for (ContentBlock block : blocks) {
                if (block.isToolUse()) {
                    invocations.add(ToolInvocation.builder()
                            .id(block.getId())
                            .name(block.getName())
                            .input(block.getInput())
                            .build());
                }
            }
        }
        return invocations;
    }

    public boolean hasToolInvocations() {
        return !toolInvocations().isEmpty();
    }
}
