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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents a single message in a conversation between user and assistant.
 * Content is either plain text ({@link #getContent()}) or an ordered sequence
 * of typed blocks ({@link #getBlocks()}) carrying tool invocations and tool
 * results.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";

    private String id;
    private String role; // user, assistant, system
    private String content;
    private List<ContentBlock> blocks;

    private Integer tokenCount;
    private List<String> attachments;
    private Instant timestamp;

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    public static Message assistant(List<ContentBlock> blocks) {
        return Message.builder().role(ROLE_ASSISTANT).blocks(new ArrayList<>(blocks)).build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean hasBlocks() {
        return blocks != null && !blocks.isEmpty();
    }

    /**
     * Ids of all tool invocations this message requests, in order.
     */
    public List<String> toolUseIds() {
        List<String> ids = new ArrayList<>();
        if (blocks != null) {
            for (ContentBlock block : blocks) {
                if (block.isToolUse()) {
                    ids.add(block.getId());
                }
            }
        }
        return ids;
    }

    /**
     * Best-effort token estimate: the stored count when known, otherwise a quarter
     * of the character length.
     */
    public int estimateTokens() {
        if (tokenCount != null) {
            return tokenCount;
        }
        int chars = 0;
        if (content != null) {
            chars += content.length();
        }
        if (blocks != null) {
            for (ContentBlock block : blocks) {
                if (block.getText() != null) {
                    chars += block.getText().length();
                }
            }
        }
        return chars / 4;
    }
}
