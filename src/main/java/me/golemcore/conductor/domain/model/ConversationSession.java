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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * In-memory conversation window for the lifetime of the process. Holds the
 * ordered message list, an optional summary of older messages, and the map of
 * attached or produced files (basename to absolute path).
 *
 * <p>
 * The host owns durable history and keeps this window in sync through
 * incremental deltas; the Conductor appends to it once per side of a turn.
 *
 * <p>
 * A turn and a delta never interleave: both run under {@link #exclusive}. The
 * per-method monitors only keep single reads and writes consistent.
 */
public class ConversationSession {

    private static final String SUMMARY_PREFIX = "[Previous conversation summary]\n";

    private String conversationId;
    private final List<Message> messages = new ArrayList<>();
    private String summary;
    private final Map<String, String> fileMap = new LinkedHashMap<>();
    private final Object turnLock = new Object();

    /**
     * Runs {@code action} while holding the session's turn lock. Callers on other
     * threads wait until it returns. Re-entrant for the holding thread.
     */
    public <T> T exclusive(Supplier<T> action) {
        synchronized (turnLock) {
            return action.get();
        }
    }

    public synchronized String getConversationId() {
        return conversationId;
    }

    public synchronized String getSummary() {
        return summary;
    }

    public synchronized List<Message> getMessages() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public synchronized void reset(String conversationId) {
        this.conversationId = conversationId;
        this.messages.clear();
        this.summary = null;
        this.fileMap.clear();
    }

    public synchronized void addMessage(Message message) {
        if (message.getId() == null) {
            long lastId = 0;
            for (Message existing : messages) {
                long id = numericId(existing);
                if (id != Long.MAX_VALUE) {
                    lastId = Math.max(lastId, id);
                }
            }
            message.setId(String.valueOf(lastId + 1));
        }
        if (message.getTokenCount() == null) {
            message.setTokenCount(message.estimateTokens());
        }
        messages.add(message);
    }

    /**
     * Replaces older messages with a summary. Messages whose numeric id is at most
     * {@code summarizedUpToId} are dropped; messages with non-numeric ids are
     * kept.
     */
    public synchronized void applySummary(String summary, long summarizedUpToId) {
        this.summary = summary;
        messages.removeIf(m -> numericId(m) <= summarizedUpToId);
    }

    public synchronized void replaceAll(String conversationId, List<Message> synced, String summary,
            Map<String, String> files) {
        this.conversationId = conversationId;
        this.messages.clear();
        this.messages.addAll(synced);
        this.summary = summary;
        this.fileMap.clear();
        this.fileMap.putAll(files);
    }

    // ==================== Files ====================

    public synchronized void registerFile(String path) {
        if (path == null || path.isBlank()) {
            return;
        }
        Path fileName = Path.of(path).getFileName();
        if (fileName != null) {
            fileMap.put(fileName.toString(), path);
        }
    }

    public synchronized Map<String, String> getFileMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fileMap));
    }

    // ==================== Context window ====================

    /**
     * Builds the context sent to the model: the summary (if any) as a system
     * message, then the newest messages that fit into {@code maxTokens}, in
     * chronological order.
     */
    public synchronized List<Message> contextForLlm(int maxTokens) {
        List<Message> context = new ArrayList<>();
        int remaining = maxTokens;
        if (summary != null && !summary.isEmpty()) {
            context.add(Message.builder()
                    .role(Message.ROLE_SYSTEM)
                    .content(SUMMARY_PREFIX + summary)
                    .build());
            remaining -= summary.length() / 4;
        }

        List<Message> window = new ArrayList<>();
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            int tokens = message.estimateTokens();
            if (remaining - tokens < 0) {
                break;
            }
            window.add(0, formatForModel(message));
            remaining -= tokens;
        }
        context.addAll(window);
        return context;
    }

    private static Message formatForModel(Message message) {
        String content = message.getContent() != null ? message.getContent() : "";
        if (message.getAttachments() != null && !message.getAttachments().isEmpty()) {
            content = content + "\n\n[Attachments: " + String.join(", ", message.getAttachments()) + "]";
        }
        String role = message.isAssistantMessage() || message.isSystemMessage() ? message.getRole()
                : Message.ROLE_USER;
        return Message.builder()
                .id(message.getId())
                .role(role)
                .content(content)
                .blocks(message.getBlocks())
                .tokenCount(message.getTokenCount())
                .build();
    }

    private static long numericId(Message message) {
        if (message.getId() == null) {
            return Long.MAX_VALUE;
        }
        try {
            return Long.parseLong(message.getId());
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
