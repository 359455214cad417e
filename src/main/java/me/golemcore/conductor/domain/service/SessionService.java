package me.golemcore.conductor.domain.service;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.ConversationSession;
import me.golemcore.conductor.domain.model.Message;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the in-memory conversation window in sync with the host, which owns
 * durable history and sends incremental deltas instead of the full log.
 *
 * <p>
 * Supported actions: {@code new_conversation}, {@code add_message},
 * {@code set_summary}, {@code sync_full}. Malformed deltas are rejected with
 * {@link IllegalArgumentException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService {

    private final ConversationSession session;

    public ConversationSession getSession() {
        return session;
    }

    /**
     * Applies one delta. Waits for an in-flight turn to finish first, so a turn
     * never sees the window change underneath it.
     */
    public void applyDelta(JsonNode delta) {
        if (delta == null || !delta.isObject()) {
            throw new IllegalArgumentException("Delta must be an object");
        }
        session.exclusive(() -> {
            apply(delta);
            return null;
        });
    }

    private void apply(JsonNode delta) {
        String action = delta.path("action").asText("");
        switch (action) {
        case "new_conversation" -> {
            session.reset(requiredText(delta, "conversation_id"));
            log.info("[Session] New conversation {}", session.getConversationId());
        }
        case "add_message" -> {
            JsonNode message = delta.get("message");
            if (message == null || !message.isObject()) {
                throw new IllegalArgumentException("add_message requires a message object");
            }
            session.addMessage(toMessage(message));
        }
        case "set_summary" -> {
            JsonNode cutoff = delta.get("summarized_up_to_id");
            if (cutoff == null || !cutoff.canConvertToLong()) {
                throw new IllegalArgumentException("set_summary requires a numeric summarized_up_to_id");
            }
            session.applySummary(requiredText(delta, "summary"), cutoff.asLong());
            log.info("[Session] Summary applied up to message {}", cutoff.asLong());
        }
        case "sync_full" -> syncFull(delta);
        default -> throw new IllegalArgumentException("Unknown delta action: " + action);
        }
    }

    private void syncFull(JsonNode delta) {
        String conversationId = requiredText(delta, "conversation_id");
        List<Message> messages = new ArrayList<>();
        Map<String, String> files = new LinkedHashMap<>();
        for (JsonNode node : delta.path("messages")) {
            messages.add(toMessage(node));
            for (JsonNode attachment : node.path("attachments")) {
                String localPath = attachment.path("local_path").asText("");
                String originalName = attachment.path("original_name").asText("");
                if (!localPath.isEmpty() && !originalName.isEmpty()) {
                    files.put(originalName, localPath);
                } else if (!localPath.isEmpty()) {
                    files.put(basename(localPath), localPath);
                }
            }
        }
        JsonNode summary = delta.get("summary");
        session.replaceAll(conversationId, messages,
                summary != null && !summary.isNull() ? summary.asText() : null, files);
        log.info("[Session] Full sync of {}: {} messages, {} files", conversationId, messages.size(),
                files.size());
    }

    private Message toMessage(JsonNode node) {
        List<String> attachments = new ArrayList<>();
        for (JsonNode attachment : node.path("attachments")) {
            if (attachment.isTextual()) {
                attachments.add(attachment.asText());
            } else if (attachment.hasNonNull("original_name")) {
                attachments.add(attachment.get("original_name").asText());
            } else if (attachment.hasNonNull("local_path")) {
                attachments.add(basename(attachment.get("local_path").asText()));
            } else {
                attachments.add("file");
            }
        }
        JsonNode id = node.get("id");
        JsonNode tokens = node.get("token_count");
        return Message.builder()
                .id(id != null && !id.isNull() ? id.asText() : null)
                .role(node.path("role").asText(Message.ROLE_USER))
                .content(node.path("content").asText(""))
                .tokenCount(tokens != null && tokens.canConvertToInt() ? tokens.asInt() : null)
                .attachments(attachments.isEmpty() ? null : attachments)
                .build();
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            throw new IllegalArgumentException("Missing required field: " + field);
        }
        return value.asText();
    }

    private static String basename(String path) {
        Path fileName = Path.of(path).getFileName();
        return fileName != null ? fileName.toString() : path;
    }
}
