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

import me.golemcore.conductor.domain.model.ConversationSession;
import me.golemcore.conductor.domain.model.Message;

import java.time.Clock;
import java.time.Instant;

public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendUserMessage(ConversationSession session, String content) {
        session.addMessage(Message.builder()
                .role(Message.ROLE_USER)
                .content(content)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendFinalAssistantAnswer(ConversationSession session, String content) {
        session.addMessage(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(content != null ? content : "")
                .timestamp(now())
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
