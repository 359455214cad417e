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

/**
 * Writes the two sides of a turn to the conversation window. The loop keeps
 * its own running message list for tool exchanges; only the user query and the
 * final answer are stored.
 */
public interface HistoryWriter {

    void appendUserMessage(ConversationSession session, String content);

    void appendFinalAssistantAnswer(ConversationSession session, String content);
}
