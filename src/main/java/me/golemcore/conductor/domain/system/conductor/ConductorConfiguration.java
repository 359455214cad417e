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
import me.golemcore.conductor.domain.service.CredentialStore;
import me.golemcore.conductor.domain.service.ModelTierRouter;
import me.golemcore.conductor.domain.service.PromptImprovementService;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.port.outbound.HostBridgePort;
import me.golemcore.conductor.port.outbound.LlmPort;
import me.golemcore.conductor.port.outbound.UsageTrackingPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for the Conductor (domain orchestrator + ports). */
@Configuration
public class ConductorConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ConversationSession conversationSession() {
        return new ConversationSession();
    }

    @Bean
    public HistoryWriter conductorHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public Conductor conductor(LlmPort llmPort, UsageTrackingPort usageTracker, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, ModelTierRouter router, HostBridgePort hostBridge,
            ConversationSession session, ConductorProperties properties) {
        LlmPort tracked = new UsageTrackingLlmPortDecorator(llmPort, usageTracker);
        return new Conductor(tracked, toolExecutorPort, historyWriter, router, hostBridge, session, properties);
    }

    @Bean
    public PromptImprovementService promptImprovementService(LlmPort llmPort, UsageTrackingPort usageTracker,
            ToolExecutorPort toolExecutorPort, ModelTierRouter router, CredentialStore credentials,
            HostBridgePort hostBridge) {
        LlmPort tracked = new UsageTrackingLlmPortDecorator(llmPort, usageTracker);
        return new PromptImprovementService(tracked, toolExecutorPort, router, credentials, hostBridge);
    }
}
