package me.golemcore.conductor.adapter.outbound.host;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.LlmUsage;
import me.golemcore.conductor.port.outbound.HostBridgePort;
import me.golemcore.conductor.port.outbound.UsageTrackingPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Forwards token usage to the host, which owns cost accounting, as a
 * {@code record_usage} notification.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HostUsageReporter implements UsageTrackingPort {

    private final HostBridgePort hostBridge;

    @Override
    public void recordUsage(String providerId, String model, LlmUsage usage) {
        if (usage == null) {
            return;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("model", model);
        params.put("input_tokens", usage.getInputTokens());
        params.put("output_tokens", usage.getOutputTokens());
        hostBridge.notify("record_usage", params);
        log.debug("[Usage] {} {}: in={}, out={}", providerId, model, usage.getInputTokens(),
                usage.getOutputTokens());
    }
}
