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

import me.golemcore.conductor.domain.model.LlmRequest;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.LlmUsage;
import me.golemcore.conductor.port.outbound.LlmPort;
import me.golemcore.conductor.port.outbound.UsageTrackingPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Decorator around {@link LlmPort} that reports token usage via
 * {@link UsageTrackingPort} after each completed call.
 */
public class UsageTrackingLlmPortDecorator implements LlmPort {

    private static final Logger log = LoggerFactory.getLogger(UsageTrackingLlmPortDecorator.class);

    private final LlmPort delegate;
    private final UsageTrackingPort usageTracker;

    public UsageTrackingLlmPortDecorator(LlmPort delegate, UsageTrackingPort usageTracker) {
        this.delegate = delegate;
        this.usageTracker = usageTracker;
    }

    @Override
    public String getProviderId() {
        return delegate.getProviderId();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return delegate.chat(request).thenApply(response -> {
            recordUsage(request, response);
            return response;
        });
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    private void recordUsage(LlmRequest request, LlmResponse response) {
        if (response == null || response.getUsage() == null) {
            return;
        }
        LlmUsage usage = response.getUsage();
        String model = response.getModel() != null ? response.getModel() : request.getModel();
        usage.setModel(model);
        try {
            usageTracker.recordUsage(delegate.getProviderId(), model, usage);
        } catch (RuntimeException e) {
            log.warn("[UsageTracking] Failed to record usage: {}", e.getMessage());
        }
    }
}
