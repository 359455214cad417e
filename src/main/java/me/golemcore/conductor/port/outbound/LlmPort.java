package me.golemcore.conductor.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the external model provider. Failures complete the future
 * exceptionally with {@link me.golemcore.conductor.domain.model.ModelApiException}
 * once the provider's retry policy has given up.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g. "anthropic").
     */
    String getProviderId();

    /**
     * Sends the conversation and tool catalog and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Checks if the provider has what it needs to accept requests.
     */
    boolean isAvailable();
}
