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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Process-lifetime holder for the model API key and the Google access token.
 * The host pushes both over the control plane; nothing is persisted.
 */
@Service
@Slf4j
public class CredentialStore {

    private volatile String apiKey;
    private volatile String accessToken;

    public void setApiKey(String apiKey) {
        this.apiKey = blankToNull(apiKey);
        log.info("[Credentials] API key {}", this.apiKey != null ? "updated" : "cleared");
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = blankToNull(accessToken);
        log.info("[Credentials] Access token {}", this.accessToken != null ? "updated" : "cleared");
    }

    public Optional<String> getApiKey() {
        return Optional.ofNullable(apiKey);
    }

    public Optional<String> getAccessToken() {
        return Optional.ofNullable(accessToken);
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
