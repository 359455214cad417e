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

import java.util.Locale;
import java.util.Optional;

/**
 * Named model tiers a turn can be routed to.
 */
public enum ModelTier {
    FAST, BALANCED, ADVANCED;

    /**
     * Parses a user preference. Accepts tier names and the provider family
     * aliases {@code haiku}, {@code sonnet}, {@code opus}.
     */
    public static Optional<ModelTier> fromPreference(String preference) {
        if (preference == null || preference.isBlank()) {
            return Optional.empty();
        }
        return switch (preference.trim().toLowerCase(Locale.ROOT)) {
        case "fast", "haiku" -> Optional.of(FAST);
        case "balanced", "sonnet" -> Optional.of(BALANCED);
        case "advanced", "opus" -> Optional.of(ADVANCED);
        default -> Optional.empty();
        };
    }
}
