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
import me.golemcore.conductor.domain.model.ModelTier;
import me.golemcore.conductor.domain.model.TurnRequest;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Picks the model tier for a turn from cheap lexical signals. Precedence:
 * explicit preference, cost-budget pressure, complex keywords, simple keywords,
 * short question, attachments, then the advanced tier by default.
 */
@Service
@Slf4j
public class ModelTierRouter {

    public record TierDecision(ModelTier tier, String model, String reason) {
    }

    private final ConductorProperties.RouterProperties settings;

    public ModelTierRouter(ConductorProperties properties) {
        this.settings = properties.getRouter();
    }

    public TierDecision route(TurnRequest request) {
        String query = request.getUserQuery() != null ? request.getUserQuery() : "";
        String lower = query.toLowerCase(Locale.ROOT).trim();

        Optional<ModelTier> preferred = ModelTier.fromPreference(request.getPreferredModel());
        if (preferred.isPresent()) {
            return decide(preferred.get(), "Using " + describe(preferred.get()) + " (user preference)");
        }

        double costUsed = request.getCostPercentUsed() != null ? request.getCostPercentUsed() : 0;
        if (costUsed >= settings.getCostThresholdPercent()) {
            return decide(ModelTier.FAST,
                    String.format(Locale.ROOT, "Using faster model (budget at %.1f%%)", costUsed));
        }

        for (String pattern : settings.getComplexPatterns()) {
            if (lower.contains(pattern)) {
                return decide(ModelTier.ADVANCED, "Using advanced model for complex task");
            }
        }
        for (String pattern : settings.getSimplePatterns()) {
            if (lower.contains(pattern)) {
                return decide(ModelTier.FAST, "Using faster model for simple task");
            }
        }

        int words = lower.isEmpty() ? 0 : lower.split("\\s+").length;
        if (words <= settings.getShortQuestionMaxWords() && query.contains("?")) {
            return decide(ModelTier.FAST, "Using faster model for quick question");
        }

        if (request.hasFiles()) {
            return decide(ModelTier.ADVANCED, "Using advanced model for file analysis");
        }
        return decide(ModelTier.ADVANCED, "Using advanced model");
    }

    public String modelFor(ModelTier tier) {
        return switch (tier) {
        case FAST -> settings.getFastModel();
        case BALANCED -> settings.getBalancedModel();
        case ADVANCED -> settings.getAdvancedModel();
        };
    }

    private TierDecision decide(ModelTier tier, String reason) {
        String model = modelFor(tier);
        log.debug("[Router] {} -> {} ({})", tier, model, reason);
        return new TierDecision(tier, model, reason);
    }

    private static String describe(ModelTier tier) {
        return switch (tier) {
        case FAST -> "faster model";
        case BALANCED -> "balanced model";
        case ADVANCED -> "advanced model";
        };
    }
}
