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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One user request plus the per-turn overrides supplied by the host. Null
 * overrides fall back to configured defaults.
 */
@Data
@Builder
public class TurnRequest {

    private String userQuery;

    @Builder.Default
    private List<String> files = new ArrayList<>();

    private String preferredModel;
    private Double costPercentUsed;

    private Integer maxIterations;
    private Integer maxToolCalls;
    private Integer maxTokens;
    private String systemPrompt;
    private String outputDir;
    private Long toolTimeoutMs;

    public boolean hasFiles() {
        return files != null && !files.isEmpty();
    }
}
