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

@Data
@Builder
public class TurnResult {

    private String content;
    private boolean error;
    private ConductorState state;
    private String model;

    @Builder.Default
    private List<String> createdFiles = new ArrayList<>();

    /** Messages exchanged with the model during the turn, including tool blocks. */
    @Builder.Default
    private List<Message> transcript = new ArrayList<>();

    private int iterations;
    private int toolCalls;
    private long inputTokens;
    private long outputTokens;
}
