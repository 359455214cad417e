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

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-call execution scope handed to a tool: how long it may take and which
 * files it may touch.
 */
@Data
@Builder
public class ToolExecutionContext {

    private Duration timeout;

    /** Writable directory for produced files, or null when none is configured. */
    private Path outputDir;

    /** Files the user attached during this conversation. */
    @Builder.Default
    private List<Path> allowedPaths = new ArrayList<>();
}
