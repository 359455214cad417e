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

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Turn-wide inputs to tool dispatch.
 *
 * @param fileMap
 *            attached and produced files, basename to absolute path
 * @param outputDir
 *            writable directory for produced files, or null
 * @param baseTimeout
 *            timeout before a tool's multiplier is applied
 */
public record DispatchScope(Map<String, String> fileMap, Path outputDir, Duration baseTimeout) {
}
