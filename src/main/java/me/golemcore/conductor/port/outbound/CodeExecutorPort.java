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

import me.golemcore.conductor.domain.model.ExecutionRequest;
import me.golemcore.conductor.domain.model.ExecutionResult;

/**
 * Runs untrusted generated code under a capability allow-list, a wall-clock
 * timeout and scoped file access. Always returns; never throws for anything the
 * submitted code does.
 */
public interface CodeExecutorPort {

    ExecutionResult execute(ExecutionRequest request);

    /**
     * Language of the accepted source, as shown to the model.
     */
    String getLanguage();
}
