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

/**
 * Why a tool result is an error.
 */
public enum ToolFailureKind {
    /** Unknown tool, invalid or missing arguments. */
    POLICY_DENIED,
    /** The tool ran (or the host answered) and reported a failure. */
    EXECUTION_FAILED,
    /** The host or the sandbox did not answer in time. */
    TIMEOUT,
    /** The per-turn tool-call ceiling was reached; the call was not dispatched. */
    BUDGET_EXCEEDED,
    /** Sandboxed code touched a forbidden module, call or path. */
    SECURITY_VIOLATION
}
