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
 * Outcome of one sandboxed run. {@code status} uses the same three-way split as
 * {@link CallOutcome}; on {@code FAILED} the {@code failureKind} tells a
 * capability violation apart from an exception thrown by the code itself.
 */
@Data
@Builder
public class ExecutionResult {

    private CallOutcome.Status status;
    private SandboxFailureKind failureKind;

    /** Captured standard output. */
    private String output;

    /** Captured standard error. */
    private String errorOutput;

    /** Value of the trailing expression, or null. */
    private String result;

    private String error;

    @Builder.Default
    private List<String> artifacts = new ArrayList<>();

    public boolean isSuccess() {
        return status == CallOutcome.Status.OK;
    }

    public boolean isTimedOut() {
        return status == CallOutcome.Status.TIMED_OUT;
    }

    public static ExecutionResult violation(String error) {
        return ExecutionResult.builder()
                .status(CallOutcome.Status.FAILED)
                .failureKind(SandboxFailureKind.SECURITY_VIOLATION)
                .output("")
                .error(error)
                .build();
    }

    public static ExecutionResult timedOut(String error) {
        return ExecutionResult.builder()
                .status(CallOutcome.Status.TIMED_OUT)
                .output("")
                .error(error)
                .build();
    }
}
