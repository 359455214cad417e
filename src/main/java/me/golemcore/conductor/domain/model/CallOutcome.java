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

import java.util.Objects;

/**
 * Result of a call into a cross-boundary or untrusted executor. Exactly one of
 * three shapes: {@link Status#OK} with a value, {@link Status#FAILED} with a
 * message and an error code, or {@link Status#TIMED_OUT} when no answer arrived
 * before the deadline.
 *
 * @param <T>
 *            value type on success
 */
public final class CallOutcome<T> {

    /** Default code for failures that carry no code of their own. */
    public static final int DEFAULT_ERROR_CODE = -32000;

    public enum Status {
        OK, FAILED, TIMED_OUT
    }

    private final Status status;
    private final T value;
    private final String message;
    private final int code;

    private CallOutcome(Status status, T value, String message, int code) {
        this.status = status;
        this.value = value;
        this.message = message;
        this.code = code;
    }

    public static <T> CallOutcome<T> ok(T value) {
        return new CallOutcome<>(Status.OK, value, null, 0);
    }

    public static <T> CallOutcome<T> failed(String message, int code) {
        return new CallOutcome<>(Status.FAILED, null, message, code);
    }

    public static <T> CallOutcome<T> failed(String message) {
        return failed(message, DEFAULT_ERROR_CODE);
    }

    public static <T> CallOutcome<T> timedOut(String message) {
        return new CallOutcome<>(Status.TIMED_OUT, null, message, 0);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isTimedOut() {
        return status == Status.TIMED_OUT;
    }

    public T getValue() {
        return value;
    }

    public String getMessage() {
        return message;
    }

    public int getCode() {
        return code;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallOutcome<?> other)) {
            return false;
        }
        return code == other.code && status == other.status
                && Objects.equals(value, other.value) && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, value, message, code);
    }

    @Override
    public String toString() {
        return switch (status) {
        case OK -> "CallOutcome[OK, " + value + "]";
        case FAILED -> "CallOutcome[FAILED, " + code + ": " + message + "]";
        case TIMED_OUT -> "CallOutcome[TIMED_OUT, " + message + "]";
        };
    }
}
