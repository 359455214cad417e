package me.golemcore.conductor.adapter.outbound.host;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.CallOutcome;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.port.outbound.HostBridgePort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Host bridge over a pair of in-memory message queues.
 *
 * <p>
 * Requests are serialized onto the outbound queue, which the host drains
 * ({@link #pollOutbound}, {@link #drainOutbound}). Answers come back on the
 * inbound queue ({@link #deliverInbound}) in any order and are paired with the
 * waiting caller by correlation id on a single dispatcher thread.
 *
 * <p>
 * The map of outstanding calls is guarded by one lock that is held only for map
 * mutation. Callers wait on their own future, outside the lock.
 */
@Component
@Slf4j
public class QueueHostBridge implements HostBridgePort {

    private static final String JSONRPC_VERSION = "2.0";
    private static final String NATIVE_TOOL_METHOD = "native_tool";
    private static final String STOP_SIGNAL = "\u0000stop";
    private static final long STOP_JOIN_MILLIS = 2000;

    private final ObjectMapper objectMapper;
    private final Duration defaultTimeout;
    private final BlockingQueue<String> outbound = new LinkedBlockingQueue<>();
    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();

    private final Object lock = new Object();
    // guarded by lock
    private final Map<String, CompletableFuture<JsonNode>> pendingCalls = new HashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread dispatcherThread;

    public QueueHostBridge(ObjectMapper objectMapper, ConductorProperties properties) {
        this.objectMapper = objectMapper;
        this.defaultTimeout = Duration.ofMillis(properties.getBridge().getDefaultTimeoutMs());
    }

    @PostConstruct
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        dispatcherThread = new Thread(this::dispatchLoop, "host-bridge-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
        log.info("[HostBridge] Dispatcher started");
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        inbound.offer(STOP_SIGNAL);
        try {
            dispatcherThread.join(STOP_JOIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[HostBridge] Dispatcher stopped");
    }

    @Override
    public CallOutcome<JsonNode> call(String tool, Map<String, Object> args, Duration requestedTimeout) {
        start();
        Duration timeout = requestedTimeout != null && !requestedTimeout.isNegative() && !requestedTimeout.isZero()
                ? requestedTimeout
                : defaultTimeout;
        String id = UUID.randomUUID().toString();
        CompletableFuture<JsonNode> pending = new CompletableFuture<>();
        synchronized (lock) {
            pendingCalls.put(id, pending);
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("tool", tool);
        params.put("args", args != null ? args : Map.of());
        params.put("timeout_ms", timeout.toMillis());

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", NATIVE_TOOL_METHOD);
        request.put("params", params);

        try {
            outbound.offer(objectMapper.writeValueAsString(request));
        } catch (JsonProcessingException e) {
            removePending(id);
            log.warn("[HostBridge] Could not serialize request for '{}': {}", tool, e.getMessage());
            return CallOutcome.failed("Could not serialize arguments for " + tool + ": " + e.getOriginalMessage());
        }
        log.debug("[HostBridge] -> {} ({}), timeout {}ms", tool, id, timeout.toMillis());

        JsonNode response;
        try {
            response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (removePending(id)) {
                log.warn("[HostBridge] '{}' ({}) timed out after {}ms", tool, id, timeout.toMillis());
                return CallOutcome.timedOut("Host did not answer " + tool + " within " + timeout.toMillis() + "ms");
            }
            // The dispatcher claimed the call before we could; its answer is on the way.
            response = pending.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            removePending(id);
            return CallOutcome.failed("Interrupted while waiting for " + tool);
        } catch (ExecutionException e) {
            removePending(id);
            return CallOutcome.failed("Host call failed: " + e.getCause().getMessage());
        }
        return toOutcome(response);
    }

    @Override
    public void log(String message, String level, Double progress) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("level", level != null ? level : "info");
        params.put("message", message);
        if (progress != null) {
            params.put("progress", progress);
        }
        enqueueNotification("log", params);
    }

    @Override
    public void notify(String method, Map<String, Object> params) {
        enqueueNotification(method, params);
    }

    /**
     * Hands one inbound message (a response from the host) to the dispatcher.
     */
    public void deliverInbound(String message) {
        if (message == null || message.isBlank()) {
            return;
        }
        inbound.offer(message);
    }

    /**
     * Takes the next outbound message, waiting up to {@code timeout}.
     *
     * @return the serialized message, or null if none arrived in time
     */
    public String pollOutbound(Duration timeout) throws InterruptedException {
        return outbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Takes up to {@code max} queued outbound messages without waiting.
     */
    public List<String> drainOutbound(int max) {
        List<String> drained = new ArrayList<>();
        outbound.drainTo(drained, max);
        return drained;
    }

    /**
     * Correlation ids of calls still waiting for an answer.
     */
    public Set<String> outstandingCallIds() {
        synchronized (lock) {
            return Set.copyOf(pendingCalls.keySet());
        }
    }

    private boolean removePending(String id) {
        synchronized (lock) {
            return pendingCalls.remove(id) != null;
        }
    }

    private void enqueueNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        notification.put("params", params != null ? params : Map.of());
        try {
            outbound.offer(objectMapper.writeValueAsString(notification));
        } catch (JsonProcessingException e) {
            log.warn("[HostBridge] Failed to send notification '{}': {}", method, e.getMessage());
        }
    }

    private void dispatchLoop() {
        while (true) {
            String raw;
            try {
                raw = inbound.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (STOP_SIGNAL.equals(raw)) {
                return;
            }
            dispatch(raw);
        }
    }

    private void dispatch(String raw) {
        JsonNode message;
        try {
            message = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("[HostBridge] Dropping malformed inbound message: {}", e.getOriginalMessage());
            return;
        }

        JsonNode idNode = message != null ? message.get("id") : null;
        if (idNode == null || !idNode.isValueNode() || idNode.isNull()) {
            log.warn("[HostBridge] Dropping inbound message without id");
            return;
        }

        String id = idNode.asText();
        CompletableFuture<JsonNode> pending;
        synchronized (lock) {
            pending = pendingCalls.remove(id);
        }
        if (pending == null) {
            log.debug("[HostBridge] Dropping response for unknown or expired id: {}", id);
            return;
        }
        pending.complete(message);
    }

    private CallOutcome<JsonNode> toOutcome(JsonNode response) {
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            if (error.isTextual()) {
                return CallOutcome.failed(error.asText());
            }
            String message = error.hasNonNull("message") ? error.get("message").asText() : "Unknown host error";
            int code = error.hasNonNull("code") ? error.get("code").asInt(CallOutcome.DEFAULT_ERROR_CODE)
                    : CallOutcome.DEFAULT_ERROR_CODE;
            return CallOutcome.failed(message, code);
        }
        JsonNode result = response.get("result");
        return CallOutcome.ok(result != null ? result : NullNode.getInstance());
    }
}
