package me.golemcore.conductor.adapter.inbound.web.controller;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.adapter.outbound.host.QueueHostBridge;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Transport for the host side of the bridge. The host drains tool requests,
 * log lines and notifications from the outbound queue and posts its answers to
 * the inbound one.
 */
@RestController
@RequestMapping("/api/bridge")
@RequiredArgsConstructor
@Slf4j
public class BridgeController {

    private static final int MAX_DRAIN = 500;
    static final long MAX_WAIT_MS = 30_000;

    private final QueueHostBridge hostBridge;
    private final ObjectMapper objectMapper;

    @GetMapping("/outbound")
    public Mono<ResponseEntity<List<JsonNode>>> drainOutbound(
            @RequestParam(defaultValue = "100") int max,
            @RequestParam(defaultValue = "0") long waitMs) {
        int limit = Math.max(1, Math.min(max, MAX_DRAIN));
        long wait = Math.min(waitMs, MAX_WAIT_MS);
        return Mono.fromCallable(() -> collect(limit, wait))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/inbound")
    public Mono<ResponseEntity<Void>> deliverInbound(@RequestBody String message) {
        try {
            objectMapper.readTree(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Inbound message is not valid JSON: " + e.getOriginalMessage(), e);
        }
        hostBridge.deliverInbound(message);
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).build());
    }

    private List<JsonNode> collect(int limit, long waitMs) throws InterruptedException {
        List<String> raw = new ArrayList<>();
        if (waitMs > 0) {
            String first = hostBridge.pollOutbound(Duration.ofMillis(waitMs));
            if (first == null) {
                return List.of();
            }
            raw.add(first);
        }
        raw.addAll(hostBridge.drainOutbound(limit - raw.size()));
        List<JsonNode> messages = new ArrayList<>(raw.size());
        for (String message : raw) {
            try {
                messages.add(objectMapper.readTree(message));
            } catch (JsonProcessingException e) {
                log.error("[HostBridge] Dropping malformed outbound message: {}", e.getOriginalMessage());
            }
        }
        return messages;
    }
}
