package me.golemcore.conductor.adapter.outbound.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.conductor.domain.model.CallOutcome;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueHostBridgeTest {

    private static final Duration POLL = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorService callers;
    private QueueHostBridge bridge;

    @BeforeEach
    void setUp() {
        ConductorProperties properties = new ConductorProperties();
        properties.getBridge().setDefaultTimeoutMs(5000);
        bridge = new QueueHostBridge(objectMapper, properties);
        bridge.start();
        callers = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        bridge.stop();
    }

    private CompletableFuture<CallOutcome<JsonNode>> callAsync(String tool, Map<String, Object> args,
            Duration timeout) {
        return CompletableFuture.supplyAsync(() -> bridge.call(tool, args, timeout), callers);
    }

    private JsonNode nextOutbound() throws Exception {
        String raw = bridge.pollOutbound(POLL);
        assertNotNull(raw, "expected an outbound message");
        return objectMapper.readTree(raw);
    }

    @Test
    void shouldSendNativeToolRequestAndReturnResult() throws Exception {
        CompletableFuture<CallOutcome<JsonNode>> call = callAsync("ocr_image",
                Map.of("image_path", "/tmp/a.png"), Duration.ofSeconds(5));

        JsonNode request = nextOutbound();
        assertEquals("2.0", request.get("jsonrpc").asText());
        assertEquals("native_tool", request.get("method").asText());
        assertEquals("ocr_image", request.at("/params/tool").asText());
        assertEquals("/tmp/a.png", request.at("/params/args/image_path").asText());
        assertEquals(5000, request.at("/params/timeout_ms").asLong());

        String id = request.get("id").asText();
        bridge.deliverInbound("{\"jsonrpc\":\"2.0\",\"id\":\"" + id + "\",\"result\":{\"text\":\"hello\"}}");

        CallOutcome<JsonNode> outcome = call.get(5, TimeUnit.SECONDS);
        assertTrue(outcome.isOk());
        assertEquals("hello", outcome.getValue().get("text").asText());
        assertTrue(bridge.outstandingCallIds().isEmpty());
    }

    @Test
    void shouldPairOutOfOrderResponsesById() throws Exception {
        CompletableFuture<CallOutcome<JsonNode>> first = callAsync("tool_a", Map.of(), Duration.ofSeconds(5));
        JsonNode firstRequest = nextOutbound();
        CompletableFuture<CallOutcome<JsonNode>> second = callAsync("tool_b", Map.of(), Duration.ofSeconds(5));
        JsonNode secondRequest = nextOutbound();

        bridge.deliverInbound(response(secondRequest.get("id").asText(), "\"from b\""));
        bridge.deliverInbound(response(firstRequest.get("id").asText(), "\"from a\""));

        assertEquals("from a", first.get(5, TimeUnit.SECONDS).getValue().asText());
        assertEquals("from b", second.get(5, TimeUnit.SECONDS).getValue().asText());
    }

    @Test
    void shouldMapErrorObjectToFailure() throws Exception {
        CompletableFuture<CallOutcome<JsonNode>> call = callAsync("smart_crop", Map.of(), Duration.ofSeconds(5));
        String id = nextOutbound().get("id").asText();

        bridge.deliverInbound("{\"jsonrpc\":\"2.0\",\"id\":\"" + id
                + "\",\"error\":{\"code\":-32001,\"message\":\"No face found\"}}");

        CallOutcome<JsonNode> outcome = call.get(5, TimeUnit.SECONDS);
        assertTrue(outcome.isFailed());
        assertEquals("No face found", outcome.getMessage());
        assertEquals(-32001, outcome.getCode());
    }

    @Test
    void shouldUseDefaultCodeForTextualError() throws Exception {
        CompletableFuture<CallOutcome<JsonNode>> call = callAsync("ffmpeg_process", Map.of(), Duration.ofSeconds(5));
        String id = nextOutbound().get("id").asText();

        bridge.deliverInbound("{\"id\":\"" + id + "\",\"error\":\"codec missing\"}");

        CallOutcome<JsonNode> outcome = call.get(5, TimeUnit.SECONDS);
        assertEquals("codec missing", outcome.getMessage());
        assertEquals(CallOutcome.DEFAULT_ERROR_CODE, outcome.getCode());
    }

    @Test
    void shouldTimeOutAndDropLateResponse() throws Exception {
        CallOutcome<JsonNode> outcome = bridge.call("slow_tool", Map.of(), Duration.ofMillis(100));

        assertTrue(outcome.isTimedOut());
        assertEquals("Host did not answer slow_tool within 100ms", outcome.getMessage());
        assertTrue(bridge.outstandingCallIds().isEmpty());

        String id = nextOutbound().get("id").asText();
        bridge.deliverInbound(response(id, "\"too late\""));

        // The late answer must not disturb the next call.
        CompletableFuture<CallOutcome<JsonNode>> next = callAsync("fast_tool", Map.of(), Duration.ofSeconds(5));
        String nextId = nextOutbound().get("id").asText();
        bridge.deliverInbound(response(nextId, "\"fresh\""));
        assertEquals("fresh", next.get(5, TimeUnit.SECONDS).getValue().asText());
    }

    @Test
    void shouldFallBackToDefaultTimeoutWhenNoneRequested() throws Exception {
        CompletableFuture<CallOutcome<JsonNode>> call = callAsync("tool", null, null);

        JsonNode request = nextOutbound();
        assertEquals(5000, request.at("/params/timeout_ms").asLong());
        assertTrue(request.at("/params/args").isObject());

        bridge.deliverInbound(response(request.get("id").asText(), "null"));
        CallOutcome<JsonNode> outcome = call.get(5, TimeUnit.SECONDS);
        assertTrue(outcome.isOk());
        assertTrue(outcome.getValue().isNull());
    }

    @Test
    void shouldIgnoreMalformedAndUnknownInbound() throws Exception {
        bridge.deliverInbound("not json");
        bridge.deliverInbound("{\"result\":1}");
        bridge.deliverInbound(response("no-such-id", "1"));

        CompletableFuture<CallOutcome<JsonNode>> call = callAsync("tool", Map.of(), Duration.ofSeconds(5));
        String id = nextOutbound().get("id").asText();
        bridge.deliverInbound(response(id, "42"));

        assertEquals(42, call.get(5, TimeUnit.SECONDS).getValue().asInt());
    }

    @Test
    void shouldEnqueueLogNotificationWithoutId() throws Exception {
        bridge.log("Thinking...", null, 0.25);

        JsonNode notification = nextOutbound();
        assertEquals("log", notification.get("method").asText());
        assertNull(notification.get("id"));
        assertEquals("info", notification.at("/params/level").asText());
        assertEquals("Thinking...", notification.at("/params/message").asText());
        assertEquals(0.25, notification.at("/params/progress").asDouble());
    }

    @Test
    void shouldDrainQueuedMessagesInOrder() throws Exception {
        bridge.log("one", "info", null);
        bridge.notify("status", Map.of("state", "busy"));
        bridge.log("three", "warn", null);

        List<String> drained = bridge.drainOutbound(2);
        assertEquals(2, drained.size());
        assertEquals("one", objectMapper.readTree(drained.get(0)).at("/params/message").asText());
        assertEquals("busy", objectMapper.readTree(drained.get(1)).at("/params/state").asText());
        assertEquals(1, bridge.drainOutbound(10).size());
        assertTrue(bridge.drainOutbound(10).isEmpty());
    }

    private static String response(String id, String resultJson) {
        return "{\"jsonrpc\":\"2.0\",\"id\":\"" + id + "\",\"result\":" + resultJson + "}";
    }
}
