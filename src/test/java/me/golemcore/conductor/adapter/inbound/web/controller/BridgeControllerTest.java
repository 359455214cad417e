package me.golemcore.conductor.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.conductor.adapter.outbound.host.QueueHostBridge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BridgeControllerTest {

    private QueueHostBridge hostBridge;
    private BridgeController controller;

    @BeforeEach
    void setUp() {
        hostBridge = mock(QueueHostBridge.class);
        controller = new BridgeController(hostBridge, new ObjectMapper());
    }

    @Test
    void shouldDrainOutboundAsJsonAndSkipMalformed() {
        when(hostBridge.drainOutbound(100)).thenReturn(List.of(
                "{\"jsonrpc\":\"2.0\",\"method\":\"log\",\"params\":{\"message\":\"hi\"}}",
                "{broken",
                "{\"jsonrpc\":\"2.0\",\"id\":\"a\",\"method\":\"native_tool\",\"params\":{}}"));

        StepVerifier.create(controller.drainOutbound(100, 0))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(2, response.getBody().size());
                    assertEquals("log", response.getBody().get(0).get("method").asText());
                    assertEquals("native_tool", response.getBody().get(1).get("method").asText());
                })
                .verifyComplete();
    }

    @Test
    void shouldClampDrainLimit() {
        when(hostBridge.drainOutbound(500)).thenReturn(List.of());

        StepVerifier.create(controller.drainOutbound(10_000, 0))
                .assertNext(response -> assertTrue(response.getBody().isEmpty()))
                .verifyComplete();
        verify(hostBridge).drainOutbound(500);
    }

    @Test
    void shouldLongPollForFirstMessage() throws Exception {
        when(hostBridge.pollOutbound(Duration.ofMillis(250))).thenReturn("{\"method\":\"log\"}");
        when(hostBridge.drainOutbound(9)).thenReturn(List.of("{\"method\":\"status\"}"));

        StepVerifier.create(controller.drainOutbound(10, 250))
                .assertNext(response -> assertEquals(2, response.getBody().size()))
                .verifyComplete();
    }

    @Test
    void shouldClampLongPollWait() throws Exception {
        when(hostBridge.pollOutbound(any())).thenReturn(null);

        StepVerifier.create(controller.drainOutbound(10, 3_600_000))
                .assertNext(response -> assertTrue(response.getBody().isEmpty()))
                .verifyComplete();
        verify(hostBridge).pollOutbound(Duration.ofMillis(BridgeController.MAX_WAIT_MS));
    }

    @Test
    void shouldReturnEmptyWhenLongPollTimesOut() throws Exception {
        when(hostBridge.pollOutbound(any())).thenReturn(null);

        StepVerifier.create(controller.drainOutbound(10, 50))
                .assertNext(response -> assertTrue(response.getBody().isEmpty()))
                .verifyComplete();
        verify(hostBridge, never()).drainOutbound(10);
    }

    @Test
    void shouldAcceptValidInbound() {
        String message = "{\"jsonrpc\":\"2.0\",\"id\":\"a\",\"result\":{}}";

        StepVerifier.create(controller.deliverInbound(message))
                .assertNext(response -> assertEquals(HttpStatus.ACCEPTED, response.getStatusCode()))
                .verifyComplete();
        verify(hostBridge).deliverInbound(message);
    }

    @Test
    void shouldRejectInvalidInbound() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> controller.deliverInbound("{oops"));

        assertTrue(error.getMessage().startsWith("Inbound message is not valid JSON"));
        verify(hostBridge, never()).deliverInbound(any());
    }
}
