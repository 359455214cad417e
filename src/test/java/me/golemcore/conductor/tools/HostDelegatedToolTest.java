package me.golemcore.conductor.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.conductor.domain.model.CallOutcome;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.ToolExecutionContext;
import me.golemcore.conductor.domain.model.ToolFailureKind;
import me.golemcore.conductor.domain.model.ToolResult;
import me.golemcore.conductor.port.outbound.HostBridgePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HostDelegatedToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HostBridgePort hostBridge;
    private ToolExecutionContext context;

    @BeforeEach
    void setUp() {
        hostBridge = mock(HostBridgePort.class);
        context = ToolExecutionContext.builder().timeout(Duration.ofSeconds(30)).build();
    }

    private static ToolDefinition definition(String name) {
        return ToolDefinition.builder().name(name).description(name).inputSchema(Map.of("type", "object")).build();
    }

    @Test
    void shouldCallHostMethodWithContextTimeout() {
        HostDelegatedTool tool = new HostDelegatedTool(definition("ocr_image"), "ocr", 2.0, false, hostBridge,
                objectMapper);
        when(hostBridge.call(eq("ocr"), anyMap(), eq(Duration.ofSeconds(30))))
                .thenReturn(CallOutcome.ok(objectMapper.valueToTree(Map.of("text", "INVOICE #12"))));

        ToolResult result = tool.execute(Map.of("image_path", "/tmp/a.png"), context).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("\"text\" : \"INVOICE #12\""));
        assertEquals("INVOICE #12", ((Map<?, ?>) result.getData()).get("text"));
        assertEquals(2.0, tool.getTimeoutMultiplier());
        assertEquals("ocr_image", tool.getToolName());
    }

    @Test
    void shouldDefaultHostMethodToToolName() {
        HostDelegatedTool tool = new HostDelegatedTool(definition("flashlight"), null, 1.0, false, hostBridge,
                objectMapper);
        when(hostBridge.call(eq("flashlight"), anyMap(), any())).thenReturn(CallOutcome.ok(null));

        ToolResult result = tool.execute(Map.of(), context).join();

        assertEquals("flashlight", tool.getHostMethod());
        assertEquals("Done", result.getOutput());
    }

    @Test
    void shouldRenderScalarResultAsText() {
        HostDelegatedTool tool = new HostDelegatedTool(definition("battery"), null, 1.0, false, hostBridge,
                objectMapper);
        when(hostBridge.call(any(), anyMap(), any())).thenReturn(CallOutcome.ok(objectMapper.valueToTree(87)));

        assertEquals("87", tool.execute(Map.of(), context).join().getOutput());
    }

    @Test
    void shouldMapHostFailureWithCode() {
        HostDelegatedTool tool = new HostDelegatedTool(definition("smart_crop"), null, 1.0, false, hostBridge,
                objectMapper);
        when(hostBridge.call(any(), anyMap(), any())).thenReturn(CallOutcome.failed("No face found", -32001));

        ToolResult result = tool.execute(Map.of(), context).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("No face found (code -32001)", result.getError());
    }

    @Test
    void shouldMapHostTimeout() {
        HostDelegatedTool tool = new HostDelegatedTool(definition("ffmpeg_process"), null, 10.0, false, hostBridge,
                objectMapper);
        when(hostBridge.call(any(), anyMap(), any()))
                .thenReturn(CallOutcome.timedOut("Host did not answer ffmpeg_process within 300000ms"));

        ToolResult result = tool.execute(Map.of(), context).join();

        assertEquals(ToolFailureKind.TIMEOUT, result.getFailureKind());
    }

    @Test
    void shouldValidatePdfPageRangeBeforeCallingHost() {
        ReadPdfTool tool = new ReadPdfTool(definition(ReadPdfTool.TOOL_NAME), null, 3.0, hostBridge, objectMapper);

        ToolResult result = tool.execute(Map.of("file_path", "/tmp/a.pdf", "pages", "5-2"), context).join();

        assertEquals(ToolFailureKind.POLICY_DENIED, result.getFailureKind());
        verify(hostBridge, never()).call(any(), anyMap(), any());
    }

    @Test
    void shouldForwardValidPdfRequest() {
        ReadPdfTool tool = new ReadPdfTool(definition(ReadPdfTool.TOOL_NAME), null, 3.0, hostBridge, objectMapper);
        when(hostBridge.call(eq("read_pdf"), anyMap(), any()))
                .thenReturn(CallOutcome.ok(objectMapper.valueToTree("Page 1 text")));

        ToolResult result = tool.execute(Map.of("file_path", "/tmp/a.pdf", "pages", "1-3"), context).join();

        assertEquals("Page 1 text", result.getOutput());
    }
}
