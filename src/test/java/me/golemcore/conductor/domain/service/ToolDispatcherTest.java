package me.golemcore.conductor.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.conductor.domain.component.ToolComponent;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.ToolExecutionContext;
import me.golemcore.conductor.domain.model.ToolFailureKind;
import me.golemcore.conductor.domain.model.ToolInvocation;
import me.golemcore.conductor.domain.model.ToolResult;
import me.golemcore.conductor.domain.system.conductor.DispatchScope;
import me.golemcore.conductor.domain.system.conductor.ToolExecutionOutcome;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.port.outbound.HostBridgePort;
import me.golemcore.conductor.tools.HostToolCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class ToolDispatcherTest {

    private static final String ECHO = "echo";

    private ConductorProperties properties;
    private CredentialStore credentials;
    private RecordingTool echo;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = new ConductorProperties();
        credentials = new CredentialStore();
        echo = new RecordingTool(ECHO, List.of("text"), false);
        HostToolCatalog emptyCatalog = new HostToolCatalog(properties, mock(HostBridgePort.class),
                new ObjectMapper());
        dispatcher = new ToolDispatcher(
                List.of(echo, new RecordingTool("calendar", List.of(), true)),
                emptyCatalog, new ToolArgumentResolver(), credentials, properties);
    }

    private static ToolInvocation call(String name, Map<String, Object> input) {
        return ToolInvocation.builder().id("tu_1").name(name).input(input).build();
    }

    private static DispatchScope scope() {
        return new DispatchScope(Map.of(), null, Duration.ofSeconds(2));
    }

    @Test
    void shouldExecuteRegisteredTool() {
        ToolExecutionOutcome outcome = dispatcher.execute(call(ECHO, Map.of("text", "hi")), scope());

        assertFalse(outcome.isError());
        assertEquals("tu_1", outcome.toolUseId());
        assertEquals("echo: hi", outcome.messageContent());
        assertFalse(outcome.synthetic());
    }

    @Test
    void shouldRejectUnknownToolAndListAvailableOnes() {
        ToolExecutionOutcome outcome = dispatcher.execute(call("teleport", Map.of()), scope());

        assertTrue(outcome.isError());
        assertEquals(ToolFailureKind.POLICY_DENIED, outcome.toolResult().getFailureKind());
        assertEquals("Error: Unknown tool: teleport. Available tools: calendar, echo", outcome.messageContent());
    }

    @Test
    void shouldSanitizeLeakedTokensInToolName() {
        ToolExecutionOutcome outcome = dispatcher.execute(call("echo<|channel|>commentary", Map.of("text", "x")),
                scope());

        assertFalse(outcome.isError());
        assertEquals(1, echo.calls.size());
    }

    @Test
    void shouldReportMissingRequiredParameters() {
        ToolExecutionOutcome outcome = dispatcher.execute(call(ECHO, Map.of("text", "  ")), scope());

        assertEquals(ToolFailureKind.POLICY_DENIED, outcome.toolResult().getFailureKind());
        assertEquals("Missing required parameter(s) for echo: text", outcome.toolResult().getError());
        assertTrue(echo.calls.isEmpty());
    }

    @Test
    void shouldRequireAccessTokenForGoogleTools() {
        ToolExecutionOutcome outcome = dispatcher.execute(call("calendar", Map.of()), scope());

        assertEquals(ToolFailureKind.POLICY_DENIED, outcome.toolResult().getFailureKind());
        assertTrue(outcome.toolResult().getError().startsWith("Google account not connected"));
    }

    @Test
    void shouldInjectStoredAccessTokenAndIgnoreModelSuppliedOne() {
        credentials.setAccessToken("ya29.real");
        RecordingTool calendar = (RecordingTool) dispatcher.getTool("calendar");

        dispatcher.execute(call("calendar", Map.of("access_token", "forged")), scope());

        assertEquals("ya29.real", calendar.calls.get(0).get("access_token"));
    }

    @Test
    void shouldNotPassAccessTokenToOtherTools() {
        credentials.setAccessToken("ya29.real");

        dispatcher.execute(call(ECHO, Map.of("text", "a", "access_token", "forged")), scope());

        assertNull(echo.calls.get(0).get("access_token"));
    }

    @Test
    void shouldResolveAttachedFileByBasename() {
        DispatchScope scope = new DispatchScope(Map.of("report.pdf", "/data/in/report.pdf"), null,
                Duration.ofSeconds(2));

        dispatcher.execute(call(ECHO, Map.of("text", "a", "file_path", "report.pdf")), scope);

        assertEquals("/data/in/report.pdf", echo.calls.get(0).get("file_path"));
        assertEquals(List.of(Path.of("/data/in/report.pdf").toAbsolutePath().normalize()),
                echo.lastContext.get().getAllowedPaths());
    }

    @Test
    void shouldScaleTimeoutByToolMultiplier() {
        echo.multiplier = 10.0;

        dispatcher.execute(call(ECHO, Map.of("text", "a")), scope());

        assertEquals(Duration.ofSeconds(20), echo.lastContext.get().getTimeout());
    }

    @Test
    void shouldTimeOutToolThatNeverCompletes() {
        properties.getTools().setDefaultTimeoutMs(10);
        RecordingTool stuck = new RecordingTool("stuck", List.of(), false) {
            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
                    ToolExecutionContext context) {
                return new CompletableFuture<>();
            }
        };
        ToolDispatcher withStuck = new ToolDispatcher(List.of(stuck),
                new HostToolCatalog(properties, mock(HostBridgePort.class), new ObjectMapper()),
                new ToolArgumentResolver(), credentials, properties);
        DispatchScope shortScope = new DispatchScope(Map.of(), null, Duration.ofMillis(10));

        ToolExecutionOutcome outcome = withStuck.execute(call("stuck", Map.of()), shortScope);

        assertEquals(ToolFailureKind.TIMEOUT, outcome.toolResult().getFailureKind());
        assertEquals("Tool stuck timed out after 10ms", outcome.toolResult().getError());
    }

    @Test
    void shouldWrapToolExceptionWithRootCause() {
        RecordingTool broken = new RecordingTool("broken", List.of(), false) {
            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
                    ToolExecutionContext context) {
                return CompletableFuture.failedFuture(new IllegalStateException("disk on fire"));
            }
        };
        ToolDispatcher withBroken = new ToolDispatcher(List.of(broken),
                new HostToolCatalog(properties, mock(HostBridgePort.class), new ObjectMapper()),
                new ToolArgumentResolver(), credentials, properties);

        ToolExecutionOutcome outcome = withBroken.execute(call("broken", Map.of()), scope());

        assertEquals(ToolFailureKind.EXECUTION_FAILED, outcome.toolResult().getFailureKind());
        assertEquals("Error: Tool execution failed: disk on fire", outcome.messageContent());
    }

    @Test
    void shouldTruncateOversizedResultKeepingHeadAndTail() {
        String big = "H".repeat(6000) + "M".repeat(10000) + "T".repeat(2000);

        String truncated = dispatcher.truncate(big, ECHO);

        assertTrue(truncated.startsWith("H".repeat(5000) + "\n\n[Output truncated...]\n\n"));
        assertTrue(truncated.endsWith("T".repeat(2000)));
        assertEquals(5000 + 2000 + "\n\n[Output truncated...]\n\n".length(), truncated.length());
    }

    @Test
    void shouldLeaveShortResultUntouched() {
        assertEquals("short", dispatcher.truncate("short", ECHO));
    }

    @Test
    void shouldHideDisabledToolsFromCatalog() {
        echo.enabled = false;

        List<String> names = dispatcher.availableTools().stream().map(ToolDefinition::getName).toList();

        assertEquals(List.of("calendar"), names);
        assertEquals(ToolFailureKind.POLICY_DENIED,
                dispatcher.execute(call(ECHO, Map.of("text", "a")), scope()).toolResult().getFailureKind());
    }

    private static class RecordingTool implements ToolComponent {

        private final String name;
        private final List<String> required;
        private final boolean needsToken;
        final List<Map<String, Object>> calls = new ArrayList<>();
        final AtomicReference<ToolExecutionContext> lastContext = new AtomicReference<>();
        double multiplier = 1.0;
        boolean enabled = true;

        RecordingTool(String name, List<String> required, boolean needsToken) {
            this.name = name;
            this.required = required;
            this.needsToken = needsToken;
        }

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder()
                    .name(name)
                    .description("test tool")
                    .inputSchema(Map.of("type", "object", "properties", Map.of(), "required", required))
                    .build();
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public double getTimeoutMultiplier() {
            return multiplier;
        }

        @Override
        public boolean requiresAccessToken() {
            return needsToken;
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
            calls.add(parameters);
            lastContext.set(context);
            return CompletableFuture.completedFuture(ToolResult.success(name + ": " + parameters.get("text")));
        }
    }
}
