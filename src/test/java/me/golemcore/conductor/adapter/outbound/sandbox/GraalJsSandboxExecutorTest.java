package me.golemcore.conductor.adapter.outbound.sandbox;

import me.golemcore.conductor.domain.model.CallOutcome;
import me.golemcore.conductor.domain.model.ExecutionRequest;
import me.golemcore.conductor.domain.model.ExecutionResult;
import me.golemcore.conductor.domain.model.SandboxFailureKind;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraalJsSandboxExecutorTest {

    private static GraalJsSandboxExecutor executor;

    @TempDir
    Path workDir;

    @BeforeAll
    static void startExecutor() {
        ConductorProperties properties = new ConductorProperties();
        properties.getSandbox().setMaxOutputLength(2000);
        properties.getSandbox().setMaxResultLength(50);
        executor = new GraalJsSandboxExecutor(properties);
    }

    @AfterAll
    static void stopExecutor() {
        executor.shutdown();
    }

    private ExecutionResult run(String code) {
        return executor.execute(ExecutionRequest.builder()
                .code(code)
                .timeout(Duration.ofSeconds(20))
                .build());
    }

    private ExecutionResult runWithFiles(String code, List<Path> allowed, Path outputDir) {
        return executor.execute(ExecutionRequest.builder()
                .code(code)
                .allowedPaths(allowed)
                .outputDir(outputDir)
                .timeout(Duration.ofSeconds(20))
                .build());
    }

    @Test
    void shouldCaptureConsoleOutputAndTrailingExpression() {
        ExecutionResult result = run("console.log('hello'); 6 * 7");

        assertTrue(result.isSuccess());
        assertEquals("hello\n", result.getOutput());
        assertEquals("42", result.getResult());
    }

    @Test
    void shouldRenderObjectsAsJson() {
        ExecutionResult result = run("({a: 1, b: [1, 2]})");

        assertEquals("{\"a\":1,\"b\":[1,2]}", result.getResult());
    }

    @Test
    void shouldReturnNoResultForStatements() {
        ExecutionResult result = run("let x = 1;");

        assertTrue(result.isSuccess());
        assertNull(result.getResult());
    }

    @Test
    void shouldTruncateLongResult() {
        ExecutionResult result = run("'x'.repeat(500)");

        assertEquals("x".repeat(50) + "... [truncated]", result.getResult());
    }

    @Test
    void shouldBoundConsoleOutput() {
        ExecutionResult result = run("for (let i = 0; i < 1000; i++) console.log('line ' + i);");

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().length() <= 2100);
    }

    @Test
    void shouldUseStatsAndEncodingModules() {
        ExecutionResult result = run("""
                const stats = require('stats');
                const enc = require('encoding');
                [stats.mean([1, 2, 3, 4]), stats.median([5, 1, 3]), enc.base64Encode('hi')].join('|')
                """);

        assertTrue(result.isSuccess(), result.getError());
        assertEquals("2.5|3|aGk=", result.getResult());
    }

    @Test
    void shouldRejectForbiddenImportBeforeRunning() {
        ExecutionResult result = run("const fs = require('fs'); fs.readFileSync('/etc/passwd')");

        assertEquals(CallOutcome.Status.FAILED, result.getStatus());
        assertEquals(SandboxFailureKind.SECURITY_VIOLATION, result.getFailureKind());
        assertTrue(result.getError().contains("'fs'"));
    }

    @Test
    void shouldBlockRequireSmuggledPastStaticCheck() {
        ExecutionResult result = run("const r = globalThis['req' + 'uire']; r('child_' + 'process')");

        assertEquals(SandboxFailureKind.SECURITY_VIOLATION, result.getFailureKind());
    }

    @Test
    void shouldHideHostGlobals() {
        ExecutionResult result = run("[typeof globalThis['Ja' + 'va'], typeof globalThis['ev' + 'al']].join(',')");

        assertTrue(result.isSuccess(), result.getError());
        assertEquals("undefined,undefined", result.getResult());
    }

    @Test
    void shouldReportRuntimeErrorWithOutputSoFar() {
        ExecutionResult result = run("console.log('before'); null.boom;");

        assertEquals(SandboxFailureKind.RUNTIME_ERROR, result.getFailureKind());
        assertTrue(result.getError().contains("TypeError"));
        assertEquals("before\n", result.getOutput());
    }

    @Test
    void shouldTimeOutRunawayLoop() {
        long start = System.currentTimeMillis();
        ExecutionResult result = executor.execute(ExecutionRequest.builder()
                .code("while (true) {}")
                .timeout(Duration.ofMillis(500))
                .build());

        assertTrue(result.isTimedOut());
        assertEquals("Execution timed out after 0.5 seconds", result.getError());
        assertTrue(System.currentTimeMillis() - start < 10_000);
    }

    @Test
    void shouldRejectBlankCode() {
        ExecutionResult result = run("   ");

        assertFalse(result.isSuccess());
        assertEquals("No code provided", result.getError());
    }

    @Test
    void shouldReadAttachedFileOnly() throws IOException {
        Path data = Files.writeString(workDir.resolve("data.csv"), "a,b\n1,2\n");
        Path secret = Files.writeString(workDir.resolve("secret.txt"), "hidden");

        ExecutionResult allowed = runWithFiles(
                "require('files').readText('" + data + "').split('\\n')[1]", List.of(data), null);
        ExecutionResult denied = runWithFiles(
                "open('" + secret + "', 'r').read()", List.of(data), null);

        assertEquals("1,2", allowed.getResult());
        assertEquals(SandboxFailureKind.SECURITY_VIOLATION, denied.getFailureKind());
        assertTrue(denied.getError().startsWith("Read access denied"));
    }

    @Test
    void shouldWriteOnlyUnderOutputDirectory() throws IOException {
        Path out = Files.createDirectories(workDir.resolve("out"));

        ExecutionResult written = runWithFiles("require('files').writeText('note.txt', 'saved')", List.of(), out);
        ExecutionResult escaped = runWithFiles("open('../escape.txt', 'w').write('x')", List.of(), out);

        assertTrue(written.isSuccess(), written.getError());
        assertEquals("saved", Files.readString(out.resolve("note.txt")));
        assertEquals(SandboxFailureKind.SECURITY_VIOLATION, escaped.getFailureKind());
        assertFalse(Files.exists(workDir.resolve("escape.txt")));
    }

    @Test
    void shouldSaveFiguresAsArtifacts() throws IOException {
        Path out = Files.createDirectories(workDir.resolve("figures"));

        ExecutionResult result = runWithFiles(
                "require('figures').lineChart([1, 4, 2, 8], 'Trend', 'trend')", List.of(), out);

        assertTrue(result.isSuccess(), result.getError());
        Path chart = FileAccessGuard.canonical(out).resolve("trend.svg");
        assertEquals(List.of(chart.toString()), result.getArtifacts());
        assertTrue(Files.readString(chart).startsWith("<svg"));
    }

    @Test
    void shouldWriteGuestTextThroughFileHandles() throws IOException {
        Path out = Files.createDirectories(workDir.resolve("handles"));

        ExecutionResult result = runWithFiles(
                "const f = open('a.txt', 'w'); f.write('hello'); f.close();"
                        + " const g = open('a.txt', 'a'); g.write(' world '); g.write(42); g.close();"
                        + " require('files').writeText('n.txt', 3.5)",
                List.of(), out);

        assertTrue(result.isSuccess(), result.getError());
        assertEquals("hello world 42", Files.readString(out.resolve("a.txt")));
        assertEquals("3.5", Files.readString(out.resolve("n.txt")));
    }

    @Test
    void shouldLabelBarChartWithGuestStrings() throws IOException {
        Path out = Files.createDirectories(workDir.resolve("bars"));

        ExecutionResult result = runWithFiles(
                "require('figures').barChart(['Jan', 'Feb'], [1, 2], 'Sales', 'bars')", List.of(), out);

        assertTrue(result.isSuccess(), result.getError());
        String svg = Files.readString(FileAccessGuard.canonical(out).resolve("bars.svg"));
        assertTrue(svg.contains(">Jan</text>"), svg);
        assertTrue(svg.contains(">Feb</text>"), svg);
        assertFalse(svg.contains("TruffleString"));
    }

    @Test
    void shouldProduceIdenticalResultsForIdenticalRuns() {
        String code = "const xs = [3, 1, 2]; console.log(xs.sort().join(',')); xs.length";

        ExecutionResult first = run(code);
        ExecutionResult second = run(code);

        assertEquals(first.getOutput(), second.getOutput());
        assertEquals(first.getResult(), second.getResult());
        assertEquals("3", second.getResult());
    }

    @Test
    void shouldIsolateGlobalsBetweenRuns() {
        run("globalThis.leaked = 'yes'");

        ExecutionResult second = run("typeof leaked");

        assertEquals("undefined", second.getResult());
    }
}
