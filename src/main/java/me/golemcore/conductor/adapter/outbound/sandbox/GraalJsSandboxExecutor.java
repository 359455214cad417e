package me.golemcore.conductor.adapter.outbound.sandbox;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.CallOutcome;
import me.golemcore.conductor.domain.model.ExecutionRequest;
import me.golemcore.conductor.domain.model.ExecutionResult;
import me.golemcore.conductor.domain.model.SandboxFailureKind;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.port.outbound.CodeExecutorPort;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs model-generated JavaScript in a fresh, capability-free GraalJS context.
 *
 * <p>
 * Each run gets its own {@link Context} with no host access, no I/O, no
 * threads, processes, native code or environment. The only capabilities are
 * injected explicitly: a gated {@code require} for the allowed modules, a gated
 * {@code open}, and {@code OUTPUT_DIR}. The context is closed after the run so
 * nothing survives between calls.
 *
 * <p>
 * Execution happens on a worker thread; the caller waits at most the requested
 * timeout and then returns {@code TIMED_OUT} while the context is cancelled in
 * the background.
 */
@Component
@Slf4j
public class GraalJsSandboxExecutor implements CodeExecutorPort {

    static final String LANGUAGE_ID = "js";
    private static final String RESULT_TRUNCATED_MARKER = "... [truncated]";

    private static final List<String> REMOVED_GLOBALS = List.of(
            "eval", "load", "loadWithNewGlobal", "quit", "exit", "print", "printErr", "read", "readbuffer",
            "readline", "Java", "Polyglot", "Graal", "Packages", "java", "javax", "com", "org", "edu", "javafx");

    private final ConductorProperties.SandboxProperties settings;
    private final ExecutorService workers;
    private final ExecutorService reaper;

    public GraalJsSandboxExecutor(ConductorProperties properties) {
        this.settings = properties.getSandbox();
        this.workers = Executors.newCachedThreadPool(daemonThreads("sandbox-worker"));
        this.reaper = Executors.newSingleThreadExecutor(daemonThreads("sandbox-reaper"));
    }

    @PostConstruct
    public void init() {
        if (settings.isWarmUp()) {
            warmUp();
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        reaper.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Sandbox] Workers did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs a trivial script so the first real call does not pay for engine
     * initialization.
     */
    public void warmUp() {
        long start = System.currentTimeMillis();
        ExecutionResult result = execute(ExecutionRequest.builder()
                .code("1 + 1")
                .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                .build());
        log.info("[Sandbox] Warm-up finished in {}ms: {}", System.currentTimeMillis() - start, result.getStatus());
    }

    @Override
    public String getLanguage() {
        return "javascript";
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) {
        String code = request.getCode();
        if (code == null || code.isBlank()) {
            return failure(SandboxFailureKind.RUNTIME_ERROR, "No code provided", "", "");
        }

        Optional<String> violation = SourceValidator.findViolation(code);
        if (violation.isPresent()) {
            log.warn("[Sandbox] Rejected before execution: {}", violation.get());
            return ExecutionResult.violation(violation.get());
        }

        Duration timeout = request.getTimeout() != null ? request.getTimeout()
                : Duration.ofSeconds(settings.getTimeoutSeconds());
        SandboxRun run = new SandboxRun(request);
        Future<ExecutionResult> future = workers.submit(run::run);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[Sandbox] Execution timed out after {}ms", timeout.toMillis());
            run.cancel();
            return ExecutionResult.timedOut("Execution timed out after " + formatSeconds(timeout) + " seconds");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel();
            return failure(SandboxFailureKind.RUNTIME_ERROR, "Execution interrupted", "", "");
        } catch (ExecutionException e) {
            log.error("[Sandbox] Worker failed", e.getCause());
            return failure(SandboxFailureKind.RUNTIME_ERROR, "Execution failed: " + e.getCause().getMessage(), "",
                    "");
        }
    }

    private Context buildContext(BoundedOutput out, BoundedOutput err) {
        return Context.newBuilder(LANGUAGE_ID)
                .allowHostAccess(HostAccess.NONE)
                .allowHostClassLookup(className -> false)
                .allowIO(IOAccess.NONE)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .allowNativeAccess(false)
                .allowEnvironmentAccess(EnvironmentAccess.NONE)
                .allowPolyglotAccess(PolyglotAccess.NONE)
                .allowExperimentalOptions(true)
                .option("engine.WarnInterpreterOnly", "false")
                .option("js.ecmascript-version", "2022")
                .option("js.load", "false")
                .option("js.print", "false")
                .option("js.graal-builtin", "false")
                .option("js.polyglot-builtin", "false")
                .option("js.java-package-globals", "false")
                .out(out)
                .err(err)
                .build();
    }

    private void installGlobals(Context context, SandboxModules modules, Path outputDir) {
        Value bindings = context.getBindings(LANGUAGE_ID);
        for (String name : REMOVED_GLOBALS) {
            if (bindings.hasMember(name)) {
                bindings.removeMember(name);
            }
        }
        bindings.putMember("require", modules.requireFunction());
        bindings.putMember("open", modules.openFunction());
        if (outputDir != null) {
            bindings.putMember("OUTPUT_DIR", outputDir.toAbsolutePath().toString());
        }
    }

    private String renderResult(Context context, Value value) {
        if (value == null) {
            return null;
        }
        String rendered;
        if (value.isNull()) {
            // undefined means the last statement was not an expression
            return "undefined".equals(SandboxModules.text(value)) ? null : "null";
        } else if (value.isString()) {
            rendered = value.asString();
        } else if (value.isNumber() || value.isBoolean() || value.canExecute()) {
            rendered = SandboxModules.text(value);
        } else {
            rendered = stringify(context, value);
        }
        int max = settings.getMaxResultLength();
        if (rendered.length() > max) {
            rendered = rendered.substring(0, max) + RESULT_TRUNCATED_MARKER;
        }
        return rendered;
    }

    private String stringify(Context context, Value value) {
        try {
            Value json = context.eval(LANGUAGE_ID, "(v) => JSON.stringify(v)").execute(value);
            return json.isString() ? json.asString() : SandboxModules.text(value);
        } catch (PolyglotException e) {
            log.debug("[Sandbox] JSON.stringify failed, using String(): {}", e.getMessage());
            return SandboxModules.text(value);
        }
    }

    private List<String> harvest(FigureRegistry figures, Path outputDir, BoundedOutput err) {
        List<String> artifacts = new ArrayList<>();
        List<FigureRegistry.Figure> pending = figures.figures();
        if (pending.isEmpty()) {
            return artifacts;
        }
        if (outputDir == null) {
            log.warn("[Sandbox] {} figure(s) dropped: no output directory", pending.size());
            return artifacts;
        }
        for (FigureRegistry.Figure figure : pending) {
            Path target = outputDir.resolve(figure.fileName()).toAbsolutePath().normalize();
            try {
                Files.createDirectories(outputDir);
                Files.writeString(target, figure.svg(), StandardCharsets.UTF_8);
                artifacts.add(target.toString());
            } catch (IOException e) {
                log.warn("[Sandbox] Could not save figure {}: {}", figure.fileName(), e.getMessage());
                byte[] note = ("Could not save figure " + figure.fileName() + ": " + e.getMessage() + "\n")
                        .getBytes(StandardCharsets.UTF_8);
                err.write(note, 0, note.length);
            }
        }
        return artifacts;
    }

    private ExecutionResult failure(SandboxFailureKind kind, String error, String output, String errorOutput) {
        return ExecutionResult.builder()
                .status(CallOutcome.Status.FAILED)
                .failureKind(kind)
                .error(error)
                .output(output)
                .errorOutput(errorOutput)
                .build();
    }

    private static String formatSeconds(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0 ? String.valueOf(millis / 1000) : String.valueOf(millis / 1000.0);
    }

    private static ThreadFactory daemonThreads(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * One execution. The worker thread owns the context until the caller gives up
     * on it; whichever side gets there first closes it.
     */
    private final class SandboxRun {

        private final ExecutionRequest request;
        private final BoundedOutput out;
        private final BoundedOutput err;
        private final FigureRegistry figures = new FigureRegistry();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile boolean cancelled;
        private volatile Context context;

        SandboxRun(ExecutionRequest request) {
            this.request = request;
            this.out = new BoundedOutput(settings.getMaxOutputLength());
            this.err = new BoundedOutput(settings.getMaxOutputLength());
        }

        ExecutionResult run() {
            Path outputDir = request.getOutputDir();
            FileAccessGuard guard = new FileAccessGuard(request.getAllowedPaths(), outputDir);
            Context ctx = buildContext(out, err);
            context = ctx;
            if (cancelled) {
                close(ctx, true);
                return ExecutionResult.timedOut("Execution cancelled");
            }
            try {
                installGlobals(ctx, new SandboxModules(guard, figures), guard.getOutputDir());
                Value value = ctx.eval(Source.create(LANGUAGE_ID, request.getCode()));
                String result = renderResult(ctx, value);
                List<String> artifacts = harvest(figures, guard.getOutputDir(), err);
                return ExecutionResult.builder()
                        .status(CallOutcome.Status.OK)
                        .output(out.render())
                        .errorOutput(err.render())
                        .result(result)
                        .artifacts(artifacts)
                        .build();
            } catch (PolyglotException e) {
                return classify(e);
            } finally {
                close(ctx, false);
            }
        }

        void cancel() {
            cancelled = true;
            Context ctx = context;
            if (ctx != null) {
                reaper.execute(() -> close(ctx, true));
            }
        }

        private ExecutionResult classify(PolyglotException e) {
            if (e.isCancelled()) {
                return ExecutionResult.timedOut("Execution cancelled");
            }
            if (e.isHostException() && e.asHostException() instanceof SandboxViolationException violation) {
                log.warn("[Sandbox] Capability violation: {}", violation.getMessage());
                return failure(SandboxFailureKind.SECURITY_VIOLATION, violation.getMessage(), out.render(),
                        err.render());
            }
            String message = e.isHostException() ? e.asHostException().getMessage() : e.getMessage();
            return failure(SandboxFailureKind.RUNTIME_ERROR, message, out.render(), err.render());
        }

        private void close(Context ctx, boolean cancelIfExecuting) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                ctx.close(cancelIfExecuting);
            } catch (PolyglotException | IllegalStateException e) {
                log.debug("[Sandbox] Context close: {}", e.getMessage());
            }
        }
    }
}
