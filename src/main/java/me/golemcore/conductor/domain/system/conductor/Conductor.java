package me.golemcore.conductor.domain.system.conductor;

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

import me.golemcore.conductor.domain.model.ConductorState;
import me.golemcore.conductor.domain.model.ContentBlock;
import me.golemcore.conductor.domain.model.ConversationSession;
import me.golemcore.conductor.domain.model.LlmRequest;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.LlmUsage;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ModelApiException;
import me.golemcore.conductor.domain.model.StopCondition;
import me.golemcore.conductor.domain.model.ToolFailureKind;
import me.golemcore.conductor.domain.model.ToolInvocation;
import me.golemcore.conductor.domain.model.TurnBudget;
import me.golemcore.conductor.domain.model.TurnRequest;
import me.golemcore.conductor.domain.model.TurnResult;
import me.golemcore.conductor.domain.service.ModelTierRouter;
import me.golemcore.conductor.domain.system.ModelErrorClassifier;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.port.outbound.HostBridgePort;
import me.golemcore.conductor.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * The ReAct loop driving one conversation turn.
 *
 * <p>
 * Each pass asks the model for the next step. Tool requests are dispatched in
 * order and their results fed back; a length-capped answer is continued; a
 * completed answer ends the turn. Iteration and tool-call ceilings end the
 * turn with a summary of the tools used so far.
 *
 * <p>
 * Whatever branch ends the turn, exactly one assistant message is written to
 * the conversation after the user message. A missing API key rejects the turn
 * before anything is written. Turns on the same session run one at a time.
 */
public class Conductor {

    private static final Logger log = LoggerFactory.getLogger(Conductor.class);

    static final String CONTINUE_PROMPT = "Continue from where you left off.";
    static final String MISSING_API_KEY = "API key not configured. Please enter your Claude API key to get started.";
    static final String TOOL_BUDGET_EXCEEDED = "Maximum tool calls reached for this query.";

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ModelTierRouter router;
    private final HostBridgePort hostBridge;
    private final ConversationSession session;
    private final ConductorProperties properties;

    public Conductor(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ModelTierRouter router, HostBridgePort hostBridge, ConversationSession session,
            ConductorProperties properties) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.router = router;
        this.hostBridge = hostBridge;
        this.session = session;
        this.properties = properties;
    }

    public TurnResult processQuery(TurnRequest request) {
        if (!llmPort.isAvailable()) {
            log.warn("[Conductor] Turn rejected: no API key configured");
            return TurnResult.builder()
                    .content(MISSING_API_KEY)
                    .error(true)
                    .state(ConductorState.FAILED)
                    .build();
        }
        return session.exclusive(() -> new Turn(request).run());
    }

    /**
     * State of one turn. Not shared across threads.
     */
    private final class Turn {

        private final TurnRequest request;
        private final ConductorProperties.TurnProperties turnSettings = properties.getTurn();
        private final TurnBudget budget;
        private final List<Message> messages = new ArrayList<>();
        private final List<String> createdFiles = new ArrayList<>();
        private int transcriptStart;
        private ConductorState state = ConductorState.THINKING;
        private boolean answered;
        private String model;
        private String systemPrompt;
        private Path outputDir;
        private Duration toolTimeout;

        Turn(TurnRequest request) {
            this.request = request;
            this.budget = new TurnBudget(
                    orDefault(request.getMaxIterations(), turnSettings.getMaxIterations()),
                    orDefault(request.getMaxToolCalls(), turnSettings.getMaxToolCalls()));
        }

        TurnResult run() {
            ModelTierRouter.TierDecision decision = router.route(request);
            model = decision.model();
            progress(decision.reason(), "info", null);

            systemPrompt = turnSettings.getSystemPrompt();
            if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
                systemPrompt = request.getSystemPrompt();
                progress("Using custom system prompt", "info", null);
            }
            outputDir = prepareOutputDir();
            long timeoutMs = request.getToolTimeoutMs() != null ? request.getToolTimeoutMs()
                    : properties.getTools().getDefaultTimeoutMs();
            toolTimeout = Duration.ofMillis(timeoutMs);

            messages.addAll(session.contextForLlm(turnSettings.getMaxContextTokens()));
            progress("Context: " + messages.size() + " previous messages, " + session.getMessages().size()
                    + " in session", "info", null);

            String userContent = buildUserContent();
            transcriptStart = messages.size();
            messages.add(Message.user(userContent));
            historyWriter.appendUserMessage(session, userContent);

            try {
                return loop();
            } catch (ModelApiException e) {
                log.warn("[Conductor] Model call failed with HTTP {}: {}", e.getStatus(), e.getMessage());
                progress("API error: " + e.getMessage(), "error", null);
                return finish(ConductorState.FAILED, ModelErrorClassifier.userMessage(e), true);
            } catch (RuntimeException e) {
                log.error("[Conductor] Unexpected failure during turn", e);
                progress("Exception: " + e.getMessage(), "error", null);
                return finish(ConductorState.FAILED, "An unexpected error occurred: " + e.getMessage(), true);
            }
        }

        private TurnResult loop() {
            int maxIterations = budget.getMaxIterations();
            while (budget.hasIterationsLeft()) {
                int iteration = budget.startIteration();
                state = ConductorState.THINKING;
                progress("Thinking... (step " + iteration + "/" + maxIterations + ")", "info",
                        (double) iteration / maxIterations * 0.5);

                LlmResponse response = callModel();
                budget.recordUsage(response.getUsage());
                reportUsage(response.getUsage());

                StopCondition condition = response.stopCondition();
                progress("Stop reason: " + response.getStopReason(), "info", null);

                switch (condition) {
                case COMPLETED -> {
                    state = ConductorState.COMPLETED;
                    progress("Preparing response...", "info", 0.95);
                    TurnResult result = finish(ConductorState.COMPLETED, response.text(), false);
                    progress("Done!", "info", 1.0);
                    return result;
                }
                case TOOL_USE -> {
                    if (!response.hasToolInvocations()) {
                        return unexpected(response);
                    }
                    dispatchTools(response, iteration);
                    if (budget.isToolCallRefused()) {
                        log.info("[Conductor] Tool-call ceiling of {} reached", budget.getMaxToolCalls());
                        return finish(ConductorState.BUDGET_EXHAUSTED, budgetSummary(), false);
                    }
                }
                case LENGTH_CAPPED -> {
                    state = ConductorState.LENGTH_CAPPED;
                    progress("Response hit token limit, continuing...", "info", null);
                    List<ContentBlock> partial = textBlocks(response);
                    if (!partial.isEmpty()) {
                        messages.add(Message.assistant(partial));
                    }
                    messages.add(Message.user(CONTINUE_PROMPT));
                }
                default -> {
                    return unexpected(response);
                }
                }
            }
            log.info("[Conductor] Iteration ceiling of {} reached", budget.getMaxIterations());
            return finish(ConductorState.BUDGET_EXHAUSTED, budgetSummary(), false);
        }

        private LlmResponse callModel() {
            state = ConductorState.AWAITING_MODEL;
            LlmRequest llmRequest = LlmRequest.builder()
                    .model(model)
                    .systemPrompt(systemPrompt)
                    .messages(new ArrayList<>(messages))
                    .tools(toolExecutor.availableTools())
                    .maxTokens(orDefault(request.getMaxTokens(), turnSettings.getMaxTokens()))
                    .build();
            try {
                LlmResponse response = llmPort.chat(llmRequest).join();
                if (response == null) {
                    throw new IllegalStateException("Model returned no response");
                }
                return response;
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException(cause.getMessage(), cause);
            }
        }

        private void dispatchTools(LlmResponse response, int iteration) {
            state = ConductorState.TOOL_USE;
            String thinking = response.text();
            if (!thinking.isBlank()) {
                progress("Thinking: " + preview(thinking, 100), "info", null);
            }
            messages.add(Message.assistant(response.getBlocks()));

            List<ToolInvocation> invocations = response.toolInvocations();
            progress("Executing " + invocations.size() + " tool(s)...", "info", null);

            List<ContentBlock> results = new ArrayList<>();
            for (ToolInvocation invocation : invocations) {
                ToolExecutionOutcome outcome;
                if (!budget.tryReserveToolCall(invocation.getName())) {
                    outcome = ToolExecutionOutcome.synthetic(invocation, ToolFailureKind.BUDGET_EXCEEDED,
                            TOOL_BUDGET_EXCEEDED);
                } else {
                    progress("Tool: " + invocation.getName(), "info",
                            0.5 + (double) iteration / budget.getMaxIterations() * 0.3);
                    outcome = dispatch(invocation);
                    collectCreatedFiles(outcome);
                }
                results.add(ContentBlock.toolResult(outcome.toolUseId(), outcome.messageContent(),
                        outcome.isError()));
            }
            messages.add(Message.builder()
                    .role(Message.ROLE_USER)
                    .blocks(results)
                    .build());
        }

        private ToolExecutionOutcome dispatch(ToolInvocation invocation) {
            DispatchScope scope = new DispatchScope(session.getFileMap(), outputDir, toolTimeout);
            try {
                ToolExecutionOutcome outcome = toolExecutor.execute(invocation, scope);
                if (outcome.isError()) {
                    progress("Tool error: " + outcome.toolResult().getError(), "warn", null);
                }
                return outcome;
            } catch (RuntimeException e) {
                log.error("[Conductor] Tool {} threw", invocation.getName(), e);
                progress("Tool exception: " + e.getMessage(), "error", null);
                return ToolExecutionOutcome.synthetic(invocation, ToolFailureKind.EXECUTION_FAILED,
                        "Tool error: " + e.getMessage());
            }
        }

        private void collectCreatedFiles(ToolExecutionOutcome outcome) {
            if (outcome.isError() || !(outcome.toolResult().getData() instanceof Map<?, ?> data)) {
                return;
            }
            if (data.get("output_path") instanceof String path && !path.isBlank()) {
                registerCreatedFile(path);
            }
            if (data.get("output_paths") instanceof List<?> paths) {
                for (Object path : paths) {
                    if (path instanceof String p && !p.isBlank()) {
                        registerCreatedFile(p);
                    }
                }
            }
        }

        private void registerCreatedFile(String path) {
            if (!createdFiles.contains(path)) {
                createdFiles.add(path);
            }
            session.registerFile(path);
            progress("File: " + path, "info", null);
        }

        private TurnResult unexpected(LlmResponse response) {
            state = ConductorState.UNEXPECTED;
            progress("Unexpected stop reason: " + response.getStopReason(), "warn", null);
            String partial = response.text();
            if (partial.isBlank()) {
                return finish(ConductorState.UNEXPECTED, budgetSummary(), false);
            }
            return finish(ConductorState.UNEXPECTED, partial, false);
        }

        private TurnResult finish(ConductorState terminal, String content, boolean error) {
            state = terminal;
            if (answered) {
                log.warn("[Conductor] Turn already answered, dropping second answer");
            } else {
                historyWriter.appendFinalAssistantAnswer(session, content);
                answered = true;
            }
            log.info("[Conductor] Turn ended {} after {} iterations, {} tool calls, {} in / {} out tokens",
                    terminal, budget.getIterations(), budget.getToolCalls(), budget.getInputTokens(),
                    budget.getOutputTokens());
            return TurnResult.builder()
                    .content(content)
                    .error(error)
                    .state(state)
                    .model(model)
                    .createdFiles(new ArrayList<>(createdFiles))
                    .transcript(new ArrayList<>(messages.subList(transcriptStart, messages.size())))
                    .iterations(budget.getIterations())
                    .toolCalls(budget.getToolCalls())
                    .inputTokens(budget.getInputTokens())
                    .outputTokens(budget.getOutputTokens())
                    .build();
        }

        private String budgetSummary() {
            StringBuilder sb = new StringBuilder("I've reached my step limit after ")
                    .append(budget.getIterations()).append(" iterations and ")
                    .append(budget.getToolCalls()).append(" tool calls. ");
            List<String> used = budget.getToolsUsed();
            if (used.isEmpty()) {
                sb.append("I was analyzing your request but couldn't complete it.");
            } else {
                sb.append("I used these tools: ").append(String.join(", ", used))
                        .append(". Here's what I found so far...");
            }
            return sb.toString();
        }

        private String buildUserContent() {
            String query = request.getUserQuery() != null ? request.getUserQuery() : "";
            if (!request.hasFiles()) {
                return query;
            }
            List<String> names = new ArrayList<>();
            for (String file : request.getFiles()) {
                session.registerFile(file);
                Path fileName = Path.of(file).getFileName();
                names.add(fileName != null ? fileName.toString() : file);
            }
            return query + "\n\n[Attached files: " + String.join(", ", names) + "]";
        }

        private Path prepareOutputDir() {
            String configured = request.getOutputDir() != null ? request.getOutputDir()
                    : properties.getTools().getOutputDir();
            if (configured == null || configured.isBlank()) {
                return null;
            }
            Path dir = Path.of(configured).toAbsolutePath().normalize();
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                log.warn("[Conductor] Could not create output directory {}: {}", dir, e.getMessage());
            }
            return dir;
        }

        private void reportUsage(LlmUsage usage) {
            if (usage != null) {
                progress("Tokens: " + usage.getInputTokens() + " in, " + usage.getOutputTokens() + " out", "info",
                        null);
            }
        }

        private List<ContentBlock> textBlocks(LlmResponse response) {
            List<ContentBlock> text = new ArrayList<>();
            for (ContentBlock block : response.getBlocks()) {
                if (block.isText() && block.getText() != null && !block.getText().isEmpty()) {
                    text.add(block);
                }
            }
            return text;
        }
    }

    private void progress(String message, String level, Double fraction) {
        try {
            hostBridge.log(message, level, fraction);
        } catch (RuntimeException e) {
            log.debug("[Conductor] Progress report failed: {}", e.getMessage());
        }
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static String preview(String text, int max) {
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
