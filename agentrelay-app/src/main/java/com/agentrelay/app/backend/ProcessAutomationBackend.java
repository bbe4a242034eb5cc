package com.agentrelay.app.backend;

import com.agentrelay.common.config.RelayConfig;
import com.agentrelay.gateway.backend.AutomationBackend;
import com.agentrelay.gateway.backend.BackendResult;
import com.agentrelay.gateway.backend.ProposedAction;
import com.agentrelay.gateway.backend.QuestionAnswer;
import com.agentrelay.gateway.backend.QuestionRequest;
import com.agentrelay.gateway.backend.RunCallbacks;
import com.agentrelay.gateway.backend.RunHandle;
import com.agentrelay.gateway.backend.RunRequest;
import com.agentrelay.gateway.backend.ToolDecision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives an external automation CLI over JSON lines.
 *
 * <p>
 * The gateway writes one {@code run} frame to the child's stdin, then reads events from its
 * stdout:
 * <ul>
 * <li>{@code {"type":"session","id"}}: continuation id</li>
 * <li>{@code {"type":"text","text"}}: streamed assistant text</li>
 * <li>{@code {"type":"tool","id","name","input"}}: proposed action, answered with
 * {@code {"type":"decision","id","allow","reason"}}</li>
 * <li>{@code {"type":"tool_result","id","content","isError"}}</li>
 * <li>{@code {"type":"question","id","question","options"}}, answered with
 * {@code {"type":"answer","id","answered","index","label"}}</li>
 * <li>{@code {"type":"result","text","sessionId","costUsd"}} or {@code {"type":"error","message"}}</li>
 * </ul>
 * Lines that are not JSON are ignored.
 */
@Slf4j
public class ProcessAutomationBackend implements AutomationBackend {

    static final long EXIT_WAIT_SECONDS = 5;
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final RelayConfig.BackendConfig config;
    private final ObjectMapper mapper;
    private final ExecutorService ioExecutor;

    public ProcessAutomationBackend(RelayConfig.BackendConfig config, ObjectMapper mapper,
            ExecutorService ioExecutor) {
        this.config = config;
        this.mapper = mapper;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public RunHandle run(RunRequest request, RunCallbacks callbacks) {
        if (config.getCommand() == null || config.getCommand().isBlank()) {
            throw new IllegalStateException("No backend command configured (backend.command)");
        }
        List<String> command = new ArrayList<>();
        command.add(config.getCommand());
        if (config.getArgs() != null) {
            command.addAll(config.getArgs());
        }
        ProcessBuilder pb = new ProcessBuilder(command);
        if (request.getWorkspace() != null) {
            pb.directory(new File(request.getWorkspace()));
        }
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start backend " + config.getCommand() + ": " + e.getMessage(), e);
        }
        log.debug("Backend started for run {} (pid {})", request.getRunId(), process.pid());

        ProcessRun run = new ProcessRun(process, callbacks, request.getRunId());
        run.write(runFrame(request));
        ioExecutor.execute(run::readLoop);
        ioExecutor.execute(run::drainStderr);
        return run;
    }

    Map<String, Object> runFrame(RunRequest request) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "run");
        frame.put("runId", request.getRunId());
        frame.put("prompt", request.getPrompt());
        frame.put("sessionId", request.getSessionId());
        frame.put("continuationId", request.getContinuationId());
        frame.put("permissionMode", request.getPermissionMode() != null ? request.getPermissionMode().key() : null);
        frame.put("channel", request.getChannel());
        frame.put("source", request.getSource());
        frame.put("workspace", request.getWorkspace());
        frame.put("model", request.getModel() != null ? request.getModel() : config.getModel());
        return frame;
    }

    private final class ProcessRun implements RunHandle {

        private final Process process;
        private final RunCallbacks callbacks;
        private final String runId;
        private final BufferedWriter stdin;
        private final CompletableFuture<BackendResult> completion = new CompletableFuture<>();
        private volatile String continuationId;
        private volatile String lastText;

        ProcessRun(Process process, RunCallbacks callbacks, String runId) {
            this.process = process;
            this.callbacks = callbacks;
            this.runId = runId;
            this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public CompletableFuture<BackendResult> completion() {
            return completion;
        }

        @Override
        public void cancel() {
            if (process.isAlive()) {
                log.info("Cancelling backend for run {}", runId);
                process.destroy();
            }
            completion.completeExceptionally(new CancellationException("run cancelled"));
        }

        void readLoop() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while (!completion.isDone() && (line = reader.readLine()) != null) {
                    if (!line.isBlank()) {
                        handleLine(line);
                    }
                }
            } catch (IOException e) {
                if (!completion.isDone()) {
                    log.warn("Reading backend output for run {} failed: {}", runId, e.getMessage());
                }
            } catch (RuntimeException e) {
                log.error("Backend event handling failed for run {}: {}", runId, e.getMessage(), e);
                completion.completeExceptionally(e);
            }
            closeStdin();
            int code = awaitExit();
            if (!completion.isDone()) {
                completion.completeExceptionally(
                        new IllegalStateException("backend exited with code " + code + " without a result"));
            }
        }

        void drainStderr() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("backend[{}] {}", runId, line);
                }
            } catch (IOException e) {
                log.debug("backend[{}] stderr closed: {}", runId, e.getMessage());
            }
        }

        private void handleLine(String line) {
            JsonNode node;
            try {
                node = mapper.readTree(line);
            } catch (JsonProcessingException e) {
                log.debug("backend[{}] non-JSON output ignored", runId);
                return;
            }
            switch (node.path("type").asText("")) {
                case "session" -> {
                    String id = node.path("id").asText(null);
                    if (id != null) {
                        continuationId = id;
                        callbacks.onContinuationId(id);
                    }
                }
                case "text" -> {
                    String text = node.path("text").asText("");
                    lastText = text;
                    callbacks.onText(text);
                }
                case "tool" -> proposeTool(node);
                case "tool_result" -> callbacks.onToolResult(node.path("id").asText(null),
                        node.path("content").asText(""), node.path("isError").asBoolean(false));
                case "question" -> ask(node);
                case "result" -> completion.complete(new BackendResult(
                        node.hasNonNull("text") ? node.get("text").asText() : lastText,
                        node.hasNonNull("sessionId") ? node.get("sessionId").asText() : continuationId,
                        node.path("costUsd").asDouble(0)));
                case "error" -> completion.completeExceptionally(
                        new IllegalStateException(node.path("message").asText("backend error")));
                default -> log.debug("backend[{}] unknown event type: {}", runId, node.path("type").asText());
            }
        }

        private void proposeTool(JsonNode node) {
            String id = node.path("id").asText(null);
            Map<String, Object> input = node.has("input") && node.get("input").isObject()
                    ? mapper.convertValue(node.get("input"), MAP_TYPE)
                    : Map.of();
            ProposedAction action = new ProposedAction(id, node.path("name").asText(""), input);
            callbacks.onToolProposed(action).whenComplete((decision, err) -> {
                ToolDecision effective = err != null ? ToolDecision.deny(err.getMessage()) : decision;
                Map<String, Object> frame = new LinkedHashMap<>();
                frame.put("type", "decision");
                frame.put("id", id);
                frame.put("allow", effective.allowed());
                frame.put("reason", effective.reason());
                write(frame);
            });
        }

        private void ask(JsonNode node) {
            String id = node.path("id").asText(null);
            List<QuestionRequest.Option> options = new ArrayList<>();
            for (JsonNode option : node.path("options")) {
                options.add(new QuestionRequest.Option(option.path("label").asText(""),
                        option.hasNonNull("description") ? option.get("description").asText() : null));
            }
            QuestionRequest question = new QuestionRequest(node.path("question").asText(""), options);
            callbacks.onQuestion(question).whenComplete((answer, err) -> {
                QuestionAnswer effective = err != null ? QuestionAnswer.unanswered(err.getMessage()) : answer;
                Map<String, Object> frame = new LinkedHashMap<>();
                frame.put("type", "answer");
                frame.put("id", id);
                frame.put("answered", effective.answered());
                frame.put("index", effective.index());
                frame.put("label", effective.label());
                frame.put("reason", effective.reason());
                write(frame);
            });
        }

        synchronized void write(Map<String, Object> frame) {
            try {
                stdin.write(mapper.writeValueAsString(frame));
                stdin.newLine();
                stdin.flush();
            } catch (IOException e) {
                log.warn("Writing {} frame to backend for run {} failed: {}", frame.get("type"), runId, e.getMessage());
            }
        }

        private synchronized void closeStdin() {
            try {
                stdin.close();
            } catch (IOException e) {
                log.debug("backend[{}] stdin already closed: {}", runId, e.getMessage());
            }
        }

        private int awaitExit() {
            try {
                if (!process.waitFor(EXIT_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                    return -1;
                }
                return process.exitValue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                return -1;
            }
        }
    }
}
