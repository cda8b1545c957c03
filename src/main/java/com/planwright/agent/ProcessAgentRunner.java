package com.planwright.agent;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each task as an external command, for example {@code claude -p {prompt}}.
 * The placeholders {@code {planId}}, {@code {taskId}} and {@code {prompt}} are
 * substituted per argument. Exit code 0 means success.
 * <p>
 * Each agent's output is drained on a thread of the runner's own unbounded pool, so
 * a full pipe never stalls an agent however many run at once.
 */
public class ProcessAgentRunner implements AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentRunner.class);

    /** Max output kept per task. Tail is preserved for error context. */
    private static final int MAX_OUTPUT_CHARS = 10_000;

    private final List<String> commandTemplate;
    private final Duration timeout;
    private final Path workingDirectory;
    private final ExecutorService outputReaders;

    public ProcessAgentRunner(String command, Duration timeout, Path workingDirectory) {
        this.commandTemplate = List.of(command.trim().split("\\s+"));
        this.timeout = timeout;
        this.workingDirectory = workingDirectory;
        var threadCount = new AtomicInteger();
        this.outputReaders = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "planwright-agent-output-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public AgentResult run(AgentRequest request) {
        var command = buildCommand(request);
        log.info("Running agent for task {} (attempt {})", request.taskId(), request.attempt());
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            log.error("Could not start agent command {}: {}", command.get(0), e.getMessage());
            return AgentResult.failure("Could not start agent: " + e.getMessage());
        }

        CompletableFuture<String> output;
        try {
            output = CompletableFuture.supplyAsync(() -> readTail(process), outputReaders);
        } catch (RejectedExecutionException e) {
            process.destroyForcibly();
            return AgentResult.failure("Agent runner is shut down");
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Agent for task {} timed out after {}s", request.taskId(), timeout.toSeconds());
                return new AgentResult(false, List.of(), "Agent timed out after " + timeout.toSeconds() + "s",
                        collect(output));
            }
            int exit = process.exitValue();
            var text = collect(output);
            if (exit == 0) {
                return new AgentResult(true, List.of(), null, text);
            }
            return new AgentResult(false, List.of(), "Agent exited with code " + exit + lastLine(text), text);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return AgentResult.failure("Agent interrupted");
        }
    }

    @PreDestroy
    public void close() {
        outputReaders.shutdownNow();
    }

    List<String> buildCommand(AgentRequest request) {
        var prompt = prompt(request);
        var command = new ArrayList<String>(commandTemplate.size());
        for (var arg : commandTemplate) {
            command.add(arg.replace("{planId}", request.planId())
                    .replace("{taskId}", request.taskId())
                    .replace("{prompt}", prompt));
        }
        return command;
    }

    static String prompt(AgentRequest request) {
        var sb = new StringBuilder()
                .append("Implement task ").append(request.taskId())
                .append(" of plan ").append(request.planId()).append(": ")
                .append(request.description());
        if (!request.fileReferences().isEmpty()) {
            sb.append("\nFiles: ").append(String.join(", ", request.fileReferences()));
        }
        return sb.toString();
    }

    private static String readTail(Process process) {
        var sb = new StringBuilder();
        try (var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                sb.append(line).append('\n');
                if (sb.length() > MAX_OUTPUT_CHARS * 2) {
                    sb.delete(0, sb.length() - MAX_OUTPUT_CHARS);
                }
            }
        } catch (IOException e) {
            log.debug("Agent output stream closed: {}", e.getMessage());
        }
        return sb.length() > MAX_OUTPUT_CHARS ? sb.substring(sb.length() - MAX_OUTPUT_CHARS) : sb.toString();
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            return "";
        }
    }

    private static String lastLine(String text) {
        var trimmed = text.strip();
        if (trimmed.isEmpty()) return "";
        int nl = trimmed.lastIndexOf('\n');
        return ": " + (nl < 0 ? trimmed : trimmed.substring(nl + 1));
    }
}
