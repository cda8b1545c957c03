package com.planwright.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProcessAgentRunnerTest {

    @TempDir
    Path workDir;

    private static AgentRequest request(Set<String> files) {
        return new AgentRequest("billing", "2.1", "Add invoice endpoint", files, 1);
    }

    private ProcessAgentRunner runner(String command, Duration timeout) {
        return new ProcessAgentRunner(command, timeout, workDir);
    }

    @Test
    @DisplayName("placeholders are substituted per argument")
    void buildCommand() {
        var command = runner("agent --plan {planId} --task={taskId} -p {prompt}", Duration.ofSeconds(5))
                .buildCommand(request(Set.of()));
        assertEquals(List.of("agent", "--plan", "billing", "--task=2.1", "-p",
                "Implement task 2.1 of plan billing: Add invoice endpoint"), command);
    }

    @Test
    @DisplayName("prompt lists referenced files")
    void promptWithFiles() {
        var files = new LinkedHashSet<>(List.of("src/api.ts", "src/db.ts"));
        var prompt = ProcessAgentRunner.prompt(request(files));
        assertTrue(prompt.endsWith("\nFiles: src/api.ts, src/db.ts"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("exit code 0 is success and output is captured")
    void successfulCommand() {
        var result = runner("echo done {taskId}", Duration.ofSeconds(10)).run(request(Set.of()));
        assertTrue(result.success());
        assertNull(result.error());
        assertTrue(result.output().contains("done 2.1"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("non-zero exit code is a failure")
    void failingCommand() {
        var result = runner("false", Duration.ofSeconds(10)).run(request(Set.of()));
        assertFalse(result.success());
        assertTrue(result.error().startsWith("Agent exited with code 1"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("command exceeding the timeout is killed")
    void timeout() {
        var result = runner("sleep 30", Duration.ofMillis(200)).run(request(Set.of()));
        assertFalse(result.success());
        assertTrue(result.error().contains("timed out"));
    }

    @Test
    @DisplayName("missing executable is a failure, not an exception")
    void missingExecutable() {
        var result = runner("planwright-no-such-agent-binary", Duration.ofSeconds(5)).run(request(Set.of()));
        assertFalse(result.success());
        assertTrue(result.error().startsWith("Could not start agent"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("many agents printing more than a pipe buffer all finish")
    void concurrentAgentsWithLargeOutput() throws Exception {
        int agents = ForkJoinPool.getCommonPoolParallelism() + 2;
        var runner = runner("seq 1 30000", Duration.ofSeconds(20));
        var pool = Executors.newFixedThreadPool(agents);
        try {
            var results = new ArrayList<Future<AgentResult>>();
            for (int i = 0; i < agents; i++) {
                results.add(pool.submit(() -> runner.run(request(Set.of()))));
            }
            for (var future : results) {
                var result = future.get(30, TimeUnit.SECONDS);
                assertTrue(result.success(), () -> "agent failed: " + result.error());
                assertTrue(result.output().endsWith("29999\n30000\n"));
            }
        } finally {
            pool.shutdownNow();
            runner.close();
        }
    }

    @Test
    @DisplayName("a closed runner reports failure instead of throwing")
    void closedRunner() {
        var runner = runner("echo late", Duration.ofSeconds(5));
        runner.close();
        var result = runner.run(request(Set.of()));
        assertFalse(result.success());
    }
}
