package com.planwright.core.commit;

import com.planwright.core.metrics.PlanwrightMetrics;
import com.planwright.core.model.ObjectMappers;
import com.planwright.vcs.CommitOutcome;
import com.planwright.vcs.VersionControl;
import com.planwright.vcs.VersionControlException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommitQueueTest {

    @TempDir
    Path dir;

    private SimpleMeterRegistry registry;
    private PlanwrightMetrics metrics;
    private CommitQueue queue;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PlanwrightMetrics(registry);
    }

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
    }

    private CommitQueue newQueue(VersionControl vcs, int maxAttempts) {
        return new CommitQueue(dir.resolve("commit-queue.json"), vcs, maxAttempts, Duration.ofMillis(5), 5,
                metrics, Clock.systemUTC());
    }

    /** Records commit messages and detects overlapping commit calls. */
    private static final class RecordingVcs implements VersionControl {
        final List<String> messages = new CopyOnWriteArrayList<>();
        final AtomicInteger concurrent = new AtomicInteger();
        volatile boolean overlapped;

        @Override
        public CommitOutcome commit(String message, List<String> files) {
            if (concurrent.incrementAndGet() > 1) {
                overlapped = true;
            }
            try {
                messages.add(message);
                return new CommitOutcome("c" + messages.size());
            } finally {
                concurrent.decrementAndGet();
            }
        }

        @Override
        public Optional<String> findCommit(String marker) {
            return Optional.empty();
        }

        @Override
        public boolean hasUncommittedChanges() {
            return false;
        }

        @Override
        public void stash(String message) {
        }
    }

    // -- Ordering tests ----------------------------------------------------------

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("concurrent producers are committed one at a time in per-producer order")
        void concurrentProducers() throws Exception {
            var vcs = new RecordingVcs();
            queue = newQueue(vcs, 3);
            queue.start();

            var pool = Executors.newFixedThreadPool(4);
            var futures = new CopyOnWriteArrayList<CompletableFuture<CommitResult>>();
            for (int p = 0; p < 4; p++) {
                int producer = p;
                pool.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        futures.add(queue.enqueue("p" + producer + "-" + i, List.of()));
                    }
                });
            }
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            assertTrue(queue.awaitDrain(Duration.ofSeconds(10)));

            assertEquals(100, vcs.messages.size());
            assertFalse(vcs.overlapped);
            for (int p = 0; p < 4; p++) {
                var prefix = "p" + p + "-";
                var mine = vcs.messages.stream().filter(m -> m.startsWith(prefix))
                        .map(m -> Integer.parseInt(m.substring(prefix.length(), m.indexOf('\n'))))
                        .toList();
                var expected = new ArrayList<Integer>();
                for (int i = 0; i < 25; i++) {
                    expected.add(i);
                }
                assertEquals(expected, mine);
            }
            for (var f : futures) {
                assertNotNull(f.get(1, TimeUnit.SECONDS).commitId());
            }
            assertEquals(100, queue.status().totalCommits());
            assertTrue(queue.status().pending().isEmpty());
        }

        @Test
        @DisplayName("each message carries the queue entry trailer")
        void trailer() throws Exception {
            var vcs = new RecordingVcs();
            queue = newQueue(vcs, 3);
            queue.start();

            var result = queue.enqueue("Complete task 1.1: build", List.of("a.txt")).get(5, TimeUnit.SECONDS);

            assertEquals("Complete task 1.1: build\n\n" + CommitQueue.marker(result.entryId()), vcs.messages.get(0));
            assertEquals(1, result.attempts());
        }
    }

    // -- Failure tests -----------------------------------------------------------

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("transient failures are retried")
        void retries() throws Exception {
            var vcs = mock(VersionControl.class);
            when(vcs.commit(anyString(), anyList()))
                    .thenThrow(new VersionControlException("index.lock exists"))
                    .thenThrow(new VersionControlException("index.lock exists"))
                    .thenReturn(new CommitOutcome("abc123"));
            queue = newQueue(vcs, 3);
            queue.start();

            var result = queue.enqueue("msg", List.of()).get(5, TimeUnit.SECONDS);

            assertEquals("abc123", result.commitId());
            assertEquals(3, result.attempts());
            assertEquals(2.0, registry.get("planwright.commits.total").tag("result", "retried").counter().count());
            assertEquals("abc123", queue.status().lastCommitId());
        }

        @Test
        @DisplayName("a commit failing every attempt fails its future and is recorded")
        void terminalFailure() throws Exception {
            var vcs = mock(VersionControl.class);
            when(vcs.commit(anyString(), anyList())).thenThrow(new VersionControlException("hook rejected"));
            queue = newQueue(vcs, 2);
            queue.start();

            var future = queue.enqueue("msg", List.of());
            var ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));

            assertInstanceOf(VersionControlException.class, ex.getCause());
            assertTrue(queue.awaitDrain(Duration.ofSeconds(5)));
            var status = queue.status();
            assertEquals(1, status.failedCommits());
            assertEquals("hook rejected", status.lastError());
            assertEquals(1, status.recentFailures().size());
            assertTrue(status.pending().isEmpty());
        }

        @Test
        @DisplayName("enqueue after shutdown is refused")
        void refusedAfterShutdown() {
            queue = newQueue(new RecordingVcs(), 1);
            queue.start();
            queue.shutdown();

            var future = queue.enqueue("late", List.of());
            assertTrue(future.isCompletedExceptionally());
        }
    }

    // -- Recovery tests ----------------------------------------------------------

    @Test
    void startResolvesInterruptedEntriesAndRequeuesTheRest() throws Exception {
        var committing = new CommitQueueEntry("e1", "first", List.of(), Instant.EPOCH,
                CommitQueueEntry.Status.COMMITTING, 0, null, null);
        var pending = new CommitQueueEntry("e2", "second", List.of(), Instant.EPOCH,
                CommitQueueEntry.Status.PENDING, 0, null, null);
        var saved = new QueueStatus(List.of(committing, pending), null, 0, 0, null, null, null, List.of());
        Files.write(dir.resolve("commit-queue.json"), ObjectMappers.create().writeValueAsBytes(saved));

        var vcs = mock(VersionControl.class);
        when(vcs.findCommit(CommitQueue.marker("e1"))).thenReturn(Optional.of("deadbeef"));
        when(vcs.commit(anyString(), any())).thenReturn(new CommitOutcome("cafe"));
        queue = newQueue(vcs, 3);
        queue.start();

        assertTrue(queue.awaitDrain(Duration.ofSeconds(5)));
        verify(vcs, times(1)).commit(contains("Planwright-Queue-Entry: e2"), any());
        verify(vcs, never()).commit(contains("Planwright-Queue-Entry: e1"), any());
        assertEquals(2, queue.status().totalCommits());
        assertTrue(queue.status().pending().isEmpty());
    }
}
