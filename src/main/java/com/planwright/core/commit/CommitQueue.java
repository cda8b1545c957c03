package com.planwright.core.commit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.planwright.core.metrics.PlanwrightMetrics;
import com.planwright.core.model.ObjectMappers;
import com.planwright.core.store.AtomicFileWriter;
import com.planwright.vcs.CommitOutcome;
import com.planwright.vcs.VersionControl;
import com.planwright.vcs.VersionControlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Serializes commits from concurrent producers. Exactly one worker thread applies
 * entries in submission order; an entry leaves the persisted pending list only after
 * the version control collaborator confirmed it or it failed terminally.
 * <p>
 * Every commit message ends with a {@value #TRAILER} trailer naming the entry, so
 * after a crash an entry that was mid-commit can be recognized in history instead of
 * being committed twice.
 */
public class CommitQueue {

    private static final Logger log = LoggerFactory.getLogger(CommitQueue.class);

    public static final String TRAILER = "Planwright-Queue-Entry";

    private final Path stateFile;
    private final VersionControl versionControl;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final int recentFailuresLimit;
    private final PlanwrightMetrics metrics;
    private final Clock clock;
    private final ObjectMapper mapper = ObjectMappers.create().enable(SerializationFeature.INDENT_OUTPUT);
    private final LinkedBlockingQueue<Work> work = new LinkedBlockingQueue<>();

    private QueueStatus state = QueueStatus.EMPTY;
    private Thread worker;
    private int outstanding;
    private volatile boolean accepting;

    private record Work(CommitQueueEntry entry, CompletableFuture<CommitResult> future) {
        static final Work STOP = new Work(null, null);
    }

    public CommitQueue(Path stateFile, VersionControl versionControl, int maxAttempts, Duration retryDelay,
                       int recentFailuresLimit, PlanwrightMetrics metrics, Clock clock) {
        this.stateFile = stateFile;
        this.versionControl = versionControl;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelay = retryDelay;
        this.recentFailuresLimit = recentFailuresLimit;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Loads persisted state, resolves entries interrupted mid-commit, re-queues the
     * rest and starts the worker.
     */
    public synchronized void start() {
        if (worker != null) {
            return;
        }
        state = readState();
        var recovered = new ArrayList<CommitQueueEntry>();
        for (var entry : state.pending()) {
            if (entry.status() == CommitQueueEntry.Status.COMMITTING) {
                var existing = versionControl.findCommit(marker(entry.id()));
                if (existing.isPresent()) {
                    log.info("Entry {} was committed as {} before the last shutdown", entry.id(), existing.get());
                    state = new QueueStatus(state.pending(), entry.id(), state.totalCommits() + 1,
                            state.failedCommits(), existing.get(), Instant.now(clock), state.lastError(),
                            state.recentFailures());
                    continue;
                }
            }
            recovered.add(entry.withStatus(CommitQueueEntry.Status.PENDING));
        }
        state = withPending(recovered);
        persist();
        for (var entry : recovered) {
            outstanding++;
            work.add(new Work(entry, new CompletableFuture<>()));
        }
        if (!recovered.isEmpty()) {
            log.info("Recovered {} pending commit(s) from {}", recovered.size(), stateFile);
        }
        accepting = true;
        worker = new Thread(this::runWorker, "planwright-commit-queue");
        worker.setDaemon(true);
        worker.start();
    }

    /**
     * Queues a commit. The future completes when the commit is confirmed, or
     * completes exceptionally with {@link VersionControlException} once all attempts
     * failed.
     */
    public CompletableFuture<CommitResult> enqueue(String message, List<String> files) {
        var future = new CompletableFuture<CommitResult>();
        synchronized (this) {
            if (!accepting) {
                future.completeExceptionally(new IllegalStateException("Commit queue is not running"));
                return future;
            }
            var entry = new CommitQueueEntry(UUID.randomUUID().toString(), message, files,
                    Instant.now(clock), CommitQueueEntry.Status.PENDING, 0, null, null);
            var pending = new ArrayList<>(state.pending());
            pending.add(entry);
            state = withPending(pending);
            persist();
            outstanding++;
            work.add(new Work(entry, future));
            log.debug("Enqueued commit {} ({} pending)", entry.id(), pending.size());
        }
        return future;
    }

    /**
     * Commits immediately on the caller's thread, bypassing the queue. Not safe while
     * queued commits may run concurrently against the same working tree.
     */
    public CommitResult commitDirect(String message, List<String> files) {
        var outcome = versionControl.commit(message, files);
        log.warn("Direct commit bypassed the queue: {}", outcome.isEmpty() ? "nothing to commit" : outcome.commitId());
        return new CommitResult(null, outcome.commitId(), 1);
    }

    public synchronized QueueStatus status() {
        return state;
    }

    /**
     * Waits until every queued entry has been processed.
     *
     * @return false when the timeout passed first
     */
    public synchronized boolean awaitDrain(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (outstanding > 0) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return true;
    }

    /**
     * Stops accepting entries, lets the worker finish what is queued and stops it.
     * Entries not reached stay in the queue file for the next start.
     */
    public void shutdown() {
        Thread t;
        synchronized (this) {
            accepting = false;
            t = worker;
            worker = null;
        }
        if (t == null) {
            return;
        }
        work.add(Work.STOP);
        try {
            t.join(TimeUnit.SECONDS.toMillis(30));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("Commit worker did not stop within 30s; interrupting");
            t.interrupt();
        }
    }

    static String marker(String entryId) {
        return TRAILER + ": " + entryId;
    }

    private void runWorker() {
        while (true) {
            Work next;
            try {
                next = work.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (next == Work.STOP) {
                return;
            }
            try {
                process(next);
            } catch (RuntimeException e) {
                log.error("Unexpected error processing commit {}: {}", next.entry().id(), e.getMessage(), e);
                next.future().completeExceptionally(e);
            } finally {
                synchronized (this) {
                    outstanding--;
                    notifyAll();
                }
            }
        }
    }

    private void process(Work item) {
        var entry = item.entry().withStatus(CommitQueueEntry.Status.COMMITTING);
        replacePending(entry);
        String message = item.entry().message() + "\n\n" + marker(entry.id());
        while (true) {
            try {
                CommitOutcome outcome = versionControl.commit(message, entry.files());
                entry = entry.done(outcome.commitId());
                succeeded(entry, outcome);
                metrics.recordCommit(outcome.isEmpty() ? "empty" : "committed");
                item.future().complete(new CommitResult(entry.id(), outcome.commitId(), entry.attempts() + 1));
                return;
            } catch (VersionControlException e) {
                entry = entry.withAttempt(e.getMessage());
                if (entry.attempts() >= maxAttempts) {
                    failed(entry);
                    metrics.recordCommit("failed");
                    log.error("Commit {} failed after {} attempt(s): {}", entry.id(), entry.attempts(), e.getMessage());
                    item.future().completeExceptionally(e);
                    return;
                }
                metrics.recordCommit("retried");
                log.warn("Commit {} attempt {}/{} failed, retrying in {}ms: {}",
                        entry.id(), entry.attempts(), maxAttempts, retryDelay.toMillis(), e.getMessage());
                replacePending(entry);
                try {
                    Thread.sleep(retryDelay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    item.future().completeExceptionally(ie);
                    return;
                }
            }
        }
    }

    private synchronized void replacePending(CommitQueueEntry entry) {
        var pending = new ArrayList<CommitQueueEntry>();
        for (var existing : state.pending()) {
            pending.add(existing.id().equals(entry.id()) ? entry : existing);
        }
        state = withPending(pending);
        persist();
    }

    private synchronized void succeeded(CommitQueueEntry entry, CommitOutcome outcome) {
        var pending = new ArrayList<>(state.pending());
        pending.removeIf(e -> e.id().equals(entry.id()));
        state = new QueueStatus(pending, entry.id(), state.totalCommits() + 1, state.failedCommits(),
                outcome.isEmpty() ? state.lastCommitId() : outcome.commitId(),
                outcome.isEmpty() ? state.lastCommitAt() : Instant.now(clock),
                state.lastError(), state.recentFailures());
        persist();
    }

    private synchronized void failed(CommitQueueEntry entry) {
        var pending = new ArrayList<>(state.pending());
        pending.removeIf(e -> e.id().equals(entry.id()));
        var failures = new ArrayList<>(state.recentFailures());
        failures.add(entry.withStatus(CommitQueueEntry.Status.FAILED));
        while (failures.size() > recentFailuresLimit) {
            failures.remove(0);
        }
        state = new QueueStatus(pending, entry.id(), state.totalCommits(), state.failedCommits() + 1,
                state.lastCommitId(), state.lastCommitAt(), entry.error(), failures);
        persist();
    }

    private QueueStatus withPending(List<CommitQueueEntry> pending) {
        return new QueueStatus(pending, state.lastProcessedId(), state.totalCommits(), state.failedCommits(),
                state.lastCommitId(), state.lastCommitAt(), state.lastError(), state.recentFailures());
    }

    private QueueStatus readState() {
        if (!Files.exists(stateFile)) {
            return QueueStatus.EMPTY;
        }
        try {
            return mapper.readValue(stateFile.toFile(), QueueStatus.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read commit queue state " + stateFile, e);
        }
    }

    private void persist() {
        try {
            AtomicFileWriter.write(stateFile, mapper.writeValueAsBytes(state), null);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot persist commit queue state " + stateFile, e);
        }
    }
}
