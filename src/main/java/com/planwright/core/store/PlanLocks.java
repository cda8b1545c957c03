package com.planwright.core.store;

import com.planwright.core.metrics.PlanwrightMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-plan write locks: an in-process {@link ReentrantLock} guards threads of this
 * JVM, an advisory {@link FileLock} on {@code status.json.lock} guards other
 * processes. The OS releases the file lock when its holder dies, so a crashed
 * process never leaves a stale lock behind.
 */
class PlanLocks {

    private static final Logger log = LoggerFactory.getLogger(PlanLocks.class);

    private static final long INITIAL_BACKOFF_MS = 10;
    private static final long MAX_BACKOFF_MS = 500;

    private final ConcurrentHashMap<String, ReentrantLock> localLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, FileLock> fileLocks = new ConcurrentHashMap<>();
    private final Duration timeout;
    private final PlanwrightMetrics metrics;

    PlanLocks(Duration timeout, PlanwrightMetrics metrics) {
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * Acquires both locks for the plan, retrying with exponential backoff.
     *
     * @throws LockTimeoutException when the deadline passes first
     */
    Held acquire(String planId, Path lockFile) {
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        var local = localLocks.computeIfAbsent(planId, k -> new ReentrantLock());
        try {
            if (!local.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                timedOut(planId, start);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(planId, elapsed(start));
        }
        if (local.getHoldCount() > 1) {
            return new Held(planId, local, false);
        }
        long backoff = INITIAL_BACKOFF_MS;
        boolean contended = false;
        try {
            Files.createDirectories(lockFile.toAbsolutePath().getParent());
            while (true) {
                FileLock fileLock = tryFileLock(lockFile);
                if (fileLock != null) {
                    fileLocks.put(planId, fileLock);
                    metrics.recordLockWait(elapsed(start).toMillis(), true);
                    if (contended) {
                        log.info("Acquired lock on plan {} after {}ms", planId, elapsed(start).toMillis());
                    }
                    return new Held(planId, local, true);
                }
                if (!contended) {
                    log.warn("Plan {} is locked by another process, waiting up to {}ms",
                            planId, timeout.toMillis());
                    contended = true;
                }
                if (System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(backoff) > deadline) {
                    local.unlock();
                    timedOut(planId, start);
                }
                Thread.sleep(backoff);
                backoff = Math.min(backoff * 2, MAX_BACKOFF_MS);
            }
        } catch (IOException e) {
            local.unlock();
            throw new StatusStoreException("Cannot open lock file " + lockFile, e);
        } catch (InterruptedException e) {
            local.unlock();
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(planId, elapsed(start));
        }
    }

    private FileLock tryFileLock(Path lockFile) throws IOException {
        FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        try {
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
            }
            return lock;
        } catch (OverlappingFileLockException e) {
            channel.close();
            return null;
        }
    }

    private void timedOut(String planId, long start) {
        var waited = elapsed(start);
        metrics.recordLockWait(waited.toMillis(), false);
        log.warn("Gave up waiting for the lock on plan {} after {}ms", planId, waited.toMillis());
        throw new LockTimeoutException(planId, waited);
    }

    private static Duration elapsed(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    final class Held implements AutoCloseable {

        private final String planId;
        private final ReentrantLock local;
        private final boolean ownsFileLock;

        private Held(String planId, ReentrantLock local, boolean ownsFileLock) {
            this.planId = planId;
            this.local = local;
            this.ownsFileLock = ownsFileLock;
        }

        @Override
        public void close() {
            try {
                if (ownsFileLock) {
                    var fileLock = fileLocks.remove(planId);
                    if (fileLock != null) {
                        try {
                            fileLock.release();
                            fileLock.channel().close();
                        } catch (IOException e) {
                            log.warn("Failed to release file lock for plan {}: {}", planId, e.getMessage());
                        }
                    }
                }
            } finally {
                local.unlock();
            }
        }
    }
}
