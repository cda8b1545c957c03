package com.planwright.core.engine;

import com.planwright.core.model.Result;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A command waiting in a run's signal queue. Exactly one of {@link #claim()} (by the
 * coordinator, before applying it) and {@link #expire()} (by a caller that stopped
 * waiting) succeeds, so an expired command is never applied.
 */
public final class PendingCommand {

    private static final int QUEUED = 0;
    private static final int CLAIMED = 1;
    private static final int EXPIRED = 2;

    private final RunCommand command;
    private final CompletableFuture<Result<Map<String, Object>>> result = new CompletableFuture<>();
    private final AtomicInteger state = new AtomicInteger(QUEUED);

    PendingCommand(RunCommand command) {
        this.command = command;
    }

    public RunCommand command() {
        return command;
    }

    public CompletableFuture<Result<Map<String, Object>>> result() {
        return result;
    }

    boolean claim() {
        return state.compareAndSet(QUEUED, CLAIMED);
    }

    /**
     * @return true when the command was withdrawn before the coordinator picked it up
     */
    public boolean expire() {
        return state.compareAndSet(QUEUED, EXPIRED);
    }

    public boolean isExpired() {
        return state.get() == EXPIRED;
    }
}
