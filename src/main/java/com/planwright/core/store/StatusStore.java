package com.planwright.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.planwright.config.PlanwrightProperties;
import com.planwright.core.events.EventBus;
import com.planwright.core.events.EventType;
import com.planwright.core.events.TaskPayloads;
import com.planwright.core.graph.DependencyGraphBuilder;
import com.planwright.core.metrics.PlanwrightMetrics;
import com.planwright.core.model.ErrorKind;
import com.planwright.core.model.ObjectMappers;
import com.planwright.core.model.Result;
import com.planwright.core.model.StatusSnapshot;
import com.planwright.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Durable per-plan state. The store is the only writer of status files and the only
 * source of {@link StatusSnapshot} instances.
 * <p>
 * Layout under the store root: {@code <planId>/status.json} plus its
 * {@code .bak} backup and {@code .lock} file, and {@code run.lock} held by the
 * process running the plan. Writes are atomic (see
 * {@link AtomicFileWriter}) and serialized per plan across threads and processes.
 * Reads never take the write lock.
 */
@Service
public class StatusStore {

    private static final Logger log = LoggerFactory.getLogger(StatusStore.class);

    static final String STATUS_FILE = "status.json";
    static final String BACKUP_FILE = "status.json.bak";
    static final String LOCK_FILE = "status.json.lock";
    static final String RUN_LOCK_FILE = "run.lock";

    private static final Pattern PLAN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final int WRITE_ATTEMPTS = 2;

    private final Path root;
    private final EventBus eventBus;
    private final DependencyGraphBuilder graphBuilder;
    private final PlanwrightMetrics metrics;
    private final SnapshotHealer healer;
    private final PlanLocks locks;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Map<String, StatusSnapshot> current = new ConcurrentHashMap<>();
    private final Set<String> activePlans = ConcurrentHashMap.newKeySet();
    private final Map<String, FileLock> runLocks = new HashMap<>();

    @Autowired
    public StatusStore(PlanwrightProperties properties, EventBus eventBus,
                       DependencyGraphBuilder graphBuilder, PlanwrightMetrics metrics) {
        this(properties.getStore().getRoot(), properties.getStore().getLockTimeout(),
                properties.getOrchestrator().getMaxRetries(), eventBus, graphBuilder, metrics,
                Clock.systemUTC());
    }

    public StatusStore(Path root, Duration lockTimeout, int maxRetries, EventBus eventBus,
                       DependencyGraphBuilder graphBuilder, PlanwrightMetrics metrics, Clock clock) {
        this.root = root;
        this.eventBus = eventBus;
        this.graphBuilder = graphBuilder;
        this.metrics = metrics;
        this.healer = new SnapshotHealer(maxRetries);
        this.locks = new PlanLocks(lockTimeout, metrics);
        this.clock = clock;
        this.mapper = ObjectMappers.create().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path root() {
        return root;
    }

    /**
     * Validates the tasks and writes the initial snapshot. Initializing a plan that
     * already exists returns the stored snapshot unchanged.
     *
     * @param phaseOrder declared phase order; derived from task order when empty
     * @throws com.planwright.core.graph.PlanValidationException on malformed tasks
     * @throws com.planwright.core.graph.CycleException          on a dependency cycle
     */
    public StatusSnapshot init(String planId, List<Task> tasks, List<String> phaseOrder) {
        requireValidPlanId(planId);
        var graph = graphBuilder.build(tasks);

        try (var held = locks.acquire(planId, lockFile(planId))) {
            if (Files.exists(statusFile(planId))) {
                var existing = read(planId);
                log.info("Plan {} already initialized with {} tasks; leaving it unchanged",
                        planId, existing.tasks().size());
                current.put(planId, existing);
                return existing;
            }
            var byId = new LinkedHashMap<String, Task>();
            for (var task : tasks) {
                byId.put(task.id(), task.withDependents(graph.dependentsOf(task.id())));
            }
            var phases = phaseOrder == null || phaseOrder.isEmpty() ? derivePhases(tasks) : phaseOrder;
            var snapshot = new StatusSnapshot(StatusSnapshot.SCHEMA_VERSION, planId, byId, phases,
                    List.of(), Instant.now(clock));
            write(snapshot);
            current.put(planId, snapshot);

            var payload = new LinkedHashMap<String, Object>();
            payload.put("phaseOrder", phases);
            payload.put("tasks", mapper.convertValue(new ArrayList<>(byId.values()), List.class));
            eventBus.emit(EventType.PLAN_INITIALIZED, planId, null, payload);
            log.info("Initialized plan {} with {} tasks in {} phases", planId, byId.size(), phases.size());
            return snapshot;
        }
    }

    public StatusSnapshot init(String planId, List<Task> tasks) {
        return init(planId, tasks, List.of());
    }

    /**
     * Reads the plan. Unless a live run (in any process) owns the plan, inconsistencies left
     * by a crashed run are repaired and the repair is persisted.
     *
     * @throws SnapshotCorruptException when neither the file nor its backup parses
     */
    public Result<StatusSnapshot> load(String planId) {
        if (!exists(planId)) {
            return Result.failure(ErrorKind.PLAN_NOT_FOUND, "No plan named " + planId);
        }
        var snapshot = read(planId);
        if (!activePlans.contains(planId) && !isRunningElsewhere(planId)
                && healer.heal(snapshot, Instant.now(clock)).changed()) {
            snapshot = repair(planId);
        }
        current.put(planId, snapshot);
        return Result.ok(snapshot);
    }

    /**
     * Applies {@code fn} to the freshest on-disk snapshot under the plan's write lock
     * and persists the result. Returning the same instance skips the write.
     */
    public Result<StatusSnapshot> mutate(String planId, UnaryOperator<StatusSnapshot> fn) {
        return tryMutate(planId, snapshot -> Result.ok(fn.apply(snapshot)));
    }

    /**
     * Like {@link #mutate} but lets the function reject the change with a typed failure,
     * in which case nothing is written.
     */
    public Result<StatusSnapshot> tryMutate(String planId, Function<StatusSnapshot, Result<StatusSnapshot>> fn) {
        if (!exists(planId)) {
            return Result.failure(ErrorKind.PLAN_NOT_FOUND, "No plan named " + planId);
        }
        try (var held = locks.acquire(planId, lockFile(planId))) {
            var before = read(planId);
            var outcome = fn.apply(before);
            if (!outcome.isOk()) {
                return outcome;
            }
            var after = outcome.value();
            if (after == before) {
                current.put(planId, before);
                return Result.ok(before);
            }
            checkInvariants(before, after);
            after = after.withUpdatedAt(Instant.now(clock));
            write(after);
            current.put(planId, after);
            return Result.ok(after);
        }
    }

    /** Last snapshot this process read or wrote, without touching the disk. */
    public Optional<StatusSnapshot> current(String planId) {
        return Optional.ofNullable(current.get(planId));
    }

    public boolean exists(String planId) {
        return PLAN_ID.matcher(planId).matches()
                && (Files.exists(statusFile(planId)) || Files.exists(backupFile(planId)));
    }

    public List<String> listPlans() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(root)) {
            return dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(this::exists)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list plans under " + root, e);
        }
    }

    /**
     * Marks the plan as owned by a live run in this process and takes the plan's run
     * lock, an OS file lock that other processes see until this one deactivates or dies.
     * While owned, {@link #load} skips crash repair so a running task is not mistaken
     * for an interrupted one.
     *
     * @return false when another run already owns the plan
     */
    public boolean activate(String planId) {
        requireValidPlanId(planId);
        synchronized (runLocks) {
            if (runLocks.containsKey(planId)) {
                return false;
            }
            var lock = tryRunLock(planId);
            if (lock == null) {
                return false;
            }
            runLocks.put(planId, lock);
            activePlans.add(planId);
            return true;
        }
    }

    public void deactivate(String planId) {
        synchronized (runLocks) {
            activePlans.remove(planId);
            var lock = runLocks.remove(planId);
            if (lock != null) {
                release(planId, lock);
            }
        }
    }

    public boolean isActive(String planId) {
        return activePlans.contains(planId);
    }

    /**
     * True while a run in another process holds the plan's run lock.
     */
    public boolean isRunningElsewhere(String planId) {
        synchronized (runLocks) {
            if (runLocks.containsKey(planId) || !exists(planId)) {
                return false;
            }
            var probe = tryRunLock(planId);
            if (probe == null) {
                return true;
            }
            release(planId, probe);
            return false;
        }
    }

    private FileLock tryRunLock(String planId) {
        FileChannel channel = null;
        try {
            Files.createDirectories(root.resolve(planId));
            channel = FileChannel.open(runLockFile(planId), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            var lock = channel.tryLock();
            if (lock == null) {
                channel.close();
            }
            return lock;
        } catch (OverlappingFileLockException e) {
            closeQuietly(planId, channel);
            return null;
        } catch (IOException e) {
            closeQuietly(planId, channel);
            throw new StatusStoreException("Cannot open run lock of plan " + planId, e);
        }
    }

    private static void release(String planId, FileLock lock) {
        try {
            lock.release();
            lock.channel().close();
        } catch (IOException e) {
            log.warn("Failed to release run lock of plan {}: {}", planId, e.getMessage());
        }
    }

    private static void closeQuietly(String planId, FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Closing run lock channel of plan {} failed: {}", planId, e.getMessage());
        }
    }

    private StatusSnapshot repair(String planId) {
        try (var held = locks.acquire(planId, lockFile(planId))) {
            var before = read(planId);
            var healed = healer.heal(before, Instant.now(clock));
            if (!healed.changed()) {
                return before;
            }
            var after = healed.snapshot().withUpdatedAt(Instant.now(clock));
            write(after);
            for (var repair : healed.repairs()) {
                log.warn("Repaired plan {}: {}", planId, repair.detail());
                metrics.recordRecovery(repair.kind().name().toLowerCase(Locale.ROOT));
                emitRepair(after, repair);
            }
            return after;
        }
    }

    private void emitRepair(StatusSnapshot after, SnapshotHealer.Repair repair) {
        if (repair.taskId() != null) {
            var task = after.tasks().get(repair.taskId());
            var payload = TaskPayloads.of(task, "repair", repair.kind().name());
            payload.put("detail", repair.detail());
            eventBus.emit(EventType.TASK_RECOVERED, after.planId(), task.id(), payload);
        } else {
            var run = after.run(repair.runId()).orElseThrow();
            var payload = new LinkedHashMap<String, Object>();
            payload.put("runId", run.runId());
            payload.put("outcome", run.outcome().name());
            payload.put("completedAt", run.completedAt().toString());
            payload.put("tasksAttempted", run.tasksAttempted());
            payload.put("tasksFailed", run.tasksFailed());
            payload.put("repair", repair.kind().name());
            eventBus.emit(EventType.RUN_COMPLETED, after.planId(), null, payload);
        }
    }

    private StatusSnapshot read(String planId) {
        Path main = statusFile(planId);
        try {
            return parse(main);
        } catch (IOException | IllegalStateException primary) {
            Path backup = backupFile(planId);
            if (!Files.exists(backup)) {
                throw new SnapshotCorruptException(main, primary);
            }
            StatusSnapshot restored;
            try {
                restored = parse(backup);
            } catch (IOException | IllegalStateException e) {
                e.addSuppressed(primary);
                throw new SnapshotCorruptException(main, e);
            }
            log.warn("Status file for plan {} is unreadable ({}); restoring from backup",
                    planId, primary.getMessage());
            metrics.recordRecovery("backup_restored");
            try (var held = locks.acquire(planId, lockFile(planId))) {
                write(restored);
            }
            var payload = new LinkedHashMap<String, Object>();
            payload.put("phaseOrder", restored.phaseOrder());
            payload.put("tasks", mapper.convertValue(new ArrayList<>(restored.tasks().values()), List.class));
            payload.put("runs", mapper.convertValue(restored.runs(), List.class));
            payload.put("reason", primary.getMessage());
            eventBus.emit(EventType.PLAN_RESTORED, planId, null, payload);
            return restored;
        }
    }

    private StatusSnapshot parse(Path file) throws IOException {
        StatusDocument document;
        try {
            document = mapper.readValue(Files.readAllBytes(file), StatusDocument.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed status file " + file + ": " + e.getOriginalMessage(), e);
        }
        if (document == null || document.tasks() == null) {
            throw new IOException("Empty status file " + file);
        }
        if (document.schemaVersion() != StatusSnapshot.SCHEMA_VERSION) {
            throw new IllegalStateException("Unsupported schemaVersion " + document.schemaVersion()
                    + " in " + file);
        }
        return document.toSnapshot();
    }

    private void write(StatusSnapshot snapshot) {
        byte[] data;
        try {
            data = mapper.writeValueAsBytes(StatusDocument.from(snapshot));
        } catch (JsonProcessingException e) {
            throw new StatusStoreException("Cannot serialize snapshot of plan " + snapshot.planId(), e);
        }
        IOException last = null;
        for (int attempt = 1; attempt <= WRITE_ATTEMPTS; attempt++) {
            try {
                AtomicFileWriter.write(statusFile(snapshot.planId()), data, backupFile(snapshot.planId()));
                return;
            } catch (IOException e) {
                last = e;
                log.warn("Write attempt {}/{} for plan {} failed: {}",
                        attempt, WRITE_ATTEMPTS, snapshot.planId(), e.getMessage());
            }
        }
        throw new StatusStoreException("Cannot persist snapshot of plan " + snapshot.planId(), last);
    }

    private void checkInvariants(StatusSnapshot before, StatusSnapshot after) {
        if (!before.planId().equals(after.planId())) {
            throw new IllegalArgumentException("Mutation changed planId of " + before.planId());
        }
        if (!before.tasks().keySet().equals(after.tasks().keySet())) {
            throw new IllegalArgumentException("Mutation added or removed tasks in plan " + before.planId());
        }
        for (var task : after.tasks().values()) {
            var old = before.tasks().get(task.id());
            if (task.retryCount() < old.retryCount()) {
                throw new IllegalArgumentException("Mutation decreased retryCount of task " + task.id());
            }
        }
        for (var oldRun : before.runs()) {
            if (!oldRun.isOpen() && !after.run(oldRun.runId()).map(oldRun::equals).orElse(false)) {
                throw new IllegalArgumentException("Mutation changed closed run " + oldRun.runId());
            }
        }
    }

    private static List<String> derivePhases(List<Task> tasks) {
        var phases = new LinkedHashSet<String>();
        tasks.forEach(t -> phases.add(t.phase()));
        return List.copyOf(phases);
    }

    private static void requireValidPlanId(String planId) {
        if (planId == null || !PLAN_ID.matcher(planId).matches()) {
            throw new IllegalArgumentException("Invalid plan id: " + planId);
        }
    }

    Path statusFile(String planId) {
        return root.resolve(planId).resolve(STATUS_FILE);
    }

    Path backupFile(String planId) {
        return root.resolve(planId).resolve(BACKUP_FILE);
    }

    Path runLockFile(String planId) {
        return root.resolve(planId).resolve(RUN_LOCK_FILE);
    }

    Path lockFile(String planId) {
        return root.resolve(planId).resolve(LOCK_FILE);
    }
}
