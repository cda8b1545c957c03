package com.planwright.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.LongFunction;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Append-only NDJSON event log. The active file is {@code events.ndjson}; when it
 * grows past the segment size it is renamed to {@code events-NNNNNN.ndjson} and a
 * fresh file is started. Segments are never deleted.
 * <p>
 * Several processes may share one log. Ids are allocated under an exclusive lock on
 * the {@code seq} sidecar, which also records the last id handed out, so every
 * writer sees a single increasing sequence. Readers take no lock: a line still being
 * written is skipped and a segment rotated away mid-read is re-listed.
 */
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    static final String ACTIVE_FILE = "events.ndjson";
    static final String SEQ_FILE = "seq";
    private static final int TAIL_BYTES = 64 * 1024;
    private static final int MAX_RELISTS = 3;

    // FileLock is held per JVM, so writers in one process also queue on a local lock
    private static final Map<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();
    private static final Pattern SEGMENT = Pattern.compile("events-(\\d{6})\\.ndjson");

    private final Path directory;
    private final long maxSegmentBytes;
    private final ObjectMapper mapper;

    public EventLog(Path directory, long maxSegmentBytes, ObjectMapper mapper) {
        this.directory = directory;
        this.maxSegmentBytes = maxSegmentBytes;
        this.mapper = mapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create event log directory " + directory, e);
        }
    }

    public Path directory() {
        return directory;
    }

    /**
     * Allocates the next id across every process sharing this directory, builds the
     * event with it and appends it. The sequence is advanced before the line is
     * written, so a crash in between leaves a gap but never a reused id.
     */
    public PlanEvent append(LongFunction<PlanEvent> factory) throws IOException {
        var local = LOCAL_LOCKS.computeIfAbsent(directory.toRealPath(), key -> new ReentrantLock());
        local.lock();
        try (var channel = FileChannel.open(directory.resolve(SEQ_FILE), StandardOpenOption.CREATE,
                StandardOpenOption.READ, StandardOpenOption.WRITE);
             var ignored = channel.lock()) {
            long last = readSeq(channel);
            if (last < 0) {
                last = scanLastId();
                log.info("Event sequence initialized from the log at id {}", last);
            }
            long id = last + 1;
            writeSeq(channel, id);
            var event = factory.apply(id);
            appendLine(event);
            return event;
        } finally {
            local.unlock();
        }
    }

    /**
     * Writes an event with a caller-chosen id, bypassing the sequence.
     */
    void appendLine(PlanEvent event) throws IOException {
        Path active = directory.resolve(ACTIVE_FILE);
        if (Files.exists(active) && Files.size(active) >= maxSegmentBytes) {
            rotate(active);
        }
        byte[] line = (mapper.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
        Files.write(active, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND,
                StandardOpenOption.DSYNC);
    }

    /**
     * Highest event id handed out, or 0 when the log is empty. Read from the
     * sequence sidecar; a log without one has the tail of its newest file read.
     */
    public long lastId() {
        Path seq = directory.resolve(SEQ_FILE);
        try {
            long recorded = parseSeq(Files.readString(seq, StandardCharsets.US_ASCII));
            if (recorded >= 0) {
                return recorded;
            }
        } catch (NoSuchFileException e) {
            log.debug("No event sequence at {}; reading the log tail", seq);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read event sequence " + seq, e);
        }
        return scanLastId();
    }

    public List<PlanEvent> readAfter(long afterId, EventFilter filter) {
        var out = new ArrayList<PlanEvent>();
        forEach(event -> {
            if (event.id() > afterId && filter.matches(event)) {
                out.add(event);
            }
        });
        return out;
    }

    /**
     * Visits every event, oldest segment first. A torn last line from a crash
     * mid-append is skipped. When a concurrent writer rotates the active file away
     * the listing is taken again and only events newer than those visited are passed on.
     */
    public void forEach(Consumer<PlanEvent> visitor) {
        long[] visited = {0};
        Consumer<PlanEvent> tracking = event -> {
            if (event.id() > visited[0]) {
                visited[0] = event.id();
                visitor.accept(event);
            }
        };
        for (int attempt = 1; ; attempt++) {
            try {
                for (Path file : files()) {
                    visitFile(file, tracking);
                }
                return;
            } catch (NoSuchFileException e) {
                if (attempt >= MAX_RELISTS) {
                    throw new UncheckedIOException("Event log kept rotating under the reader", e);
                }
                log.debug("Event log segment {} moved while reading; listing again", e.getFile());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read event log " + directory, e);
            }
        }
    }

    private void visitFile(Path file, Consumer<PlanEvent> visitor) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) continue;
            try {
                visitor.accept(mapper.readValue(line, PlanEvent.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable event at {}:{}: {}", file.getFileName(), i + 1,
                        e.getOriginalMessage());
            }
        }
    }

    /**
     * Last readable id in the newest non-empty file. Ids only grow, so older
     * segments never need to be opened.
     */
    long scanLastId() {
        var all = files();
        for (int i = all.size() - 1; i >= 0; i--) {
            long id = lastIdIn(all.get(i));
            if (id > 0) {
                return id;
            }
        }
        return 0;
    }

    private long lastIdIn(Path file) {
        try (var channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            long start = Math.max(0, size - TAIL_BYTES);
            var buffer = ByteBuffer.allocate((int) (size - start));
            readFully(channel, buffer, start);
            String[] lines = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8)
                    .split("\n");
            // the first line of a partial tail may be cut, so it is never trusted
            int first = start > 0 ? 1 : 0;
            for (int i = lines.length - 1; i >= first; i--) {
                if (lines[i].isBlank()) continue;
                try {
                    return mapper.readValue(lines[i], PlanEvent.class).id();
                } catch (JsonProcessingException e) {
                    log.debug("Unreadable tail line in {}: {}", file.getFileName(), e.getOriginalMessage());
                }
            }
            if (start > 0) {
                long[] max = {0};
                visitFile(file, event -> max[0] = Math.max(max[0], event.id()));
                return max[0];
            }
            return 0;
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read event log " + file, e);
        }
    }

    private static long readSeq(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0 || size > 32) {
            return -1;
        }
        var buffer = ByteBuffer.allocate((int) size);
        readFully(channel, buffer, 0);
        return parseSeq(new String(buffer.array(), 0, buffer.position(), StandardCharsets.US_ASCII));
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long from) throws IOException {
        while (buffer.hasRemaining()) {
            if (channel.read(buffer, from + buffer.position()) < 0) {
                break;
            }
        }
    }

    private static void writeSeq(FileChannel channel, long id) throws IOException {
        var buffer = ByteBuffer.wrap(Long.toString(id).getBytes(StandardCharsets.US_ASCII));
        channel.truncate(0);
        while (buffer.hasRemaining()) {
            channel.write(buffer, buffer.position());
        }
        channel.force(false);
    }

    private static long parseSeq(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    List<Path> files() {
        var files = new ArrayList<Path>(segments());
        Path active = directory.resolve(ACTIVE_FILE);
        if (Files.exists(active)) {
            files.add(active);
        }
        return files;
    }

    private List<Path> segments() {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                    .filter(p -> SEGMENT.matcher(p.getFileName().toString()).matches())
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list event log " + directory, e);
        }
    }

    private void rotate(Path active) throws IOException {
        var existing = segments();
        int next = 1;
        if (!existing.isEmpty()) {
            var m = SEGMENT.matcher(existing.get(existing.size() - 1).getFileName().toString());
            if (m.matches()) {
                next = Integer.parseInt(m.group(1)) + 1;
            }
        }
        Path target = directory.resolve(String.format(Locale.ROOT, "events-%06d.ndjson", next));
        Files.move(active, target);
        log.info("Rotated event log into {}", target.getFileName());
    }
}
