package com.planwright.core.events;

import com.planwright.config.PlanwrightProperties;
import com.planwright.core.metrics.PlanwrightMetrics;
import com.planwright.core.model.ObjectMappers;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Pub/sub event bus for plan execution events.
 * <p>
 * Every event gets its id from the {@link EventLog}, which allocates ids across all
 * processes sharing the log, and is kept in a bounded ring buffer for late
 * subscribers and handed to each matching subscriber's bounded queue. Catch-up reads
 * of the durable log happen outside the bus lock. Queues are drained on a shared executor, one drain at a time per
 * subscriber, so each subscriber sees events in emission order. Emission never waits
 * on a subscriber: when a queue is full its oldest buffered event is dropped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Object lock = new Object();
    private final EventLog eventLog;
    private final int bufferSize;
    private final int subscriberQueueSize;
    private final PlanwrightMetrics metrics;
    private final Clock clock;
    private final Deque<PlanEvent> ring = new ArrayDeque<>();
    private final List<Channel> channels = new CopyOnWriteArrayList<>();
    private final ExecutorService deliveryExecutor;
    private long lastId;
    // ids at or below this were written by another bus and are only in the log
    private long lastForeignId;
    // ids at or below this have left the ring
    private long evictedUpTo;

    @Autowired
    public EventBus(PlanwrightProperties properties, PlanwrightMetrics metrics) {
        this(new EventLog(properties.getStore().getRoot().resolve("events"),
                        properties.getEvents().getMaxSegmentBytes(), ObjectMappers.create()),
                properties.getEvents().getBufferSize(),
                properties.getEvents().getSubscriberQueueSize(),
                metrics, Clock.systemUTC());
    }

    public EventBus(EventLog eventLog, int bufferSize, int subscriberQueueSize,
                    PlanwrightMetrics metrics, Clock clock) {
        this.eventLog = eventLog;
        this.bufferSize = bufferSize;
        this.subscriberQueueSize = subscriberQueueSize;
        this.metrics = metrics;
        this.clock = clock;
        var threadCount = new AtomicInteger();
        this.deliveryExecutor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "planwright-events-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.lastId = eventLog.lastId();
        this.lastForeignId = lastId;
        this.evictedUpTo = lastId;
        log.debug("Event bus ready at {}, last event id {}", eventLog.directory(), lastId);
    }

    public Path logDirectory() {
        return eventLog.directory();
    }

    /**
     * Emits an event to the log, the ring buffer and all matching subscribers.
     *
     * @param taskId  nullable for plan- and run-level events
     * @param payload nullable
     */
    public PlanEvent emit(EventType type, String planId, String taskId, Map<String, Object> payload) {
        synchronized (lock) {
            var at = Instant.now(clock);
            var built = new PlanEvent[1];
            PlanEvent event;
            try {
                event = eventLog.append(id -> built[0] = new PlanEvent(id, type, planId, taskId, at, payload));
            } catch (IOException | UncheckedIOException e) {
                metrics.recordEventPersistFailure();
                event = built[0] != null ? built[0] : new PlanEvent(lastId + 1, type, planId, taskId, at, payload);
                log.error("Failed to append event {} ({}) to the event log: {}",
                        event.id(), type.wireName(), e.getMessage(), e);
            }
            if (event.id() > lastId + 1) {
                lastForeignId = event.id() - 1;
            }
            lastId = Math.max(lastId, event.id());
            remember(event);
            log.debug("Emitted event {} {} plan={} task={}", event.id(), type.wireName(), planId, taskId);
            for (var channel : channels) {
                if (channel.filter.matches(event)) {
                    channel.offer(event);
                }
            }
            return event;
        }
    }

    public Subscription subscribe(EventFilter filter, Consumer<PlanEvent> consumer) {
        return subscribe(filter, consumer, -1);
    }

    /**
     * Subscribes and, when {@code afterId >= 0}, first replays every matching event
     * with a larger id. No event emitted concurrently is missed or delivered twice.
     */
    public Subscription subscribe(EventFilter filter, Consumer<PlanEvent> consumer, long afterId) {
        var channel = new Channel(UUID.randomUUID().toString(), filter, consumer);
        if (afterId < 0) {
            synchronized (lock) {
                channels.add(channel);
            }
        } else {
            boolean registered = false;
            synchronized (lock) {
                if (ringCovers(afterId)) {
                    ringAfter(filter, afterId).forEach(channel::offer);
                    channels.add(channel);
                    registered = true;
                }
            }
            if (!registered) {
                catchUp(filter, afterId, channel);
            }
        }
        log.debug("Subscriber {} registered (plan={}, after={})", channel.id, filter.planId(), afterId);
        return channel;
    }

    public void unsubscribe(Subscription subscription) {
        subscription.unsubscribe();
    }

    /**
     * Events matching the filter with id greater than {@code afterId}, oldest first.
     * Served from the ring buffer when it reaches back far enough, otherwise from the
     * durable log.
     */
    public List<PlanEvent> history(EventFilter filter, long afterId) {
        synchronized (lock) {
            if (ringCovers(afterId)) {
                return ringAfter(filter, afterId);
            }
        }
        return catchUp(filter, afterId, null);
    }

    /**
     * Reads the durable log directly, seeing events appended by other processes.
     */
    public List<PlanEvent> readLog(EventFilter filter, long afterId) {
        return eventLog.readAfter(afterId, filter);
    }

    public long lastEventId() {
        synchronized (lock) {
            return lastId;
        }
    }

    public int subscriberCount() {
        return channels.size();
    }

    @PreDestroy
    public void shutdown() {
        channels.clear();
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deliveryExecutor.shutdownNow();
        }
    }

    private void remember(PlanEvent event) {
        ring.addLast(event);
        while (ring.size() > bufferSize) {
            evictedUpTo = ring.removeFirst().id();
        }
    }

    private boolean ringCovers(long afterId) {
        return afterId >= lastForeignId && afterId >= evictedUpTo;
    }

    private List<PlanEvent> ringAfter(EventFilter filter, long afterId) {
        var out = new ArrayList<PlanEvent>();
        for (var event : ring) {
            if (event.id() > afterId && filter.matches(event)) {
                out.add(event);
            }
        }
        return out;
    }

    /**
     * Reads the log without holding the bus lock, then takes the lock only to splice
     * on the ring events newer than the last one read and, for a subscription, to
     * register its channel. Repeats the read if the ring moved past it meanwhile.
     */
    private List<PlanEvent> catchUp(EventFilter filter, long afterId, Channel channel) {
        var out = new ArrayList<PlanEvent>();
        long[] readUpTo = {afterId};
        while (true) {
            eventLog.forEach(event -> {
                if (event.id() > readUpTo[0]) {
                    readUpTo[0] = event.id();
                    if (filter.matches(event)) {
                        out.add(event);
                    }
                }
            });
            if (channel != null) {
                trimReplay(channel, out);
            }
            synchronized (lock) {
                if (evictedUpTo <= readUpTo[0]) {
                    out.addAll(ringAfter(filter, readUpTo[0]));
                    if (channel != null) {
                        out.forEach(channel::offer);
                        channels.add(channel);
                    }
                    return out;
                }
            }
            log.debug("Ring moved past id {} during catch-up; reading the log tail again", readUpTo[0]);
        }
    }

    // a replay longer than the queue would only push out its own head
    private void trimReplay(Channel channel, List<PlanEvent> replay) {
        int excess = replay.size() - subscriberQueueSize;
        if (excess <= 0) {
            return;
        }
        replay.subList(0, excess).clear();
        for (int i = 0; i < excess; i++) {
            metrics.recordDroppedEvent();
        }
        log.warn("Subscriber {} replay exceeds its queue; dropped {} oldest events", channel.id, excess);
    }

    private final class Channel implements Subscription {

        private final String id;
        private final EventFilter filter;
        private final Consumer<PlanEvent> consumer;
        private final Deque<PlanEvent> queue = new ArrayDeque<>();
        private final AtomicBoolean draining = new AtomicBoolean();
        private volatile boolean active = true;

        Channel(String id, EventFilter filter, Consumer<PlanEvent> consumer) {
            this.id = id;
            this.filter = filter;
            this.consumer = consumer;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void unsubscribe() {
            active = false;
            channels.remove(this);
            synchronized (queue) {
                queue.clear();
            }
            log.debug("Subscriber {} removed", id);
        }

        void offer(PlanEvent event) {
            synchronized (queue) {
                if (queue.size() >= subscriberQueueSize) {
                    var dropped = queue.pollFirst();
                    metrics.recordDroppedEvent();
                    log.warn("Subscriber {} is falling behind; dropped event {} ({})",
                            id, dropped.id(), dropped.type().wireName());
                }
                queue.addLast(event);
            }
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (draining.compareAndSet(false, true)) {
                try {
                    deliveryExecutor.execute(this::drain);
                } catch (java.util.concurrent.RejectedExecutionException e) {
                    draining.set(false);
                    log.debug("Delivery executor stopped; subscriber {} not drained", id);
                }
            }
        }

        private void drain() {
            while (true) {
                PlanEvent next;
                synchronized (queue) {
                    next = queue.pollFirst();
                    if (next == null) {
                        draining.set(false);
                        break;
                    }
                }
                if (active) {
                    deliverSafely(next);
                }
            }
            boolean more;
            synchronized (queue) {
                more = !queue.isEmpty();
            }
            if (more) {
                scheduleDrain();
            }
        }

        private void deliverSafely(PlanEvent event) {
            try {
                consumer.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber {} threw exception processing event {}: {}",
                        id, event.type().wireName(), e.getMessage(), e);
            }
        }
    }
}
