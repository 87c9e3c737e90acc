package me.golemcore.soundboard.infrastructure.event;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.soundboard.domain.model.DomainEvent;
import me.golemcore.soundboard.domain.model.EventPayload;
import me.golemcore.soundboard.domain.model.EventSource;
import me.golemcore.soundboard.domain.model.EventType;
import me.golemcore.soundboard.infrastructure.config.SoundboardProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process publish/subscribe hub with one actor per subscriber.
 *
 * <p>
 * Every subscriber owns a bounded queue and a single dedicated worker thread.
 * {@link #publish(DomainEvent)} only enqueues and returns immediately, so
 * publishers (repositories, right after a storage commit) never wait for a
 * slow handler such as a rate-limited notification call.
 *
 * <p>
 * Delivery guarantees:
 * <ul>
 * <li>a subscriber observes its events in publish order</li>
 * <li>no ordering between different subscribers</li>
 * <li>a failing handler is logged and skipped; the worker keeps draining its
 * queue and other subscribers are unaffected</li>
 * <li>no retry of failed handler invocations</li>
 * <li>if a subscriber queue is full the event is dropped for that subscriber
 * only</li>
 * </ul>
 *
 * <p>
 * One instance per process, injected explicitly wherever events are published
 * or consumed. {@link #shutdown(Duration)} enqueues a drain sentinel into every
 * queue and waits for all workers to finish.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class EventBus {

    private static final DomainEvent DRAIN = DomainEvent.of(EventType.SHUTDOWN,
            new EventPayload.SystemSignal("drain"), EventSource.SYSTEM, Instant.EPOCH);

    private final int queueCapacity;
    private final Duration drainTimeout;
    private final Map<EventType, List<SubscriberWorker>> subscribers;
    private final List<SubscriberWorker> allWorkers = new CopyOnWriteArrayList<>();
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicLong sequence = new AtomicLong();

    @Autowired
    public EventBus(SoundboardProperties properties) {
        this(properties.getEvents().getQueueCapacity(), properties.getEvents().getDrainTimeout());
    }

    public EventBus(int queueCapacity, Duration drainTimeout) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        this.queueCapacity = queueCapacity;
        this.drainTimeout = drainTimeout;
        Map<EventType, List<SubscriberWorker>> map = new EnumMap<>(EventType.class);
        for (EventType type : EventType.values()) {
            map.put(type, new CopyOnWriteArrayList<>());
        }
        this.subscribers = Collections.unmodifiableMap(map);
    }

    /**
     * Registers a handler for a single event type, backed by its own worker.
     */
    public Subscription subscribe(EventType eventType, EventHandler handler) {
        return subscribe(eventType.name().toLowerCase(Locale.ROOT) + "-" + sequence.incrementAndGet(),
                EnumSet.of(eventType), handler);
    }

    /**
     * Registers one subscriber for several event types. The subscriber observes
     * events of all of its types in publish order.
     */
    public Subscription subscribe(String name, Set<EventType> eventTypes, EventHandler handler) {
        if (eventTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        lifecycleLock.readLock().lock();
        try {
            if (!accepting.get()) {
                throw new IllegalStateException("Event bus is shut down");
            }
            SubscriberWorker worker = new SubscriberWorker(name, EnumSet.copyOf(eventTypes), handler);
            allWorkers.add(worker);
            for (EventType type : worker.eventTypes) {
                subscribers.get(type).add(worker);
            }
            worker.start();
            log.debug("[EventBus] Subscribed '{}' to {}", name, worker.eventTypes);
            return worker;
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    /**
     * Enqueues the event for every subscriber of its type and returns without
     * waiting for delivery.
     */
    public void publish(DomainEvent event) {
        lifecycleLock.readLock().lock();
        try {
            if (!accepting.get()) {
                log.warn("[EventBus] Dropping {} published after shutdown", event.type());
                return;
            }
            List<SubscriberWorker> targets = subscribers.get(event.type());
            log.debug("[EventBus] Publishing {} from {} to {} subscriber(s)",
                    event.type(), event.source().tag(), targets.size());
            for (SubscriberWorker worker : targets) {
                worker.enqueue(event);
            }
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    public boolean isRunning() {
        return accepting.get();
    }

    /**
     * Number of subscribers currently registered for the type.
     */
    public int subscriberCount(EventType eventType) {
        return subscribers.get(eventType).size();
    }

    @PreDestroy
    public void shutdown() {
        shutdown(drainTimeout);
    }

    /**
     * Stops accepting events, lets every worker drain its queue and waits for all
     * of them to exit. Safe to call more than once.
     */
    public void shutdown(Duration timeout) {
        List<SubscriberWorker> workers;
        lifecycleLock.writeLock().lock();
        try {
            if (!accepting.compareAndSet(true, false)) {
                return;
            }
            workers = new ArrayList<>(allWorkers);
        } finally {
            lifecycleLock.writeLock().unlock();
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        for (SubscriberWorker worker : workers) {
            worker.requestDrain(remaining(deadline));
        }
        boolean clean = true;
        for (SubscriberWorker worker : workers) {
            clean &= worker.awaitTermination(remaining(deadline));
        }
        if (clean) {
            log.info("[EventBus] Shut down, {} subscriber(s) drained", workers.size());
        } else {
            log.warn("[EventBus] Shutdown timed out after {}, remaining events discarded", timeout);
        }
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private final class SubscriberWorker implements Subscription {

        private final String name;
        private final Set<EventType> eventTypes;
        private final EventHandler handler;
        private final BlockingQueue<DomainEvent> queue;
        private final ExecutorService executor;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicLong failures = new AtomicLong();

        private SubscriberWorker(String name, Set<EventType> eventTypes, EventHandler handler) {
            this.name = name;
            this.eventTypes = Collections.unmodifiableSet(eventTypes);
            this.handler = handler;
            this.queue = new ArrayBlockingQueue<>(queueCapacity);
            this.executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "event-bus-" + name);
                t.setDaemon(true);
                return t;
            });
        }

        private void start() {
            executor.submit(this::runLoop);
        }

        private synchronized void enqueue(DomainEvent event) {
            if (cancelled.get()) {
                log.warn("[EventBus] Subscriber '{}' was cancelled, dropping {}", name, event.type());
                return;
            }
            if (!queue.offer(event)) {
                log.error("[EventBus] Queue full for subscriber '{}', dropping {}", name, event.type());
            }
        }

        private void runLoop() {
            while (true) {
                DomainEvent event;
                try {
                    event = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[EventBus] Subscriber '{}' interrupted, {} event(s) left", name, queue.size());
                    return;
                }
                if (event == DRAIN) {
                    log.debug("[EventBus] Subscriber '{}' drained", name);
                    return;
                }
                try {
                    handler.handle(event);
                } catch (Exception e) {
                    failures.incrementAndGet();
                    log.error("[EventBus] Subscriber '{}' failed on {}: {}", name, event.type(), e.getMessage(), e);
                }
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("[EventBus] Subscriber '{}' interrupted, {} event(s) left", name, queue.size());
                    return;
                }
            }
        }

        private void requestDrain(long timeoutNanos) {
            try {
                if (!queue.offer(DRAIN, timeoutNanos, TimeUnit.NANOSECONDS)) {
                    log.warn("[EventBus] Could not enqueue drain for '{}', interrupting", name);
                    executor.shutdownNow();
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
                return;
            }
            executor.shutdown();
        }

        private boolean awaitTermination(long timeoutNanos) {
            try {
                if (executor.awaitTermination(timeoutNanos, TimeUnit.NANOSECONDS)) {
                    return true;
                }
                executor.shutdownNow();
                return false;
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
                return false;
            }
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Set<EventType> eventTypes() {
            return eventTypes;
        }

        @Override
        public void cancel() {
            // Under the enqueue monitor: every event accepted before this point precedes the drain.
            synchronized (this) {
                if (!cancelled.compareAndSet(false, true)) {
                    return;
                }
            }
            lifecycleLock.readLock().lock();
            try {
                for (EventType type : eventTypes) {
                    subscribers.get(type).remove(this);
                }
                allWorkers.remove(this);
            } finally {
                lifecycleLock.readLock().unlock();
            }
            requestDrain(drainTimeout.toNanos());
            log.debug("[EventBus] Unsubscribed '{}'", name);
        }

        @Override
        public String toString() {
            return "Subscription[" + name + " " + eventTypes + ", failures=" + failures.get() + "]";
        }
    }
}
