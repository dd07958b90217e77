package com.phasegate.core.events;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Append-only event channel for orchestration runs.
 * <p>
 * Publishing only enqueues the event; delivery happens on a dispatcher thread so a
 * slow or failing subscriber never stalls the orchestration loop. Events are delivered
 * in publish order. Supports per-run subscriptions and global subscriptions.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<OrchestrationEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all runs. */
    private final CopyOnWriteArrayList<Consumer<OrchestrationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final Executor dispatcher;
    private final ExecutorService ownedDispatcher;

    @Autowired
    public EventBus() {
        this.ownedDispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "phasegate-events");
            t.setDaemon(true);
            return t;
        });
        this.dispatcher = ownedDispatcher;
    }

    /**
     * Creates a bus delivering on the given executor. {@code Runnable::run} delivers
     * synchronously on the publishing thread.
     */
    public EventBus(Executor dispatcher) {
        this.dispatcher = dispatcher;
        this.ownedDispatcher = null;
    }

    /**
     * Enqueue an event for delivery to all matching subscribers (run-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(OrchestrationEvent event) {
        log.debug("Publishing event: {} for run {}", event.type(), event.runId());
        try {
            dispatcher.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("Event bus closed, dropping {} for run {}", event.type(), event.runId());
        }
    }

    /**
     * Subscribe to events of a specific run.
     *
     * @param runId    the run to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<OrchestrationEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> {
            CopyOnWriteArrayList<Consumer<OrchestrationEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all runs.
     *
     * @param consumer callback invoked for each event regardless of run
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<OrchestrationEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Waits until every event published before this call has been delivered.
     *
     * @return false if the timeout elapsed first
     */
    public boolean drain(Duration timeout) {
        CountDownLatch latch = new CountDownLatch(1);
        try {
            dispatcher.execute(latch::countDown);
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @PreDestroy
    public void close() {
        if (ownedDispatcher != null) {
            ownedDispatcher.shutdown();
        }
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(OrchestrationEvent event) {
        List<Consumer<OrchestrationEvent>> runSubs = event.runId() == null ? null : runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<OrchestrationEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<OrchestrationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    private void deliverSafely(Consumer<OrchestrationEvent> subscriber, OrchestrationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type(), e.getMessage(), e);
        }
    }
}
