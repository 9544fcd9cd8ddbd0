package com.questrail.tictactoe.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * EventBus
 * =============================================================================
 * In-process publish/subscribe router keyed by event type.
 *
 * <h2>Delivery</h2>
 * <ul>
 *   <li>{@link #publish(GameEvent)} is synchronous: every subscriber of the
 *       event's exact type runs on the caller's thread, in subscription order,
 *       before the call returns.</li>
 *   <li>Delivery iterates a snapshot of the subscriber list taken under the
 *       lock, so a subscriber may subscribe or unsubscribe while being called.</li>
 *   <li>Exceptions thrown by a subscriber propagate to the publisher and stop
 *       delivery to the remaining subscribers of that publish.</li>
 * </ul>
 *
 * <h2>Asynchronous mode</h2>
 * {@link #publishAsync(GameEvent)} queues the event for a single worker thread
 * that delivers in FIFO order. It is meant for deferred work (AI moves) so that
 * the publishing thread never waits on an expensive subscriber. A subscriber
 * failure on the worker has no caller to return to and is logged.
 *
 * <p>There is no cross-thread total order: concurrent publishes from different
 * threads may interleave, each one still delivered in full.</p>
 */
public final class EventBus implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Object lock = new Object();
    private final Map<Class<? extends GameEvent>, List<TypedSubscriber<?>>> subscribers = new HashMap<>();

    // Created on first publishAsync.
    private ExecutorService worker;
    private boolean closed;

    /**
     * Subscribe {@code handler} to events of exactly {@code type}.
     *
     * <p>Subscribing the same handler twice delivers twice.</p>
     */
    public <E extends GameEvent> void subscribe(Class<E> type, Consumer<? super E> handler)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        synchronized (lock) {
            subscribers.computeIfAbsent(type, t -> new ArrayList<>()).add(new TypedSubscriber<>(type, handler));
        }
    }

    /**
     * Remove the first registration of {@code handler} for {@code type}.
     *
     * @return {@code true} if a registration was removed
     */
    public <E extends GameEvent> boolean unsubscribe(Class<E> type, Consumer<? super E> handler)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        synchronized (lock) {
            List<TypedSubscriber<?>> list = subscribers.get(type);
            if (list == null) {
                return false;
            }
            for (int i = 0; i < list.size(); i++) {
                if ((Object) list.get(i).handler == handler) {
                    list.remove(i);
                    if (list.isEmpty()) {
                        subscribers.remove(type);
                    }
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Deliver {@code event} to its subscribers on the calling thread.
     */
    public void publish(GameEvent event)
    {
        Objects.requireNonNull(event, "event");
        List<TypedSubscriber<?>> snapshot;
        synchronized (lock) {
            List<TypedSubscriber<?>> list = subscribers.get(event.getClass());
            if (list == null) {
                log.trace("No subscribers for {}", event);
                return;
            }
            snapshot = List.copyOf(list);
        }

        for (TypedSubscriber<?> subscriber : snapshot) {
            subscriber.accept(event);
        }
    }

    /**
     * Queue {@code event} for delivery on the bus worker thread.
     *
     * @throws IllegalStateException if the bus has been closed
     */
    public void publishAsync(GameEvent event)
    {
        Objects.requireNonNull(event, "event");
        ExecutorService w;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("EventBus is closed");
            }
            if (worker == null) {
                worker = Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "event-bus-worker");
                    t.setDaemon(true);
                    return t;
                });
            }
            w = worker;
        }

        try {
            w.execute(() -> deliverAsync(event));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("EventBus is closed", e);
        }
    }

    private void deliverAsync(GameEvent event)
    {
        try {
            publish(event);
        } catch (RuntimeException e) {
            log.error("Subscriber failed while handling {} on the bus worker", event, e);
        }
    }

    /**
     * Number of subscribers currently registered for {@code type}.
     */
    public int subscriberCount(Class<? extends GameEvent> type)
    {
        synchronized (lock) {
            List<TypedSubscriber<?>> list = subscribers.get(type);
            return list == null ? 0 : list.size();
        }
    }

    /**
     * Drop every subscription and stop the worker thread. Events already queued
     * for asynchronous delivery are discarded.
     */
    @Override
    public void close()
    {
        ExecutorService w;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            subscribers.clear();
            w = worker;
            worker = null;
        }

        if (w != null) {
            w.shutdownNow();
            try {
                if (!w.awaitTermination(2, TimeUnit.SECONDS)) {
                    log.warn("Event bus worker did not terminate");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static final class TypedSubscriber<E extends GameEvent>
    {
        private final Class<E> type;
        private final Consumer<? super E> handler;

        TypedSubscriber(Class<E> type, Consumer<? super E> handler)
        {
            this.type = type;
            this.handler = handler;
        }

        void accept(GameEvent event)
        {
            handler.accept(type.cast(event));
        }
    }
}
