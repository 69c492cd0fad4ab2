package org.gamboni.sideshelf.tech;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.gamboni.sideshelf.data.PlayerEvent;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Publish/subscribe channel for player events.
 *
 * <p>Producers (services, native callbacks, the native bridge) dispatch to the bus, the coordinator subscribes
 * to it, so that producers never depend on the coordinator directly.
 */
@Slf4j
public class PlayerEventBus {
    public static final int DEFAULT_HISTORY_SIZE = 100;

    public record HistoryEntry(PlayerEvent event, Instant timestamp) {}

    /** One entry per subscribe() call, so the same listener may be subscribed (and unsubscribed) twice. */
    private static final class Subscription {
        final Consumer<PlayerEvent> listener;

        Subscription(Consumer<PlayerEvent> listener) {
            this.listener = listener;
        }
    }

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final EvictingQueue<HistoryEntry> history;

    public PlayerEventBus() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public PlayerEventBus(int historySize) {
        this.history = EvictingQueue.create(historySize);
    }

    /** Notify all listeners. A failing listener is logged and does not prevent the others from being notified. */
    public void dispatch(PlayerEvent event) {
        log.debug("Event dispatched: {}", event.type());

        synchronized (history) {
            history.add(new HistoryEntry(event, Instant.now()));
        }

        for (var subscription : subscriptions) {
            try {
                subscription.listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Event listener error on {}", event.type(), e);
            }
        }
    }

    /**
     * Subscribe to events.
     *
     * @return a function removing the subscription. Calling it more than once has no further effect.
     */
    public Runnable subscribe(Consumer<PlayerEvent> listener) {
        var subscription = new Subscription(listener);
        subscriptions.add(subscription);
        return () -> subscriptions.remove(subscription);
    }

    /** Subscribe a listener doing asynchronous work. The dispatcher does not wait for it; failures are logged. */
    public Runnable subscribeAsync(Function<PlayerEvent, ? extends CompletionStage<?>> listener) {
        return subscribe(event -> listener.apply(event).whenComplete((result, error) -> {
            if (error != null) {
                log.error("Asynchronous event listener error on {}", event.type(), error);
            }
        }));
    }

    public List<HistoryEntry> getEventHistory() {
        synchronized (history) {
            return ImmutableList.copyOf(history);
        }
    }

    public void clearListeners() {
        subscriptions.clear();
    }
}
