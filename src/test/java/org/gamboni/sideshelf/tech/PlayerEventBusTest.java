package org.gamboni.sideshelf.tech;

import org.gamboni.sideshelf.data.PlayerEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class PlayerEventBusTest {

    @Test
    void testListenersReceiveEventsInOrder() {
        var bus = new PlayerEventBus();
        List<PlayerEvent> received = new ArrayList<>();
        bus.subscribe(received::add);

        bus.dispatch(new PlayerEvent.Play());
        bus.dispatch(new PlayerEvent.Seek(10));

        assertEquals(List.of(new PlayerEvent.Play(), new PlayerEvent.Seek(10)), received);
    }

    @Test
    void testFailingListenerDoesNotAffectOthers() {
        var bus = new PlayerEventBus();
        List<PlayerEvent> received = new ArrayList<>();
        bus.subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe(received::add);

        assertDoesNotThrow(() -> bus.dispatch(new PlayerEvent.Pause()));
        assertEquals(List.of(new PlayerEvent.Pause()), received);
    }

    @Test
    void testUnsubscribe() {
        var bus = new PlayerEventBus();
        List<PlayerEvent> received = new ArrayList<>();
        Consumer<PlayerEvent> listener = received::add;
        Runnable first = bus.subscribe(listener);
        bus.subscribe(listener);

        bus.dispatch(new PlayerEvent.Play());
        assertEquals(2, received.size());

        first.run();
        first.run();
        bus.dispatch(new PlayerEvent.Play());
        assertEquals(3, received.size());

        bus.clearListeners();
        bus.dispatch(new PlayerEvent.Play());
        assertEquals(3, received.size());
    }

    @Test
    void testAsyncListenerFailureIsContained() {
        var bus = new PlayerEventBus();
        List<PlayerEvent> received = new ArrayList<>();
        bus.subscribeAsync(event -> CompletableFuture.failedFuture(new IllegalStateException("async bug")));
        bus.subscribeAsync(event -> CompletableFuture.runAsync(() -> {}).thenRun(() -> {}));
        bus.subscribe(received::add);

        assertDoesNotThrow(() -> bus.dispatch(new PlayerEvent.Stop()));
        assertEquals(1, received.size());
    }

    @Test
    void testHistoryIsBounded() {
        var bus = new PlayerEventBus(3);
        for (int i = 0; i < 5; i++) {
            bus.dispatch(new PlayerEvent.Seek(i));
        }

        var history = bus.getEventHistory();
        assertEquals(3, history.size());
        assertEquals(new PlayerEvent.Seek(2), history.get(0).event());
        assertEquals(new PlayerEvent.Seek(4), history.get(2).event());
        assertFalse(history.get(0).timestamp().isAfter(history.get(2).timestamp()));
    }
}
