package org.gamboni.sideshelf.tech.bridge;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.gamboni.sideshelf.data.PlayerEvent;
import org.gamboni.sideshelf.tech.Mapping;
import org.gamboni.sideshelf.tech.PlayerEventBus;
import org.gamboni.sideshelf.tech.RuntimeContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoopbackNativeTransportTest {
    private final Mapping mapping = new Mapping();

    @Test
    void testMessagesReachEveryListenerIncludingSender() {
        var transport = new LoopbackNativeTransport(mapping);
        List<NativeMessage> first = new ArrayList<>();
        List<NativeMessage> second = new ArrayList<>();
        transport.addListener(first::add);
        Runnable removeSecond = transport.addListener(second::add);

        var message = new NativeMessage("SEEK", JsonNodeFactory.instance.objectNode().put("position", 12.0), "ctx-a");
        transport.send(message);

        assertEquals(List.of(message), first);
        assertEquals(List.of(message), second);

        removeSecond.run();
        transport.send(new NativeMessage("PLAY", null, "ctx-a"));
        assertEquals(2, first.size());
        assertEquals(1, second.size());
    }

    @Test
    void testFailingListenerIsContained() {
        var transport = new LoopbackNativeTransport(mapping);
        List<NativeMessage> received = new ArrayList<>();
        transport.addListener(m -> {
            throw new IllegalStateException("listener bug");
        });
        transport.addListener(received::add);

        assertDoesNotThrow(() -> transport.send(new NativeMessage("PLAY", null, "ctx-a")));
        assertEquals(1, received.size());
    }

    @Test
    void testTwoContextsExchangeEventsWithoutEcho() {
        var transport = new LoopbackNativeTransport(mapping);
        var uiBus = new PlayerEventBus();
        var headlessBus = new PlayerEventBus();
        var ui = new NativeBridgeIntegrator(RuntimeContext.UI, uiBus, transport, mapping);
        var headless = new NativeBridgeIntegrator(RuntimeContext.HEADLESS, headlessBus, transport, mapping);
        ui.initialize();
        headless.initialize();

        List<PlayerEvent> uiEvents = new ArrayList<>();
        List<PlayerEvent> headlessEvents = new ArrayList<>();
        uiBus.subscribe(uiEvents::add);
        headlessBus.subscribe(headlessEvents::add);

        uiBus.dispatch(new PlayerEvent.Seek(90));
        headlessBus.dispatch(new PlayerEvent.Pause());

        assertEquals(List.of(new PlayerEvent.Seek(90), new PlayerEvent.Pause()), uiEvents);
        assertEquals(List.of(new PlayerEvent.Seek(90), new PlayerEvent.Pause()), headlessEvents);

        ui.close();
        headless.close();
    }
}
