package org.gamboni.sideshelf.tech.bridge;

import com.google.common.util.concurrent.MoreExecutors;
import lombok.extern.slf4j.Slf4j;
import org.gamboni.sideshelf.tech.Mapping;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * In-process stand-in for the native event module: every message is serialized, as it would be when crossing
 * into native code, and re-emitted to every registered listener.
 */
@Slf4j
public class LoopbackNativeTransport implements NativeTransport {
    private final Mapping mapping;
    private final Executor deliveryExecutor;
    private final List<Consumer<NativeMessage>> listeners = new CopyOnWriteArrayList<>();

    public LoopbackNativeTransport(Mapping mapping) {
        this(mapping, MoreExecutors.directExecutor());
    }

    public LoopbackNativeTransport(Mapping mapping, Executor deliveryExecutor) {
        this.mapping = mapping;
        this.deliveryExecutor = deliveryExecutor;
    }

    @Override
    public void send(NativeMessage message) {
        String json = mapping.writeValueAsString(message);
        log.trace("> {}", json);
        for (var listener : listeners) {
            deliveryExecutor.execute(() -> {
                try {
                    listener.accept(mapping.readValue(json, NativeMessage.class));
                } catch (RuntimeException e) {
                    log.error("Native event listener failed on {}", json, e);
                }
            });
        }
    }

    @Override
    public Runnable addListener(Consumer<NativeMessage> listener) {
        // wrap so that the same listener registered twice is removed once per call
        Consumer<NativeMessage> registration = listener::accept;
        listeners.add(registration);
        return () -> listeners.remove(registration);
    }
}
