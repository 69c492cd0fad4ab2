package org.gamboni.sideshelf.tech.bridge;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.gamboni.sideshelf.data.PlayerEvent;
import org.gamboni.sideshelf.tech.Mapping;
import org.gamboni.sideshelf.tech.PlayerEventBus;
import org.gamboni.sideshelf.tech.RuntimeContext;

import java.util.UUID;

/**
 * Connects the local {@link PlayerEventBus} to the other execution context through the {@link NativeTransport}.
 * Local events are broadcast to native, and native events sent by other contexts are dispatched locally.
 */
@Slf4j
public class NativeBridgeIntegrator implements AutoCloseable {
    /* Design notes:
     * The transport echoes every message to every context, the sender included, so each message is tagged with
     * the id of its sender and a context drops the messages carrying its own id.
     * The other direction needs care as well: dispatching a native event to the local bus notifies our own bus
     * listener, which must not send it back out. The bus dispatches synchronously, so a flag held while
     * dispatching a native event is enough to recognise those. It is per-thread, as native messages and local
     * events may arrive on different threads.
     */

    @Getter
    private final String contextId;
    private final RuntimeContext runtimeContext;
    private final PlayerEventBus eventBus;
    private final NativeTransport transport;
    private final Mapping mapping;

    private final ThreadLocal<Boolean> processingNativeEvent = ThreadLocal.withInitial(() -> false);

    private Runnable unsubscribeBus;
    private Runnable unsubscribeNative;

    public NativeBridgeIntegrator(RuntimeContext runtimeContext, PlayerEventBus eventBus, NativeTransport transport, Mapping mapping) {
        this.runtimeContext = runtimeContext;
        this.eventBus = eventBus;
        this.transport = transport;
        this.mapping = mapping;
        this.contextId = "ctx-" + System.currentTimeMillis() + "-" + UUID.randomUUID();
    }

    public synchronized void initialize() {
        if (isInitialized()) {
            return;
        }
        log.info("Initializing native bridge for {} context with id {}", runtimeContext, contextId);

        this.unsubscribeBus = eventBus.subscribe(event -> {
            if (!processingNativeEvent.get()) {
                broadcastToNative(event);
            }
        });
        this.unsubscribeNative = transport.addListener(this::handleNativeMessage);
    }

    public synchronized boolean isInitialized() {
        return unsubscribeBus != null;
    }

    private void handleNativeMessage(NativeMessage message) {
        if (contextId.equals(message.contextId())) {
            return; // our own message, echoed back
        }

        PlayerEvent event;
        try {
            event = mapping.toEvent(message.type(), message.payload());
        } catch (IllegalArgumentException e) {
            log.error("Dropping unreadable cross-context event from {}", message.contextId(), e);
            return;
        }

        log.debug("Received cross-context event: {}", event.type());
        processingNativeEvent.set(true);
        try {
            eventBus.dispatch(event);
        } finally {
            processingNativeEvent.set(false);
        }
    }

    private void broadcastToNative(PlayerEvent event) {
        log.debug("Broadcasting event to native: {}", event.type());
        transport.send(new NativeMessage(
                event.type().name(),
                mapping.payloadOf(event).orElse(null),
                contextId));
    }

    @Override
    public synchronized void close() {
        if (unsubscribeBus != null) {
            unsubscribeBus.run();
            unsubscribeBus = null;
        }
        if (unsubscribeNative != null) {
            unsubscribeNative.run();
            unsubscribeNative = null;
        }
    }
}
