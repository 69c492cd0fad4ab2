package org.gamboni.sideshelf;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.gamboni.sideshelf.tech.Mapping;
import org.gamboni.sideshelf.tech.PlayerEventBus;
import org.gamboni.sideshelf.tech.RuntimeContext;
import org.gamboni.sideshelf.tech.bridge.NativeBridgeIntegrator;
import org.gamboni.sideshelf.tech.bridge.NativeTransport;

import java.time.Duration;

/**
 * Everything one execution context needs to take part in playback: its event bus, its coordinator and its end
 * of the native bridge. The UI and the headless service each construct their own.
 */
@Slf4j
public class PlayerRuntime implements AutoCloseable {
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    @Getter
    private final RuntimeContext runtimeContext;
    @Getter
    private final Mapping mapping;
    @Getter
    private final PlayerEventBus eventBus;
    @Getter
    private final PlayerStateCoordinator coordinator;
    @Getter
    private final NativeBridgeIntegrator bridge;

    /**
     * @param coordinator builder carrying the coordinator's collaborators (player service, stores, executors).
     *                    The runtime context, configuration and event bus are set by this constructor.
     */
    public PlayerRuntime(RuntimeContext runtimeContext,
                         CoordinatorConfig config,
                         NativeTransport transport,
                         Mapping mapping,
                         PlayerStateCoordinator.PlayerStateCoordinatorBuilder coordinator) {
        this.runtimeContext = runtimeContext;
        this.mapping = mapping;
        this.eventBus = new PlayerEventBus(config.historySize());
        this.coordinator = coordinator
                .runtimeContext(runtimeContext)
                .config(config)
                .eventBus(eventBus)
                .build();
        this.bridge = new NativeBridgeIntegrator(runtimeContext, eventBus, transport, mapping);
    }

    public PlayerRuntime start() {
        bridge.initialize();
        log.info("{} player runtime started", runtimeContext);
        return this;
    }

    /** Diagnostics of the coordinator, as JSON. */
    public String exportDiagnosticsJson() {
        return mapping.writeValueAsString(coordinator.exportDiagnostics());
    }

    /** Lets the coordinator finish the events already queued, then disconnects everything. */
    @Override
    public void close() {
        if (!coordinator.awaitIdle(SHUTDOWN_TIMEOUT)) {
            log.warn("{} events still queued at shutdown", coordinator.getEventQueue().size());
        }
        bridge.close();
        coordinator.close();
        eventBus.clearListeners();
        log.info("{} player runtime closed", runtimeContext);
    }
}
