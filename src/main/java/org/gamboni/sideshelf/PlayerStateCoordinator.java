package org.gamboni.sideshelf;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.gamboni.sideshelf.data.CoordinatorMetrics;
import org.gamboni.sideshelf.data.DiagnosticEvent;
import org.gamboni.sideshelf.data.DiagnosticsReport;
import org.gamboni.sideshelf.data.EventProcessingResult;
import org.gamboni.sideshelf.data.EventType;
import org.gamboni.sideshelf.data.NativeState;
import org.gamboni.sideshelf.data.PersistedPlayerState;
import org.gamboni.sideshelf.data.PlayerError;
import org.gamboni.sideshelf.data.PlayerEvent;
import org.gamboni.sideshelf.data.PlayerState;
import org.gamboni.sideshelf.data.ResumePositionInfo;
import org.gamboni.sideshelf.data.StateContext;
import org.gamboni.sideshelf.data.TransitionHistoryEntry;
import org.gamboni.sideshelf.data.TransitionValidation;
import org.gamboni.sideshelf.store.PlayerStore;
import org.gamboni.sideshelf.store.PositionStore;
import org.gamboni.sideshelf.store.ProgressRepository;
import org.gamboni.sideshelf.store.SessionRepository;
import org.gamboni.sideshelf.store.UserDirectory;
import org.gamboni.sideshelf.tech.PlayerEventBus;
import org.gamboni.sideshelf.tech.RuntimeContext;
import org.gamboni.sideshelf.tech.media.PlayerService;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Single owner of the player state of one execution context.
 *
 * <p>Events are validated against the {@link TransitionTable}, applied to the state and turned into
 * {@link PlayerService} calls, strictly one at a time and in the order they were dispatched.
 */
@Slf4j
public class PlayerStateCoordinator implements AutoCloseable {

    /* Design notes: events come from the UI, from the native player callbacks and from the other execution
     * context through the native bridge. Side effects are asynchronous, and the native player reports back while
     * we are still waiting for a command to complete, so blocking the producers would deadlock. Like a browser,
     * we have an event queue instead: dispatch() only appends to it, and a single drain loop, running on a
     * sequential executor, processes events one by one. The drain loop holds the state-transition lock for the
     * whole duration of an event, side effect included, so that event N is completely done before N+1 starts.
     * Side effects must never call dispatch() synchronously. Follow-up events (resuming after a seek, a
     * reconciled position) go through the event bus and land at the end of the queue like any other event.
     */

    private final RuntimeContext runtimeContext;
    private final PlayerService playerService;
    private final PlayerEventBus eventBus;
    private final StoreBridge storeBridge;
    private final PositionResolver positionResolver;
    private final CoordinatorDiagnostics diagnostics;

    /** Must be sequential. */
    private final Executor eventLoop;
    private final Executor resolutionExecutor;
    /** The executor we created ourselves, if any, so that we can shut it down. */
    private final Optional<ExecutorService> ownedExecutor;
    private final Runnable busSubscription;

    private final Queue<PlayerEvent> eventQueue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final ReentrantLock stateTransitionLock = new ReentrantLock();

    private final MutableContext context = new MutableContext();
    private volatile StateContext published;
    private volatile boolean observerMode = false;

    private final List<CoordinatorListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Only {@code playerService} and {@code positionStore} are mandatory.
     *
     * @param playerStore ignored in the {@link RuntimeContext#HEADLESS headless} context
     * @param eventLoop sequential executor running the drain loop; a dedicated thread if not set
     * @param resolutionExecutor where position resolution runs; the common pool if not set
     */
    @Builder
    private PlayerStateCoordinator(RuntimeContext runtimeContext,
                                   CoordinatorConfig config,
                                   PlayerService playerService,
                                   PlayerEventBus eventBus,
                                   PlayerStore playerStore,
                                   PositionStore positionStore,
                                   UserDirectory userDirectory,
                                   SessionRepository sessionRepository,
                                   ProgressRepository progressRepository,
                                   Executor eventLoop,
                                   Executor resolutionExecutor) {
        this.runtimeContext = (runtimeContext == null) ? RuntimeContext.UI : runtimeContext;
        if (config == null) {
            config = CoordinatorConfig.DEFAULTS;
        }
        this.playerService = checkNotNull(playerService, "playerService");
        this.eventBus = (eventBus == null) ? new PlayerEventBus(config.historySize()) : eventBus;

        Optional<PlayerStore> store = this.runtimeContext.hasPlayerStore()
                ? Optional.ofNullable(playerStore)
                : Optional.empty();
        this.storeBridge = new StoreBridge(store);
        this.positionResolver = new PositionResolver(
                config,
                store,
                checkNotNull(positionStore, "positionStore"),
                (userDirectory == null) ? Optional::empty : userDirectory,
                (sessionRepository == null) ? (userId, itemId) -> Optional.empty() : sessionRepository,
                (progressRepository == null) ? (itemId, userId) -> Optional.empty() : progressRepository);
        this.diagnostics = new CoordinatorDiagnostics(config.historySize());

        if (eventLoop == null) {
            ExecutorService executor = new ThreadPoolExecutor(
                    1,
                    1, // important: to make this a *sequential* executor
                    Long.MAX_VALUE,
                    TimeUnit.SECONDS,
                    new LinkedBlockingDeque<>(),
                    new ThreadFactoryBuilder()
                            .setNameFormat("player-coordinator-" + this.runtimeContext.name().toLowerCase() + "-%d")
                            .setDaemon(true)
                            .build());
            this.eventLoop = executor;
            this.ownedExecutor = Optional.of(executor);
        } else {
            this.eventLoop = eventLoop;
            this.ownedExecutor = Optional.empty();
        }
        this.resolutionExecutor = (resolutionExecutor == null) ? ForkJoinPool.commonPool() : resolutionExecutor;

        this.published = context.snapshot();
        this.busSubscription = this.eventBus.subscribe(this::dispatch);
        log.info("Player state coordinator created for {} context", this.runtimeContext);
    }

    public RuntimeContext getRuntimeContext() {
        return runtimeContext;
    }

    public PlayerEventBus getEventBus() {
        return eventBus;
    }

    /** Queues an event for processing. Never blocks. */
    public void dispatch(PlayerEvent event) {
        checkNotNull(event);
        eventQueue.add(event);
        if (processing.compareAndSet(false, true)) {
            try {
                eventLoop.execute(this::processEventQueue);
            } catch (RejectedExecutionException e) {
                processing.set(false);
                log.warn("Coordinator is closed, {} will not be processed", event.type());
            }
        }
    }

    private void processEventQueue() {
        boolean drained = false;
        try {
            drainEventQueue();
            drained = true;
        } finally {
            if (!drained) {
                // an Error escaped: release the flag so that the next dispatch restarts the loop
                processing.set(false);
            }
        }
    }

    private void drainEventQueue() {
        // Re-check after releasing the flag: a producer may have enqueued after our last poll but before the
        // flag was cleared, and seen it still set.
        do {
            PlayerEvent event;
            while ((event = eventQueue.poll()) != null) {
                stateTransitionLock.lock();
                try {
                    handleEvent(event);
                } catch (RuntimeException e) {
                    PlayerEvent failed = event;
                    log.error("Error processing event {}", failed.type(), e);
                    notifyListeners(l -> l.error(failed, e));
                } finally {
                    stateTransitionLock.unlock();
                }
            }
            processing.set(false);
        } while (!eventQueue.isEmpty() && processing.compareAndSet(false, true));
    }

    private void handleEvent(PlayerEvent event) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        Instant timestamp = Instant.now();

        PlayerState currentState = context.getCurrentState();
        TransitionValidation validation = TransitionTable.validate(currentState, event);

        if (updateContext(event)) {
            log.debug("Context updated from {}: {}", event.type(), context.snapshot());
        }

        DiagnosticEvent diagnostic = new DiagnosticEvent(timestamp, event, currentState,
                validation.nextState(), validation.allowed(), context.snapshot());
        diagnostics.recordEvent(diagnostic, new TransitionHistoryEntry(timestamp, event, currentState,
                validation.nextState(), validation.allowed(), validation.reason(), stopwatch.elapsed()));
        notifyListeners(l -> l.diagnostic(diagnostic));

        PlayerState newState = currentState;
        if (validation.allowed()) {
            newState = validation.nextState().orElse(currentState);
            if (newState != currentState) {
                log.info("Transition: {} --[{}]--> {}", currentState, event.type(), newState);
                context.setPreviousState(currentState);
                context.setCurrentState(newState);
                diagnostics.recordTransition();
            }
            published = context.snapshot();

            if (!observerMode) {
                executeTransition(event, currentState, newState);
                published = context.snapshot();
                if (event.type() == EventType.NATIVE_PROGRESS_UPDATED) {
                    storeBridge.syncPosition(published);
                } else {
                    storeBridge.syncState(published);
                }
            }
        } else {
            diagnostics.recordRejection();
            log.warn("Rejected: {} --[{}]--> Reason: {}", currentState, event.type(),
                    validation.reason().orElse("unknown"));
            published = context.snapshot();
        }

        Duration processingTime = stopwatch.elapsed();
        diagnostics.recordProcessed(timestamp, processingTime);

        EventProcessingResult result = new EventProcessingResult(true, newState != currentState,
                currentState, newState, processingTime);
        notifyListeners(l -> l.eventProcessed(event, result));
    }

    /** Applies the event payload to the context, whether or not the transition is allowed.
     * @return whether anything was written */
    private boolean updateContext(PlayerEvent event) {
        return switch (event.type()) {
            case RESTORE_STATE -> {
                PersistedPlayerState state = ((PlayerEvent.RestoreState) event).state();
                context.setCurrentTrack(state.currentTrack().orElse(null));
                context.setPosition(state.position());
                context.setPlaybackRate(state.playbackRate());
                context.setVolume(state.volume());
                context.setPlaying(state.playing());
                context.setSessionId(state.playSessionId().orElse(null));
                state.currentTrack().ifPresent(track -> context.setDuration(track.duration()));
                yield true;
            }
            case LOAD_TRACK -> {
                context.setLoadingTrack(true);
                yield true;
            }
            case NATIVE_TRACK_CHANGED -> {
                var changed = (PlayerEvent.NativeTrackChanged) event;
                context.setCurrentTrack(changed.track().orElse(null));
                changed.track().ifPresent(track -> context.setDuration(track.duration()));
                yield true;
            }
            case QUEUE_RELOADED -> {
                context.setLoadingTrack(false);
                context.setPosition(((PlayerEvent.QueueReloaded) event).position());
                yield true;
            }
            case NATIVE_PROGRESS_UPDATED -> {
                var progress = (PlayerEvent.NativeProgressUpdated) event;
                context.setSeeking(false);
                // While loading, the native player reports 0 until it has seeked to the resume position.
                if (!(context.isLoadingTrack() && progress.position() == 0)) {
                    context.setPosition(progress.position());
                }
                context.setDuration(progress.duration());
                context.setLastPositionUpdate(Instant.now());
                yield true;
            }
            case SEEK -> {
                // a second seek before the first completes interrupts nothing new
                if (context.getCurrentState() != PlayerState.SEEKING) {
                    context.setPreSeekState(context.getCurrentState());
                }
                context.setSeeking(true);
                context.setPosition(((PlayerEvent.Seek) event).position());
                yield true;
            }
            case SEEK_COMPLETE -> {
                context.setSeeking(false);
                yield true;
            }
            case POSITION_RECONCILED -> {
                context.setPosition(((PlayerEvent.PositionReconciled) event).position());
                diagnostics.recordReconciliation();
                yield true;
            }
            case PLAY -> {
                context.setPlaying(true);
                yield true;
            }
            case PAUSE -> {
                context.setPlaying(false);
                yield true;
            }
            case STOP -> {
                context.setPlaying(false);
                context.setPosition(0);
                context.setCurrentTrack(null);
                context.setSessionId(null);
                context.setSessionStartTime(null);
                yield true;
            }
            case SET_RATE -> {
                context.setPlaybackRate(((PlayerEvent.SetRate) event).rate());
                yield true;
            }
            case SET_VOLUME -> {
                context.setVolume(((PlayerEvent.SetVolume) event).volume());
                yield true;
            }
            case BUFFERING_STARTED -> {
                context.setBuffering(true);
                yield true;
            }
            case BUFFERING_COMPLETED -> {
                context.setBuffering(false);
                yield true;
            }
            case SESSION_CREATED -> {
                context.setSessionId(((PlayerEvent.SessionCreated) event).sessionId());
                context.setSessionStartTime(Instant.now());
                yield true;
            }
            case SESSION_UPDATED -> {
                context.setPendingSyncPosition(null);
                yield true;
            }
            case SESSION_ENDED -> {
                context.setSessionId(null);
                context.setSessionStartTime(null);
                yield true;
            }
            case SESSION_SYNC_COMPLETED -> {
                context.setLastServerSync(Instant.now());
                yield true;
            }
            case SESSION_SYNC_FAILED -> {
                context.setLastError(((PlayerEvent.SessionSyncFailed) event).error());
                yield true;
            }
            case CHAPTER_CHANGED -> {
                context.setCurrentChapter(((PlayerEvent.ChapterChanged) event).chapter());
                yield true;
            }
            case NATIVE_STATE_CHANGED -> {
                context.setPlaying(((PlayerEvent.NativeStateChanged) event).state() == NativeState.PLAYING);
                yield true;
            }
            case NATIVE_ERROR -> {
                context.setLastError(((PlayerEvent.NativeError) event).error());
                yield true;
            }
            case NATIVE_PLAYBACK_ERROR -> {
                var error = (PlayerEvent.NativePlaybackError) event;
                context.setLastError(PlayerError.of(error.code(), error.message()));
                yield true;
            }
            case RELOAD_QUEUE, APP_FOREGROUNDED, APP_BACKGROUNDED, SESSION_SYNC_STARTED -> false;
        };
    }

    /** Runs the side effect of an accepted event. Failures are logged, the transition stays committed. */
    private void executeTransition(PlayerEvent event, PlayerState fromState, PlayerState toState) {
        try {
            switch (toState) {
                case LOADING -> {
                    if (event instanceof PlayerEvent.LoadTrack load) {
                        await(playerService.executeLoadTrack(load.libraryItemId(), load.episodeId()));
                    }
                }
                case PLAYING -> {
                    if (event.type() == EventType.PLAY) {
                        await(playerService.executePlay());
                    }
                }
                case PAUSED -> {
                    if (event.type() == EventType.PAUSE) {
                        await(playerService.executePause());
                    }
                }
                case STOPPING -> await(playerService.executeStop());
                case IDLE -> {
                    if (event.type() == EventType.STOP) {
                        await(playerService.executeStop());
                    }
                }
                case READY -> {
                    if (fromState == PlayerState.SEEKING) {
                        resumeAfterSeek();
                    }
                }
                case SEEKING, BUFFERING, ERROR -> {}
            }

            if (event instanceof PlayerEvent.Seek seek) {
                await(playerService.executeSeek(seek.position()));
            } else if (event instanceof PlayerEvent.SetRate setRate) {
                await(playerService.executeSetRate(setRate.rate()));
            } else if (event instanceof PlayerEvent.SetVolume setVolume) {
                await(playerService.executeSetVolume(setVolume.volume()));
            }
        } catch (RuntimeException e) {
            log.error("Error executing {} --[{}]--> {}", fromState, event.type(), toState, e);
        }
    }

    private void resumeAfterSeek() {
        PlayerState interrupted = context.getPreSeekState();
        context.setPreSeekState(null);
        if (interrupted == PlayerState.PLAYING) {
            log.debug("Seek complete, resuming playback");
            eventBus.dispatch(new PlayerEvent.Play());
        }
    }

    private static void await(CompletableFuture<Void> future) {
        future.join();
    }

    private void notifyListeners(Consumer<CoordinatorListener> notification) {
        for (var listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                log.error("Coordinator listener failed", e);
            }
        }
    }

    /**
     * Works out where playback of the given item should resume from, and feeds the result back into the event
     * stream as a {@link PlayerEvent.PositionReconciled} event.
     */
    public CompletableFuture<ResumePositionInfo> resolveCanonicalPosition(String libraryItemId) {
        checkNotNull(libraryItemId);
        return CompletableFuture.supplyAsync(() -> {
            ResumePositionInfo info = positionResolver.resolve(libraryItemId);
            eventBus.dispatch(new PlayerEvent.PositionReconciled(info.position()));
            return info;
        }, resolutionExecutor);
    }

    public PlayerState getState() {
        return published.currentState();
    }

    public StateContext getContext() {
        return published;
    }

    public CoordinatorMetrics getMetrics() {
        return diagnostics.metrics(eventQueue.size());
    }

    public List<TransitionHistoryEntry> getTransitionHistory() {
        return diagnostics.transitionHistory();
    }

    /** Events waiting to be processed, oldest first. */
    public List<PlayerEvent> getEventQueue() {
        return List.copyOf(eventQueue);
    }

    public List<Duration> getProcessingTimes() {
        return diagnostics.processingTimes();
    }

    public DiagnosticsReport exportDiagnostics() {
        return new DiagnosticsReport(
                getContext(),
                getMetrics(),
                getEventQueue(),
                getProcessingTimes(),
                getTransitionHistory(),
                diagnostics.recentDiagnostics(),
                observerMode);
    }

    /** In observer mode, transitions are validated and recorded but no side effect is executed. */
    public void setObserverMode(boolean enabled) {
        if (observerMode != enabled) {
            log.info("Observer mode {}", enabled ? "enabled" : "disabled");
        }
        this.observerMode = enabled;
    }

    public boolean isObserverMode() {
        return observerMode;
    }

    /** @return a handle removing the listener */
    public Runnable addListener(CoordinatorListener listener) {
        listeners.add(checkNotNull(listener));
        return () -> listeners.remove(listener);
    }

    /**
     * Waits until every event dispatched so far has been processed.
     *
     * @return false if the queue still was not empty after {@code timeout}
     */
    public boolean awaitIdle(Duration timeout) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        while (processing.get() || !eventQueue.isEmpty()) {
            if (stopwatch.elapsed().compareTo(timeout) >= 0) {
                return false;
            }
            Uninterruptibles.sleepUninterruptibly(Duration.ofMillis(5));
        }
        return true;
    }

    /** Stops listening to the event bus. Events already queued are still processed. */
    @Override
    public void close() {
        busSubscription.run();
        ownedExecutor.ifPresent(ExecutorService::shutdown);
        log.info("Player state coordinator for {} context closed", runtimeContext);
    }
}
