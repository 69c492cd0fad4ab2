package org.gamboni.sideshelf;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Sets;
import org.gamboni.sideshelf.data.EventType;
import org.gamboni.sideshelf.data.NativeState;
import org.gamboni.sideshelf.data.PlayerEvent;
import org.gamboni.sideshelf.data.PlayerState;
import org.gamboni.sideshelf.data.TransitionValidation;

import java.util.Set;

import static org.gamboni.sideshelf.data.EventType.*;
import static org.gamboni.sideshelf.data.PlayerState.*;

/**
 * Allowed state transitions of the player state machine.
 *
 * <p>Pairs missing from the table are rejected. Native events are accepted in every state where playback may be
 * going on, because the native player knows better than us what it is doing.
 */
public final class TransitionTable {

    static final String DUPLICATE_LOAD_REASON = "Track already loading; duplicate LOAD_TRACK rejected";

    private static final ImmutableTable<PlayerState, EventType, PlayerState> TRANSITIONS = buildTable();

    /** Events accepted in any state, leaving it unchanged, unless the table says otherwise. */
    private static final ImmutableSet<EventType> NO_OP_EVENTS = Sets.immutableEnumSet(
            NATIVE_PROGRESS_UPDATED,
            SESSION_CREATED,
            SESSION_UPDATED,
            SESSION_ENDED,
            SESSION_SYNC_STARTED,
            SESSION_SYNC_COMPLETED,
            SESSION_SYNC_FAILED,
            CHAPTER_CHANGED,
            POSITION_RECONCILED,
            APP_FOREGROUNDED,
            APP_BACKGROUNDED);

    private TransitionTable() {}

    private static ImmutableTable<PlayerState, EventType, PlayerState> buildTable() {
        var table = ImmutableTable.<PlayerState, EventType, PlayerState>builder();

        table.put(IDLE, LOAD_TRACK, LOADING)
                .put(IDLE, RELOAD_QUEUE, LOADING)
                .put(IDLE, RESTORE_STATE, IDLE)
                .put(IDLE, STOP, IDLE)
                .put(IDLE, NATIVE_STATE_CHANGED, IDLE);

        table.put(LOADING, NATIVE_TRACK_CHANGED, READY)
                .put(LOADING, QUEUE_RELOADED, READY)
                .put(LOADING, PLAY, PLAYING)
                .put(LOADING, STOP, STOPPING)
                .put(LOADING, NATIVE_STATE_CHANGED, LOADING);

        table.put(READY, PLAY, PLAYING)
                .put(READY, LOAD_TRACK, LOADING)
                .put(READY, RELOAD_QUEUE, LOADING)
                .put(READY, STOP, IDLE)
                .put(READY, SEEK, SEEKING)
                .put(READY, SET_RATE, READY)
                .put(READY, SET_VOLUME, READY)
                .put(READY, NATIVE_STATE_CHANGED, READY)
                .put(READY, NATIVE_TRACK_CHANGED, READY);

        table.put(PLAYING, PAUSE, PAUSED)
                .put(PLAYING, STOP, STOPPING)
                .put(PLAYING, SEEK, SEEKING)
                .put(PLAYING, LOAD_TRACK, LOADING)
                .put(PLAYING, BUFFERING_STARTED, BUFFERING)
                .put(PLAYING, SET_RATE, PLAYING)
                .put(PLAYING, SET_VOLUME, PLAYING)
                .put(PLAYING, NATIVE_STATE_CHANGED, PLAYING)
                .put(PLAYING, NATIVE_TRACK_CHANGED, PLAYING);

        table.put(PAUSED, PLAY, PLAYING)
                .put(PAUSED, STOP, STOPPING)
                .put(PAUSED, SEEK, SEEKING)
                .put(PAUSED, LOAD_TRACK, LOADING)
                .put(PAUSED, SET_RATE, PAUSED)
                .put(PAUSED, SET_VOLUME, PAUSED)
                .put(PAUSED, NATIVE_STATE_CHANGED, PAUSED)
                .put(PAUSED, NATIVE_TRACK_CHANGED, PAUSED);

        table.put(SEEKING, SEEK_COMPLETE, READY)
                .put(SEEKING, NATIVE_PROGRESS_UPDATED, READY)
                .put(SEEKING, STOP, STOPPING)
                .put(SEEKING, NATIVE_STATE_CHANGED, SEEKING);

        // NATIVE_STATE_CHANGED only ends buffering when the player reports it is playing, see validate()
        table.put(BUFFERING, BUFFERING_COMPLETED, PLAYING)
                .put(BUFFERING, NATIVE_STATE_CHANGED, PLAYING)
                .put(BUFFERING, PAUSE, PAUSED)
                .put(BUFFERING, STOP, STOPPING)
                .put(BUFFERING, NATIVE_TRACK_CHANGED, BUFFERING);

        table.put(STOPPING, NATIVE_STATE_CHANGED, IDLE)
                .put(STOPPING, STOP, STOPPING);

        table.put(ERROR, PLAY, PLAYING) // retry
                .put(ERROR, LOAD_TRACK, LOADING) // load a different track
                .put(ERROR, STOP, IDLE)
                .put(ERROR, NATIVE_STATE_CHANGED, ERROR);

        for (var state : Set.of(LOADING, READY, PLAYING, PAUSED, SEEKING, BUFFERING)) {
            table.put(state, NATIVE_ERROR, ERROR)
                    .put(state, NATIVE_PLAYBACK_ERROR, ERROR);
        }

        return table.build();
    }

    /** Validate the given event in the given state. Never throws: rejections are reported in the result. */
    public static TransitionValidation validate(PlayerState currentState, PlayerEvent event) {
        EventType type = event.type();

        if (currentState == LOADING && type == LOAD_TRACK) {
            // a second load would create a second listening session
            return TransitionValidation.rejected(DUPLICATE_LOAD_REASON);
        }

        PlayerState nextState = TRANSITIONS.get(currentState, type);
        if (nextState != null) {
            if (currentState == BUFFERING
                    && event instanceof PlayerEvent.NativeStateChanged nativeState
                    && nativeState.state() != NativeState.PLAYING) {
                return TransitionValidation.allowed(BUFFERING);
            }
            return TransitionValidation.allowed(nextState);
        }

        if (isNoOpEvent(type)) {
            return TransitionValidation.noOp(currentState);
        }

        return TransitionValidation.rejected("Event " + type + " not allowed in state " + currentState);
    }

    public static boolean isNoOpEvent(EventType type) {
        return NO_OP_EVENTS.contains(type);
    }

    /** All events accepted in the given state. */
    public static Set<EventType> allowedEvents(PlayerState state) {
        return Sets.immutableEnumSet(Sets.union(TRANSITIONS.row(state).keySet(), NO_OP_EVENTS));
    }
}
