package org.gamboni.sideshelf.data;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Events that can be dispatched to the player state machine.
 *
 * <p>Each variant carries exactly the payload it needs. {@link #type()} identifies the variant and is
 * what {@code switch} statements should be written against, so that the compiler checks they are exhaustive.
 */
public sealed interface PlayerEvent {

    EventType type();

    // Commands, from the user or the UI

    record LoadTrack(String libraryItemId, Optional<String> episodeId) implements PlayerEvent {
        public LoadTrack {
            checkNotNull(libraryItemId);
            episodeId = (episodeId == null) ? Optional.empty() : episodeId;
        }

        public LoadTrack(String libraryItemId) {
            this(libraryItemId, Optional.empty());
        }

        @Override
        public EventType type() {
            return EventType.LOAD_TRACK;
        }
    }

    record Play() implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.PLAY;
        }
    }

    record Pause() implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.PAUSE;
        }
    }

    record Stop() implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.STOP;
        }
    }

    /** @param position target position in seconds */
    record Seek(double position) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.SEEK;
        }
    }

    record SeekComplete() implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.SEEK_COMPLETE;
        }
    }

    record SetRate(double rate) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.SET_RATE;
        }
    }

    record SetVolume(double volume) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.SET_VOLUME;
        }
    }

    // Lifecycle

    record RestoreState(PersistedPlayerState state) implements PlayerEvent {
        public RestoreState {
            checkNotNull(state);
        }

        @Override
        public EventType type() {
            return EventType.RESTORE_STATE;
        }
    }

    record ReloadQueue(String libraryItemId) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.RELOAD_QUEUE;
        }
    }

    record QueueReloaded(double position) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.QUEUE_RELOADED;
        }
    }

    record AppForegrounded() implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.APP_FOREGROUNDED;
        }
    }

    record AppBackgrounded() implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.APP_BACKGROUNDED;
        }
    }

    // Internal

    record ChapterChanged(CurrentChapter chapter) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.CHAPTER_CHANGED;
        }
    }

    record BufferingStarted() implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.BUFFERING_STARTED;
        }
    }

    record BufferingCompleted() implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.BUFFERING_COMPLETED;
        }
    }

    record PositionReconciled(double position) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.POSITION_RECONCILED;
        }
    }

    // Listening sessions

    record SessionCreated(String sessionId) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.SESSION_CREATED;
        }
    }

    record SessionUpdated(double position) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.SESSION_UPDATED;
        }
    }

    record SessionEnded(String sessionId) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.SESSION_ENDED;
        }
    }

    record SessionSyncStarted() implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.SESSION_SYNC_STARTED;
        }
    }

    record SessionSyncCompleted() implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.SESSION_SYNC_COMPLETED;
        }
    }

    record SessionSyncFailed(PlayerError error) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.SESSION_SYNC_FAILED;
        }
    }

    // Reported by the native player

    record NativeStateChanged(NativeState state) implements PlayerEvent {
        public NativeStateChanged {
            checkNotNull(state);
        }

        @Override
        public EventType type() {
            return EventType.NATIVE_STATE_CHANGED;
        }
    }

    /** @param position current position in seconds
     * @param duration duration of the current track in seconds */
    record NativeProgressUpdated(double position, double duration) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.NATIVE_PROGRESS_UPDATED;
        }
    }

    /** @param track new active track, empty when the native queue became empty */
    record NativeTrackChanged(Optional<PlayerTrack> track) implements PlayerEvent {
        public NativeTrackChanged {
            track = (track == null) ? Optional.empty() : track;
        }

        @Override
        public EventType type() {
            return EventType.NATIVE_TRACK_CHANGED;
        }
    }

    record NativeError(PlayerError error) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.NATIVE_ERROR;
        }
    }

    record NativePlaybackError(String code, String message) implements PlayerEvent {
        @Override
        public EventType type() {
            return EventType.NATIVE_PLAYBACK_ERROR;
        }
    }
}
