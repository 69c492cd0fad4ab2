package org.gamboni.sideshelf.data;

import java.time.Instant;
import java.util.Optional;

/**
 * Immutable snapshot of the player state held by the coordinator.
 *
 * @param position position in seconds (media time)
 * @param duration duration of the current track in seconds
 * @param preSeekState the state a seek interrupted, until playback resumes from it
 * @param pendingSyncPosition position waiting to be synced to the server
 */
public record StateContext(
        PlayerState currentState,
        Optional<PlayerState> previousState,
        Optional<PlayerTrack> currentTrack,
        double position,
        double duration,
        double playbackRate,
        double volume,
        Optional<String> sessionId,
        Optional<Instant> sessionStartTime,
        Optional<Instant> lastPositionUpdate,
        Optional<CurrentChapter> currentChapter,
        boolean playing,
        boolean buffering,
        boolean seeking,
        Optional<PlayerState> preSeekState,
        boolean loadingTrack,
        Optional<Instant> lastServerSync,
        Optional<Double> pendingSyncPosition,
        Optional<PlayerError> lastError) {

    /** Id of the current chapter, if any. */
    public Optional<Long> currentChapterId() {
        return currentChapter.map(c -> c.chapter().id());
    }
}
