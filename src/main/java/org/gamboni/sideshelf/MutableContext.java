package org.gamboni.sideshelf;

import lombok.Getter;
import lombok.Setter;
import org.gamboni.sideshelf.data.CurrentChapter;
import org.gamboni.sideshelf.data.PlayerError;
import org.gamboni.sideshelf.data.PlayerState;
import org.gamboni.sideshelf.data.PlayerTrack;
import org.gamboni.sideshelf.data.StateContext;

import java.time.Instant;
import java.util.Optional;

/** The coordinator's working copy of the player state. Only touched from the event loop; everybody else gets a
 * {@link StateContext} snapshot. Nullable fields are empty in the snapshot. */
@Getter
@Setter
class MutableContext {
    private PlayerState currentState = PlayerState.IDLE;
    private PlayerState previousState;
    private PlayerTrack currentTrack;
    private double position;
    private double duration;
    private double playbackRate = 1;
    private double volume = 1;
    private String sessionId;
    private Instant sessionStartTime;
    private Instant lastPositionUpdate;
    private CurrentChapter currentChapter;
    private boolean playing;
    private boolean buffering;
    private boolean seeking;
    private PlayerState preSeekState;
    private boolean loadingTrack;
    private Instant lastServerSync;
    private Double pendingSyncPosition;
    private PlayerError lastError;

    StateContext snapshot() {
        return new StateContext(
                currentState,
                Optional.ofNullable(previousState),
                Optional.ofNullable(currentTrack),
                position,
                duration,
                playbackRate,
                volume,
                Optional.ofNullable(sessionId),
                Optional.ofNullable(sessionStartTime),
                Optional.ofNullable(lastPositionUpdate),
                Optional.ofNullable(currentChapter),
                playing,
                buffering,
                seeking,
                Optional.ofNullable(preSeekState),
                loadingTrack,
                Optional.ofNullable(lastServerSync),
                Optional.ofNullable(pendingSyncPosition),
                Optional.ofNullable(lastError));
    }
}
