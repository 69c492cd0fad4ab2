package org.gamboni.sideshelf.data;

import java.util.Optional;

/** Player state as persisted between runs, used by {@link PlayerEvent.RestoreState}. */
public record PersistedPlayerState(
        Optional<PlayerTrack> currentTrack,
        double position,
        double playbackRate,
        double volume,
        boolean playing,
        Optional<String> playSessionId) {

    public PersistedPlayerState {
        currentTrack = (currentTrack == null) ? Optional.empty() : currentTrack;
        playSessionId = (playSessionId == null) ? Optional.empty() : playSessionId;
    }
}
