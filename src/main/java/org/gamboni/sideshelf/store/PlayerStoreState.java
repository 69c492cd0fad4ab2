package org.gamboni.sideshelf.store;

import lombok.With;
import org.gamboni.sideshelf.data.PlayerTrack;

import java.util.Optional;

/**
 * What the UI sees of the player.
 *
 * @param nowPlayingRevision incremented each time the now-playing metadata is refreshed
 */
@With
public record PlayerStoreState(
        Optional<PlayerTrack> currentTrack,
        boolean playing,
        double position,
        boolean trackLoading,
        boolean seeking,
        double playbackRate,
        double volume,
        Optional<String> playSessionId,
        long nowPlayingRevision) {

    public static final PlayerStoreState INITIAL = new PlayerStoreState(
            Optional.empty(),
            false,
            0,
            false,
            false,
            1,
            1,
            Optional.empty(),
            0);
}
