package org.gamboni.sideshelf.store;

import org.gamboni.sideshelf.data.PlayerTrack;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/** Observable player state read by the UI. The coordinator only writes to it, apart from reading the position
 * when resolving where to resume. */
public interface PlayerStore {
    double position();

    void updatePosition(double position);

    void updatePlayingState(boolean playing);

    void setCurrentTrack(Optional<PlayerTrack> track);

    void setTrackLoading(boolean loading);

    void setSeeking(boolean seeking);

    void setPlaybackRate(double rate);

    void setVolume(double volume);

    void setPlaySessionId(Optional<String> sessionId);

    /** Refresh the metadata shown on the lock screen and in notifications. */
    CompletableFuture<Void> updateNowPlayingMetadata();
}
