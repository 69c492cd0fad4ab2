package org.gamboni.sideshelf.tech.media;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Commands understood by the service owning the native player.
 *
 * <p>Implementations must be idempotent and must never dispatch player events from these methods: the coordinator
 * calls them while processing an event, and the native player reports the outcome through its own events.
 */
public interface PlayerService {
    CompletableFuture<Void> executeLoadTrack(String libraryItemId, Optional<String> episodeId);

    CompletableFuture<Void> executePlay();

    CompletableFuture<Void> executePause();

    CompletableFuture<Void> executeStop();

    /** @param position target position in seconds */
    CompletableFuture<Void> executeSeek(double position);

    CompletableFuture<Void> executeSetRate(double rate);

    CompletableFuture<Void> executeSetVolume(double volume);
}
