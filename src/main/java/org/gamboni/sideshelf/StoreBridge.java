package org.gamboni.sideshelf;

import lombok.extern.slf4j.Slf4j;
import org.gamboni.sideshelf.data.StateContext;
import org.gamboni.sideshelf.store.PlayerStore;

import java.util.Objects;
import java.util.Optional;

/**
 * Projects the coordinator's state into the UI's {@link PlayerStore}.
 *
 * <p>Best effort: the store is absent in the headless context and may fail at any time, which must never affect
 * event processing.
 */
@Slf4j
class StoreBridge {
    private final Optional<PlayerStore> store;

    /** Last chapter the now-playing metadata was refreshed for. Only accessed from the event loop. */
    private Long lastSyncedChapterId;

    StoreBridge(Optional<PlayerStore> store) {
        this.store = store;
    }

    /** Lightweight update for progress ticks, which arrive every second or so. */
    void syncPosition(StateContext context) {
        store.ifPresent(s -> {
            try {
                s.updatePosition(context.position());
                refreshMetadataOnChapterChange(s, context);
            } catch (RuntimeException e) {
                log.debug("Player store unavailable, position not synced", e);
            }
        });
    }

    /** Full update of every field the UI observes. */
    void syncState(StateContext context) {
        store.ifPresent(s -> {
            try {
                s.setCurrentTrack(context.currentTrack());
                s.updatePlayingState(context.playing());
                s.updatePosition(context.position());
                s.setTrackLoading(context.loadingTrack());
                s.setSeeking(context.seeking());
                s.setPlaybackRate(context.playbackRate());
                s.setVolume(context.volume());
                s.setPlaySessionId(context.sessionId());
                refreshMetadataOnChapterChange(s, context);
            } catch (RuntimeException e) {
                log.debug("Player store unavailable, state not synced", e);
            }
        });
    }

    private void refreshMetadataOnChapterChange(PlayerStore s, StateContext context) {
        Long chapterId = context.currentChapterId().orElse(null);
        if (chapterId == null || Objects.equals(chapterId, lastSyncedChapterId)) {
            return;
        }
        lastSyncedChapterId = chapterId;
        s.updateNowPlayingMetadata().whenComplete((result, error) -> {
            if (error != null) {
                log.error("Failed to update now playing metadata", error);
            }
        });
    }
}
