package org.gamboni.sideshelf.store;

import com.google.common.util.concurrent.MoreExecutors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.gamboni.sideshelf.data.PlayerTrack;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * In-memory {@link PlayerStore}. Each update that changes something gets a new stamp and is pushed to listeners,
 * so that a listener which missed some updates can tell.
 */
@Slf4j
public class PlayerHistoryStore implements PlayerStore {

    /** A state published to listeners, with the stamp of the update that produced it. */
    public record Stamped(long stamp, PlayerStoreState state) {}

    private final List<Consumer<Stamped>> listeners = new CopyOnWriteArrayList<>();
    private final Executor metadataExecutor;

    private long stamp = 0;
    @Getter
    private volatile PlayerStoreState state = PlayerStoreState.INITIAL;

    public PlayerHistoryStore() {
        this(MoreExecutors.directExecutor());
    }

    public PlayerHistoryStore(Executor metadataExecutor) {
        this.metadataExecutor = metadataExecutor;
    }

    public synchronized long getStamp() {
        return stamp;
    }

    public Runnable addListener(Consumer<Stamped> listener) {
        Consumer<Stamped> registration = listener::accept;
        listeners.add(registration);
        return () -> listeners.remove(registration);
    }

    public class UpdateSession {
        private PlayerStoreState pending;

        private UpdateSession(PlayerStoreState initial) {
            this.pending = initial;
        }

        public void setCurrentTrack(Optional<PlayerTrack> track) {
            pending = pending.withCurrentTrack(track);
        }

        public void setPlaying(boolean playing) {
            pending = pending.withPlaying(playing);
        }

        public void setPosition(double position) {
            pending = pending.withPosition(position);
        }

        public void setTrackLoading(boolean loading) {
            pending = pending.withTrackLoading(loading);
        }

        public void setSeeking(boolean seeking) {
            pending = pending.withSeeking(seeking);
        }

        public void setPlaybackRate(double rate) {
            pending = pending.withPlaybackRate(rate);
        }

        public void setVolume(double volume) {
            pending = pending.withVolume(volume);
        }

        public void setPlaySessionId(Optional<String> sessionId) {
            pending = pending.withPlaySessionId(sessionId);
        }

        private void bumpNowPlayingRevision() {
            pending = pending.withNowPlayingRevision(pending.nowPlayingRevision() + 1);
        }
    }

    /** Apply the given changes atomically. Listeners are only notified if the state actually changed. */
    public synchronized void update(Consumer<UpdateSession> work) {
        var session = new UpdateSession(state);
        work.accept(session);
        if (session.pending.equals(state)) {
            return;
        }
        this.state = session.pending;
        var published = new Stamped(++stamp, state);
        for (var listener : listeners) {
            try {
                listener.accept(published);
            } catch (RuntimeException e) {
                log.error("Store listener failed at stamp {}", published.stamp(), e);
            }
        }
    }

    @Override
    public double position() {
        return state.position();
    }

    @Override
    public void updatePosition(double position) {
        update(s -> s.setPosition(position));
    }

    @Override
    public void updatePlayingState(boolean playing) {
        update(s -> s.setPlaying(playing));
    }

    @Override
    public void setCurrentTrack(Optional<PlayerTrack> track) {
        update(s -> s.setCurrentTrack(track));
    }

    @Override
    public void setTrackLoading(boolean loading) {
        update(s -> s.setTrackLoading(loading));
    }

    @Override
    public void setSeeking(boolean seeking) {
        update(s -> s.setSeeking(seeking));
    }

    @Override
    public void setPlaybackRate(double rate) {
        update(s -> s.setPlaybackRate(rate));
    }

    @Override
    public void setVolume(double volume) {
        update(s -> s.setVolume(volume));
    }

    @Override
    public void setPlaySessionId(Optional<String> sessionId) {
        update(s -> s.setPlaySessionId(sessionId));
    }

    @Override
    public CompletableFuture<Void> updateNowPlayingMetadata() {
        return CompletableFuture.runAsync(() -> update(UpdateSession::bumpNowPlayingRevision), metadataExecutor);
    }
}
