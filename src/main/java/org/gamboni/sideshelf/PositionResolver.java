package org.gamboni.sideshelf;

import lombok.extern.slf4j.Slf4j;
import org.gamboni.sideshelf.data.ActiveSession;
import org.gamboni.sideshelf.data.MediaProgress;
import org.gamboni.sideshelf.data.ResumePositionInfo;
import org.gamboni.sideshelf.data.ResumeSource;
import org.gamboni.sideshelf.store.PlayerStore;
import org.gamboni.sideshelf.store.PositionStore;
import org.gamboni.sideshelf.store.ProgressRepository;
import org.gamboni.sideshelf.store.SessionRepository;
import org.gamboni.sideshelf.store.UserDirectory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Decides where playback of a library item should resume from.
 *
 * <p>Sources, from least to most authoritative: the position currently held by the {@link PlayerStore}, the
 * position persisted locally by the {@link PositionStore}, then the user's active listening session and saved
 * progress. Any of them may be unavailable or fail, in which case resolution carries on with the others.
 */
@Slf4j
class PositionResolver {
    private final CoordinatorConfig config;
    private final Optional<PlayerStore> playerStore;
    private final PositionStore positionStore;
    private final UserDirectory users;
    private final SessionRepository sessions;
    private final ProgressRepository progress;

    PositionResolver(CoordinatorConfig config,
                     Optional<PlayerStore> playerStore,
                     PositionStore positionStore,
                     UserDirectory users,
                     SessionRepository sessions,
                     ProgressRepository progress) {
        this.config = config;
        this.playerStore = playerStore;
        this.positionStore = positionStore;
        this.users = users;
        this.sessions = sessions;
        this.progress = progress;
    }

    private record Candidate(double position, ResumeSource source) {}

    /** Resolves the resume position, persisting it locally if it changed. Never throws. */
    ResumePositionInfo resolve(String libraryItemId) {
        Candidate chosen = new Candidate(
                lookup("player store position", () -> playerStore.map(PlayerStore::position)).orElse(0d),
                ResumeSource.STORE);

        Optional<Double> asyncStoragePosition = lookup("persisted position", positionStore::load);
        if (asyncStoragePosition.isPresent()) {
            chosen = new Candidate(asyncStoragePosition.get(), ResumeSource.ASYNC_STORAGE);
        }
        Optional<Double> persisted = asyncStoragePosition;

        Optional<String> userId = lookup("current user", users::currentUserId);
        if (userId.isPresent()) {
            Optional<ActiveSession> session = lookup("active session",
                    () -> sessions.findActiveSession(userId.get(), libraryItemId));
            Optional<MediaProgress> saved = lookup("saved progress",
                    () -> progress.findProgress(libraryItemId, userId.get()));

            if (saved.map(MediaProgress::finished).orElse(false)) {
                log.info("Item {} is finished, resuming from the beginning", libraryItemId);
                chosen = new Candidate(0, ResumeSource.SAVED_PROGRESS);
                if (clearPersisted()) {
                    persisted = Optional.empty();
                }
            } else if (session.isPresent()) {
                chosen = fromSession(session.get(), saved, asyncStoragePosition);
            } else if (saved.isPresent() && saved.get().currentTime() > 0) {
                chosen = new Candidate(saved.get().currentTime(), ResumeSource.SAVED_PROGRESS);
            }
        } else {
            log.debug("No authenticated user, skipping session and progress lookup");
        }

        Optional<Double> authoritative = (chosen.source() == ResumeSource.STORE)
                ? Optional.empty()
                : Optional.of(chosen.position());
        if (authoritative.isPresent() && !authoritative.equals(persisted)) {
            persist(authoritative.get());
        }

        log.info("Resolved position {} for item {} from {}",
                formatTime(chosen.position()), libraryItemId, chosen.source());
        return new ResumePositionInfo(chosen.position(), chosen.source(), authoritative, asyncStoragePosition);
    }

    private Candidate fromSession(ActiveSession session, Optional<MediaProgress> saved, Optional<Double> persisted) {
        double minPlausible = config.minPlausiblePosition();
        double sessionPosition = session.currentTime();
        Optional<MediaProgress> plausibleSaved = saved.filter(p -> p.currentTime() >= minPlausible);

        if (sessionPosition < minPlausible) {
            if (plausibleSaved.isPresent()) {
                log.warn("Session position {} looks like a reset, using saved progress {}",
                        formatTime(sessionPosition), formatTime(plausibleSaved.get().currentTime()));
                return new Candidate(plausibleSaved.get().currentTime(), ResumeSource.SAVED_PROGRESS);
            }
            Optional<Double> plausiblePersisted = persisted.filter(p -> p >= minPlausible);
            if (plausiblePersisted.isPresent()) {
                log.warn("Session position {} looks like a reset, using persisted position {}",
                        formatTime(sessionPosition), formatTime(plausiblePersisted.get()));
                return new Candidate(plausiblePersisted.get(), ResumeSource.ASYNC_STORAGE);
            }
            return new Candidate(sessionPosition, ResumeSource.ACTIVE_SESSION);
        }

        if (plausibleSaved.isPresent() && plausibleSaved.get().lastUpdate().isPresent()) {
            MediaProgress p = plausibleSaved.get();
            double difference = Math.abs(sessionPosition - p.currentTime());
            if (difference > config.largeDiscrepancyThreshold()) {
                // the session only wins when strictly newer
                boolean sessionIsNewer = session.updatedAt().isAfter(p.lastUpdate().get());
                log.info("Session ({}) and saved progress ({}) differ by {}, using the most recent: {}",
                        formatTime(sessionPosition), formatTime(p.currentTime()), formatTime(difference),
                        sessionIsNewer ? "session" : "saved progress");
                return sessionIsNewer
                        ? new Candidate(sessionPosition, ResumeSource.ACTIVE_SESSION)
                        : new Candidate(p.currentTime(), ResumeSource.SAVED_PROGRESS);
            }
        }
        return new Candidate(sessionPosition, ResumeSource.ACTIVE_SESSION);
    }

    private <T> Optional<T> lookup(String what, Supplier<Optional<T>> query) {
        try {
            return query.get();
        } catch (RuntimeException e) {
            log.error("Failed to read {}, falling back to other sources", what, e);
            return Optional.empty();
        }
    }

    private boolean clearPersisted() {
        try {
            positionStore.clear();
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to clear persisted position", e);
            return false;
        }
    }

    private void persist(double position) {
        try {
            positionStore.save(position);
        } catch (RuntimeException e) {
            log.error("Failed to persist position {}", formatTime(position), e);
        }
    }

    /** Formats a number of seconds as h:mm:ss, or m:ss under an hour. */
    static String formatTime(double seconds) {
        long total = Math.round(seconds);
        long h = total / 3600;
        long m = (total / 60) % 60;
        long s = total % 60;
        return (h > 0)
                ? String.format("%d:%02d:%02d", h, m, s)
                : String.format("%d:%02d", m, s);
    }
}
