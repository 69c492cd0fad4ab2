package org.gamboni.sideshelf.data;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public record TransitionHistoryEntry(
        Instant timestamp,
        PlayerEvent event,
        PlayerState fromState,
        Optional<PlayerState> toState,
        boolean allowed,
        Optional<String> reason,
        Duration processingTime) {
}
