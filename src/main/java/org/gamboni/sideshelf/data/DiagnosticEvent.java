package org.gamboni.sideshelf.data;

import java.time.Instant;
import java.util.Optional;

/** What the coordinator saw when processing one event, including the context right after the update. */
public record DiagnosticEvent(
        Instant timestamp,
        PlayerEvent event,
        PlayerState currentState,
        Optional<PlayerState> nextState,
        boolean allowed,
        StateContext context) {
}
