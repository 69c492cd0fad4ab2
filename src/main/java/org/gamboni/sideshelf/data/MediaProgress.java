package org.gamboni.sideshelf.data;

import java.time.Instant;
import java.util.Optional;

/** Progress saved for a library item, as last synced with the server. */
public record MediaProgress(String libraryItemId, double currentTime, boolean finished, Optional<Instant> lastUpdate) {
}
