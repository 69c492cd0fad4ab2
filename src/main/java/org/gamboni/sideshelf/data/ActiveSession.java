package org.gamboni.sideshelf.data;

import java.time.Instant;

/** A local listening session still open for a library item. */
public record ActiveSession(String sessionId, String libraryItemId, double currentTime, Instant updatedAt) {
}
