package org.gamboni.sideshelf.data;

import java.util.Optional;

/**
 * Outcome of canonical position resolution.
 *
 * @param position the position playback should resume from, in seconds
 * @param source the source that produced {@code position}
 * @param authoritativePosition the position to persist locally; empty when only the in-memory store was available
 * @param asyncStoragePosition the locally persisted position as read before resolution
 */
public record ResumePositionInfo(
        double position,
        ResumeSource source,
        Optional<Double> authoritativePosition,
        Optional<Double> asyncStoragePosition) {
}
