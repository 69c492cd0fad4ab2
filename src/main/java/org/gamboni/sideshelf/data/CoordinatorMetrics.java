package org.gamboni.sideshelf.data;

import java.time.Instant;
import java.util.Optional;

/**
 * @param avgEventProcessingTime moving average over the most recent events, in milliseconds
 */
public record CoordinatorMetrics(
        int eventQueueLength,
        double avgEventProcessingTime,
        long totalEventsProcessed,
        long stateTransitionCount,
        long rejectedTransitionCount,
        long positionReconciliationCount,
        Optional<Instant> lastEventTimestamp) {
}
