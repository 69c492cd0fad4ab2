package org.gamboni.sideshelf;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import org.gamboni.sideshelf.data.CoordinatorMetrics;
import org.gamboni.sideshelf.data.DiagnosticEvent;
import org.gamboni.sideshelf.data.TransitionHistoryEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Counters and bounded histories of the coordinator. Written by the event loop, read by anybody. */
class CoordinatorDiagnostics {
    private final EvictingQueue<Duration> processingTimes;
    private final EvictingQueue<TransitionHistoryEntry> transitionHistory;
    private final EvictingQueue<DiagnosticEvent> recentDiagnostics;

    private long totalEventsProcessed;
    private long stateTransitionCount;
    private long rejectedTransitionCount;
    private long positionReconciliationCount;
    private Instant lastEventTimestamp;

    CoordinatorDiagnostics(int historySize) {
        this.processingTimes = EvictingQueue.create(historySize);
        this.transitionHistory = EvictingQueue.create(historySize);
        this.recentDiagnostics = EvictingQueue.create(historySize);
    }

    synchronized void recordEvent(DiagnosticEvent diagnostic, TransitionHistoryEntry entry) {
        recentDiagnostics.add(diagnostic);
        transitionHistory.add(entry);
    }

    synchronized void recordTransition() {
        stateTransitionCount++;
    }

    synchronized void recordRejection() {
        rejectedTransitionCount++;
    }

    synchronized void recordReconciliation() {
        positionReconciliationCount++;
    }

    synchronized void recordProcessed(Instant timestamp, Duration processingTime) {
        processingTimes.add(processingTime);
        totalEventsProcessed++;
        lastEventTimestamp = timestamp;
    }

    synchronized CoordinatorMetrics metrics(int eventQueueLength) {
        return new CoordinatorMetrics(
                eventQueueLength,
                processingTimes.stream()
                        .mapToDouble(time -> time.toNanos() / 1_000_000d)
                        .average()
                        .orElse(0),
                totalEventsProcessed,
                stateTransitionCount,
                rejectedTransitionCount,
                positionReconciliationCount,
                Optional.ofNullable(lastEventTimestamp));
    }

    synchronized List<Duration> processingTimes() {
        return ImmutableList.copyOf(processingTimes);
    }

    synchronized List<TransitionHistoryEntry> transitionHistory() {
        return ImmutableList.copyOf(transitionHistory);
    }

    synchronized List<DiagnosticEvent> recentDiagnostics() {
        return ImmutableList.copyOf(recentDiagnostics);
    }
}
