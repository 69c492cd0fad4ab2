package org.gamboni.sideshelf.data;

import java.time.Duration;
import java.util.List;

/** Everything the coordinator knows about itself, for export to a bug report. */
public record DiagnosticsReport(
        StateContext context,
        CoordinatorMetrics metrics,
        List<PlayerEvent> eventQueue,
        List<Duration> processingTimes,
        List<TransitionHistoryEntry> transitionHistory,
        List<DiagnosticEvent> recentDiagnostics,
        boolean observerMode) {
}
