package org.gamboni.sideshelf;

import org.gamboni.sideshelf.data.DiagnosticEvent;
import org.gamboni.sideshelf.data.EventProcessingResult;
import org.gamboni.sideshelf.data.PlayerEvent;

/** Receives notifications from the coordinator's event loop. Called on the loop's thread, so must return quickly. */
public interface CoordinatorListener {
    default void diagnostic(DiagnosticEvent diagnostic) {}

    default void eventProcessed(PlayerEvent event, EventProcessingResult result) {}

    /** Processing of {@code event} failed. The event loop carries on with the next event. */
    default void error(PlayerEvent event, Throwable error) {}
}
