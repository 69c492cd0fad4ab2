package org.gamboni.sideshelf.data;

import java.time.Duration;

public record EventProcessingResult(
        boolean success,
        boolean stateChanged,
        PlayerState previousState,
        PlayerState newState,
        Duration processingTime) {
}
