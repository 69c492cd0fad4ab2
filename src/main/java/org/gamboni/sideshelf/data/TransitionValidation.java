package org.gamboni.sideshelf.data;

import java.util.Optional;

/**
 * Result of validating an event against the transition table.
 *
 * @param nextState the state after the event; equal to the current state for no-op transitions, empty when rejected
 * @param reason why the event was rejected, or a note for no-op events
 */
public record TransitionValidation(boolean allowed, Optional<PlayerState> nextState, Optional<String> reason) {

    public static TransitionValidation allowed(PlayerState nextState) {
        return new TransitionValidation(true, Optional.of(nextState), Optional.empty());
    }

    public static TransitionValidation noOp(PlayerState currentState) {
        return new TransitionValidation(true, Optional.of(currentState), Optional.of("No-op event"));
    }

    public static TransitionValidation rejected(String reason) {
        return new TransitionValidation(false, Optional.empty(), Optional.of(reason));
    }
}
