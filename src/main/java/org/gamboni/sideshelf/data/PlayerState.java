package org.gamboni.sideshelf.data;

/** States of the player state machine. There is no terminal state: {@link #STOPPING} always returns to {@link #IDLE}. */
public enum PlayerState {
    /** No track loaded. */
    IDLE,
    /** Loading track metadata and files. */
    LOADING,
    /** Track loaded, ready to play. */
    READY,
    PLAYING,
    PAUSED,
    /** A seek is in progress; the state it interrupted is kept in {@link StateContext#preSeekState()}. */
    SEEKING,
    /** Waiting for audio data. */
    BUFFERING,
    STOPPING,
    /** Recoverable error. */
    ERROR
}
