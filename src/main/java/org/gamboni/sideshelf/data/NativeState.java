package org.gamboni.sideshelf.data;

/** Playback state as reported by the native player itself. */
public enum NativeState {
    NONE,
    READY,
    LOADING,
    BUFFERING,
    PLAYING,
    PAUSED,
    STOPPED,
    ENDED,
    ERROR
}
