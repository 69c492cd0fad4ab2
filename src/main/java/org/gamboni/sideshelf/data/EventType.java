package org.gamboni.sideshelf.data;

/** Discriminator of {@link PlayerEvent} variants, also used as the event name on the wire. */
public enum EventType {
    LOAD_TRACK(PlayerEvent.LoadTrack.class),
    PLAY(PlayerEvent.Play.class),
    PAUSE(PlayerEvent.Pause.class),
    STOP(PlayerEvent.Stop.class),
    SEEK(PlayerEvent.Seek.class),
    SEEK_COMPLETE(PlayerEvent.SeekComplete.class),
    SET_RATE(PlayerEvent.SetRate.class),
    SET_VOLUME(PlayerEvent.SetVolume.class),
    RESTORE_STATE(PlayerEvent.RestoreState.class),
    RELOAD_QUEUE(PlayerEvent.ReloadQueue.class),
    QUEUE_RELOADED(PlayerEvent.QueueReloaded.class),
    APP_FOREGROUNDED(PlayerEvent.AppForegrounded.class),
    APP_BACKGROUNDED(PlayerEvent.AppBackgrounded.class),
    CHAPTER_CHANGED(PlayerEvent.ChapterChanged.class),
    BUFFERING_STARTED(PlayerEvent.BufferingStarted.class),
    BUFFERING_COMPLETED(PlayerEvent.BufferingCompleted.class),
    POSITION_RECONCILED(PlayerEvent.PositionReconciled.class),
    SESSION_CREATED(PlayerEvent.SessionCreated.class),
    SESSION_UPDATED(PlayerEvent.SessionUpdated.class),
    SESSION_ENDED(PlayerEvent.SessionEnded.class),
    SESSION_SYNC_STARTED(PlayerEvent.SessionSyncStarted.class),
    SESSION_SYNC_COMPLETED(PlayerEvent.SessionSyncCompleted.class),
    SESSION_SYNC_FAILED(PlayerEvent.SessionSyncFailed.class),
    NATIVE_STATE_CHANGED(PlayerEvent.NativeStateChanged.class),
    NATIVE_PROGRESS_UPDATED(PlayerEvent.NativeProgressUpdated.class),
    NATIVE_TRACK_CHANGED(PlayerEvent.NativeTrackChanged.class),
    NATIVE_ERROR(PlayerEvent.NativeError.class),
    NATIVE_PLAYBACK_ERROR(PlayerEvent.NativePlaybackError.class);

    private final Class<? extends PlayerEvent> eventClass;

    EventType(Class<? extends PlayerEvent> eventClass) {
        this.eventClass = eventClass;
    }

    public Class<? extends PlayerEvent> eventClass() {
        return eventClass;
    }
}
