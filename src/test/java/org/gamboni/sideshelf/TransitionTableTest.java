package org.gamboni.sideshelf;

import org.gamboni.sideshelf.data.CurrentChapter;
import org.gamboni.sideshelf.data.Chapter;
import org.gamboni.sideshelf.data.EventType;
import org.gamboni.sideshelf.data.NativeState;
import org.gamboni.sideshelf.data.PersistedPlayerState;
import org.gamboni.sideshelf.data.PlayerError;
import org.gamboni.sideshelf.data.PlayerEvent;
import org.gamboni.sideshelf.data.PlayerState;
import org.gamboni.sideshelf.data.TransitionValidation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransitionTableTest {

    /** One sample event of each type. */
    static final List<PlayerEvent> SAMPLES = List.of(
            new PlayerEvent.LoadTrack("item-1"),
            new PlayerEvent.Play(),
            new PlayerEvent.Pause(),
            new PlayerEvent.Stop(),
            new PlayerEvent.Seek(42),
            new PlayerEvent.SeekComplete(),
            new PlayerEvent.SetRate(1.5),
            new PlayerEvent.SetVolume(0.5),
            new PlayerEvent.RestoreState(new PersistedPlayerState(Optional.empty(), 10, 1, 1, false, Optional.empty())),
            new PlayerEvent.ReloadQueue("item-1"),
            new PlayerEvent.QueueReloaded(10),
            new PlayerEvent.AppForegrounded(),
            new PlayerEvent.AppBackgrounded(),
            new PlayerEvent.ChapterChanged(new CurrentChapter(new Chapter(1, "One", 0, 600), 12, 600)),
            new PlayerEvent.BufferingStarted(),
            new PlayerEvent.BufferingCompleted(),
            new PlayerEvent.PositionReconciled(100),
            new PlayerEvent.SessionCreated("session-1"),
            new PlayerEvent.SessionUpdated(100),
            new PlayerEvent.SessionEnded("session-1"),
            new PlayerEvent.SessionSyncStarted(),
            new PlayerEvent.SessionSyncCompleted(),
            new PlayerEvent.SessionSyncFailed(PlayerError.of("offline")),
            new PlayerEvent.NativeStateChanged(NativeState.PLAYING),
            new PlayerEvent.NativeProgressUpdated(100, 3600),
            new PlayerEvent.NativeTrackChanged(Optional.empty()),
            new PlayerEvent.NativeError(PlayerError.of("boom")),
            new PlayerEvent.NativePlaybackError("E42", "decoder failure"));

    @Test
    void testSamplesCoverEveryEventType() {
        assertEquals(EventType.values().length, SAMPLES.stream().map(PlayerEvent::type).distinct().count());
    }

    @Test
    void testValidateIsTotalAndDeterministic() {
        for (var state : PlayerState.values()) {
            for (var event : SAMPLES) {
                TransitionValidation first = TransitionTable.validate(state, event);
                assertEquals(first, TransitionTable.validate(state, event), state + " / " + event);
                assertEquals(first.allowed(), first.nextState().isPresent(), state + " / " + event);
                if (!first.allowed()) {
                    assertTrue(first.reason().isPresent(), state + " / " + event);
                }
            }
        }
    }

    @Test
    void testDuplicateLoadTrackRejected() {
        var validation = TransitionTable.validate(PlayerState.LOADING, new PlayerEvent.LoadTrack("item-2"));
        assertFalse(validation.allowed());
        assertEquals(Optional.of(TransitionTable.DUPLICATE_LOAD_REASON), validation.reason());
    }

    @Test
    void testUnlistedPairRejectedWithReason() {
        var validation = TransitionTable.validate(PlayerState.IDLE, new PlayerEvent.Play());
        assertFalse(validation.allowed());
        assertEquals(Optional.of("Event PLAY not allowed in state IDLE"), validation.reason());

        assertFalse(TransitionTable.validate(PlayerState.PLAYING, new PlayerEvent.Play()).allowed());
        assertFalse(TransitionTable.validate(PlayerState.IDLE, new PlayerEvent.Seek(10)).allowed());
        assertFalse(TransitionTable.validate(PlayerState.STOPPING, new PlayerEvent.LoadTrack("item-1")).allowed());
    }

    @Test
    void testPlaybackLifecycle() {
        assertNext(PlayerState.IDLE, new PlayerEvent.LoadTrack("item-1"), PlayerState.LOADING);
        assertNext(PlayerState.LOADING, new PlayerEvent.NativeTrackChanged(Optional.empty()), PlayerState.READY);
        assertNext(PlayerState.READY, new PlayerEvent.Play(), PlayerState.PLAYING);
        assertNext(PlayerState.PLAYING, new PlayerEvent.Pause(), PlayerState.PAUSED);
        assertNext(PlayerState.PAUSED, new PlayerEvent.Seek(10), PlayerState.SEEKING);
        assertNext(PlayerState.SEEKING, new PlayerEvent.NativeProgressUpdated(10, 3600), PlayerState.READY);
        assertNext(PlayerState.READY, new PlayerEvent.Stop(), PlayerState.IDLE);
        assertNext(PlayerState.PLAYING, new PlayerEvent.Stop(), PlayerState.STOPPING);
        assertNext(PlayerState.STOPPING, new PlayerEvent.NativeStateChanged(NativeState.STOPPED), PlayerState.IDLE);
    }

    @Test
    void testRestorationFlow() {
        var restore = new PlayerEvent.RestoreState(new PersistedPlayerState(Optional.empty(), 10, 1, 1, false, Optional.empty()));
        assertNext(PlayerState.IDLE, restore, PlayerState.IDLE);
        assertNext(PlayerState.IDLE, new PlayerEvent.ReloadQueue("item-1"), PlayerState.LOADING);
        assertNext(PlayerState.LOADING, new PlayerEvent.QueueReloaded(10), PlayerState.READY);
    }

    @Test
    void testBufferingEndsOnlyWhenNativePlays() {
        assertNext(PlayerState.PLAYING, new PlayerEvent.BufferingStarted(), PlayerState.BUFFERING);
        assertNext(PlayerState.BUFFERING, new PlayerEvent.NativeStateChanged(NativeState.BUFFERING), PlayerState.BUFFERING);
        assertNext(PlayerState.BUFFERING, new PlayerEvent.NativeStateChanged(NativeState.PLAYING), PlayerState.PLAYING);
        assertNext(PlayerState.BUFFERING, new PlayerEvent.BufferingCompleted(), PlayerState.PLAYING);
    }

    @Test
    void testNativeStateChangedKeepsPlayingAndPausedStates() {
        assertNext(PlayerState.PAUSED, new PlayerEvent.NativeStateChanged(NativeState.PLAYING), PlayerState.PAUSED);
        assertNext(PlayerState.PLAYING, new PlayerEvent.NativeStateChanged(NativeState.PAUSED), PlayerState.PLAYING);
    }

    @Test
    void testErrorRecovery() {
        assertNext(PlayerState.PLAYING, new PlayerEvent.NativePlaybackError("E1", "lost"), PlayerState.ERROR);
        assertNext(PlayerState.ERROR, new PlayerEvent.Play(), PlayerState.PLAYING);
        assertNext(PlayerState.ERROR, new PlayerEvent.LoadTrack("item-2"), PlayerState.LOADING);
        assertNext(PlayerState.ERROR, new PlayerEvent.Stop(), PlayerState.IDLE);
    }

    @ParameterizedTest
    @EnumSource(PlayerState.class)
    void testNoOpEventsKeepState(PlayerState state) {
        var validation = TransitionTable.validate(state, new PlayerEvent.PositionReconciled(10));
        assertTrue(validation.allowed());
        assertEquals(Optional.of(state), validation.nextState());
        assertEquals(Optional.of("No-op event"), validation.reason());
    }

    @ParameterizedTest
    @EnumSource(PlayerState.class)
    void testStopAlwaysAllowed(PlayerState state) {
        assertTrue(TransitionTable.validate(state, new PlayerEvent.Stop()).allowed());
    }

    @ParameterizedTest
    @EnumSource(PlayerState.class)
    void testAllowedEventsAgreesWithValidate(PlayerState state) {
        var allowed = TransitionTable.allowedEvents(state);
        for (var event : SAMPLES) {
            if (state == PlayerState.LOADING && event.type() == EventType.LOAD_TRACK) {
                continue;
            }
            assertEquals(allowed.contains(event.type()), TransitionTable.validate(state, event).allowed(),
                    state + " / " + event.type());
        }
    }

    @Test
    void testIsNoOpEvent() {
        assertTrue(TransitionTable.isNoOpEvent(EventType.NATIVE_PROGRESS_UPDATED));
        assertTrue(TransitionTable.isNoOpEvent(EventType.APP_BACKGROUNDED));
        assertFalse(TransitionTable.isNoOpEvent(EventType.PLAY));
    }

    private static void assertNext(PlayerState from, PlayerEvent event, PlayerState expected) {
        var validation = TransitionTable.validate(from, event);
        assertTrue(validation.allowed(), () -> from + " / " + event.type() + ": " + validation.reason());
        assertEquals(Optional.of(expected), validation.nextState());
    }
}
