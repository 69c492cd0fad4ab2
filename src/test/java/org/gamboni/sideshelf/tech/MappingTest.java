package org.gamboni.sideshelf.tech;

import com.fasterxml.jackson.databind.JsonNode;
import org.gamboni.sideshelf.data.Chapter;
import org.gamboni.sideshelf.data.NativeState;
import org.gamboni.sideshelf.data.PersistedPlayerState;
import org.gamboni.sideshelf.data.PlayerError;
import org.gamboni.sideshelf.data.PlayerEvent;
import org.gamboni.sideshelf.data.PlayerTrack;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MappingTest {
    private final Mapping mapping = new Mapping();

    @Test
    void testEventWithoutPayload() {
        assertTrue(mapping.payloadOf(new PlayerEvent.Play()).isEmpty());
        assertEquals("{\"type\":\"PLAY\"}", mapping.writeValueAsString(new PlayerEvent.Play()));
        assertEquals(new PlayerEvent.Play(), mapping.toEvent("PLAY", null));
    }

    @Test
    void testEventPayload() {
        JsonNode payload = mapping.payloadOf(new PlayerEvent.Seek(42.5)).orElseThrow();
        assertEquals(42.5, payload.get("position").asDouble());
        assertEquals(new PlayerEvent.Seek(42.5), mapping.toEvent("SEEK", payload));
    }

    @Test
    void testNestedPayload() {
        var track = new PlayerTrack("item-1", "media-1", "The Book", "An Author", Optional.of("file:///cover.jpg"),
                3600, true, List.of(new Chapter(1, "One", 0, 3600)));
        var restore = new PlayerEvent.RestoreState(new PersistedPlayerState(
                Optional.of(track), 120, 1.25, 1, true, Optional.of("session-1")));

        String json = mapping.writeValueAsString(restore);
        assertEquals(restore, mapping.readValue(json, PlayerEvent.class));

        var changed = new PlayerEvent.NativeTrackChanged(Optional.empty());
        assertEquals(changed, mapping.readValue(mapping.writeValueAsString(changed), PlayerEvent.class));
    }

    @Test
    void testOptionalFieldsMayBeMissing() {
        JsonNode payload = mapping.get().createObjectNode().put("libraryItemId", "item-1");
        assertEquals(new PlayerEvent.LoadTrack("item-1"), mapping.toEvent("LOAD_TRACK", payload));

        JsonNode error = mapping.get().createObjectNode()
                .set("error", mapping.get().createObjectNode().put("message", "boom"));
        assertEquals(new PlayerEvent.NativeError(PlayerError.of("boom")), mapping.toEvent("NATIVE_ERROR", error));
    }

    @Test
    void testEnumPayload() {
        var event = new PlayerEvent.NativeStateChanged(NativeState.BUFFERING);
        JsonNode payload = mapping.payloadOf(event).orElseThrow();
        assertEquals("BUFFERING", payload.get("state").asText());
        assertEquals(event, mapping.toEvent("NATIVE_STATE_CHANGED", payload));
    }

    @Test
    void testUnknownType() {
        var e = assertThrows(IllegalArgumentException.class, () -> mapping.toEvent("REWIND", null));
        assertTrue(e.getMessage().contains("REWIND"));
    }

    @Test
    void testMalformedPayload() {
        JsonNode payload = mapping.get().createObjectNode().put("state", "DANCING");
        assertThrows(IllegalArgumentException.class, () -> mapping.toEvent("NATIVE_STATE_CHANGED", payload));
    }
}
