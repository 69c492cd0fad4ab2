package org.gamboni.sideshelf.tech;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.gamboni.sideshelf.data.PlayerEvent;

import java.util.Optional;
import java.util.function.Supplier;

/** Helper object for mapping data to and from JSON, with special handling of {@link PlayerEvent}s which are
 * represented by their type name and a payload object.
 */
public class Mapping implements Supplier<ObjectMapper> {
    private final ObjectMapper jacksonMapper;
    private final PlayerEventJsonFormat eventFormat;

    public Mapping() {
        this.eventFormat = new PlayerEventJsonFormat(baseMapper());
        this.jacksonMapper = baseMapper().registerModule(eventFormat.jacksonModule());
    }

    private static ObjectMapper baseMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                // Messages may come from a context running a different version of the app: don't crash on junk
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                // payload-less events are empty records
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
    }

    /** Payload of the given event, or empty if the event carries none. */
    public Optional<JsonNode> payloadOf(PlayerEvent event) {
        return eventFormat.payloadOf(event);
    }

    /** Rebuild an event from its wire representation.
     *
     * @throws IllegalArgumentException if the type is unknown or the payload does not match it
     */
    public PlayerEvent toEvent(String type, JsonNode payload) {
        return eventFormat.toEvent(type, payload);
    }

    public String writeValueAsString(Object payload) {
        try {
            return jacksonMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    public <T> T readValue(String text, Class<T> type) {
        try {
            return jacksonMapper.readValue(text, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public ObjectMapper get() {
        return this.jacksonMapper;
    }
}
