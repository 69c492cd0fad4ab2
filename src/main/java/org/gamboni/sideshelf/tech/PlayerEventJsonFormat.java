package org.gamboni.sideshelf.tech;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.gamboni.sideshelf.data.EventType;
import org.gamboni.sideshelf.data.PlayerEvent;

import java.io.IOException;
import java.util.Optional;

/** Represents {@link PlayerEvent} instances as {@code {"type": ..., "payload": {...}}} objects. */
public class PlayerEventJsonFormat {
    /** Maps payload records; must not have this format registered, as payloads are events themselves. */
    private final ObjectMapper payloadMapper;

    public PlayerEventJsonFormat(ObjectMapper payloadMapper) {
        this.payloadMapper = payloadMapper;
    }

    public SimpleModule jacksonModule() {
        return new SimpleModule()
                .addSerializer(new StdSerializer<>(PlayerEvent.class) {
                    @Override
                    public void serialize(PlayerEvent value, JsonGenerator gen, SerializerProvider provider) throws IOException {
                        gen.writeStartObject();
                        gen.writeStringField("type", value.type().name());
                        Optional<JsonNode> payload = payloadOf(value);
                        if (payload.isPresent()) {
                            gen.writeFieldName("payload");
                            gen.writeTree(payload.get());
                        }
                        gen.writeEndObject();
                    }
                })
                .addDeserializer(PlayerEvent.class, new StdDeserializer<PlayerEvent>(PlayerEvent.class) {
                    @Override
                    public PlayerEvent deserialize(JsonParser p, DeserializationContext ctxt) throws IOException, JacksonException {
                        JsonNode node = p.readValueAsTree();
                        return toEvent(node.path("type").asText(), node.get("payload"));
                    }
                });
    }

    public Optional<JsonNode> payloadOf(PlayerEvent event) {
        ObjectNode payload = payloadMapper.valueToTree(event);
        return payload.isEmpty() ? Optional.empty() : Optional.of(payload);
    }

    public PlayerEvent toEvent(String type, JsonNode payload) {
        EventType eventType;
        try {
            eventType = EventType.valueOf(type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event type '" + type + "'", e);
        }
        JsonNode body = (payload == null || payload.isNull()) ? payloadMapper.createObjectNode() : payload;
        try {
            return payloadMapper.treeToValue(body, eventType.eventClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed " + type + " payload: " + body, e);
        }
    }
}
