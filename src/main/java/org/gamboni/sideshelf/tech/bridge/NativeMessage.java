package org.gamboni.sideshelf.tech.bridge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A player event as it crosses the native layer between execution contexts.
 *
 * @param type the {@link org.gamboni.sideshelf.data.EventType} name
 * @param payload event payload, null for events without one
 * @param contextId id of the context that sent the message
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NativeMessage(String type, JsonNode payload, String contextId) {
}
