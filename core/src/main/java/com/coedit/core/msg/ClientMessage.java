package com.coedit.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Frame received from a client.
 * <p>
 * Which fields are populated depends on {@link #type}:
 * <ul>
 *   <li>{@code update}: {@code data.content}, {@code timestamp}</li>
 *   <li>{@code cursor}: {@code position}, optional {@code selection}</li>
 *   <li>{@code chat}: {@code message}</li>
 *   <li>{@code ping}: nothing</li>
 * </ul>
 * </p>
 */
@Value
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientMessage {
    @JsonProperty("type")
    InboundType type;

    @JsonProperty("data")
    ContentData data;

    @JsonProperty("message")
    String message;

    /**
     * Editor-specific caret location, passed through untouched.
     */
    @JsonProperty("position")
    JsonNode position;

    @JsonProperty("selection")
    JsonNode selection;

    /**
     * Client clock in epoch millis; may be absent.
     */
    @JsonProperty("timestamp")
    Long timestamp;

    @JsonCreator
    public ClientMessage(
        @JsonProperty("type") InboundType type,
        @JsonProperty("data") ContentData data,
        @JsonProperty("message") String message,
        @JsonProperty("position") JsonNode position,
        @JsonProperty("selection") JsonNode selection,
        @JsonProperty("timestamp") Long timestamp
    ) {
        this.type = type;
        this.data = data;
        this.message = message;
        this.position = position;
        this.selection = selection;
        this.timestamp = timestamp;
    }
}
