package com.coedit.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Immutable unit of cross-instance fan-out.
 * <p>
 * <b>Self-echo suppression:</b> {@code originInstanceId} is the identity of the process that
 * produced the event. An instance that receives an envelope carrying its own identity has
 * already delivered it locally and discards it.
 * </p>
 * <p>
 * <b>Ordering:</b> envelopes of one document share a channel (Redis) or a partition key
 * (Kafka), so a subscriber observes them in publish order per origin.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public class Envelope {
    /**
     * Random id, used only for log correlation.
     */
    @JsonProperty("msgId")
    String msgId;

    @JsonProperty("type")
    OutboundType type;

    @JsonProperty("documentId")
    String documentId;

    @JsonProperty("originInstanceId")
    String originInstanceId;

    /**
     * Frame to hand to the receiving instance's local sessions as-is.
     */
    @JsonProperty("payload")
    ServerMessage payload;

    /**
     * Creation time in epoch millis. For updates this is the LWW timestamp.
     */
    @JsonProperty("timestamp")
    long timestamp;

    @JsonCreator
    public Envelope(
        @JsonProperty("msgId") String msgId,
        @JsonProperty("type") OutboundType type,
        @JsonProperty("documentId") String documentId,
        @JsonProperty("originInstanceId") String originInstanceId,
        @JsonProperty("payload") ServerMessage payload,
        @JsonProperty("timestamp") long timestamp
    ) {
        this.msgId = msgId;
        this.type = type;
        this.documentId = documentId;
        this.originInstanceId = originInstanceId;
        this.payload = payload;
        this.timestamp = timestamp;
    }
}
