package com.lexsim.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Envelope for node-to-node messages.
 * <p>
 * <b>Ordering guarantee:</b> a channel delivers messages to a node in enqueue order,
 * targeted and broadcast messages interleaved as they arrived.
 * </p>
 * <p>
 * <b>Identity:</b> {@code id} is strictly increasing per channel, starting at 0, and never reused.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class Message {
    @JsonProperty("id")
    long id;

    /**
     * Sending node.
     */
    @JsonProperty("source")
    int source;

    /**
     * Target node, or {@code null} for a broadcast.
     */
    @JsonProperty("destination")
    Integer destination;

    @JsonProperty("payload")
    Payload payload;

    /**
     * Enqueue time in seconds since the epoch.
     */
    @JsonProperty("timestamp")
    long timestamp;

    @JsonCreator
    public Message(
        @JsonProperty("id") long id,
        @JsonProperty("source") int source,
        @JsonProperty("destination") Integer destination,
        @JsonProperty("payload") Payload payload,
        @JsonProperty("timestamp") long timestamp
    ) {
        this.id = id;
        this.source = source;
        this.destination = destination;
        this.payload = Objects.requireNonNull(payload, "payload");
        this.timestamp = timestamp;
    }

    @JsonIgnore
    public boolean isBroadcast() {
        return destination == null;
    }

    /**
     * Whether {@code nodeId} may receive this message: it is addressed to the node or broadcast.
     */
    public boolean isVisibleTo(int nodeId) {
        return destination == null || destination == nodeId;
    }
}
