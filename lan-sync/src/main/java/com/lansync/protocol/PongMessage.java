package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("PONG")
public final class PongMessage extends Message {

    private final long timestamp;

    @JsonCreator
    public PongMessage(@JsonProperty(value = "timestamp", required = true) long timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public MessageType getType() {
        return MessageType.PONG;
    }

    /**
     * Timestamp of the PING this answers, in the sender's clock.
     */
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "PongMessage{timestamp=" + timestamp + '}';
    }
}
