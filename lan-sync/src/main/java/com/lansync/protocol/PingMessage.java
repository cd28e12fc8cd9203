package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Keep-alive probe. The peer answers with a {@link PongMessage} carrying the same timestamp.
 */
@JsonTypeName("PING")
public final class PingMessage extends Message {

    private final long timestamp;

    @JsonCreator
    public PingMessage(@JsonProperty(value = "timestamp", required = true) long timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public MessageType getType() {
        return MessageType.PING;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public PongMessage reply() {
        return new PongMessage(timestamp);
    }

    @Override
    public String toString() {
        return "PingMessage{timestamp=" + timestamp + '}';
    }
}
