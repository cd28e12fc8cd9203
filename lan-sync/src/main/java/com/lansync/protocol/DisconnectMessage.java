package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Planned disconnect. The receiving side closes the connection.
 */
@JsonTypeName("DISCONNECT")
public final class DisconnectMessage extends Message {

    private final String reason;

    @JsonCreator
    public DisconnectMessage(@JsonProperty("reason") String reason) {
        this.reason = reason;
    }

    @Override
    public MessageType getType() {
        return MessageType.DISCONNECT;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "DisconnectMessage{reason='" + reason + "'}";
    }
}
