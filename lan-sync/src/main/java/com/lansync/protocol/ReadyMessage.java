package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("READY")
public final class ReadyMessage extends Message {

    @JsonCreator
    public ReadyMessage() {
    }

    @Override
    public MessageType getType() {
        return MessageType.READY;
    }
}
