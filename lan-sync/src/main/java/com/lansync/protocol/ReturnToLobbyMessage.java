package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("RETURN_TO_LOBBY")
public final class ReturnToLobbyMessage extends Message {

    @JsonCreator
    public ReturnToLobbyMessage() {
    }

    @Override
    public MessageType getType() {
        return MessageType.RETURN_TO_LOBBY;
    }
}
