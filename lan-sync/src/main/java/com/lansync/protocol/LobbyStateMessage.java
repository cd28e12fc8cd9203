package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;

@JsonTypeName("LOBBY_STATE")
public final class LobbyStateMessage extends Message {

    private final JsonNode settings;
    private final int connectedCount;

    @JsonCreator
    public LobbyStateMessage(@JsonProperty("settings") JsonNode settings,
                             @JsonProperty(value = "connectedCount", required = true) int connectedCount) {
        this.settings = blob(settings);
        this.connectedCount = connectedCount;
    }

    @Override
    public MessageType getType() {
        return MessageType.LOBBY_STATE;
    }

    public JsonNode getSettings() {
        return settings;
    }

    public int getConnectedCount() {
        return connectedCount;
    }

    @Override
    public String toString() {
        return "LobbyStateMessage{connectedCount=" + connectedCount + '}';
    }
}
