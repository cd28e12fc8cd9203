package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Base of every message on the game link.
 *
 * The set of messages is closed: one final subclass per {@link MessageType}, each
 * immutable once constructed so it can cross from the I/O thread to the caller's thread
 * without copying. The {@code "type"} property is the discriminant on the wire.
 *
 * JSON format (one per line):
 * {"type":"INPUT","entityId":1,"direction":"UP"}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(InputMessage.class),
        @JsonSubTypes.Type(ReadyMessage.class),
        @JsonSubTypes.Type(WorldSnapshotMessage.class),
        @JsonSubTypes.Type(GameStartMessage.class),
        @JsonSubTypes.Type(GameEndMessage.class),
        @JsonSubTypes.Type(PlayerAssignedMessage.class),
        @JsonSubTypes.Type(LobbyStateMessage.class),
        @JsonSubTypes.Type(ReturnToLobbyMessage.class),
        @JsonSubTypes.Type(PingMessage.class),
        @JsonSubTypes.Type(PongMessage.class),
        @JsonSubTypes.Type(DisconnectMessage.class)
})
public abstract class Message {

    Message() {
    }

    @JsonIgnore
    public abstract MessageType getType();

    /**
     * Optional JSON blobs arrive as {@code NullNode} when sent as explicit nulls.
     */
    static JsonNode blob(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{type=" + getType() + '}';
    }
}
