package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Tells a client which entity it controls and, optionally, which connection slot it holds.
 */
@JsonTypeName("PLAYER_ASSIGNED")
public final class PlayerAssignedMessage extends Message {

    private final int entityId;
    private final Integer slot;

    @JsonCreator
    public PlayerAssignedMessage(@JsonProperty(value = "entityId", required = true) int entityId,
                                 @JsonProperty("slot") Integer slot) {
        this.entityId = entityId;
        this.slot = slot;
    }

    @Override
    public MessageType getType() {
        return MessageType.PLAYER_ASSIGNED;
    }

    public int getEntityId() {
        return entityId;
    }

    public Integer getSlot() {
        return slot;
    }

    @Override
    public String toString() {
        return "PlayerAssignedMessage{entityId=" + entityId + ", slot=" + slot + '}';
    }
}
