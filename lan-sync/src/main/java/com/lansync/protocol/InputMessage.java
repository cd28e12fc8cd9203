package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.lansync.state.Facing;

import java.util.Objects;

/**
 * Direction change requested by a client for the entity it controls.
 */
@JsonTypeName("INPUT")
public final class InputMessage extends Message {

    private final int entityId;
    private final Facing direction;

    @JsonCreator
    public InputMessage(@JsonProperty(value = "entityId", required = true) int entityId,
                        @JsonProperty(value = "direction", required = true) Facing direction) {
        this.entityId = entityId;
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    @Override
    public MessageType getType() {
        return MessageType.INPUT;
    }

    public int getEntityId() {
        return entityId;
    }

    public Facing getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return "InputMessage{entityId=" + entityId + ", direction=" + direction + '}';
    }
}
