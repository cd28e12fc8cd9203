package com.lansync.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An entity that will appear at {@code position} once {@code countdown} reaches zero.
 */
public final class PendingSpawn {

    private final int entityId;
    private final Cell position;
    private final int countdown;

    @JsonCreator
    public PendingSpawn(@JsonProperty(value = "id", required = true) int entityId,
                        @JsonProperty(value = "pos", required = true) Cell position,
                        @JsonProperty(value = "countdown", required = true) int countdown) {
        this.entityId = entityId;
        this.position = Objects.requireNonNull(position, "position");
        this.countdown = countdown;
    }

    @JsonProperty("id")
    public int getEntityId() {
        return entityId;
    }

    @JsonProperty("pos")
    public Cell getPosition() {
        return position;
    }

    public int getCountdown() {
        return countdown;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PendingSpawn)) {
            return false;
        }
        PendingSpawn other = (PendingSpawn) o;
        return entityId == other.entityId && countdown == other.countdown && position.equals(other.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, position, countdown);
    }

    @Override
    public String toString() {
        return "PendingSpawn{id=" + entityId + ", pos=" + position + ", countdown=" + countdown + '}';
    }
}
