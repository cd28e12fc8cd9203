package com.lansync.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Authoritative state of one entity at one tick.
 *
 * The position is an ordered chain of cells, head first. A single-cell entity is a chain
 * of length one.
 *
 * JSON format:
 * {
 *     "id": 0,
 *     "pos": [[3, 3], [2, 3]],
 *     "facing": "RIGHT",
 *     "active": true,
 *     "meta": 3
 * }
 */
public final class EntitySnapshot {

    private final int entityId;
    private final List<Cell> positions;
    private final Facing facing;
    private final boolean active;
    private final int meta;

    @JsonCreator
    public EntitySnapshot(@JsonProperty(value = "id", required = true) int entityId,
                          @JsonProperty(value = "pos", required = true) List<Cell> positions,
                          @JsonProperty(value = "facing", required = true) Facing facing,
                          @JsonProperty(value = "active", required = true) boolean active,
                          @JsonProperty("meta") Integer meta) {
        this.entityId = entityId;
        this.positions = List.copyOf(Objects.requireNonNull(positions, "positions"));
        this.facing = Objects.requireNonNull(facing, "facing");
        this.active = active;
        this.meta = meta != null ? meta : 0;
    }

    public EntitySnapshot(int entityId, List<Cell> positions, Facing facing, boolean active) {
        this(entityId, positions, facing, active, 0);
    }

    @JsonProperty("id")
    public int getEntityId() {
        return entityId;
    }

    @JsonProperty("pos")
    public List<Cell> getPositions() {
        return positions;
    }

    public Facing getFacing() {
        return facing;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Small per-entity counter owned by the simulation, e.g. remaining lives.
     */
    public int getMeta() {
        return meta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EntitySnapshot)) {
            return false;
        }
        EntitySnapshot other = (EntitySnapshot) o;
        return entityId == other.entityId
                && active == other.active
                && meta == other.meta
                && facing == other.facing
                && positions.equals(other.positions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, positions, facing, active, meta);
    }

    @Override
    public String toString() {
        return "EntitySnapshot{" +
                "id=" + entityId +
                ", pos=" + positions +
                ", facing=" + facing +
                ", active=" + active +
                ", meta=" + meta +
                '}';
    }
}
