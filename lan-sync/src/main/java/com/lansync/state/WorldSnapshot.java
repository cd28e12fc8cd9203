package com.lansync.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One authoritative, complete description of the world at a given tick.
 *
 * Produced once per host tick, carried by a {@code WORLD_SNAPSHOT} message and buffered on
 * the client. Immutable: every list is copied on construction, so a snapshot can be handed
 * from the network thread to the render thread without further synchronization.
 *
 * JSON format:
 * {
 *     "tick": 42,
 *     "entities": [ {"id": 0, "pos": [[3, 3]], "facing": "RIGHT", "active": true, "meta": 3} ],
 *     "looseItems": [ {"pos": [5, 5], "kind": "apple"} ],
 *     "pendingSpawns": [ {"id": 1, "pos": [7, 7], "countdown": 30} ]
 * }
 */
public final class WorldSnapshot {

    private final long tick;
    private final List<EntitySnapshot> entities;
    private final List<LooseItem> looseItems;
    private final List<PendingSpawn> pendingSpawns;

    @JsonCreator
    public WorldSnapshot(@JsonProperty(value = "tick", required = true) long tick,
                         @JsonProperty("entities") List<EntitySnapshot> entities,
                         @JsonProperty("looseItems") List<LooseItem> looseItems,
                         @JsonProperty("pendingSpawns") List<PendingSpawn> pendingSpawns) {
        this.tick = tick;
        this.entities = entities != null ? List.copyOf(entities) : List.of();
        this.looseItems = looseItems != null ? List.copyOf(looseItems) : List.of();
        this.pendingSpawns = pendingSpawns != null ? List.copyOf(pendingSpawns) : List.of();
    }

    public long getTick() {
        return tick;
    }

    public List<EntitySnapshot> getEntities() {
        return entities;
    }

    public List<LooseItem> getLooseItems() {
        return looseItems;
    }

    public List<PendingSpawn> getPendingSpawns() {
        return pendingSpawns;
    }

    /**
     * Finds the entity with the given id in this snapshot.
     */
    public Optional<EntitySnapshot> findEntity(int entityId) {
        for (EntitySnapshot entity : entities) {
            if (entity.getEntityId() == entityId) {
                return Optional.of(entity);
            }
        }
        return Optional.empty();
    }

    public static Builder builder(long tick) {
        return new Builder(tick);
    }

    public static class Builder {
        private final long tick;
        private final List<EntitySnapshot> entities = new ArrayList<>();
        private final List<LooseItem> looseItems = new ArrayList<>();
        private final List<PendingSpawn> pendingSpawns = new ArrayList<>();

        private Builder(long tick) {
            this.tick = tick;
        }

        public Builder entity(EntitySnapshot entity) {
            entities.add(entity);
            return this;
        }

        public Builder looseItem(LooseItem item) {
            looseItems.add(item);
            return this;
        }

        public Builder pendingSpawn(PendingSpawn spawn) {
            pendingSpawns.add(spawn);
            return this;
        }

        public WorldSnapshot build() {
            return new WorldSnapshot(tick, entities, looseItems, pendingSpawns);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorldSnapshot)) {
            return false;
        }
        WorldSnapshot other = (WorldSnapshot) o;
        return tick == other.tick
                && entities.equals(other.entities)
                && looseItems.equals(other.looseItems)
                && pendingSpawns.equals(other.pendingSpawns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tick, entities, looseItems, pendingSpawns);
    }

    @Override
    public String toString() {
        return "WorldSnapshot{" +
                "tick=" + tick +
                ", entities=" + entities.size() +
                ", looseItems=" + looseItems.size() +
                ", pendingSpawns=" + pendingSpawns.size() +
                '}';
    }
}
