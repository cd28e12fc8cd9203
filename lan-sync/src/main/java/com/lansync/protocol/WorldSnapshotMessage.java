package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.lansync.state.WorldSnapshot;

import java.util.Objects;

/**
 * Carries one host tick to the clients. The tick lives inside the snapshot.
 */
@JsonTypeName("WORLD_SNAPSHOT")
public final class WorldSnapshotMessage extends Message {

    private final WorldSnapshot snapshot;

    @JsonCreator
    public WorldSnapshotMessage(@JsonProperty(value = "snapshot", required = true) WorldSnapshot snapshot) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    }

    @Override
    public MessageType getType() {
        return MessageType.WORLD_SNAPSHOT;
    }

    public WorldSnapshot getSnapshot() {
        return snapshot;
    }

    @JsonIgnore
    public long getTick() {
        return snapshot.getTick();
    }

    @Override
    public String toString() {
        return "WorldSnapshotMessage{" + snapshot + '}';
    }
}
