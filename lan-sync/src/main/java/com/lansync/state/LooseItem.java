package com.lansync.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An item lying on the grid, e.g. food. The kind is opaque to the sync layer.
 */
public final class LooseItem {

    private final Cell position;
    private final String kind;

    @JsonCreator
    public LooseItem(@JsonProperty(value = "pos", required = true) Cell position,
                     @JsonProperty(value = "kind", required = true) String kind) {
        this.position = Objects.requireNonNull(position, "position");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @JsonProperty("pos")
    public Cell getPosition() {
        return position;
    }

    public String getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LooseItem)) {
            return false;
        }
        LooseItem other = (LooseItem) o;
        return position.equals(other.position) && kind.equals(other.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, kind);
    }

    @Override
    public String toString() {
        return "LooseItem{pos=" + position + ", kind='" + kind + "'}";
    }
}
