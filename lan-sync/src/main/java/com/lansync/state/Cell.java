package com.lansync.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One integer grid cell.
 *
 * Serialized as a two-element array, e.g. {@code [3, 7]}, to keep snapshots small. Arrays
 * of any other length are rejected.
 */
public final class Cell {

    private final int x;
    private final int y;

    public Cell(int x, int y) {
        this.x = x;
        this.y = y;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Cell fromArray(int[] xy) {
        if (xy.length != 2) {
            throw new IllegalArgumentException("A cell is [x, y], got " + xy.length + " elements");
        }
        return new Cell(xy[0], xy[1]);
    }

    @JsonValue
    public int[] toArray() {
        return new int[]{x, y};
    }

    public static Cell of(int x, int y) {
        return new Cell(x, y);
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    /**
     * Returns the neighbouring cell one step towards {@code facing}, wrapped onto a
     * {@code width x height} grid.
     */
    public Cell step(Facing facing, int width, int height) {
        return new Cell(Math.floorMod(x + facing.getDx(), width),
                Math.floorMod(y + facing.getDy(), height));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        Cell other = (Cell) o;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "[" + x + "," + y + "]";
    }
}
