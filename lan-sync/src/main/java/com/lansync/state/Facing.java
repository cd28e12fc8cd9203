package com.lansync.state;

/**
 * Heading of an entity on the grid.
 *
 * Screen coordinates: y grows downward, so UP is (0, -1).
 */
public enum Facing {
    UP(0, -1),
    DOWN(0, 1),
    LEFT(-1, 0),
    RIGHT(1, 0);

    private final int dx;
    private final int dy;

    Facing(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int getDx() {
        return dx;
    }

    public int getDy() {
        return dy;
    }
}
