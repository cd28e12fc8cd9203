package com.lansync.sync;

import com.lansync.state.Cell;

/**
 * A possibly fractional grid position, as handed to the renderer.
 */
public final class RenderPoint {

    private final double x;
    private final double y;

    public RenderPoint(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public static RenderPoint of(Cell cell) {
        return new RenderPoint(cell.getX(), cell.getY());
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RenderPoint)) {
            return false;
        }
        RenderPoint other = (RenderPoint) o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
