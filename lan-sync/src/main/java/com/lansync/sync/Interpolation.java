package com.lansync.sync;

import com.lansync.state.Cell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Blends two position chains of the same entity.
 *
 * The grid wraps on both axes, so a segment that stepped off one edge and came back on the
 * other looks like a jump across the whole board. Before blending, such a segment is unrolled
 * by one grid extent so the blend takes the short path, and the result is wrapped back
 * into {@code [0, extent)}.
 */
public final class Interpolation {

    private Interpolation() {
    }

    /**
     * @param before chain at the earlier snapshot, head first
     * @param after  chain at the later snapshot, head first
     * @param factor 0 reproduces {@code before}, 1 reproduces {@code after}, above 1 extrapolates
     */
    public static List<RenderPoint> interpolate(List<Cell> before, List<Cell> after, double factor,
                                                int gridWidth, int gridHeight) {
        if (before == null || before.isEmpty()) {
            return toPoints(after);
        }
        if (after == null || after.isEmpty()) {
            return toPoints(before);
        }

        int length = Math.max(before.size(), after.size());
        List<RenderPoint> result = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            if (i < before.size() && i < after.size()) {
                Cell from = before.get(i);
                Cell to = after.get(i);
                double x = blendAxis(from.getX(), to.getX(), factor, gridWidth);
                double y = blendAxis(from.getY(), to.getY(), factor, gridHeight);
                result.add(new RenderPoint(x, y));
            } else if (i < after.size()) {
                // Chain grew: new tail segments appear as soon as blending starts.
                if (factor > 0.0) {
                    result.add(RenderPoint.of(after.get(i)));
                }
            } else if (factor < 0.5) {
                // Chain shrank: old tail segments linger for the first half of the blend.
                result.add(RenderPoint.of(before.get(i)));
            }
        }
        return result;
    }

    static double blendAxis(int from, int to, double factor, int extent) {
        double start = from;
        double end = to;
        int delta = to - from;
        if (Math.abs(delta) > extent / 2) {
            if (delta > 0) {
                start += extent;
            } else {
                end += extent;
            }
        }
        return wrap(start + (end - start) * factor, extent);
    }

    static double wrap(double value, int extent) {
        double wrapped = value % extent;
        return wrapped < 0 ? wrapped + extent : wrapped;
    }

    static List<RenderPoint> toPoints(List<Cell> cells) {
        if (cells == null || cells.isEmpty()) {
            return Collections.emptyList();
        }
        List<RenderPoint> points = new ArrayList<>(cells.size());
        for (Cell cell : cells) {
            points.add(RenderPoint.of(cell));
        }
        return points;
    }
}
