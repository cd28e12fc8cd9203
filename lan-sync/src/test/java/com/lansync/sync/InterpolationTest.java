package com.lansync.sync;

import com.lansync.state.Cell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Interpolation Tests")
class InterpolationTest {

    private static final int GRID = 15;

    private static List<RenderPoint> blend(List<Cell> before, List<Cell> after, double factor) {
        return Interpolation.interpolate(before, after, factor, GRID, GRID);
    }

    @Test
    @DisplayName("Factor 0 and 1 should reproduce the endpoints")
    void testIdentity() {
        List<Cell> before = List.of(Cell.of(3, 3), Cell.of(2, 3));
        List<Cell> after = List.of(Cell.of(4, 3), Cell.of(3, 3));

        assertEquals(List.of(new RenderPoint(3, 3), new RenderPoint(2, 3)), blend(before, after, 0.0));
        assertEquals(List.of(new RenderPoint(4, 3), new RenderPoint(3, 3)), blend(before, after, 1.0));
    }

    @Test
    @DisplayName("Should blend linearly in between")
    void testMidpoint() {
        List<RenderPoint> points = blend(List.of(Cell.of(3, 3)), List.of(Cell.of(4, 5)), 0.5);

        assertEquals(List.of(new RenderPoint(3.5, 4)), points);
    }

    @Test
    @DisplayName("Crossing the right edge should take the short path")
    void testWrapRightEdge() {
        List<RenderPoint> points = blend(List.of(Cell.of(14, 7)), List.of(Cell.of(0, 7)), 0.5);

        assertEquals(14.5, points.get(0).getX(), 1e-9);
        assertEquals(7.0, points.get(0).getY(), 1e-9);
    }

    @Test
    @DisplayName("Crossing the left edge should take the short path")
    void testWrapLeftEdge() {
        List<RenderPoint> points = blend(List.of(Cell.of(0, 7)), List.of(Cell.of(14, 7)), 0.5);

        assertEquals(14.5, points.get(0).getX(), 1e-9);
    }

    @Test
    @DisplayName("Moving from x=1 to x=W-2 should land near an edge, not mid-grid")
    void testWrapOneToWidthMinusTwo() {
        double forward = blend(List.of(Cell.of(1, 7)), List.of(Cell.of(GRID - 2, 7)), 0.5).get(0).getX();
        double backward = blend(List.of(Cell.of(GRID - 2, 7)), List.of(Cell.of(1, 7)), 0.5).get(0).getX();

        for (double x : new double[]{forward, backward}) {
            assertTrue(x <= 1.0 || x >= GRID - 1.0, "x=" + x + " should be within 1 unit of an edge");
        }
        assertEquals(14.5, forward, 1e-9);
    }

    @Test
    @DisplayName("Crossing the top edge should take the short path")
    void testWrapVertical() {
        List<RenderPoint> quarter = blend(List.of(Cell.of(5, 0)), List.of(Cell.of(5, 14)), 0.25);
        List<RenderPoint> end = blend(List.of(Cell.of(5, 14)), List.of(Cell.of(5, 0)), 1.0);

        assertEquals(14.75, quarter.get(0).getY(), 1e-9);
        assertEquals(0.0, end.get(0).getY(), 1e-9);
    }

    @Test
    @DisplayName("Results should always stay inside the grid")
    void testResultsInBounds() {
        for (double factor = 0.0; factor <= 1.5; factor += 0.1) {
            for (RenderPoint p : blend(List.of(Cell.of(14, 0)), List.of(Cell.of(0, 14)), factor)) {
                assertTrue(p.getX() >= 0 && p.getX() < GRID, "x=" + p.getX());
                assertTrue(p.getY() >= 0 && p.getY() < GRID, "y=" + p.getY());
            }
        }
    }

    @Test
    @DisplayName("Factors above 1 should continue the motion")
    void testExtrapolation() {
        List<RenderPoint> points = blend(List.of(Cell.of(3, 3)), List.of(Cell.of(4, 3)), 1.5);

        assertEquals(new RenderPoint(4.5, 3), points.get(0));
    }

    @Test
    @DisplayName("A grown chain should show its new tail once blending starts")
    void testGrowingChain() {
        List<Cell> before = List.of(Cell.of(3, 3));
        List<Cell> after = List.of(Cell.of(4, 3), Cell.of(3, 3));

        assertEquals(1, blend(before, after, 0.0).size());
        List<RenderPoint> points = blend(before, after, 0.3);
        assertEquals(2, points.size());
        assertEquals(new RenderPoint(3, 3), points.get(1));
    }

    @Test
    @DisplayName("A shrunk chain should keep its old tail for the first half")
    void testShrinkingChain() {
        List<Cell> before = List.of(Cell.of(4, 3), Cell.of(3, 3), Cell.of(2, 3));
        List<Cell> after = List.of(Cell.of(5, 3));

        assertEquals(3, blend(before, after, 0.4).size());
        assertEquals(1, blend(before, after, 0.5).size());
    }

    @Test
    @DisplayName("An empty side should yield the other side unchanged")
    void testEmptySides() {
        List<Cell> chain = List.of(Cell.of(1, 2));

        assertEquals(List.of(new RenderPoint(1, 2)), blend(List.of(), chain, 0.7));
        assertEquals(List.of(new RenderPoint(1, 2)), blend(chain, List.of(), 0.7));
        assertTrue(blend(List.of(), List.of(), 0.5).isEmpty());
    }
}
