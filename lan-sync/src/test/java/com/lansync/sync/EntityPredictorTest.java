package com.lansync.sync;

import com.lansync.state.Cell;
import com.lansync.state.Facing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Entity Predictor Tests")
class EntityPredictorTest {

    // 60 ticks per second and one move every 6 ticks: one move per 100 ms
    private static final int MOVE_INTERVAL = 6;

    private final AtomicLong clock = new AtomicLong(1000);
    private EntityPredictor predictor;

    @BeforeEach
    void setUp() {
        predictor = new EntityPredictor(60, 5, 15, 15, clock::get);
        predictor.onServerUpdate(0, List.of(Cell.of(3, 3), Cell.of(2, 3)), Facing.RIGHT, true, 10);
    }

    @Test
    @DisplayName("Without elapsed time the last known chain is returned")
    void testNoElapsedTime() {
        assertEquals(List.of(Cell.of(3, 3), Cell.of(2, 3)), predictor.predict(0, MOVE_INTERVAL).orElseThrow());
    }

    @Test
    @DisplayName("Should move one cell per movement interval")
    void testCadence() {
        clock.set(1099);
        assertEquals(List.of(Cell.of(3, 3), Cell.of(2, 3)), predictor.predict(0, MOVE_INTERVAL).orElseThrow());

        clock.set(1100);
        assertEquals(List.of(Cell.of(4, 3), Cell.of(3, 3)), predictor.predict(0, MOVE_INTERVAL).orElseThrow());

        // Asking again at the same instant must not advance twice.
        assertEquals(List.of(Cell.of(4, 3), Cell.of(3, 3)), predictor.predict(0, MOVE_INTERVAL).orElseThrow());

        clock.set(1300);
        assertEquals(List.of(Cell.of(6, 3), Cell.of(5, 3)), predictor.predict(0, MOVE_INTERVAL).orElseThrow());
    }

    @Test
    @DisplayName("A long stall should be capped and not caught up on")
    void testMoveCap() {
        clock.set(11_000);
        assertEquals(List.of(Cell.of(8, 3), Cell.of(7, 3)), predictor.predict(0, MOVE_INTERVAL).orElseThrow());

        clock.set(11_100);
        assertEquals(List.of(Cell.of(9, 3), Cell.of(8, 3)), predictor.predict(0, MOVE_INTERVAL).orElseThrow());
    }

    @Test
    @DisplayName("The head should wrap around the grid")
    void testWrap() {
        predictor.onServerUpdate(1, List.of(Cell.of(14, 0), Cell.of(13, 0)), Facing.RIGHT, true, 10);
        predictor.onServerUpdate(2, List.of(Cell.of(5, 0)), Facing.UP, true, 10);
        clock.set(1100);

        assertEquals(List.of(Cell.of(0, 0), Cell.of(14, 0)), predictor.predict(1, MOVE_INTERVAL).orElseThrow());
        assertEquals(List.of(Cell.of(5, 14)), predictor.predict(2, MOVE_INTERVAL).orElseThrow());
    }

    @Test
    @DisplayName("A server update should replace the prediction")
    void testServerUpdateResets() {
        clock.set(1200);
        predictor.predict(0, MOVE_INTERVAL);

        predictor.onServerUpdate(0, List.of(Cell.of(7, 7), Cell.of(7, 8)), Facing.UP, true, 22);

        assertEquals(List.of(Cell.of(7, 7), Cell.of(7, 8)), predictor.predict(0, MOVE_INTERVAL).orElseThrow());
        assertEquals(22, predictor.getLastServerTick(0));
        clock.set(1300);
        assertEquals(List.of(Cell.of(7, 6), Cell.of(7, 7)), predictor.predict(0, MOVE_INTERVAL).orElseThrow());
    }

    @Test
    @DisplayName("Unknown, inactive and empty entities have no prediction")
    void testNothingToPredict() {
        predictor.onServerUpdate(1, List.of(Cell.of(1, 1)), Facing.UP, false, 10);
        predictor.onServerUpdate(2, List.of(), Facing.UP, true, 10);
        clock.set(2000);

        assertTrue(predictor.predict(9, MOVE_INTERVAL).isEmpty());
        assertTrue(predictor.predict(1, MOVE_INTERVAL).isEmpty());
        assertTrue(predictor.predict(2, MOVE_INTERVAL).isEmpty());
        assertEquals(-1, predictor.getLastServerTick(9));
    }

    @Test
    @DisplayName("Should reject a non-positive movement interval")
    void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> predictor.predict(0, 0));
    }

    @Test
    @DisplayName("Clear should forget every entity")
    void testClear() {
        predictor.clear();

        assertFalse(predictor.hasRecord(0));
        assertTrue(predictor.predict(0, MOVE_INTERVAL).isEmpty());
    }

    @Test
    @DisplayName("Retaining a set of ids should forget every other entity")
    void testRetainOnly() {
        predictor.onServerUpdate(1, List.of(Cell.of(8, 8)), Facing.UP, true, 10);

        predictor.retainOnly(Set.of(1));

        assertFalse(predictor.hasRecord(0));
        assertTrue(predictor.predict(0, MOVE_INTERVAL).isEmpty());
        assertTrue(predictor.hasRecord(1));
    }
}
