package com.lansync.sync;

import com.lansync.config.SyncConfig;
import com.lansync.state.Cell;
import com.lansync.state.Facing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Dead reckoning for head-driven chains.
 *
 * From an entity's last authoritative chain, its facing and its movement cadence, estimates
 * where it should be now: every {@code moveIntervalTicks} host ticks the head steps one cell
 * forward (wrapping on the grid) and the tail cell drops off, keeping the length fixed.
 *
 * Only used when there is nothing buffered to interpolate from. The number of moves guessed
 * per call is capped so a long stall never produces a wild guess.
 *
 * Not thread-safe.
 */
public class EntityPredictor {

    private final int tickRate;
    private final int moveCap;
    private final int gridWidth;
    private final int gridHeight;
    private final LongSupplier currentTimeMillis;

    private final Map<Integer, PredictionRecord> records = new HashMap<>();

    public EntityPredictor(int tickRate, int moveCap, int gridWidth, int gridHeight,
                           LongSupplier currentTimeMillis) {
        this.tickRate = tickRate;
        this.moveCap = moveCap;
        this.gridWidth = gridWidth;
        this.gridHeight = gridHeight;
        this.currentTimeMillis = currentTimeMillis;
    }

    public EntityPredictor(SyncConfig config, LongSupplier currentTimeMillis) {
        this(config.getTickRate(), config.getPredictionMoveCap(), config.getGridWidth(),
                config.getGridHeight(), currentTimeMillis);
    }

    /**
     * Replaces everything known about an entity with fresh authoritative data.
     */
    public void onServerUpdate(int entityId, List<Cell> positions, Facing facing, boolean active, long tick) {
        records.put(entityId, new PredictionRecord(positions, facing, active, tick,
                currentTimeMillis.getAsLong()));
    }

    /**
     * Estimates the entity's current chain.
     *
     * @param moveIntervalTicks host ticks between two moves of this entity
     * @return the predicted chain, or empty if the entity is unknown, inactive or has no cells
     */
    public Optional<List<Cell>> predict(int entityId, int moveIntervalTicks) {
        if (moveIntervalTicks <= 0) {
            throw new IllegalArgumentException("moveIntervalTicks must be positive, was " + moveIntervalTicks);
        }
        PredictionRecord record = records.get(entityId);
        if (record == null || !record.active || record.predictedPositions.isEmpty()) {
            return Optional.empty();
        }

        long elapsedMillis = currentTimeMillis.getAsLong() - record.lastUpdateMillis;
        long expectedMoves = elapsedMillis * tickRate / (1000L * moveIntervalTicks);
        long movesToApply = Math.min(expectedMoves - record.movesAlreadyPredicted, moveCap);
        if (movesToApply <= 0) {
            return Optional.of(List.copyOf(record.predictedPositions));
        }

        List<Cell> chain = new ArrayList<>(record.predictedPositions);
        for (long i = 0; i < movesToApply; i++) {
            Cell head = chain.get(0).step(record.facing, gridWidth, gridHeight);
            chain.add(0, head);
            chain.remove(chain.size() - 1);
        }
        record.predictedPositions = chain;
        // Moves skipped by the cap are dropped, not caught up on later.
        record.movesAlreadyPredicted = expectedMoves;
        return Optional.of(List.copyOf(chain));
    }

    /**
     * Forgets every entity not in {@code entityIds}.
     */
    public void retainOnly(Collection<Integer> entityIds) {
        records.keySet().retainAll(entityIds);
    }

    public boolean hasRecord(int entityId) {
        return records.containsKey(entityId);
    }

    /**
     * Tick of the last authoritative update for the entity, or -1 if unknown.
     */
    public long getLastServerTick(int entityId) {
        PredictionRecord record = records.get(entityId);
        return record != null ? record.lastServerTick : -1;
    }

    public void clear() {
        records.clear();
    }

    private static final class PredictionRecord {
        private final Facing facing;
        private final boolean active;
        private final long lastServerTick;
        private final long lastUpdateMillis;

        private long movesAlreadyPredicted;
        // Starts as the last known chain and advances with each prediction.
        private List<Cell> predictedPositions;

        private PredictionRecord(List<Cell> positions, Facing facing, boolean active,
                                 long lastServerTick, long lastUpdateMillis) {
            this.facing = facing;
            this.active = active;
            this.lastServerTick = lastServerTick;
            this.lastUpdateMillis = lastUpdateMillis;
            this.movesAlreadyPredicted = 0;
            this.predictedPositions = List.copyOf(positions);
        }
    }
}
