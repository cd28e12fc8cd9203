package com.lansync.sync;

import com.lansync.config.SyncConfig;
import com.lansync.state.Cell;
import com.lansync.state.EntitySnapshot;
import com.lansync.state.Facing;
import com.lansync.state.WorldSnapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * The client-side entry point for smooth rendering of host snapshots.
 *
 * Call {@link #ingest} for every snapshot received from the host and {@link #positionsFor}
 * once per frame for every visible entity. Positions come from the state buffer
 * (interpolation, or bounded extrapolation past the newest snapshot); dead reckoning takes
 * over while the buffer has nothing for the entity at the render instant, as long as the
 * newest snapshot still has it. An entity the host removed renders nowhere.
 *
 * Threading Model:
 * - Not thread-safe. Ingest and queries must come from the same thread, typically the
 *   main loop that also drains the connection's message queue.
 */
public class Synchronizer {

    private static final Logger logger = LoggerFactory.getLogger(Synchronizer.class);

    private final StateBuffer stateBuffer;
    private final EntityPredictor predictor;
    private final long bufferDelayMillis;
    private final int gridWidth;
    private final int gridHeight;

    private long lastTick = -1;
    private boolean enabled = true;

    // Reported by getStats()
    private long interpolationCount;
    private long extrapolationCount;
    private long predictionCount;

    public Synchronizer(SyncConfig config) {
        this(config, System::currentTimeMillis);
    }

    public Synchronizer(SyncConfig config, LongSupplier currentTimeMillis) {
        this(new StateBuffer(config, currentTimeMillis), new EntityPredictor(config, currentTimeMillis),
                config.getBufferDelayMillis(), config.getGridWidth(), config.getGridHeight());
    }

    Synchronizer(StateBuffer stateBuffer, EntityPredictor predictor, long bufferDelayMillis,
                 int gridWidth, int gridHeight) {
        this.stateBuffer = stateBuffer;
        this.predictor = predictor;
        this.bufferDelayMillis = bufferDelayMillis;
        this.gridWidth = gridWidth;
        this.gridHeight = gridHeight;
    }

    /**
     * Feeds one authoritative snapshot.
     *
     * @return false if the tick is not newer than the last ingested one (the snapshot is dropped)
     */
    public boolean ingest(WorldSnapshot snapshot, long tick) {
        if (tick <= lastTick) {
            logger.debug("Ignoring stale snapshot for tick {} (last {})", tick, lastTick);
            return false;
        }
        if (!stateBuffer.addSnapshot(snapshot, tick)) {
            return false;
        }
        lastTick = tick;

        Set<Integer> present = new HashSet<>();
        for (EntitySnapshot entity : snapshot.getEntities()) {
            predictor.onServerUpdate(entity.getEntityId(), entity.getPositions(), entity.getFacing(),
                    entity.isActive(), tick);
            present.add(entity.getEntityId());
        }
        // A snapshot carries the whole world: anything missing from it is gone.
        predictor.retainOnly(present);
        return true;
    }

    /**
     * Render positions for one entity, head first.
     *
     * @param moveIntervalTicks host ticks between moves of this entity, used for dead reckoning
     * @return the positions, or empty if no source has data for the entity
     */
    public Optional<List<RenderPoint>> positionsFor(int entityId, int moveIntervalTicks) {
        if (!enabled) {
            return stateBuffer.getLatestSnapshot()
                    .flatMap(snapshot -> snapshot.findEntity(entityId))
                    .map(entity -> Interpolation.toPoints(entity.getPositions()));
        }

        Optional<RenderState> renderState = stateBuffer.getRenderState(bufferDelayMillis);
        if (renderState.isEmpty()) {
            return predict(entityId, moveIntervalTicks);
        }

        RenderState state = renderState.get();
        Optional<EntitySnapshot> before = state.getBefore().findEntity(entityId);
        if (before.isEmpty()) {
            // Spawned after the render base: only newer snapshots know it.
            return latestEntity(entityId).isPresent() ? predict(entityId, moveIntervalTicks) : Optional.empty();
        }
        Optional<EntitySnapshot> after = state.isVerbatim()
                ? Optional.empty()
                : state.getAfter().findEntity(entityId);
        if (after.isEmpty()) {
            return Optional.of(Interpolation.toPoints(before.get().getPositions()));
        }

        if (state.isExtrapolating()) {
            extrapolationCount++;
        } else {
            interpolationCount++;
        }
        return Optional.of(Interpolation.interpolate(before.get().getPositions(), after.get().getPositions(),
                state.getFactor(), gridWidth, gridHeight));
    }

    private Optional<List<RenderPoint>> predict(int entityId, int moveIntervalTicks) {
        Optional<List<Cell>> predicted = predictor.predict(entityId, moveIntervalTicks);
        if (predicted.isPresent()) {
            predictionCount++;
        }
        return predicted.map(Interpolation::toPoints);
    }

    /**
     * True if no snapshot arrived within the last {@code maxAgeMillis}, or none ever did.
     */
    public boolean isStale(long maxAgeMillis) {
        return stateBuffer.getMillisSinceLastUpdate() > maxAgeMillis;
    }

    public Optional<Facing> facingOf(int entityId) {
        return latestEntity(entityId).map(EntitySnapshot::getFacing);
    }

    public Optional<Boolean> isActive(int entityId) {
        return latestEntity(entityId).map(EntitySnapshot::isActive);
    }

    public Optional<Integer> metaOf(int entityId) {
        return latestEntity(entityId).map(EntitySnapshot::getMeta);
    }

    public Optional<WorldSnapshot> getLatestSnapshot() {
        return stateBuffer.getLatestSnapshot();
    }

    private Optional<EntitySnapshot> latestEntity(int entityId) {
        return stateBuffer.getLatestSnapshot().flatMap(snapshot -> snapshot.findEntity(entityId));
    }

    /**
     * With smoothing disabled, {@link #positionsFor} returns the latest snapshot's cells as is.
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long getLastTick() {
        return lastTick;
    }

    /**
     * Clears all buffered and predicted state, e.g. when a new session starts.
     */
    public void reset() {
        stateBuffer.clear();
        predictor.clear();
        lastTick = -1;
        interpolationCount = 0;
        extrapolationCount = 0;
        predictionCount = 0;
    }

    public SyncStats getStats() {
        return new SyncStats(interpolationCount, extrapolationCount, predictionCount, stateBuffer.size(),
                stateBuffer.getMillisSinceLastUpdate(), stateBuffer.getEstimatedTickIntervalMillis());
    }
}
