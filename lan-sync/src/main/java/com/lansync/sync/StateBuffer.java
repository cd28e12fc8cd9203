package com.lansync.sync;

import com.lansync.config.SyncConfig;
import com.lansync.state.WorldSnapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Bounded, time-ordered history of received snapshots.
 *
 * Rendering runs a fixed delay behind real time so that, most of the time, the render
 * instant falls between two snapshots that have already arrived and can be blended.
 * Larger delays absorb more jitter at the cost of more perceived lag.
 *
 * Invariant: stored ticks are strictly increasing. Duplicates and late arrivals are
 * dropped on insert, never reordered in.
 *
 * Not thread-safe: owned by the thread that drives the {@link Synchronizer}.
 */
public class StateBuffer {

    private static final Logger logger = LoggerFactory.getLogger(StateBuffer.class);

    private static final double INITIAL_TICK_INTERVAL_MILLIS = 1000.0 / 60.0;
    private static final double EMA_KEEP = 0.9;

    private final int capacity;
    private final long extrapolationWindowMillis;
    private final double extrapolationFactorCap;
    private final LongSupplier currentTimeMillis;

    private final Deque<BufferedSnapshot> entries;
    private long lastReceiveMillis = -1;
    private double estimatedTickIntervalMillis = INITIAL_TICK_INTERVAL_MILLIS;

    public StateBuffer(int capacity, long extrapolationWindowMillis, double extrapolationFactorCap,
                       LongSupplier currentTimeMillis) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.extrapolationWindowMillis = extrapolationWindowMillis;
        this.extrapolationFactorCap = extrapolationFactorCap;
        this.currentTimeMillis = currentTimeMillis;
        this.entries = new ArrayDeque<>(capacity);
    }

    public StateBuffer(SyncConfig config, LongSupplier currentTimeMillis) {
        this(config.getStateBufferCapacity(), config.getExtrapolationWindowMillis(),
                config.getExtrapolationFactorCap(), currentTimeMillis);
    }

    /**
     * Buffers a snapshot if its tick is newer than everything already buffered.
     *
     * @return true if accepted, false if dropped as duplicate or out of order
     */
    public boolean addSnapshot(WorldSnapshot snapshot, long tick) {
        BufferedSnapshot newest = entries.peekLast();
        if (newest != null && tick <= newest.getTick()) {
            logger.debug("Dropping snapshot for tick {} (newest buffered is {})", tick, newest.getTick());
            return false;
        }

        long now = currentTimeMillis.getAsLong();
        if (newest != null) {
            long elapsed = now - newest.getReceiveMillis();
            if (elapsed > 0) {
                double sample = (double) elapsed / (tick - newest.getTick());
                estimatedTickIntervalMillis = EMA_KEEP * estimatedTickIntervalMillis + (1.0 - EMA_KEEP) * sample;
            }
        }

        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(new BufferedSnapshot(snapshot, tick, now));
        lastReceiveMillis = now;
        return true;
    }

    /**
     * Picks the state to render for "now minus {@code bufferDelayMillis}".
     *
     * - nothing buffered: empty
     * - one entry, or render time before the oldest entry: that entry as is
     * - render time between two entries: the pair, factor in [0, 1]
     * - render time past the newest entry: extrapolation from the last two entries, factor
     *   capped; beyond the extrapolation window the newest entry as is
     */
    public Optional<RenderState> getRenderState(long bufferDelayMillis) {
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        BufferedSnapshot oldest = entries.peekFirst();
        BufferedSnapshot newest = entries.peekLast();
        if (entries.size() == 1) {
            return Optional.of(RenderState.verbatim(oldest.getSnapshot()));
        }

        long renderTime = currentTimeMillis.getAsLong() - bufferDelayMillis;

        if (renderTime < oldest.getReceiveMillis()) {
            return Optional.of(RenderState.verbatim(oldest.getSnapshot()));
        }

        if (renderTime > newest.getReceiveMillis()) {
            return Optional.of(extrapolate(renderTime));
        }

        Iterator<BufferedSnapshot> it = entries.iterator();
        BufferedSnapshot before = it.next();
        while (it.hasNext()) {
            BufferedSnapshot after = it.next();
            if (before.getReceiveMillis() <= renderTime && renderTime <= after.getReceiveMillis()) {
                long span = after.getReceiveMillis() - before.getReceiveMillis();
                if (span <= 0) {
                    return Optional.of(RenderState.verbatim(after.getSnapshot()));
                }
                double factor = (double) (renderTime - before.getReceiveMillis()) / span;
                factor = Math.max(0.0, Math.min(1.0, factor));
                return Optional.of(new RenderState(before.getSnapshot(), after.getSnapshot(), factor));
            }
            before = after;
        }
        // Unreachable while receive times are non-decreasing.
        return Optional.of(RenderState.verbatim(newest.getSnapshot()));
    }

    private RenderState extrapolate(long renderTime) {
        Iterator<BufferedSnapshot> newestFirst = entries.descendingIterator();
        BufferedSnapshot newest = newestFirst.next();
        BufferedSnapshot previous = newestFirst.next();

        if (renderTime - newest.getReceiveMillis() > extrapolationWindowMillis) {
            return RenderState.verbatim(newest.getSnapshot());
        }
        long span = newest.getReceiveMillis() - previous.getReceiveMillis();
        if (span <= 0) {
            return RenderState.verbatim(newest.getSnapshot());
        }
        double factor = (double) (renderTime - previous.getReceiveMillis()) / span;
        return new RenderState(previous.getSnapshot(), newest.getSnapshot(),
                Math.min(factor, extrapolationFactorCap));
    }

    public Optional<WorldSnapshot> getLatestSnapshot() {
        BufferedSnapshot newest = entries.peekLast();
        return newest != null ? Optional.of(newest.getSnapshot()) : Optional.empty();
    }

    /**
     * Milliseconds since the last accepted snapshot, {@link Long#MAX_VALUE} if none ever arrived.
     */
    public long getMillisSinceLastUpdate() {
        if (lastReceiveMillis < 0) {
            return Long.MAX_VALUE;
        }
        return currentTimeMillis.getAsLong() - lastReceiveMillis;
    }

    /**
     * Smoothed wall-clock milliseconds per sender tick. Diagnostic only.
     */
    public double getEstimatedTickIntervalMillis() {
        return estimatedTickIntervalMillis;
    }

    public List<Long> getTicks() {
        List<Long> ticks = new ArrayList<>(entries.size());
        for (BufferedSnapshot entry : entries) {
            ticks.add(entry.getTick());
        }
        return ticks;
    }

    public int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        entries.clear();
        lastReceiveMillis = -1;
        estimatedTickIntervalMillis = INITIAL_TICK_INTERVAL_MILLIS;
    }
}
