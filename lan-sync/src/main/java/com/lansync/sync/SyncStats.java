package com.lansync.sync;

/**
 * Point-in-time counters from a {@link Synchronizer}, for debug overlays and logs.
 */
public final class SyncStats {

    private final long interpolations;
    private final long extrapolations;
    private final long predictions;
    private final int bufferSize;
    private final long millisSinceLastUpdate;
    private final double estimatedTickIntervalMillis;

    SyncStats(long interpolations, long extrapolations, long predictions, int bufferSize,
              long millisSinceLastUpdate, double estimatedTickIntervalMillis) {
        this.interpolations = interpolations;
        this.extrapolations = extrapolations;
        this.predictions = predictions;
        this.bufferSize = bufferSize;
        this.millisSinceLastUpdate = millisSinceLastUpdate;
        this.estimatedTickIntervalMillis = estimatedTickIntervalMillis;
    }

    public long getInterpolations() {
        return interpolations;
    }

    public long getExtrapolations() {
        return extrapolations;
    }

    public long getPredictions() {
        return predictions;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * {@link Long#MAX_VALUE} if nothing was ever received.
     */
    public long getMillisSinceLastUpdate() {
        return millisSinceLastUpdate;
    }

    public double getEstimatedTickIntervalMillis() {
        return estimatedTickIntervalMillis;
    }

    @Override
    public String toString() {
        return "SyncStats{" +
                "interpolations=" + interpolations +
                ", extrapolations=" + extrapolations +
                ", predictions=" + predictions +
                ", bufferSize=" + bufferSize +
                ", millisSinceLastUpdate=" + millisSinceLastUpdate +
                ", estimatedTickIntervalMillis=" + estimatedTickIntervalMillis +
                '}';
    }
}
