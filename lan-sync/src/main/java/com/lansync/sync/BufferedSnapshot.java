package com.lansync.sync;

import com.lansync.state.WorldSnapshot;

/**
 * A snapshot together with the tick it was accepted for and its local arrival time.
 */
public final class BufferedSnapshot {

    private final WorldSnapshot snapshot;
    private final long tick;
    private final long receiveMillis;

    BufferedSnapshot(WorldSnapshot snapshot, long tick, long receiveMillis) {
        this.snapshot = snapshot;
        this.tick = tick;
        this.receiveMillis = receiveMillis;
    }

    public WorldSnapshot getSnapshot() {
        return snapshot;
    }

    public long getTick() {
        return tick;
    }

    public long getReceiveMillis() {
        return receiveMillis;
    }

    @Override
    public String toString() {
        return "BufferedSnapshot{tick=" + tick + ", receiveMillis=" + receiveMillis + '}';
    }
}
