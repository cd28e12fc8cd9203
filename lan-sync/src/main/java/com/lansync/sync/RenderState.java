package com.lansync.sync;

import com.lansync.state.WorldSnapshot;

/**
 * What to draw right now: a snapshot, optionally a second one to blend towards, and the
 * blend factor.
 *
 * A factor of 0 or a missing {@code after} means "draw {@code before} as is". Factors in
 * (0, 1] interpolate, factors above 1 extrapolate past {@code after}.
 */
public final class RenderState {

    private final WorldSnapshot before;
    private final WorldSnapshot after;
    private final double factor;

    RenderState(WorldSnapshot before, WorldSnapshot after, double factor) {
        this.before = before;
        this.after = after;
        this.factor = factor;
    }

    static RenderState verbatim(WorldSnapshot snapshot) {
        return new RenderState(snapshot, null, 0.0);
    }

    public WorldSnapshot getBefore() {
        return before;
    }

    /**
     * The snapshot to blend towards, or {@code null} when {@code before} is used as is.
     */
    public WorldSnapshot getAfter() {
        return after;
    }

    public double getFactor() {
        return factor;
    }

    public boolean isVerbatim() {
        return after == null || factor == 0.0;
    }

    public boolean isExtrapolating() {
        return after != null && factor > 1.0;
    }

    @Override
    public String toString() {
        return "RenderState{" +
                "before=" + before.getTick() +
                ", after=" + (after != null ? after.getTick() : "none") +
                ", factor=" + factor +
                '}';
    }
}
