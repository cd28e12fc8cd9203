package com.lansync.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Hand-off from the I/O thread to the main loop.
 *
 * The I/O thread appends as records are parsed; the main loop drains once per tick.
 * Draining swaps the backing list under the lock, so a message is returned by exactly one
 * drain and receipt order is kept.
 */
public class MessageQueue {

    private final Object lock = new Object();
    private List<InboundMessage> pending = new ArrayList<>();

    public void add(InboundMessage message) {
        synchronized (lock) {
            pending.add(message);
        }
    }

    /**
     * Returns everything queued since the last drain, oldest first. Never blocks.
     */
    public List<InboundMessage> drain() {
        List<InboundMessage> drained;
        synchronized (lock) {
            if (pending.isEmpty()) {
                return Collections.emptyList();
            }
            drained = pending;
            pending = new ArrayList<>();
        }
        return Collections.unmodifiableList(drained);
    }

    public int size() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            pending.clear();
        }
    }
}
