package com.lansync.session;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Records connection events as strings ("joined:1", "left:1", "lost:reason") for tests.
 */
public class RecordingConnectionListener implements ConnectionListener {

    private final BlockingQueue<String> events = new LinkedBlockingQueue<>();

    @Override
    public void playerJoined(int slot, String address) {
        events.add("joined:" + slot);
    }

    @Override
    public void playerLeft(int slot) {
        events.add("left:" + slot);
    }

    @Override
    public void connectionLost(String reason) {
        events.add("lost:" + reason);
    }

    /**
     * Next event, or null if none arrives in time.
     */
    public String next(long timeoutMillis) throws InterruptedException {
        return events.poll(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Waits a little and returns whatever else arrived.
     */
    public List<String> remaining(long waitMillis) throws InterruptedException {
        Thread.sleep(waitMillis);
        List<String> rest = new ArrayList<>();
        events.drainTo(rest);
        return rest;
    }

    /**
     * Keeps draining until at least {@code count} messages arrived or the timeout passes.
     */
    public static List<InboundMessage> drainUntil(Supplier<List<InboundMessage>> drain, int count,
                                                  long timeoutMillis) throws InterruptedException {
        List<InboundMessage> received = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (received.size() < count && System.currentTimeMillis() < deadline) {
            received.addAll(drain.get());
            if (received.size() < count) {
                Thread.sleep(10);
            }
        }
        return received;
    }
}
