package com.lansync.session;

/**
 * Outcome of starting a host or connecting to one. Setup failures are reported here rather
 * than thrown, so callers can show them directly.
 */
public final class ConnectResult {

    private final boolean ok;
    private final String address;
    private final String error;

    private ConnectResult(boolean ok, String address, String error) {
        this.ok = ok;
        this.address = address;
        this.error = error;
    }

    public static ConnectResult success(String address) {
        return new ConnectResult(true, address, null);
    }

    public static ConnectResult failure(String error) {
        return new ConnectResult(false, null, error);
    }

    public boolean isOk() {
        return ok;
    }

    /**
     * "ip:port" of the bound host or of the host connected to; null on failure.
     */
    public String getAddress() {
        return address;
    }

    /**
     * Human-readable reason; null on success.
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return ok ? "ConnectResult{ok, address=" + address + '}' : "ConnectResult{failed, error=" + error + '}';
    }
}
