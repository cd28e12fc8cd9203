package com.lansync.session;

import com.lansync.handler.ChannelSends;
import com.lansync.protocol.Message;

import io.netty.channel.Channel;

/**
 * Host-side record of one connected client.
 *
 * Slot, channel and address are fixed for the lifetime of the connection. The channel's
 * frame decoder holds the partial read buffer for this connection.
 */
public class ClientSession {

    private final int slot;
    private final Channel channel;
    private final String address;
    private final long connectedAt;

    public ClientSession(int slot, Channel channel, String address) {
        this.slot = slot;
        this.channel = channel;
        this.address = address;
        this.connectedAt = System.currentTimeMillis();
    }

    public int getSlot() {
        return slot;
    }

    public Channel getChannel() {
        return channel;
    }

    /**
     * Peer address as "ip:port".
     */
    public String getAddress() {
        return address;
    }

    public long getConnectedAt() {
        return connectedAt;
    }

    /**
     * Writes and flushes a message to this client, waiting at most {@code timeoutMillis}.
     *
     * @return false if the client is gone, the write failed or it stalled (the channel is then closed)
     */
    public boolean send(Message message, long timeoutMillis) {
        return ChannelSends.writeAndFlush(channel, message, timeoutMillis);
    }

    /**
     * Checks if the session is still active (channel open).
     */
    public boolean isActive() {
        return channel != null && channel.isActive();
    }

    @Override
    public String toString() {
        return "ClientSession{" +
                "slot=" + slot +
                ", address='" + address + '\'' +
                ", active=" + isActive() +
                '}';
    }
}
