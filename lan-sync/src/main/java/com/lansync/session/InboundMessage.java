package com.lansync.session;

import com.lansync.protocol.Message;

/**
 * A parsed message and the slot it came from. On a client the sender is always the host,
 * slot {@value #HOST_SLOT}.
 */
public final class InboundMessage {

    public static final int HOST_SLOT = 0;

    private final int slot;
    private final Message message;

    public InboundMessage(int slot, Message message) {
        this.slot = slot;
        this.message = message;
    }

    public int getSlot() {
        return slot;
    }

    public Message getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "InboundMessage{slot=" + slot + ", message=" + message + '}';
    }
}
