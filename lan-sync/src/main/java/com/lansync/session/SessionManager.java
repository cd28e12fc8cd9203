package com.lansync.session;

import io.netty.channel.Channel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks connected clients and the slot each one holds.
 *
 * Slot 0 is the host itself; clients get the lowest free slot in {@code 1..maxClients}.
 * A slot is freed when its session is removed and can be reused by the next client.
 *
 * Thread Safety:
 * - Registration and removal happen on the I/O thread; lookups may come from any thread
 * - ConcurrentHashMap keeps lookups lock-free; registration is synchronized so slot
 *   allocation is atomic
 */
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final int maxClients;

    // Map channel ID to session for fast lookup from Netty handlers
    private final Map<String, ClientSession> sessionsByChannelId;

    // Map slot to session for sends from game logic
    private final Map<Integer, ClientSession> sessionsBySlot;

    public SessionManager(int maxClients) {
        this.maxClients = maxClients;
        this.sessionsByChannelId = new ConcurrentHashMap<>();
        this.sessionsBySlot = new ConcurrentHashMap<>();
    }

    /**
     * Creates a session for a newly connected channel.
     *
     * @return the session, or null if every slot is taken
     */
    public synchronized ClientSession register(Channel channel) {
        for (int slot = 1; slot <= maxClients; slot++) {
            if (!sessionsBySlot.containsKey(slot)) {
                ClientSession session = new ClientSession(slot, channel, describe(channel.remoteAddress()));
                sessionsBySlot.put(slot, session);
                sessionsByChannelId.put(channel.id().asLongText(), session);
                logger.debug("Slot {} assigned to {} ({} of {} taken)",
                        slot, session.getAddress(), sessionsBySlot.size(), maxClients);
                return session;
            }
        }
        return null;
    }

    /**
     * Removes the session of a closed channel.
     *
     * @return the removed session, or null if the channel had none (never registered or
     *         already removed)
     */
    public synchronized ClientSession remove(Channel channel) {
        ClientSession session = sessionsByChannelId.remove(channel.id().asLongText());
        if (session != null) {
            sessionsBySlot.remove(session.getSlot());
        }
        return session;
    }

    public ClientSession getSessionBySlot(int slot) {
        return sessionsBySlot.get(slot);
    }

    public ClientSession getSessionByChannel(Channel channel) {
        return sessionsByChannelId.get(channel.id().asLongText());
    }

    /**
     * Returns a snapshot of all sessions ordered by slot.
     */
    public List<ClientSession> getAllSessions() {
        List<ClientSession> sessions = new ArrayList<>(sessionsBySlot.values());
        sessions.sort(Comparator.comparingInt(ClientSession::getSlot));
        return sessions;
    }

    public int getSessionCount() {
        return sessionsBySlot.size();
    }

    public int getMaxClients() {
        return maxClients;
    }

    static String describe(SocketAddress address) {
        if (address instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) address;
            return inet.getAddress() != null
                    ? inet.getAddress().getHostAddress() + ":" + inet.getPort()
                    : inet.getHostString() + ":" + inet.getPort();
        }
        return String.valueOf(address);
    }
}
