package com.lansync;

import com.lansync.client.HostConnection;
import com.lansync.config.SyncConfig;
import com.lansync.discovery.DiscoveredServer;
import com.lansync.discovery.DiscoveryBroadcaster;
import com.lansync.discovery.DiscoveryListener;
import com.lansync.protocol.WorldSnapshotMessage;
import com.lansync.server.HostServer;
import com.lansync.session.InboundMessage;
import com.lansync.session.RecordingConnectionListener;
import com.lansync.state.Cell;
import com.lansync.state.EntitySnapshot;
import com.lansync.state.Facing;
import com.lansync.state.WorldSnapshot;
import com.lansync.sync.RenderPoint;
import com.lansync.sync.Synchronizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full path on loopback: discovery, connect, join, snapshot broadcast, render positions.
 */
@DisplayName("End-to-End Scenario Tests")
class EndToEndScenarioTest {

    private static final long TIMEOUT = 5000;
    private static final long HEARTBEAT_MILLIS = 200;

    private HostServer server;
    private DiscoveryBroadcaster broadcaster;
    private DiscoveryListener discovery;
    private HostConnection client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.shutdown();
        }
        if (discovery != null) {
            discovery.stop();
        }
        if (broadcaster != null) {
            broadcaster.stop();
        }
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    @DisplayName("Client should discover, join and render the host's first snapshot")
    void testDiscoverJoinAndRender() throws Exception {
        // Client side: listen for announcements on an ephemeral port.
        SyncConfig clientConfig = SyncConfig.builder().discoveryPort(0).build();
        discovery = new DiscoveryListener(clientConfig);
        assertTrue(discovery.start());

        // Host side: game link plus heartbeat aimed at the listener over loopback.
        SyncConfig hostConfig = SyncConfig.builder()
                .gamePort(0)
                .discoveryPort(discovery.getPort())
                .broadcastAddress("127.0.0.1")
                .heartbeatIntervalMillis(HEARTBEAT_MILLIS)
                .build();
        RecordingConnectionListener hostEvents = new RecordingConnectionListener();
        server = new HostServer(hostConfig, hostEvents);
        assertTrue(server.start(4).isOk());
        broadcaster = new DiscoveryBroadcaster(hostConfig, "TestServer", server.getPort());

        long announcedAt = System.currentTimeMillis();
        assertTrue(broadcaster.start());

        DiscoveredServer found = null;
        while (found == null && System.currentTimeMillis() - announcedAt < TIMEOUT) {
            List<DiscoveredServer> servers = discovery.getServers();
            if (!servers.isEmpty()) {
                found = servers.get(0);
            } else {
                Thread.sleep(10);
            }
        }
        assertNotNull(found, "Host should be discovered");
        long discoveryMillis = System.currentTimeMillis() - announcedAt;
        assertTrue(discoveryMillis <= 2 * HEARTBEAT_MILLIS + 500,
                "Discovered after " + discoveryMillis + " ms");
        assertEquals("TestServer", found.getName());

        // Connect to what discovery reported.
        client = new HostConnection(clientConfig, new RecordingConnectionListener());
        assertTrue(client.connect(found.getIp(), found.getPort()).isOk());
        assertEquals("joined:1", hostEvents.next(TIMEOUT));

        WorldSnapshot snapshot = WorldSnapshot.builder(10)
                .entity(new EntitySnapshot(0, List.of(Cell.of(3, 3)), Facing.RIGHT, true))
                .build();
        assertEquals(1, server.broadcast(new WorldSnapshotMessage(snapshot)));

        List<InboundMessage> received = RecordingConnectionListener.drainUntil(client::getMessages, 1, TIMEOUT);
        assertEquals(1, received.size());
        WorldSnapshotMessage message = (WorldSnapshotMessage) received.get(0).getMessage();

        Synchronizer synchronizer = new Synchronizer(clientConfig);
        assertTrue(synchronizer.ingest(message.getSnapshot(), message.getTick()));

        assertEquals(List.of(new RenderPoint(3, 3)), synchronizer.positionsFor(0, 16).orElseThrow());
    }
}
