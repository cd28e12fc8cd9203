package com.lansync.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lansync.state.Cell;
import com.lansync.state.EntitySnapshot;
import com.lansync.state.Facing;
import com.lansync.state.LooseItem;
import com.lansync.state.WorldSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the wire format:
 * - one JSON record per message, discriminated by "type"
 * - strict validation of type and required fields on decode
 */
@DisplayName("Message Codec Tests")
class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    // ==========================================
    // Encoding
    // ==========================================

    @Test
    @DisplayName("Should write the type discriminant and payload fields")
    void testEncodeInput() throws Exception {
        String json = codec.encode(new InputMessage(1, Facing.UP));

        JsonNode node = codec.getObjectMapper().readTree(json);
        assertEquals("INPUT", node.get("type").asText());
        assertEquals(1, node.get("entityId").asInt());
        assertEquals("UP", node.get("direction").asText());
    }

    @Test
    @DisplayName("Encoded record should never contain a raw newline")
    void testEncodedRecordIsOneLine() throws Exception {
        String json = codec.encode(new DisconnectMessage("first line\nsecond line"));

        assertFalse(json.contains("\n"), "Newlines inside strings must be escaped");
        DisconnectMessage decoded = (DisconnectMessage) codec.decode(json);
        assertEquals("first line\nsecond line", decoded.getReason());
    }

    @Test
    @DisplayName("Should write cells as two-element arrays")
    void testSnapshotWireShape() throws Exception {
        WorldSnapshot snapshot = WorldSnapshot.builder(10)
                .entity(new EntitySnapshot(0, List.of(Cell.of(3, 3)), Facing.RIGHT, true))
                .looseItem(new LooseItem(Cell.of(5, 5), "apple"))
                .build();

        String json = codec.encode(new WorldSnapshotMessage(snapshot));

        assertTrue(json.contains("\"pos\":[[3,3]]"), json);
        assertTrue(json.contains("\"type\":\"WORLD_SNAPSHOT\""), json);
        WorldSnapshotMessage decoded = (WorldSnapshotMessage) codec.decode(json);
        assertEquals(snapshot, decoded.getSnapshot());
        assertEquals(10, decoded.getTick());
    }

    @Test
    @DisplayName("Should omit absent optional fields")
    void testOptionalFieldsOmitted() {
        String json = codec.encode(GameEndMessage.draw(List.of(4, 4)));

        assertFalse(json.contains("winnerId"), json);
    }

    // ==========================================
    // Decoding
    // ==========================================

    @Test
    @DisplayName("Should decode every message kind to its own class")
    void testDecodeAllTypes() throws Exception {
        assertInstanceOf(InputMessage.class, codec.decode("{\"type\":\"INPUT\",\"entityId\":2,\"direction\":\"LEFT\"}"));
        assertInstanceOf(ReadyMessage.class, codec.decode("{\"type\":\"READY\"}"));
        assertInstanceOf(WorldSnapshotMessage.class, codec.decode("{\"type\":\"WORLD_SNAPSHOT\",\"snapshot\":{\"tick\":1}}"));
        assertInstanceOf(GameStartMessage.class, codec.decode("{\"type\":\"GAME_START\",\"participantCount\":2}"));
        assertInstanceOf(GameEndMessage.class, codec.decode("{\"type\":\"GAME_END\",\"winnerId\":1}"));
        assertInstanceOf(PlayerAssignedMessage.class, codec.decode("{\"type\":\"PLAYER_ASSIGNED\",\"entityId\":1}"));
        assertInstanceOf(LobbyStateMessage.class, codec.decode("{\"type\":\"LOBBY_STATE\",\"connectedCount\":3}"));
        assertInstanceOf(ReturnToLobbyMessage.class, codec.decode("{\"type\":\"RETURN_TO_LOBBY\"}"));
        assertInstanceOf(PingMessage.class, codec.decode("{\"type\":\"PING\",\"timestamp\":5}"));
        assertInstanceOf(PongMessage.class, codec.decode("{\"type\":\"PONG\",\"timestamp\":5}"));
        assertInstanceOf(DisconnectMessage.class, codec.decode("{\"type\":\"DISCONNECT\"}"));
    }

    @Test
    @DisplayName("Snapshot lists should default to empty when absent")
    void testSnapshotDefaults() throws Exception {
        WorldSnapshotMessage message = (WorldSnapshotMessage) codec.decode(
                "{\"type\":\"WORLD_SNAPSHOT\",\"snapshot\":{\"tick\":7}}");

        WorldSnapshot snapshot = message.getSnapshot();
        assertEquals(7, snapshot.getTick());
        assertTrue(snapshot.getEntities().isEmpty());
        assertTrue(snapshot.getLooseItems().isEmpty());
        assertTrue(snapshot.getPendingSpawns().isEmpty());
    }

    @Test
    @DisplayName("Entity meta should default to zero when absent")
    void testEntityMetaDefault() throws Exception {
        WorldSnapshotMessage message = (WorldSnapshotMessage) codec.decode(
                "{\"type\":\"WORLD_SNAPSHOT\",\"snapshot\":{\"tick\":1,\"entities\":["
                        + "{\"id\":0,\"pos\":[[1,2],[0,2]],\"facing\":\"RIGHT\",\"active\":true}]}}");

        EntitySnapshot entity = message.getSnapshot().findEntity(0).orElseThrow();
        assertEquals(0, entity.getMeta());
        assertEquals(List.of(Cell.of(1, 2), Cell.of(0, 2)), entity.getPositions());
    }

    @Test
    @DisplayName("A missing winner should decode as a draw")
    void testDrawDecoding() throws Exception {
        GameEndMessage end = (GameEndMessage) codec.decode("{\"type\":\"GAME_END\",\"scores\":[3,3]}");

        assertTrue(end.isDraw());
        assertEquals(List.of(3, 3), end.getScores());
    }

    @Test
    @DisplayName("Opaque blobs should pass through untouched")
    void testOpaqueBlob() throws Exception {
        ObjectNode settings = codec.createObjectNode();
        settings.put("speed", "fast");
        settings.putArray("walls").add(1).add(2);

        LobbyStateMessage decoded = (LobbyStateMessage) codec.decode(codec.encode(new LobbyStateMessage(settings, 2)));

        assertEquals(settings, decoded.getSettings());
        assertEquals(2, decoded.getConnectedCount());
    }

    @Test
    @DisplayName("Unknown fields should be ignored")
    void testUnknownFieldsIgnored() throws Exception {
        Message message = codec.decode("{\"type\":\"READY\",\"version\":2,\"extra\":{\"a\":1}}");

        assertEquals(MessageType.READY, message.getType());
    }

    @Test
    @DisplayName("A ping reply should echo the timestamp")
    void testPingReply() {
        PongMessage pong = new PingMessage(1234L).reply();

        assertEquals(1234L, pong.getTimestamp());
    }

    // ==========================================
    // Validation
    // ==========================================

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "not json",
            "[1,2,3]",
            "{\"entityId\":1,\"direction\":\"UP\"}",
            "{\"type\":\"TELEPORT\",\"entityId\":1}",
            "{\"type\":\"INPUT\",\"direction\":\"UP\"}",
            "{\"type\":\"INPUT\",\"entityId\":1}",
            "{\"type\":\"INPUT\",\"entityId\":\"1\",\"direction\":\"UP\"}",
            "{\"type\":\"INPUT\",\"entityId\":1.5,\"direction\":\"UP\"}",
            "{\"type\":\"INPUT\",\"entityId\":1,\"direction\":\"SIDEWAYS\"}",
            "{\"type\":\"PING\"}",
            "{\"type\":\"WORLD_SNAPSHOT\"}",
            "{\"type\":\"WORLD_SNAPSHOT\",\"snapshot\":{}}",
            "{\"type\":\"WORLD_SNAPSHOT\",\"snapshot\":{\"tick\":1,\"entities\":[{\"id\":0,\"facing\":\"UP\",\"active\":true}]}}",
            "{\"type\":\"WORLD_SNAPSHOT\",\"snapshot\":{\"tick\":1,\"entities\":[{\"id\":0,\"pos\":[[3,4,5]],\"facing\":\"UP\",\"active\":true}]}}",
            "{\"type\":\"WORLD_SNAPSHOT\",\"snapshot\":{\"tick\":1,\"entities\":[{\"id\":0,\"pos\":[[3]],\"facing\":\"UP\",\"active\":true}]}}",
            "{\"type\":\"WORLD_SNAPSHOT\",\"snapshot\":{\"tick\":1,\"entities\":[{\"id\":0,\"pos\":[[3.5,4]],\"facing\":\"UP\",\"active\":true}]}}"
    })
    @DisplayName("Should reject malformed records")
    void testRejectsMalformed(String line) {
        assertThrows(MalformedMessageException.class, () -> codec.decode(line));
    }

    @Test
    @DisplayName("Should reject a null record")
    void testRejectsNull() {
        assertThrows(MalformedMessageException.class, () -> codec.decode(null));
    }
}
