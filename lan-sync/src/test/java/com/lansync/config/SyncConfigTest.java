package com.lansync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Sync Config Tests")
class SyncConfigTest {

    @Test
    @DisplayName("Defaults should match the documented values")
    void testDefaults() {
        SyncConfig config = SyncConfig.defaults();

        assertEquals(50000, config.getDiscoveryPort());
        assertEquals(5555, config.getGamePort());
        assertEquals("255.255.255.255", config.getBroadcastAddress());
        assertEquals(1000, config.getHeartbeatIntervalMillis());
        assertEquals(5000, config.getServerTtlMillis());
        assertEquals(500, config.getDiscoveryScanMillis());
        assertEquals(200, config.getSendTimeoutMillis());
        assertEquals(80, config.getBufferDelayMillis());
        assertEquals(30, config.getStateBufferCapacity());
        assertEquals(500, config.getExtrapolationWindowMillis());
        assertEquals(1.5, config.getExtrapolationFactorCap());
        assertEquals(5, config.getPredictionMoveCap());
        assertEquals(60, config.getTickRate());
        assertEquals(15, config.getGridWidth());
        assertEquals(15, config.getGridHeight());
    }

    @Test
    @DisplayName("Should read overrides from JSON and keep defaults for the rest")
    void testLoadOverrides() throws IOException {
        SyncConfig config = SyncConfig.load(json("{\"gamePort\":6000,\"gridWidth\":20,\"someFutureKey\":true}"));

        assertEquals(6000, config.getGamePort());
        assertEquals(20, config.getGridWidth());
        assertEquals(15, config.getGridHeight());
        assertEquals(50000, config.getDiscoveryPort());
    }

    @Test
    @DisplayName("Should reject invalid values on load")
    void testLoadRejectsInvalid() {
        assertThrows(IOException.class, () -> SyncConfig.load(json("{\"gamePort\":70000}")));
        assertThrows(IOException.class, () -> SyncConfig.load(json("{\"stateBufferCapacity\":0}")));
        assertThrows(IOException.class, () -> SyncConfig.load(json("not json")));
    }

    @Test
    @DisplayName("Builder should validate ranges")
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> SyncConfig.builder().discoveryPort(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SyncConfig.builder().tickRate(0).build());
        assertThrows(IllegalArgumentException.class, () -> SyncConfig.builder().extrapolationFactorCap(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> SyncConfig.builder().bufferDelayMillis(-5).build());
        assertThrows(IllegalArgumentException.class, () -> SyncConfig.builder().broadcastAddress(" ").build());
        assertThrows(IllegalArgumentException.class, () -> SyncConfig.builder().sendTimeoutMillis(0).build());
    }

    @Test
    @DisplayName("toBuilder should copy every value")
    void testToBuilder() {
        SyncConfig original = SyncConfig.builder().gamePort(7000).tickRate(30).build();
        SyncConfig copy = original.toBuilder().discoveryPort(51000).build();

        assertEquals(7000, copy.getGamePort());
        assertEquals(30, copy.getTickRate());
        assertEquals(51000, copy.getDiscoveryPort());
    }

    @Test
    @DisplayName("Should read lansync.json from the classpath")
    void testLoadDefaultFromClasspath() {
        SyncConfig config = SyncConfig.loadDefault();

        assertEquals(120, config.getBufferDelayMillis());
    }

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
