package com.roomsnap.collab;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class SyncConfigTest {
    @Test
    void defaultsMatchTheDocumentedValues() {
        SyncConfig config = SyncConfig.builder().build();

        assertEquals(URI.create("ws://localhost:8887"), config.getServerUri());
        assertEquals(5, config.getMaxReconnectAttempts());
        assertEquals(1000, config.getReconnectBaseDelayMillis());
        assertEquals(5000, config.getSyncIntervalMillis());
        assertEquals(100, config.getCursorThrottleMillis());
        assertNull(config.getMongoUri());
    }

    @Test
    void classpathResourceIsLoaded() {
        SyncConfig loaded = SyncConfig.load();

        assertEquals(8887, loaded.getServerPort());
        assertEquals("roomsnap_collab", loaded.getMongoDatabase());
    }

    @Test
    void environmentOverridesProperties() {
        Properties properties = new Properties();
        properties.setProperty("sync.interval.ms", "2500");
        properties.setProperty("sync.reconnect.max.attempts", "3");

        SyncConfig config = SyncConfig.builder()
                .fromProperties(properties)
                .fromEnvironment(Map.of("COLLAB_SYNC_INTERVAL_MS", "1000",
                        "MONGODB_URI", "mongodb://db:27017",
                        "COLLAB_SNAPSHOT_DIR", "/tmp/snapshots"))
                .build();

        assertEquals(1000, config.getSyncIntervalMillis());
        assertEquals(3, config.getMaxReconnectAttempts());
        assertEquals("mongodb://db:27017", config.getMongoUri());
        assertEquals(Paths.get("/tmp/snapshots"), config.getSnapshotDirectory());
    }

    @Test
    void invalidNumbersAreRejected() {
        Properties properties = new Properties();
        properties.setProperty("sync.interval.ms", "soon");

        assertThrows(IllegalArgumentException.class, () -> SyncConfig.builder().fromProperties(properties));
        assertThrows(IllegalArgumentException.class, () -> SyncConfig.builder().syncIntervalMillis(0));
    }

    @Test
    void toStringMasksMongoCredentials() {
        SyncConfig config = SyncConfig.builder().mongoUri("mongodb://user:secret@db:27017").build();

        assertTrue(config.toString().contains("user:******@db"));
    }
}
