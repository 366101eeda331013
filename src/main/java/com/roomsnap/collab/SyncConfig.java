package com.roomsnap.collab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Settings of the sync engine and the relay server.
 * <p>
 * Values come from the classpath resource {@code collab-sync.properties},
 * then from environment variables, then from explicit builder calls.
 */
public class SyncConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(SyncConfig.class);
    
    public static final String RESOURCE = "collab-sync.properties";
    
    private final URI serverUri;
    private final int serverPort;
    private final long connectTimeoutMillis;
    private final int maxReconnectAttempts;
    private final long reconnectBaseDelayMillis;
    private final long syncIntervalMillis;
    private final long cursorThrottleMillis;
    private final long joinTimeoutMillis;
    private final Path snapshotDirectory;
    private final String mongoUri;
    private final String mongoDatabase;
    
    private SyncConfig(Builder builder) {
        this.serverUri = builder.serverUri;
        this.serverPort = builder.serverPort;
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.reconnectBaseDelayMillis = builder.reconnectBaseDelayMillis;
        this.syncIntervalMillis = builder.syncIntervalMillis;
        this.cursorThrottleMillis = builder.cursorThrottleMillis;
        this.joinTimeoutMillis = builder.joinTimeoutMillis;
        this.snapshotDirectory = builder.snapshotDirectory;
        this.mongoUri = builder.mongoUri;
        this.mongoDatabase = builder.mongoDatabase;
    }
    
    /**
     * Loads the configuration from the classpath and the process environment.
     * @return The loaded configuration.
     */
    public static SyncConfig load() {
        return builder().fromProperties(loadResource()).fromEnvironment(System.getenv()).build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    private static Properties loadResource() {
        Properties properties = new Properties();
        try (InputStream in = SyncConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                LOGGER.debug("No {} on the classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not read {}: {}", RESOURCE, e.getMessage());
        }
        return properties;
    }
    
    public URI getServerUri() {
        return serverUri;
    }
    
    public int getServerPort() {
        return serverPort;
    }
    
    public long getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }
    
    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }
    
    public long getReconnectBaseDelayMillis() {
        return reconnectBaseDelayMillis;
    }
    
    public long getSyncIntervalMillis() {
        return syncIntervalMillis;
    }
    
    public long getCursorThrottleMillis() {
        return cursorThrottleMillis;
    }
    
    public long getJoinTimeoutMillis() {
        return joinTimeoutMillis;
    }
    
    public Path getSnapshotDirectory() {
        return snapshotDirectory;
    }
    
    /**
     * @return The MongoDB connection string, or null to keep rooms in memory.
     */
    public String getMongoUri() {
        return mongoUri;
    }
    
    public String getMongoDatabase() {
        return mongoDatabase;
    }
    
    @Override
    public String toString() {
        return "SyncConfig{serverUri=" + serverUri +
                ", serverPort=" + serverPort +
                ", maxReconnectAttempts=" + maxReconnectAttempts +
                ", syncIntervalMillis=" + syncIntervalMillis +
                ", snapshotDirectory=" + snapshotDirectory +
                ", mongoUri=" + (mongoUri != null ? mongoUri.replaceAll(":[^/]+@", ":******@") : "not set") +
                '}';
    }
    
    public static class Builder {
        private URI serverUri = URI.create("ws://localhost:8887");
        private int serverPort = 8887;
        private long connectTimeoutMillis = 5000;
        private int maxReconnectAttempts = 5;
        private long reconnectBaseDelayMillis = 1000;
        private long syncIntervalMillis = 5000;
        private long cursorThrottleMillis = 100;
        private long joinTimeoutMillis = 10000;
        private Path snapshotDirectory = Paths.get(System.getProperty("user.home"), ".roomsnap", "sessions");
        private String mongoUri;
        private String mongoDatabase = "roomsnap_collab";
        
        /**
         * Applies every {@code sync.*} key present in the given properties.
         * @param properties The properties.
         * @return This builder.
         */
        public Builder fromProperties(Properties properties) {
            String value;
            if ((value = properties.getProperty("sync.server.uri")) != null) serverUri(URI.create(value.trim()));
            if ((value = properties.getProperty("sync.server.port")) != null) serverPort(parseInt("sync.server.port", value));
            if ((value = properties.getProperty("sync.connect.timeout.ms")) != null) connectTimeoutMillis(parseLong("sync.connect.timeout.ms", value));
            if ((value = properties.getProperty("sync.reconnect.max.attempts")) != null) maxReconnectAttempts(parseInt("sync.reconnect.max.attempts", value));
            if ((value = properties.getProperty("sync.reconnect.base.delay.ms")) != null) reconnectBaseDelayMillis(parseLong("sync.reconnect.base.delay.ms", value));
            if ((value = properties.getProperty("sync.interval.ms")) != null) syncIntervalMillis(parseLong("sync.interval.ms", value));
            if ((value = properties.getProperty("sync.cursor.throttle.ms")) != null) cursorThrottleMillis(parseLong("sync.cursor.throttle.ms", value));
            if ((value = properties.getProperty("sync.join.timeout.ms")) != null) joinTimeoutMillis(parseLong("sync.join.timeout.ms", value));
            if ((value = properties.getProperty("sync.snapshot.dir")) != null) snapshotDirectory(Paths.get(expandHome(value.trim())));
            if ((value = properties.getProperty("sync.mongodb.uri")) != null && !value.isBlank()) mongoUri(value.trim());
            if ((value = properties.getProperty("sync.mongodb.database")) != null) mongoDatabase(value.trim());
            return this;
        }
        
        /**
         * Applies the environment variable overrides.
         * @param env The environment, usually {@link System#getenv()}.
         * @return This builder.
         */
        public Builder fromEnvironment(Map<String, String> env) {
            Properties mapped = new Properties();
            copy(env, "COLLAB_SERVER_URI", mapped, "sync.server.uri");
            copy(env, "COLLAB_SERVER_PORT", mapped, "sync.server.port");
            copy(env, "COLLAB_CONNECT_TIMEOUT_MS", mapped, "sync.connect.timeout.ms");
            copy(env, "COLLAB_RECONNECT_MAX_ATTEMPTS", mapped, "sync.reconnect.max.attempts");
            copy(env, "COLLAB_RECONNECT_BASE_DELAY_MS", mapped, "sync.reconnect.base.delay.ms");
            copy(env, "COLLAB_SYNC_INTERVAL_MS", mapped, "sync.interval.ms");
            copy(env, "COLLAB_CURSOR_THROTTLE_MS", mapped, "sync.cursor.throttle.ms");
            copy(env, "COLLAB_JOIN_TIMEOUT_MS", mapped, "sync.join.timeout.ms");
            copy(env, "COLLAB_SNAPSHOT_DIR", mapped, "sync.snapshot.dir");
            copy(env, "MONGODB_URI", mapped, "sync.mongodb.uri");
            copy(env, "MONGODB_DATABASE", mapped, "sync.mongodb.database");
            return fromProperties(mapped);
        }
        
        public Builder serverUri(URI serverUri) {
            this.serverUri = serverUri;
            return this;
        }
        
        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }
        
        public Builder connectTimeoutMillis(long connectTimeoutMillis) {
            this.connectTimeoutMillis = requirePositive("sync.connect.timeout.ms", connectTimeoutMillis);
            return this;
        }
        
        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            if (maxReconnectAttempts < 0) {
                throw new IllegalArgumentException("sync.reconnect.max.attempts must not be negative");
            }
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }
        
        public Builder reconnectBaseDelayMillis(long reconnectBaseDelayMillis) {
            this.reconnectBaseDelayMillis = requirePositive("sync.reconnect.base.delay.ms", reconnectBaseDelayMillis);
            return this;
        }
        
        public Builder syncIntervalMillis(long syncIntervalMillis) {
            this.syncIntervalMillis = requirePositive("sync.interval.ms", syncIntervalMillis);
            return this;
        }
        
        public Builder cursorThrottleMillis(long cursorThrottleMillis) {
            if (cursorThrottleMillis < 0) {
                throw new IllegalArgumentException("sync.cursor.throttle.ms must not be negative");
            }
            this.cursorThrottleMillis = cursorThrottleMillis;
            return this;
        }
        
        public Builder joinTimeoutMillis(long joinTimeoutMillis) {
            this.joinTimeoutMillis = requirePositive("sync.join.timeout.ms", joinTimeoutMillis);
            return this;
        }
        
        public Builder snapshotDirectory(Path snapshotDirectory) {
            this.snapshotDirectory = snapshotDirectory;
            return this;
        }
        
        public Builder mongoUri(String mongoUri) {
            this.mongoUri = mongoUri;
            return this;
        }
        
        public Builder mongoDatabase(String mongoDatabase) {
            this.mongoDatabase = mongoDatabase;
            return this;
        }
        
        public SyncConfig build() {
            return new SyncConfig(this);
        }
        
        private static void copy(Map<String, String> env, String variable, Properties target, String key) {
            String value = env.get(variable);
            if (value != null) {
                target.setProperty(key, value);
            }
        }
        
        private static String expandHome(String path) {
            return path.replace("${user.home}", System.getProperty("user.home"));
        }
        
        private static int parseInt(String key, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not a number: " + value, e);
            }
        }
        
        private static long parseLong(String key, String value) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not a number: " + value, e);
            }
        }
        
        private static long requirePositive(String key, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException(key + " must be positive");
            }
            return value;
        }
    }
}
