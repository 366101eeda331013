package com.roomsnap.collab;

import com.roomsnap.collab.network.ExecutorTaskScheduler;
import com.roomsnap.collab.network.InMemoryRoomRepository;
import com.roomsnap.collab.network.MessageCodec;
import com.roomsnap.collab.network.MongoRoomRepository;
import com.roomsnap.collab.network.RoomRegistry;
import com.roomsnap.collab.network.RoomRepository;
import com.roomsnap.collab.network.SyncRelayServer;
import com.roomsnap.collab.network.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Starts the sync relay server.
 * <p>
 * Usage: {@code java -jar roomsnap-collab-sync.jar [port]}
 */
public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);
    
    private static final long EVICTION_PERIOD_MILLIS = 60_000;
    
    public static void main(String[] args) {
        SyncConfig config = SyncConfig.load();
        int port = config.getServerPort();
        
        // Check if a custom port was specified
        if (args.length > 0) {
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                LOGGER.warn("Invalid port number {}, using {}", args[0], port);
            }
        }
        
        Clock clock = Clock.systemUTC();
        RoomRepository repository = openRepository(config, clock);
        RoomRegistry registry = new RoomRegistry(new MessageCodec(), repository, clock);
        SyncRelayServer server = new SyncRelayServer(port, new MessageCodec(), registry);
        
        TaskScheduler scheduler = new ExecutorTaskScheduler("room-eviction");
        scheduler.scheduleAtFixedRate(() -> {
            int evicted = registry.evictExpired();
            if (evicted > 0) {
                LOGGER.info("Evicted {} expired room(s)", evicted);
            }
        }, EVICTION_PERIOD_MILLIS);
        
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down sync relay server");
            scheduler.shutdown();
            try {
                server.stop(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            repository.close();
        }, "relay-shutdown"));
        
        server.start();
        LOGGER.info("Relay configured with {}", config);
    }
    
    private static RoomRepository openRepository(SyncConfig config, Clock clock) {
        if (config.getMongoUri() == null) {
            LOGGER.info("No MongoDB configured, keeping rooms in memory");
            return new InMemoryRoomRepository();
        }
        try {
            return MongoRoomRepository.connect(config.getMongoUri(), config.getMongoDatabase(), clock);
        } catch (IllegalStateException e) {
            LOGGER.warn("{}; falling back to in-memory rooms", e.getMessage());
            return new InMemoryRoomRepository();
        }
    }
}
