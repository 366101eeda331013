package com.roomsnap.collab.network;

import com.roomsnap.collab.error.MessageDecodingException;
import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket relay between the participants of each room.
 * <p>
 * Decodes every frame, lets the {@link RoomRegistry} apply it, and writes
 * the resulting deliveries. Messages are never echoed to their sender.
 */
public class SyncRelayServer extends WebSocketServer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SyncRelayServer.class);
    
    public static final int DEFAULT_PORT = 8887;
    
    private final MessageCodec codec;
    private final RoomRegistry registry;
    
    // Map of connection to connection id
    private final Map<WebSocket, String> connectionIds = new ConcurrentHashMap<>();
    
    // Map of connection id to connection
    private final Map<String, WebSocket> connections = new ConcurrentHashMap<>();
    
    public SyncRelayServer(int port, MessageCodec codec, RoomRegistry registry) {
        super(new InetSocketAddress(port));
        this.codec = codec;
        this.registry = registry;
        setReuseAddr(true);
    }
    
    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        String connectionId = "conn_" + UUID.randomUUID();
        connectionIds.put(conn, connectionId);
        connections.put(connectionId, conn);
        LOGGER.info("New connection {} from {}", connectionId, conn.getRemoteSocketAddress());
    }
    
    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        String connectionId = connectionIds.remove(conn);
        if (connectionId == null) {
            return;
        }
        connections.remove(connectionId);
        registry.disconnected(connectionId);
        LOGGER.info("Connection {} closed ({} {})", connectionId, code, reason);
    }
    
    @Override
    public void onMessage(WebSocket conn, String message) {
        String connectionId = connectionIds.get(conn);
        if (connectionId == null) {
            LOGGER.warn("Message from unregistered connection {}", conn.getRemoteSocketAddress());
            return;
        }
        
        Optional<CollaborationMessage> decoded;
        try {
            decoded = codec.decode(message);
        } catch (MessageDecodingException e) {
            LOGGER.warn("Dropping malformed frame from {}: {}", connectionId, e.getMessage());
            return;
        }
        if (decoded.isEmpty()) {
            return;
        }
        
        List<RoomRegistry.Delivery> deliveries = registry.handle(connectionId, decoded.get());
        for (RoomRegistry.Delivery delivery : deliveries) {
            WebSocket target = connections.get(delivery.getConnectionId());
            if (target != null && target.isOpen()) {
                target.send(codec.encode(delivery.getMessage()));
            } else {
                LOGGER.debug("Skipping delivery to closed connection {}", delivery.getConnectionId());
            }
        }
    }
    
    @Override
    public void onError(WebSocket conn, Exception ex) {
        if (conn != null) {
            LOGGER.warn("Error on connection {}: {}", conn.getRemoteSocketAddress(), ex.getMessage());
        } else {
            LOGGER.error("Relay server error", ex);
        }
    }
    
    @Override
    public void onStart() {
        setConnectionLostTimeout(30);
        LOGGER.info("Sync relay server started on port {}", getPort());
    }
    
    public int connectionCount() {
        return connections.size();
    }
}
