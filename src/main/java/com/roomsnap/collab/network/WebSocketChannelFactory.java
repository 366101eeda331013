package com.roomsnap.collab.network;

import org.java_websocket.client.WebSocketClient;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * Opens WebSocket channels to the relay server.
 */
public class WebSocketChannelFactory implements ChannelFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketChannelFactory.class);
    
    private static final int CONNECTION_LOST_TIMEOUT_SECONDS = 30;
    
    private final URI serverUri;
    private final long connectTimeoutMillis;
    
    public WebSocketChannelFactory(URI serverUri, long connectTimeoutMillis) {
        this.serverUri = serverUri;
        this.connectTimeoutMillis = connectTimeoutMillis;
    }
    
    @Override
    public Channel open(Channel.Listener listener) throws IOException {
        WebSocketChannel channel = new WebSocketChannel(serverUri, listener);
        channel.setConnectionLostTimeout(CONNECTION_LOST_TIMEOUT_SECONDS);
        
        boolean connected;
        try {
            connected = channel.connectBlocking(connectTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting to " + serverUri, e);
        }
        
        if (!connected) {
            channel.close();
            throw new IOException("Could not connect to " + serverUri);
        }
        return channel;
    }
    
    private static final class WebSocketChannel extends WebSocketClient implements Channel {
        private final Channel.Listener listener;
        private volatile boolean opened;
        
        WebSocketChannel(URI serverUri, Channel.Listener listener) {
            super(serverUri);
            this.listener = listener;
        }
        
        @Override
        public void onOpen(ServerHandshake handshake) {
            opened = true;
            LOGGER.info("Connected to {}", getURI());
        }
        
        @Override
        public void onMessage(String message) {
            listener.onText(message);
        }
        
        @Override
        public void onClose(int code, String reason, boolean remote) {
            // A failed handshake also closes; only report channels that were handed out
            if (opened) {
                LOGGER.info("Connection to {} closed ({}): {}", getURI(), code, reason);
                listener.onClosed(reason, remote);
            }
        }
        
        @Override
        public void onError(Exception ex) {
            LOGGER.warn("WebSocket error on {}: {}", getURI(), ex.getMessage());
        }
        
        @Override
        public boolean write(String text) {
            try {
                send(text);
                return true;
            } catch (WebsocketNotConnectedException e) {
                LOGGER.debug("Write refused, connection is not open");
                return false;
            }
        }
    }
}
