package com.roomsnap.collab.network;

import com.roomsnap.collab.error.MessageDecodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns the persistent connection to the synchronization endpoint.
 * <p>
 * A dropped or failed connection is retried with exponential backoff
 * (base delay, doubling per attempt). Once the retry budget is spent the
 * link settles in {@link LinkState#CONNECTION_LOST} and stays there until
 * {@link #connect()} is called again. Sending never blocks: while the link
 * is not connected envelopes wait in the {@link OutboundQueue}, which is
 * flushed in order on every transition to {@link LinkState#CONNECTED}.
 * <p>
 * Listeners are always notified outside the link's monitor.
 */
public class TransportLink {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransportLink.class);
    
    private final ChannelFactory channelFactory;
    private final MessageCodec codec;
    private final OutboundQueue outboundQueue;
    private final TaskScheduler scheduler;
    private final int maxReconnectAttempts;
    private final long baseReconnectDelayMillis;
    
    private final List<Consumer<CollaborationMessage>> messageListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<LinkState>> stateListeners = new CopyOnWriteArrayList<>();
    
    private LinkState state = LinkState.DISCONNECTED;
    private Channel channel;
    private int reconnectAttempts;
    private TaskScheduler.Cancellable pendingReconnect;
    
    public TransportLink(ChannelFactory channelFactory, MessageCodec codec, OutboundQueue outboundQueue,
                         TaskScheduler scheduler, int maxReconnectAttempts, long baseReconnectDelayMillis) {
        this.channelFactory = channelFactory;
        this.codec = codec;
        this.outboundQueue = outboundQueue;
        this.scheduler = scheduler;
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.baseReconnectDelayMillis = baseReconnectDelayMillis;
    }
    
    /**
     * Connects to the endpoint, blocking until the first attempt settles.
     * A failed first attempt starts the reconnection cycle.
     * @return true if the link is connected when this call returns.
     */
    public boolean connect() {
        synchronized (this) {
            if (state == LinkState.CONNECTED) {
                return true;
            }
            if (state == LinkState.CONNECTING) {
                return false;
            }
            cancelPendingReconnect();
            reconnectAttempts = 0;
        }
        changeState(LinkState.CONNECTING);
        return attemptOpen();
    }
    
    /**
     * Closes the connection on purpose. Cancels any pending reconnection
     * attempt; queued envelopes are kept.
     */
    public void disconnect() {
        Channel closing;
        synchronized (this) {
            cancelPendingReconnect();
            closing = channel;
            channel = null;
        }
        changeState(LinkState.DISCONNECTED);
        if (closing != null) {
            closing.close();
        }
    }
    
    /**
     * Sends an envelope, or queues it if the link is not connected.
     * @param message The envelope.
     */
    public void send(CollaborationMessage message) {
        synchronized (this) {
            if (state == LinkState.CONNECTED && outboundQueue.isEmpty() && write(message)) {
                return;
            }
            outboundQueue.enqueue(message);
            if (state == LinkState.CONNECTED) {
                flush();
            }
        }
    }
    
    public synchronized LinkState getState() {
        return state;
    }
    
    public synchronized boolean isConnected() {
        return state == LinkState.CONNECTED;
    }
    
    /**
     * Cancels a scheduled reconnection attempt, leaving the link disconnected.
     * Has no effect unless the link is currently reconnecting.
     */
    public void cancelReconnect() {
        synchronized (this) {
            if (state != LinkState.RECONNECTING) {
                return;
            }
            cancelPendingReconnect();
        }
        changeState(LinkState.DISCONNECTED);
    }
    
    public OutboundQueue getOutboundQueue() {
        return outboundQueue;
    }
    
    public void addMessageListener(Consumer<CollaborationMessage> listener) {
        messageListeners.add(listener);
    }
    
    public void addStateListener(Consumer<LinkState> listener) {
        stateListeners.add(listener);
    }
    
    private boolean attemptOpen() {
        ChannelListener listener = new ChannelListener();
        Channel opened;
        try {
            opened = channelFactory.open(listener);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Connection attempt failed: {}", e.getMessage());
            onAttemptFailed();
            return false;
        }
        
        int flushed = 0;
        LinkState next;
        synchronized (this) {
            if (state != LinkState.CONNECTING && state != LinkState.RECONNECTING) {
                // Disconnected while the attempt was in flight
                opened.close();
                return false;
            }
            listener.owner = opened;
            if (!opened.isOpen()) {
                // Closed before it could be registered
                LOGGER.warn("Connection closed during handshake");
                next = scheduleReconnect();
            } else {
                channel = opened;
                reconnectAttempts = 0;
                state = LinkState.CONNECTED;
                flushed = flush();
                next = null;
            }
        }
        if (next != null) {
            changeState(next);
            return false;
        }
        LOGGER.info("Link connected, flushed {} queued message(s)", flushed);
        notifyStateListeners(LinkState.CONNECTED);
        return true;
    }

    private void onAttemptFailed() {
        LinkState next;
        synchronized (this) {
            if (state != LinkState.CONNECTING && state != LinkState.RECONNECTING) {
                return;
            }
            next = scheduleReconnect();
        }
        changeState(next);
    }
    
    private void onChannelClosed(Channel closed, String reason) {
        LinkState next;
        synchronized (this) {
            if (closed == null || closed != channel) {
                return;
            }
            channel = null;
            reconnectAttempts = 0;
            LOGGER.warn("Connection dropped: {}", reason);
            next = scheduleReconnect();
        }
        changeState(next);
    }
    
    private void retry() {
        synchronized (this) {
            pendingReconnect = null;
            if (state != LinkState.RECONNECTING) {
                return;
            }
        }
        attemptOpen();
    }
    
    // Must hold the monitor. Returns the state the link moves to.
    private LinkState scheduleReconnect() {
        if (reconnectAttempts >= maxReconnectAttempts) {
            LOGGER.error("Giving up after {} reconnection attempts", reconnectAttempts);
            return LinkState.CONNECTION_LOST;
        }
        reconnectAttempts++;
        long delay = baseReconnectDelayMillis * (1L << (reconnectAttempts - 1));
        LOGGER.info("Reconnecting in {} ms (attempt {}/{})", delay, reconnectAttempts, maxReconnectAttempts);
        pendingReconnect = scheduler.schedule(this::retry, delay);
        return LinkState.RECONNECTING;
    }
    
    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel();
            pendingReconnect = null;
        }
    }
    
    // Must hold the monitor
    private int flush() {
        return outboundQueue.drain(this::write);
    }
    
    private boolean write(CollaborationMessage message) {
        return channel != null && channel.write(codec.encode(message));
    }
    
    private void changeState(LinkState next) {
        synchronized (this) {
            if (state == next) {
                return;
            }
            state = next;
        }
        notifyStateListeners(next);
    }
    
    private void notifyStateListeners(LinkState newState) {
        for (Consumer<LinkState> listener : stateListeners) {
            try {
                listener.accept(newState);
            } catch (RuntimeException e) {
                LOGGER.warn("Link state listener failed: {}", e.getMessage(), e);
            }
        }
    }
    
    private void onText(String text) {
        Optional<CollaborationMessage> decoded;
        try {
            decoded = codec.decode(text);
        } catch (MessageDecodingException e) {
            LOGGER.warn("Dropping malformed envelope: {}", e.getMessage());
            return;
        }
        if (decoded.isEmpty()) {
            return;
        }
        
        CollaborationMessage message = decoded.get();
        LOGGER.debug("Received {}", message);
        for (Consumer<CollaborationMessage> listener : messageListeners) {
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to handle {}: {}", message, e.getMessage(), e);
            }
        }
    }
    
    private final class ChannelListener implements Channel.Listener {
        private volatile Channel owner;
        
        @Override
        public void onText(String text) {
            TransportLink.this.onText(text);
        }
        
        @Override
        public void onClosed(String reason, boolean remote) {
            onChannelClosed(owner, reason);
        }
    }
}
