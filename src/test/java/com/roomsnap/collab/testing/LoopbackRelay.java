package com.roomsnap.collab.testing;

import com.roomsnap.collab.error.MessageDecodingException;
import com.roomsnap.collab.network.Channel;
import com.roomsnap.collab.network.ChannelFactory;
import com.roomsnap.collab.network.CollaborationMessage;
import com.roomsnap.collab.network.MessageCodec;
import com.roomsnap.collab.network.RoomRegistry;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes frames between in-memory clients through a real {@link RoomRegistry}.
 * <p>
 * Replies to the sender are delivered at once; relayed frames wait for
 * {@link #pump()} so tests control interleaving.
 */
public class LoopbackRelay {
    private final MessageCodec codec = new MessageCodec();
    private final RoomRegistry registry;
    private final Map<String, RelayChannel> channels = new LinkedHashMap<>();
    private final Deque<Runnable> inFlight = new ArrayDeque<>();
    private int nextConnection;
    private boolean reachable = true;
    
    public LoopbackRelay(RoomRegistry registry) {
        this.registry = registry;
    }
    
    public ChannelFactory channelFactory() {
        return listener -> {
            synchronized (this) {
                if (!reachable) {
                    throw new IOException("Relay unreachable");
                }
                RelayChannel channel = new RelayChannel("conn-" + (++nextConnection), listener);
                channels.put(channel.id, channel);
                return channel;
            }
        };
    }
    
    /**
     * Delivers relayed frames until none are left.
     * @return The number of frames delivered.
     */
    public int pump() {
        int delivered = 0;
        while (true) {
            Runnable next;
            synchronized (this) {
                next = inFlight.poll();
            }
            if (next == null) {
                return delivered;
            }
            next.run();
            delivered++;
        }
    }
    
    public synchronized void setReachable(boolean reachable) {
        this.reachable = reachable;
    }
    
    /**
     * Closes every open connection from the server side.
     */
    public void dropAll() {
        List<RelayChannel> open;
        synchronized (this) {
            open = new ArrayList<>(channels.values());
        }
        for (RelayChannel channel : open) {
            channel.dropFromServer();
        }
    }
    
    public RoomRegistry getRegistry() {
        return registry;
    }
    
    private final class RelayChannel implements Channel {
        private final String id;
        private final Listener listener;
        private volatile boolean open = true;
        
        private RelayChannel(String id, Listener listener) {
            this.id = id;
            this.listener = listener;
        }
        
        @Override
        public boolean write(String text) {
            if (!open) {
                return false;
            }
            CollaborationMessage message;
            try {
                message = codec.decode(text).orElseThrow();
            } catch (MessageDecodingException e) {
                throw new IllegalStateException(e);
            }
            for (RoomRegistry.Delivery delivery : registry.handle(id, message)) {
                RelayChannel target;
                synchronized (LoopbackRelay.this) {
                    target = channels.get(delivery.getConnectionId());
                }
                if (target == null) {
                    continue;
                }
                String frame = codec.encode(delivery.getMessage());
                if (target == this) {
                    listener.onText(frame);
                } else {
                    synchronized (LoopbackRelay.this) {
                        inFlight.add(() -> target.receive(frame));
                    }
                }
            }
            return true;
        }
        
        @Override
        public boolean isOpen() {
            return open;
        }
        
        @Override
        public void close() {
            open = false;
            forget();
        }
        
        private void receive(String frame) {
            if (open) {
                listener.onText(frame);
            }
        }
        
        private void dropFromServer() {
            open = false;
            forget();
            listener.onClosed("relay closed the connection", true);
        }
        
        private void forget() {
            synchronized (LoopbackRelay.this) {
                channels.remove(id);
            }
            registry.disconnected(id);
        }
    }
}
