package com.roomsnap.collab.testing;

import com.roomsnap.collab.error.MessageDecodingException;
import com.roomsnap.collab.network.Channel;
import com.roomsnap.collab.network.ChannelFactory;
import com.roomsnap.collab.network.CollaborationMessage;
import com.roomsnap.collab.network.MessageCodec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Hands out in-memory channels, or refuses to while unreachable.
 */
public class FakeChannelFactory implements ChannelFactory {
    private final MessageCodec codec = new MessageCodec();
    private final List<FakeChannel> channels = new ArrayList<>();
    private boolean reachable = true;
    private int openAttempts;
    private Function<CollaborationMessage, CollaborationMessage> responder;
    
    @Override
    public synchronized Channel open(Channel.Listener listener) throws IOException {
        openAttempts++;
        if (!reachable) {
            throw new IOException("Connection refused");
        }
        FakeChannel channel = new FakeChannel(listener);
        channels.add(channel);
        return channel;
    }
    
    public synchronized void setReachable(boolean reachable) {
        this.reachable = reachable;
    }
    
    public synchronized int getOpenAttempts() {
        return openAttempts;
    }
    
    /**
     * Answers every written envelope for which the function returns non-null.
     * @param responder Maps a sent envelope to the reply, or to null.
     */
    public synchronized void setResponder(Function<CollaborationMessage, CollaborationMessage> responder) {
        this.responder = responder;
    }
    
    public synchronized FakeChannel current() {
        return channels.isEmpty() ? null : channels.get(channels.size() - 1);
    }
    
    /**
     * @return Every envelope written on any channel, in order.
     */
    public synchronized List<CollaborationMessage> sent() {
        List<CollaborationMessage> all = new ArrayList<>();
        for (FakeChannel channel : channels) {
            all.addAll(channel.sentMessages());
        }
        return all;
    }
    
    public class FakeChannel implements Channel {
        private final Listener listener;
        private final List<String> written = new ArrayList<>();
        private volatile boolean open = true;
        
        FakeChannel(Listener listener) {
            this.listener = listener;
        }
        
        @Override
        public boolean write(String text) {
            if (!open) {
                return false;
            }
            synchronized (written) {
                written.add(text);
            }
            Function<CollaborationMessage, CollaborationMessage> reply;
            synchronized (FakeChannelFactory.this) {
                reply = responder;
            }
            if (reply != null) {
                CollaborationMessage answer = reply.apply(decode(text));
                if (answer != null) {
                    receive(answer);
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
        }
        
        public void receive(CollaborationMessage message) {
            listener.onText(codec.encode(message));
        }
        
        public void receiveText(String text) {
            listener.onText(text);
        }
        
        public void dropFromServer() {
            open = false;
            listener.onClosed("server went away", true);
        }
        
        public List<CollaborationMessage> sentMessages() {
            List<CollaborationMessage> messages = new ArrayList<>();
            synchronized (written) {
                for (String text : written) {
                    messages.add(decode(text));
                }
            }
            return messages;
        }
        
        private CollaborationMessage decode(String text) {
            try {
                return codec.decode(text).orElseThrow();
            } catch (MessageDecodingException e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
