package com.roomsnap.collab.network;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stamps outgoing envelopes with the local participant's sequence number
 * and hands them to the transport link.
 */
public class OutboundMessenger {
    private final TransportLink link;
    private final MessageCodec codec;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    
    public OutboundMessenger(TransportLink link, MessageCodec codec, Clock clock) {
        this.link = link;
        this.codec = codec;
        this.clock = clock;
    }
    
    /**
     * Builds and sends an envelope. Never blocks on the network.
     * @param type The envelope type.
     * @param sessionId The session, empty for directory requests.
     * @param participantId The local participant.
     * @param payload The payload object, a JSON tree, or null.
     * @return The envelope as sent or queued.
     */
    public CollaborationMessage send(MessageType type, String sessionId, String participantId, Object payload) {
        JsonElement data;
        if (payload == null) {
            data = JsonNull.INSTANCE;
        } else if (payload instanceof JsonElement) {
            data = (JsonElement) payload;
        } else {
            data = codec.toPayload(payload);
        }
        
        CollaborationMessage message = new CollaborationMessage(
                type, sessionId, participantId, data, clock.millis(), sequence.incrementAndGet());
        link.send(message);
        return message;
    }
    
    public long lastSequence() {
        return sequence.get();
    }
    
    public TransportLink getLink() {
        return link;
    }
    
    public MessageCodec getCodec() {
        return codec;
    }
}
