package com.roomsnap.collab.network;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;

import java.util.Objects;

/**
 * The wire envelope exchanged between participants.
 * The sequence is strictly increasing per originating participant, starting at 1.
 */
public class CollaborationMessage {
    private final MessageType type;
    private final String sessionId;
    private final String participantId;
    private final JsonElement data;
    private final long timestamp;
    private final long sequence;
    
    public CollaborationMessage(MessageType type, String sessionId, String participantId,
                                JsonElement data, long timestamp, long sequence) {
        this.type = Objects.requireNonNull(type, "type");
        this.sessionId = sessionId == null ? "" : sessionId;
        this.participantId = participantId == null ? "" : participantId;
        this.data = data == null ? JsonNull.INSTANCE : data;
        this.timestamp = timestamp;
        this.sequence = sequence;
    }
    
    public MessageType getType() {
        return type;
    }
    
    public String getSessionId() {
        return sessionId;
    }
    
    public String getParticipantId() {
        return participantId;
    }
    
    /**
     * Gets the type-dependent payload.
     * @return The payload, JsonNull when there is none.
     */
    public JsonElement getData() {
        return data;
    }
    
    public long getTimestamp() {
        return timestamp;
    }
    
    public long getSequence() {
        return sequence;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        
        CollaborationMessage that = (CollaborationMessage) o;
        return timestamp == that.timestamp
                && sequence == that.sequence
                && type == that.type
                && sessionId.equals(that.sessionId)
                && participantId.equals(that.participantId)
                && data.equals(that.data);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, sessionId, participantId, data, timestamp, sequence);
    }
    
    @Override
    public String toString() {
        return type.wireName() + " #" + sequence + " from " + participantId + " in " + sessionId;
    }
}
