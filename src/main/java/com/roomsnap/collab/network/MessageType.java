package com.roomsnap.collab.network;

import java.util.HashMap;
import java.util.Map;

/**
 * The envelope types understood on the wire.
 */
public enum MessageType {
    JOIN("join"),
    LEAVE("leave"),
    MEASUREMENT("measurement"),
    CURSOR("cursor"),
    ANNOTATION("annotation"),
    SYNC("sync"),
    CHAT("chat"),
    
    // Room directory traffic between a client and the relay server
    ROOM_REQUEST("room_request"),
    ROOM_STATE("room_state"),
    ROOM_ERROR("room_error");
    
    private static final Map<String, MessageType> BY_WIRE_NAME = new HashMap<>();
    
    static {
        for (MessageType type : values()) {
            BY_WIRE_NAME.put(type.wireName, type);
        }
    }
    
    private final String wireName;
    
    MessageType(String wireName) {
        this.wireName = wireName;
    }
    
    public String wireName() {
        return wireName;
    }
    
    /**
     * Whether this type belongs to the room directory exchange rather than
     * to a session's shared state.
     * @return true for directory control messages.
     */
    public boolean isDirectoryControl() {
        return this == ROOM_REQUEST || this == ROOM_STATE || this == ROOM_ERROR;
    }
    
    /**
     * Looks up a type by its wire name.
     * @param wireName The value of the envelope's type field.
     * @return The type, or null if the name is unknown.
     */
    public static MessageType fromWireName(String wireName) {
        return BY_WIRE_NAME.get(wireName);
    }
}
