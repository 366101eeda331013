package com.roomsnap.collab.event;

/**
 * A typed event name. The type parameter is the payload handed to subscribers.
 *
 * @param <T> The payload type.
 */
public final class EventKey<T> {
    private final String name;
    private final Class<T> payloadType;
    
    EventKey(String name, Class<T> payloadType) {
        this.name = name;
        this.payloadType = payloadType;
    }
    
    public String getName() {
        return name;
    }
    
    public Class<T> getPayloadType() {
        return payloadType;
    }
    
    @Override
    public String toString() {
        return name;
    }
}
