package com.roomsnap.collab.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed publish/subscribe between the engine and its UI and notification
 * collaborators. Each handler runs in isolation: a handler that throws is
 * logged and the remaining handlers still receive the event.
 */
public class EventBus {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventBus.class);
    
    private final Map<EventKey<?>, List<Subscription>> handlers = new ConcurrentHashMap<>();
    
    /**
     * Subscribes a handler to an event.
     * @param key The event.
     * @param handler The handler to add.
     * @param <T> The payload type.
     */
    public <T> void on(EventKey<T> key, Consumer<? super T> handler) {
        if (key == null || handler == null) {
            return;
        }
        Consumer<Object> typed = payload -> handler.accept(key.getPayloadType().cast(payload));
        handlers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(new Subscription(handler, typed));
    }
    
    /**
     * Removes a previously subscribed handler.
     * @param key The event.
     * @param handler The handler to remove.
     * @param <T> The payload type.
     */
    public <T> void off(EventKey<T> key, Consumer<? super T> handler) {
        List<Subscription> list = handlers.get(key);
        if (list == null) {
            return;
        }
        for (Subscription subscription : list) {
            if (subscription.handler.equals(handler)) {
                list.remove(subscription);
                return;
            }
        }
    }
    
    /**
     * Delivers an event to every handler subscribed to it, in subscription order.
     * @param key The event.
     * @param payload The payload.
     * @param <T> The payload type.
     */
    public <T> void emit(EventKey<T> key, T payload) {
        List<Subscription> list = handlers.get(key);
        if (list == null) {
            return;
        }
        
        for (Subscription subscription : list) {
            try {
                subscription.typed.accept(payload);
            } catch (RuntimeException e) {
                LOGGER.warn("Handler for {} failed: {}", key, e.getMessage(), e);
            }
        }
    }
    
    public int handlerCount(EventKey<?> key) {
        List<Subscription> list = handlers.get(key);
        return list == null ? 0 : list.size();
    }
    
    public void clear() {
        handlers.clear();
    }
    
    private static final class Subscription {
        private final Object handler;
        private final Consumer<Object> typed;
        
        private Subscription(Object handler, Consumer<Object> typed) {
            this.handler = handler;
            this.typed = typed;
        }
    }
}
