package com.roomsnap.collab.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.roomsnap.collab.model.ChatMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;

class EventBusTest {
    private static final ChatMessage HELLO = new ChatMessage("hello", "Alice", "#FF6B6B");

    @Test
    void failingHandlerDoesNotStopTheOthers() {
        EventBus bus = new EventBus();
        List<String> seen = new ArrayList<>();
        bus.on(SessionEvents.CHAT_MESSAGE, chat -> seen.add("first"));
        bus.on(SessionEvents.CHAT_MESSAGE, chat -> {
            throw new IllegalStateException("boom");
        });
        bus.on(SessionEvents.CHAT_MESSAGE, chat -> seen.add("third"));

        bus.emit(SessionEvents.CHAT_MESSAGE, HELLO);

        assertEquals(List.of("first", "third"), seen);
    }

    @Test
    void offRemovesOnlyThatHandler() {
        EventBus bus = new EventBus();
        List<ChatMessage> seen = new ArrayList<>();
        Consumer<ChatMessage> removed = seen::add;
        bus.on(SessionEvents.CHAT_MESSAGE, removed);
        bus.on(SessionEvents.CHAT_MESSAGE, seen::add);

        bus.off(SessionEvents.CHAT_MESSAGE, removed);
        bus.emit(SessionEvents.CHAT_MESSAGE, HELLO);

        assertEquals(1, seen.size());
        assertEquals(1, bus.handlerCount(SessionEvents.CHAT_MESSAGE));
    }

    @Test
    void eventsAreKeptApart() {
        EventBus bus = new EventBus();
        List<Object> seen = new ArrayList<>();
        bus.on(SessionEvents.PARTICIPANT_JOINED, seen::add);

        bus.emit(SessionEvents.CHAT_MESSAGE, HELLO);

        assertTrue(seen.isEmpty());
    }

    @Test
    void handlersReceivePayloadsAsTheKeyType() {
        EventBus bus = new EventBus();
        EventKey<Number> measured = new EventKey<>("measured", Number.class);
        List<Double> doubled = new ArrayList<>();
        bus.on(measured, value -> doubled.add(value.doubleValue() * 2));

        bus.emit(measured, 21);
        bus.emit(measured, 1.5);

        assertEquals(List.of(42.0, 3.0), doubled);
    }

    @Test
    void clearDropsAllSubscriptions() {
        EventBus bus = new EventBus();
        bus.on(SessionEvents.CHAT_MESSAGE, chat -> { });

        bus.clear();

        assertEquals(0, bus.handlerCount(SessionEvents.CHAT_MESSAGE));
    }
}
