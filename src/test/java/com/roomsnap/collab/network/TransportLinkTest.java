package com.roomsnap.collab.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.roomsnap.collab.testing.FakeChannelFactory;
import com.roomsnap.collab.testing.ManualScheduler;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransportLinkTest {
    private FakeChannelFactory channels;
    private ManualScheduler scheduler;
    private TransportLink link;
    private final List<LinkState> states = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        channels = new FakeChannelFactory();
        scheduler = new ManualScheduler();
        link = new TransportLink(channels, new MessageCodec(), new OutboundQueue(), scheduler, 5, 1000);
        link.addStateListener(states::add);
    }

    @Test
    void connectsAndWritesDirectly() {
        assertTrue(link.connect());

        link.send(message(1));

        assertEquals(LinkState.CONNECTED, link.getState());
        assertEquals(1, channels.current().sentMessages().size());
        assertTrue(link.getOutboundQueue().isEmpty());
    }

    @Test
    void backsOffExponentiallyThenReportsConnectionLostOnce() {
        channels.setReachable(false);

        assertFalse(link.connect());
        while (scheduler.runNextOneShot()) {
            // keep failing until the link gives up
        }

        assertEquals(List.of(1000L, 2000L, 4000L, 8000L, 16000L), scheduler.requestedDelays());
        assertEquals(LinkState.CONNECTION_LOST, link.getState());
        assertEquals(1, states.stream().filter(state -> state == LinkState.CONNECTION_LOST).count());
        assertEquals(6, channels.getOpenAttempts());
        assertEquals(0, scheduler.pendingOneShots());
    }

    @Test
    void queuedMessagesFlushInOrderOnReconnect() {
        channels.setReachable(false);
        link.connect();
        link.send(message(1));
        link.send(message(2));
        link.send(message(3));
        assertEquals(3, link.getOutboundQueue().size());

        channels.setReachable(true);
        scheduler.runNextOneShot();

        assertEquals(LinkState.CONNECTED, link.getState());
        List<Long> sequences = channels.current().sentMessages().stream()
                .map(CollaborationMessage::getSequence)
                .collect(Collectors.toList());
        assertEquals(List.of(1L, 2L, 3L), sequences);
        assertTrue(link.getOutboundQueue().isEmpty());
    }

    @Test
    void droppedConnectionReconnectsAndDeliversWhatWasSentMeanwhile() {
        link.connect();
        channels.current().dropFromServer();

        assertEquals(LinkState.RECONNECTING, link.getState());
        link.send(message(4));
        assertEquals(1, link.getOutboundQueue().size());

        scheduler.runNextOneShot();

        assertEquals(LinkState.CONNECTED, link.getState());
        assertEquals(4L, channels.current().sentMessages().get(0).getSequence());
        assertEquals(List.of(1000L), scheduler.requestedDelays());
    }

    @Test
    void successfulReconnectResetsTheBackoff() {
        link.connect();
        channels.current().dropFromServer();
        scheduler.runNextOneShot();
        channels.current().dropFromServer();

        assertEquals(List.of(1000L, 1000L), scheduler.requestedDelays());
    }

    @Test
    void disconnectCancelsPendingReconnect() {
        channels.setReachable(false);
        link.connect();

        link.disconnect();

        assertEquals(LinkState.DISCONNECTED, link.getState());
        assertEquals(0, scheduler.pendingOneShots());
    }

    @Test
    void cancelReconnectOnlyActsWhileReconnecting() {
        link.connect();
        link.cancelReconnect();
        assertEquals(LinkState.CONNECTED, link.getState());

        channels.current().dropFromServer();
        link.cancelReconnect();

        assertEquals(LinkState.DISCONNECTED, link.getState());
        assertEquals(0, scheduler.pendingOneShots());
    }

    @Test
    void malformedInboundIsDroppedAndListenersAreIsolated() {
        List<CollaborationMessage> received = new ArrayList<>();
        link.addMessageListener(message -> {
            throw new IllegalStateException("boom");
        });
        link.addMessageListener(received::add);
        link.connect();

        channels.current().receiveText("{broken");
        channels.current().receive(message(9));

        assertEquals(1, received.size());
        assertEquals(9L, received.get(0).getSequence());
        assertEquals(LinkState.CONNECTED, link.getState());
    }

    private static CollaborationMessage message(long sequence) {
        return new CollaborationMessage(MessageType.CHAT, "session_1", "participant_a", null, 1000, sequence);
    }
}
