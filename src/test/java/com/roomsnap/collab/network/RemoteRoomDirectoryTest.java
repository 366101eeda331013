package com.roomsnap.collab.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.gson.JsonObject;
import com.roomsnap.collab.error.CollaborationException;
import com.roomsnap.collab.error.ConnectionLostException;
import com.roomsnap.collab.error.ErrorKind;
import com.roomsnap.collab.error.SessionNotFoundException;
import com.roomsnap.collab.model.SessionSettings;
import com.roomsnap.collab.session.Session;
import com.roomsnap.collab.testing.FakeChannelFactory;
import com.roomsnap.collab.testing.ManualScheduler;
import com.roomsnap.collab.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RemoteRoomDirectoryTest {
    private final MessageCodec codec = new MessageCodec();
    private FakeChannelFactory channels;
    private TransportLink link;
    private OutboundMessenger messenger;

    @BeforeEach
    void setUp() {
        channels = new FakeChannelFactory();
        link = new TransportLink(channels, codec, new OutboundQueue(), new ManualScheduler(), 5, 1000);
        messenger = new OutboundMessenger(link, codec, new MutableClock(1000));
    }

    @Test
    void returnsTheSessionTheServerReports() throws CollaborationException {
        Session room = new Session("session_1", "ABC123", "host", 1000, SessionSettings.defaults());
        channels.setResponder(request -> request.getType() == MessageType.ROOM_REQUEST
                ? new CollaborationMessage(MessageType.ROOM_STATE, room.getId(), "relay",
                        codec.toPayload(room), 1000, 1)
                : null);
        link.connect();
        RemoteRoomDirectory directory = new RemoteRoomDirectory(messenger, "participant_bob", 1000);

        Session found = directory.requestSession("ABC123");

        assertEquals("session_1", found.getId());
        CollaborationMessage request = channels.sent().get(0);
        assertEquals(MessageType.ROOM_REQUEST, request.getType());
        assertEquals("", request.getSessionId());
        assertEquals("participant_bob", request.getParticipantId());
        assertEquals("ABC123", request.getData().getAsJsonObject().get("roomCode").getAsString());
    }

    @Test
    void roomErrorBecomesNotFound() {
        channels.setResponder(request -> {
            JsonObject error = new JsonObject();
            error.addProperty("roomCode", "ZZZZZZ");
            error.addProperty("error", "NOT_FOUND");
            return new CollaborationMessage(MessageType.ROOM_ERROR, "", "relay", error, 1000, 1);
        });
        link.connect();
        RemoteRoomDirectory directory = new RemoteRoomDirectory(messenger, "participant_bob", 1000);

        SessionNotFoundException error = assertThrows(SessionNotFoundException.class,
                () -> directory.requestSession("ZZZZZZ"));

        assertEquals("ZZZZZZ", error.getRoomCode());
        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
    }

    @Test
    void silenceTimesOutAsConnectionLost() {
        link.connect();
        RemoteRoomDirectory directory = new RemoteRoomDirectory(messenger, "participant_bob", 50);

        assertThrows(ConnectionLostException.class, () -> directory.requestSession("ABC123"));
    }

    @Test
    void failsFastOnceTheLinkHasGivenUp() {
        channels.setReachable(false);
        TransportLink deadLink = new TransportLink(channels, codec, new OutboundQueue(), new ManualScheduler(), 0, 1000);
        deadLink.connect();
        RemoteRoomDirectory directory = new RemoteRoomDirectory(
                new OutboundMessenger(deadLink, codec, new MutableClock(1000)), "participant_bob", 10_000);

        assertEquals(LinkState.CONNECTION_LOST, deadLink.getState());
        assertThrows(ConnectionLostException.class, () -> directory.requestSession("ABC123"));
    }
}
