package com.roomsnap.collab.network;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.roomsnap.collab.error.CollaborationException;
import com.roomsnap.collab.error.ConnectionLostException;
import com.roomsnap.collab.error.MessageDecodingException;
import com.roomsnap.collab.error.SessionNotFoundException;
import com.roomsnap.collab.session.RoomDirectory;
import com.roomsnap.collab.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks the relay server for the state of a room over the transport link.
 * <p>
 * Sends {@code room_request} and waits for the matching {@code room_state}
 * or {@code room_error}. Concurrent requests for the same code share one
 * round trip.
 */
public class RemoteRoomDirectory implements RoomDirectory {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteRoomDirectory.class);
    
    static final String ERROR_NOT_FOUND = "NOT_FOUND";
    
    private final OutboundMessenger messenger;
    private final String participantId;
    private final long timeoutMillis;
    private final Map<String, CompletableFuture<Session>> pending = new ConcurrentHashMap<>();
    
    public RemoteRoomDirectory(OutboundMessenger messenger, String participantId, long timeoutMillis) {
        this.messenger = messenger;
        this.participantId = participantId;
        this.timeoutMillis = timeoutMillis;
        messenger.getLink().addMessageListener(this::onMessage);
    }
    
    @Override
    public Session requestSession(String roomCode) throws CollaborationException {
        if (messenger.getLink().getState() == LinkState.CONNECTION_LOST) {
            throw new ConnectionLostException("Not connected to the collaboration server");
        }
        
        boolean[] created = new boolean[1];
        CompletableFuture<Session> future = pending.computeIfAbsent(roomCode, code -> {
            created[0] = true;
            return new CompletableFuture<>();
        });
        if (created[0]) {
            JsonObject query = new JsonObject();
            query.addProperty("roomCode", roomCode);
            messenger.send(MessageType.ROOM_REQUEST, "", participantId, query);
        }
        
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ConnectionLostException("No answer for room " + roomCode
                    + " within " + timeoutMillis + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionLostException("Interrupted while waiting for room " + roomCode, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CollaborationException) {
                throw (CollaborationException) e.getCause();
            }
            throw new ConnectionLostException("Room request failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pending.remove(roomCode, future);
        }
    }
    
    private void onMessage(CollaborationMessage message) {
        if (message.getType() != MessageType.ROOM_STATE && message.getType() != MessageType.ROOM_ERROR) {
            return;
        }
        
        JsonElement data = message.getData();
        if (!data.isJsonObject()) {
            LOGGER.warn("Dropping {} without payload", message.getType().wireName());
            return;
        }
        
        try {
            if (message.getType() == MessageType.ROOM_STATE) {
                Session session = messenger.getCodec().fromPayload(data, Session.class);
                complete(session.getRoomCode(), session, null);
            } else {
                JsonObject error = data.getAsJsonObject();
                String roomCode = error.has("roomCode") ? error.get("roomCode").getAsString() : "";
                String reason = error.has("error") ? error.get("error").getAsString() : ERROR_NOT_FOUND;
                LOGGER.info("Room {} unavailable: {}", roomCode, reason);
                complete(roomCode, null, new SessionNotFoundException(roomCode));
            }
        } catch (MessageDecodingException e) {
            LOGGER.warn("Dropping unreadable {}: {}", message.getType().wireName(), e.getMessage());
        }
    }
    
    private void complete(String roomCode, Session session, CollaborationException failure) {
        CompletableFuture<Session> future = pending.get(roomCode);
        if (future == null) {
            LOGGER.debug("No pending request for room {}", roomCode);
            return;
        }
        if (failure != null) {
            future.completeExceptionally(failure);
        } else {
            future.complete(session.copy());
        }
    }
}
