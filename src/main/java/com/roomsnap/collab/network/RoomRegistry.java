package com.roomsnap.collab.network;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.roomsnap.collab.error.MessageDecodingException;
import com.roomsnap.collab.model.Annotation;
import com.roomsnap.collab.model.CursorPosition;
import com.roomsnap.collab.model.Participant;
import com.roomsnap.collab.model.SharedMeasurement;
import com.roomsnap.collab.session.MeasurementApplyResult;
import com.roomsnap.collab.session.Session;
import com.roomsnap.collab.session.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The relay server's authoritative view of every room.
 * <p>
 * Each room is a {@link SessionStateStore} fed with the same envelopes the
 * participants exchange. Connections are identified by opaque ids and bound
 * to a session by the first message they send for it. Handling an envelope
 * yields the deliveries the transport must perform; the registry itself
 * never touches a socket.
 */
public class RoomRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(RoomRegistry.class);
    
    public static final String SERVER_PARTICIPANT_ID = "relay";
    
    private final MessageCodec codec;
    private final RoomRepository repository;
    private final Clock clock;
    
    private final Map<String, SessionStateStore> roomsBySessionId = new HashMap<>();
    private final Map<String, String> sessionByConnection = new HashMap<>();
    private final Map<String, Set<String>> connectionsBySession = new HashMap<>();
    private long sequence;
    
    public RoomRegistry(MessageCodec codec, RoomRepository repository, Clock clock) {
        this.codec = codec;
        this.repository = repository;
        this.clock = clock;
    }
    
    /**
     * Applies one envelope received from a connection.
     * @param connectionId The sending connection.
     * @param message The decoded envelope.
     * @return What to send, and to whom.
     */
    public synchronized List<Delivery> handle(String connectionId, CollaborationMessage message) {
        try {
            switch (message.getType()) {
                case ROOM_REQUEST:
                    return Collections.singletonList(new Delivery(connectionId, answerRoomRequest(message)));
                case ROOM_STATE:
                case ROOM_ERROR:
                    LOGGER.warn("Ignoring {} sent by connection {}", message.getType().wireName(), connectionId);
                    return Collections.emptyList();
                case JOIN:
                    return handleJoin(connectionId, message);
                default:
                    return handleSessionMessage(connectionId, message);
            }
        } catch (MessageDecodingException e) {
            LOGGER.warn("Dropping {} from {}: {}", message.getType().wireName(), message.getParticipantId(), e.getMessage());
            return Collections.emptyList();
        }
    }
    
    /**
     * Forgets a closed connection. Its participant keeps its presence flag
     * so that a reconnecting client resumes silently.
     * @param connectionId The closed connection.
     */
    public synchronized void disconnected(String connectionId) {
        String sessionId = sessionByConnection.remove(connectionId);
        if (sessionId != null) {
            Set<String> members = connectionsBySession.get(sessionId);
            if (members != null) {
                members.remove(connectionId);
                if (members.isEmpty()) {
                    connectionsBySession.remove(sessionId);
                }
            }
        }
    }
    
    /**
     * Looks up a live room by code, evicting it if it has expired.
     * @param roomCode The room code.
     * @return A snapshot of the room.
     */
    public synchronized Optional<Session> findRoom(String roomCode) {
        return roomByCode(roomCode).flatMap(SessionStateStore::snapshot);
    }
    
    /**
     * Drops every expired room held in memory.
     * @return The number of rooms evicted.
     */
    public synchronized int evictExpired() {
        long now = clock.millis();
        List<String> expired = new ArrayList<>();
        for (Map.Entry<String, SessionStateStore> entry : roomsBySessionId.entrySet()) {
            Optional<Session> session = entry.getValue().snapshot();
            if (session.isEmpty() || session.get().isExpired(now)) {
                expired.add(entry.getKey());
            }
        }
        expired.forEach(this::evict);
        return expired.size();
    }
    
    public synchronized int roomCount() {
        return roomsBySessionId.size();
    }
    
    public synchronized Set<String> connectionsOf(String sessionId) {
        Set<String> members = connectionsBySession.get(sessionId);
        return members == null ? Collections.emptySet() : new LinkedHashSet<>(members);
    }
    
    private CollaborationMessage answerRoomRequest(CollaborationMessage request) {
        JsonElement data = request.getData();
        String roomCode = data.isJsonObject() && data.getAsJsonObject().has("roomCode")
                ? data.getAsJsonObject().get("roomCode").getAsString() : "";
        
        Optional<Session> room = findRoom(roomCode);
        if (room.isEmpty()) {
            LOGGER.info("Room {} requested by {} not found", roomCode, request.getParticipantId());
            JsonObject error = new JsonObject();
            error.addProperty("roomCode", roomCode);
            error.addProperty("error", RemoteRoomDirectory.ERROR_NOT_FOUND);
            return reply(MessageType.ROOM_ERROR, "", error);
        }
        return reply(MessageType.ROOM_STATE, room.get().getId(), codec.toPayload(room.get()));
    }
    
    private List<Delivery> handleJoin(String connectionId, CollaborationMessage message)
            throws MessageDecodingException {
        JsonElement data = message.getData();
        boolean announcesRoom = data.isJsonObject() && data.getAsJsonObject().has("roomCode");
        
        SessionStateStore room = liveRoom(message.getSessionId());
        if (announcesRoom && room == null) {
            Session announced = codec.fromPayload(data, Session.class).copy();
            Optional<SessionStateStore> clash = roomByCode(announced.getRoomCode());
            if (clash.isPresent()) {
                LOGGER.warn("Room code {} already in use, ignoring session {}",
                        announced.getRoomCode(), announced.getId());
                return Collections.emptyList();
            }
            room = new SessionStateStore(clock);
            room.install(announced);
            roomsBySessionId.put(announced.getId(), room);
            repository.save(announced);
            bind(connectionId, announced.getId());
            LOGGER.info("Registered room {} for session {}", announced.getRoomCode(), announced.getId());
            return relay(connectionId, message);
        }
        
        if (room == null) {
            LOGGER.warn("Join from {} for unknown session {}", message.getParticipantId(), message.getSessionId());
            return Collections.emptyList();
        }
        
        Participant participant;
        if (announcesRoom) {
            Optional<Participant> announcer = codec.fromPayload(data, Session.class)
                    .findParticipant(message.getParticipantId());
            if (announcer.isEmpty()) {
                return Collections.emptyList();
            }
            participant = announcer.get();
        } else {
            participant = codec.fromPayload(data, Participant.class);
        }
        
        Session current = room.snapshot().orElseThrow();
        if (!current.hasSeatFor(participant.getId())) {
            LOGGER.warn("Room {} is full, rejecting join of {}", current.getRoomCode(), participant.getId());
            return Collections.emptyList();
        }
        try {
            room.putParticipant(participant);
        } catch (IllegalStateException e) {
            LOGGER.warn("Rejected join of {}: {}", participant.getId(), e.getMessage());
            return Collections.emptyList();
        }
        bind(connectionId, message.getSessionId());
        persist(room);
        return relay(connectionId, message);
    }
    
    private List<Delivery> handleSessionMessage(String connectionId, CollaborationMessage message)
            throws MessageDecodingException {
        SessionStateStore room = liveRoom(message.getSessionId());
        if (room == null) {
            LOGGER.debug("Dropping {} for unknown session {}", message.getType().wireName(), message.getSessionId());
            return Collections.emptyList();
        }
        bind(connectionId, message.getSessionId());
        
        JsonElement data = message.getData();
        switch (message.getType()) {
            case LEAVE:
                room.markInactive(message.getParticipantId());
                persist(room);
                break;
            case MEASUREMENT:
                SharedMeasurement measurement = codec.fromPayload(data, SharedMeasurement.class);
                if (room.applyRemoteMeasurement(measurement) == MeasurementApplyResult.CONFLICT_QUEUED) {
                    // the relay keeps the higher version and leaves resolution to the peers
                    room.takeConflicts(measurement.getId());
                }
                persist(room);
                break;
            case ANNOTATION:
                room.putAnnotation(codec.fromPayload(data, Annotation.class));
                persist(room);
                break;
            case SYNC:
                SyncPayload sync = codec.fromPayload(data, SyncPayload.class);
                room.replaceContent(sync.getMeasurements(), sync.getAnnotations());
                persist(room);
                break;
            case CURSOR:
                room.putCursor(codec.fromPayload(data, CursorPosition.class));
                break;
            default:
                break;
        }
        return relay(connectionId, message);
    }
    
    private List<Delivery> relay(String senderConnectionId, CollaborationMessage message) {
        List<Delivery> deliveries = new ArrayList<>();
        for (String member : connectionsOf(message.getSessionId())) {
            if (!member.equals(senderConnectionId)) {
                deliveries.add(new Delivery(member, message));
            }
        }
        return deliveries;
    }
    
    private SessionStateStore liveRoom(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            return null;
        }
        SessionStateStore room = roomsBySessionId.get(sessionId);
        if (room == null) {
            Optional<Session> stored = repository.findById(sessionId);
            if (stored.isEmpty()) {
                return null;
            }
            room = new SessionStateStore(clock);
            room.install(stored.get());
            roomsBySessionId.put(sessionId, room);
        }
        return expireIfNeeded(sessionId, room);
    }
    
    private Optional<SessionStateStore> roomByCode(String roomCode) {
        for (Map.Entry<String, SessionStateStore> entry : roomsBySessionId.entrySet()) {
            Optional<Session> session = entry.getValue().snapshot();
            if (session.isPresent() && session.get().getRoomCode().equals(roomCode)) {
                return Optional.ofNullable(expireIfNeeded(entry.getKey(), entry.getValue()));
            }
        }
        Optional<Session> stored = repository.findByRoomCode(roomCode);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(liveRoom(stored.get().getId()));
    }
    
    private SessionStateStore expireIfNeeded(String sessionId, SessionStateStore room) {
        Optional<Session> session = room.snapshot();
        if (session.isEmpty() || session.get().isExpired(clock.millis())) {
            evict(sessionId);
            return null;
        }
        return room;
    }
    
    private void evict(String sessionId) {
        SessionStateStore removed = roomsBySessionId.remove(sessionId);
        repository.delete(sessionId);
        Set<String> members = connectionsBySession.remove(sessionId);
        if (members != null) {
            members.forEach(sessionByConnection::remove);
        }
        if (removed != null) {
            LOGGER.info("Evicted expired session {}", sessionId);
        }
    }
    
    private void bind(String connectionId, String sessionId) {
        String previous = sessionByConnection.put(connectionId, sessionId);
        if (previous != null && !previous.equals(sessionId)) {
            Set<String> old = connectionsBySession.get(previous);
            if (old != null) {
                old.remove(connectionId);
            }
        }
        connectionsBySession.computeIfAbsent(sessionId, id -> new LinkedHashSet<>()).add(connectionId);
    }
    
    private void persist(SessionStateStore room) {
        room.snapshot().ifPresent(repository::save);
    }
    
    private CollaborationMessage reply(MessageType type, String sessionId, JsonElement data) {
        return new CollaborationMessage(type, sessionId, SERVER_PARTICIPANT_ID, data, clock.millis(), ++sequence);
    }
    
    /**
     * One envelope to write to one connection.
     */
    public static final class Delivery {
        private final String connectionId;
        private final CollaborationMessage message;
        
        public Delivery(String connectionId, CollaborationMessage message) {
            this.connectionId = connectionId;
            this.message = message;
        }
        
        public String getConnectionId() {
            return connectionId;
        }
        
        public CollaborationMessage getMessage() {
            return message;
        }
    }
}
