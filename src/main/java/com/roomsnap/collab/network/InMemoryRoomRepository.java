package com.roomsnap.collab.network;

import com.roomsnap.collab.session.Session;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps rooms for the lifetime of the relay process only.
 */
public class InMemoryRoomRepository implements RoomRepository {
    private final Map<String, Session> sessionsById = new ConcurrentHashMap<>();
    
    @Override
    public void save(Session session) {
        sessionsById.put(session.getId(), session.copy());
    }
    
    @Override
    public Optional<Session> findByRoomCode(String roomCode) {
        return sessionsById.values().stream()
                .filter(session -> session.getRoomCode().equals(roomCode))
                .findFirst()
                .map(Session::copy);
    }
    
    @Override
    public Optional<Session> findById(String sessionId) {
        Session session = sessionsById.get(sessionId);
        return session == null ? Optional.empty() : Optional.of(session.copy());
    }
    
    @Override
    public void delete(String sessionId) {
        sessionsById.remove(sessionId);
    }
    
    public int size() {
        return sessionsById.size();
    }
}
