package com.roomsnap.collab.network;

import com.roomsnap.collab.session.Session;

import java.util.Optional;

/**
 * Durable home of the rooms held by the relay server.
 */
public interface RoomRepository extends AutoCloseable {
    
    void save(Session session);
    
    Optional<Session> findByRoomCode(String roomCode);
    
    Optional<Session> findById(String sessionId);
    
    void delete(String sessionId);
    
    @Override
    default void close() {
    }
}
