package com.roomsnap.collab.session;

import com.roomsnap.collab.error.CollaborationException;

/**
 * Source of the remote authoritative state of a room.
 */
public interface RoomDirectory {
    
    /**
     * Fetches the current state of the session behind a room code.
     * @param roomCode The room code.
     * @return The remote session.
     * @throws CollaborationException NOT_FOUND for unknown or expired codes,
     *         CONNECTION_LOST if the directory could not be reached.
     */
    Session requestSession(String roomCode) throws CollaborationException;
}
