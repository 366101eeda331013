package com.roomsnap.collab.error;

/**
 * The room code is unknown or the session behind it has expired.
 */
public final class SessionNotFoundException extends CollaborationException {
    private static final long serialVersionUID = 1L;
    
    private final String roomCode;
    
    public SessionNotFoundException(String roomCode) {
        super(ErrorKind.NOT_FOUND, "No active session for room code " + roomCode);
        this.roomCode = roomCode;
    }
    
    public String getRoomCode() {
        return roomCode;
    }
}
