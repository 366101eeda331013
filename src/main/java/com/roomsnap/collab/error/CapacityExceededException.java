package com.roomsnap.collab.error;

public final class CapacityExceededException extends CollaborationException {
    private static final long serialVersionUID = 1L;
    
    public CapacityExceededException(String roomCode, int maxParticipants) {
        super(ErrorKind.CAPACITY_EXCEEDED,
                "Room " + roomCode + " is full (" + maxParticipants + " participants)");
    }
}
