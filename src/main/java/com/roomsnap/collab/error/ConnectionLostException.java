package com.roomsnap.collab.error;

public final class ConnectionLostException extends CollaborationException {
    private static final long serialVersionUID = 1L;
    
    public ConnectionLostException(String message) {
        super(ErrorKind.CONNECTION_LOST, message);
    }
    
    public ConnectionLostException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION_LOST, message, cause);
    }
}
