package com.roomsnap.collab.error;

/**
 * Base class of every failure the collaboration engine reports to its callers.
 */
public class CollaborationException extends Exception {
    private static final long serialVersionUID = 1L;
    
    private final ErrorKind kind;
    
    public CollaborationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    public CollaborationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
    
    public ErrorKind getKind() {
        return kind;
    }
}
