package com.roomsnap.collab.error;

/**
 * The local participant's role does not allow the requested mutation.
 */
public final class PermissionDeniedException extends CollaborationException {
    private static final long serialVersionUID = 1L;
    
    public PermissionDeniedException(String message) {
        super(ErrorKind.PERMISSION_DENIED, message);
    }
}
