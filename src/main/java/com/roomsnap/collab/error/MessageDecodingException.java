package com.roomsnap.collab.error;

/**
 * An inbound envelope could not be decoded. Always dropped, never fatal.
 */
public final class MessageDecodingException extends CollaborationException {
    private static final long serialVersionUID = 1L;
    
    public MessageDecodingException(String message) {
        super(ErrorKind.DECODE_ERROR, message);
    }
    
    public MessageDecodingException(String message, Throwable cause) {
        super(ErrorKind.DECODE_ERROR, message, cause);
    }
}
