package com.roomsnap.collab.error;

/**
 * The failure categories surfaced by the collaboration engine.
 */
public enum ErrorKind {
    NOT_FOUND,
    CAPACITY_EXCEEDED,
    PERMISSION_DENIED,
    CONNECTION_LOST,
    DECODE_ERROR
}
