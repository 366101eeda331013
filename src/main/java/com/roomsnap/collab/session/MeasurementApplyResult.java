package com.roomsnap.collab.session;

/**
 * Outcome of applying a remote measurement to the store.
 */
public enum MeasurementApplyResult {
    /** The measurement was not known locally and has been added. */
    ADDED,
    /** The incoming version was newer and replaced the local copy. */
    APPLIED,
    /** The incoming version was not newer; it waits in the conflict queue. */
    CONFLICT_QUEUED,
    /** Exact replay of the local copy; nothing changed. */
    DUPLICATE,
    /** No session is active. */
    IGNORED
}
