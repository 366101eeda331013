package com.roomsnap.collab.session;

import java.time.Clock;

/**
 * Lets at most one cursor broadcast through per interval.
 * Movements inside the interval are discarded, not deferred.
 */
public class CursorThrottle {
    private final Clock clock;
    private final long intervalMillis;
    private long lastBroadcast = Long.MIN_VALUE;
    
    public CursorThrottle(Clock clock, long intervalMillis) {
        this.clock = clock;
        this.intervalMillis = intervalMillis;
    }
    
    /**
     * Claims the next broadcast slot if one is available.
     * @return true if the caller may broadcast now.
     */
    public synchronized boolean tryAcquire() {
        long now = clock.millis();
        if (lastBroadcast != Long.MIN_VALUE && now - lastBroadcast < intervalMillis) {
            return false;
        }
        lastBroadcast = now;
        return true;
    }
    
    public synchronized void reset() {
        lastBroadcast = Long.MIN_VALUE;
    }
}
