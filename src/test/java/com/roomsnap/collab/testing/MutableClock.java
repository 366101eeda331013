package com.roomsnap.collab.testing;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A clock that only moves when told to.
 */
public class MutableClock extends Clock {
    private volatile long millis;
    
    public MutableClock(long startMillis) {
        this.millis = startMillis;
    }
    
    public void advance(long deltaMillis) {
        millis += deltaMillis;
    }
    
    public void set(long newMillis) {
        millis = newMillis;
    }
    
    @Override
    public long millis() {
        return millis;
    }
    
    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis);
    }
    
    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }
    
    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
