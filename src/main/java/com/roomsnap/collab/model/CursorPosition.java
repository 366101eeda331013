package com.roomsnap.collab.model;

import java.util.Objects;

/**
 * Ephemeral cursor of one participant. Never versioned; the latest write wins.
 */
public class CursorPosition {
    private final String participantId;
    private final double x;
    private final double y;
    private final double z;
    private final long timestamp;
    
    public CursorPosition(String participantId, double x, double y, double z, long timestamp) {
        this.participantId = participantId;
        this.x = x;
        this.y = y;
        this.z = z;
        this.timestamp = timestamp;
    }
    
    public CursorPosition(String participantId, Point3 point, long timestamp) {
        this(participantId, point.getX(), point.getY(), point.getZ(), timestamp);
    }
    
    public String getParticipantId() {
        return participantId;
    }
    
    public double getX() {
        return x;
    }
    
    public double getY() {
        return y;
    }
    
    public double getZ() {
        return z;
    }
    
    public long getTimestamp() {
        return timestamp;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        
        CursorPosition that = (CursorPosition) o;
        return Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && Double.compare(z, that.z) == 0
                && timestamp == that.timestamp
                && Objects.equals(participantId, that.participantId);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(participantId, x, y, z, timestamp);
    }
    
    @Override
    public String toString() {
        return "CursorPosition{" +
                "participantId='" + participantId + '\'' +
                ", x=" + x +
                ", y=" + y +
                ", z=" + z +
                '}';
    }
}
