package com.roomsnap.collab.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A measurement shared with every participant of a session.
 * The version starts at 1 and strictly increases with every accepted mutation.
 */
public class SharedMeasurement {
    private final String id;
    private final String authorId;
    private final List<Point3> points;
    private final double distance;
    private final String unit;
    private final String label;
    private final long timestamp;
    private final long version;
    private final boolean locked;
    
    public SharedMeasurement(String id, String authorId, List<Point3> points, double distance,
                             String unit, String label, long timestamp, long version, boolean locked) {
        this.id = id;
        this.authorId = authorId;
        this.points = points == null ? new ArrayList<>() : new ArrayList<>(points);
        this.distance = distance;
        this.unit = unit;
        this.label = label;
        this.timestamp = timestamp;
        this.version = version;
        this.locked = locked;
    }
    
    public String getId() {
        return id;
    }
    
    public String getAuthorId() {
        return authorId;
    }
    
    /**
     * Gets the ordered points of this measurement.
     * @return An unmodifiable view of the points.
     */
    public List<Point3> getPoints() {
        return points == null ? Collections.emptyList() : Collections.unmodifiableList(points);
    }
    
    public double getDistance() {
        return distance;
    }
    
    public String getUnit() {
        return unit;
    }
    
    /**
     * Gets the optional label.
     * @return The label, or null if none was set.
     */
    public String getLabel() {
        return label;
    }
    
    public long getTimestamp() {
        return timestamp;
    }
    
    public long getVersion() {
        return version;
    }
    
    public boolean isLocked() {
        return locked;
    }
    
    /**
     * Applies a partial update, producing the next version.
     * @param update The fields to change.
     * @param now The mutation time in epoch millis.
     * @return The updated measurement at version + 1.
     */
    public SharedMeasurement apply(MeasurementUpdate update, long now) {
        return new SharedMeasurement(
                id,
                authorId,
                update.getPoints() != null ? update.getPoints() : points,
                update.getDistance() != null ? update.getDistance() : distance,
                update.getUnit() != null ? update.getUnit() : unit,
                update.getLabel() != null ? update.getLabel() : label,
                now,
                version + 1,
                locked);
    }
    
    public SharedMeasurement withVersion(long newVersion) {
        return new SharedMeasurement(id, authorId, points, distance, unit, label, timestamp, newVersion, locked);
    }
    
    /**
     * Changes the host-only lock flag, producing the next version.
     * @param newLocked The new lock state.
     * @param now The mutation time in epoch millis.
     * @return The updated measurement at version + 1.
     */
    public SharedMeasurement withLocked(boolean newLocked, long now) {
        return new SharedMeasurement(id, authorId, points, distance, unit, label, now, version + 1, newLocked);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        
        SharedMeasurement that = (SharedMeasurement) o;
        return Double.compare(distance, that.distance) == 0
                && timestamp == that.timestamp
                && version == that.version
                && locked == that.locked
                && Objects.equals(id, that.id)
                && Objects.equals(authorId, that.authorId)
                && Objects.equals(getPoints(), that.getPoints())
                && Objects.equals(unit, that.unit)
                && Objects.equals(label, that.label);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(id, authorId, getPoints(), distance, unit, label, timestamp, version, locked);
    }
    
    @Override
    public String toString() {
        return "SharedMeasurement{" +
                "id='" + id + '\'' +
                ", distance=" + distance + " " + unit +
                ", version=" + version +
                ", locked=" + locked +
                '}';
    }
}
