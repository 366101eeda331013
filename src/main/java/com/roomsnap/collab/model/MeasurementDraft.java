package com.roomsnap.collab.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Geometry handed over by the measurement subsystem, ready to be shared.
 */
public class MeasurementDraft {
    private final String id;
    private final List<Point3> points;
    private final double distance;
    private final String unit;
    private final String label;
    
    /**
     * Creates a draft.
     * @param id The measurement id, or null to have one generated.
     * @param points The ordered measurement points.
     * @param distance The computed distance.
     * @param unit The distance unit, e.g. "m".
     * @param label An optional label, may be null.
     */
    public MeasurementDraft(String id, List<Point3> points, double distance, String unit, String label) {
        this.id = id;
        this.points = new ArrayList<>(points);
        this.distance = distance;
        this.unit = unit;
        this.label = label;
    }
    
    public String getId() {
        return id;
    }
    
    public List<Point3> getPoints() {
        return Collections.unmodifiableList(points);
    }
    
    public double getDistance() {
        return distance;
    }
    
    public String getUnit() {
        return unit;
    }
    
    public String getLabel() {
        return label;
    }
    
    /**
     * Expresses this draft as an update of an existing measurement.
     * @return The equivalent update.
     */
    public MeasurementUpdate asUpdate() {
        return MeasurementUpdate.builder()
                .points(points)
                .distance(distance)
                .unit(unit)
                .label(label)
                .build();
    }
}
