package com.roomsnap.collab.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A partial change to a shared measurement. Null fields are left untouched.
 */
public class MeasurementUpdate {
    private final List<Point3> points;
    private final Double distance;
    private final String unit;
    private final String label;
    
    private MeasurementUpdate(Builder builder) {
        this.points = builder.points;
        this.distance = builder.distance;
        this.unit = builder.unit;
        this.label = builder.label;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public List<Point3> getPoints() {
        return points;
    }
    
    public Double getDistance() {
        return distance;
    }
    
    public String getUnit() {
        return unit;
    }
    
    public String getLabel() {
        return label;
    }
    
    public static class Builder {
        private List<Point3> points;
        private Double distance;
        private String unit;
        private String label;
        
        private Builder() {
        }
        
        public Builder points(List<Point3> points) {
            this.points = points == null ? null : new ArrayList<>(points);
            return this;
        }
        
        public Builder distance(double distance) {
            this.distance = distance;
            return this;
        }
        
        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }
        
        public Builder label(String label) {
            this.label = label;
            return this;
        }
        
        public MeasurementUpdate build() {
            return new MeasurementUpdate(this);
        }
    }
}
