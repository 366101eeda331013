package com.roomsnap.collab.network;

import com.roomsnap.collab.model.Annotation;
import com.roomsnap.collab.model.SharedMeasurement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Payload of a sync envelope: the sender's full measurements and annotations.
 */
public class SyncPayload {
    private final List<SharedMeasurement> measurements;
    private final List<Annotation> annotations;
    
    public SyncPayload(List<SharedMeasurement> measurements, List<Annotation> annotations) {
        this.measurements = new ArrayList<>(measurements);
        this.annotations = new ArrayList<>(annotations);
    }
    
    public List<SharedMeasurement> getMeasurements() {
        return measurements == null ? Collections.emptyList() : measurements;
    }
    
    public List<Annotation> getAnnotations() {
        return annotations == null ? Collections.emptyList() : annotations;
    }
}
