package com.roomsnap.collab.session;

import com.roomsnap.collab.model.Annotation;
import com.roomsnap.collab.model.CursorPosition;
import com.roomsnap.collab.model.Participant;
import com.roomsnap.collab.model.Role;
import com.roomsnap.collab.model.SessionSettings;
import com.roomsnap.collab.model.SharedMeasurement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One live, time-boxed collaborative room.
 * <p>
 * Only {@link SessionStateStore} mutates a session; everyone else sees
 * read-only views or detached copies from {@link #copy()}.
 */
public class Session {
    private final String id;
    private final String roomCode;
    private final String hostId;
    private final List<Participant> participants;
    private final List<SharedMeasurement> measurements;
    private final Map<String, CursorPosition> cursors;
    private final List<Annotation> annotations;
    private final long createdAt;
    private long updatedAt;
    private final SessionSettings settings;
    
    public Session(String id, String roomCode, String hostId, long createdAt, SessionSettings settings) {
        this(id, roomCode, hostId, new ArrayList<>(), new ArrayList<>(), new LinkedHashMap<>(),
                new ArrayList<>(), createdAt, createdAt, settings);
    }
    
    private Session(String id, String roomCode, String hostId, List<Participant> participants,
                    List<SharedMeasurement> measurements, Map<String, CursorPosition> cursors,
                    List<Annotation> annotations, long createdAt, long updatedAt, SessionSettings settings) {
        this.id = id;
        this.roomCode = roomCode;
        this.hostId = hostId;
        this.participants = participants;
        this.measurements = measurements;
        this.cursors = cursors;
        this.annotations = annotations;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.settings = settings;
    }
    
    public String getId() {
        return id;
    }
    
    public String getRoomCode() {
        return roomCode;
    }
    
    public String getHostId() {
        return hostId;
    }
    
    public List<Participant> getParticipants() {
        return Collections.unmodifiableList(participants);
    }
    
    public List<SharedMeasurement> getMeasurements() {
        return Collections.unmodifiableList(measurements);
    }
    
    public Map<String, CursorPosition> getCursors() {
        return Collections.unmodifiableMap(cursors);
    }
    
    public List<Annotation> getAnnotations() {
        return Collections.unmodifiableList(annotations);
    }
    
    public long getCreatedAt() {
        return createdAt;
    }
    
    public long getUpdatedAt() {
        return updatedAt;
    }
    
    public SessionSettings getSettings() {
        return settings == null ? SessionSettings.defaults() : settings;
    }
    
    public Optional<Participant> findParticipant(String participantId) {
        for (Participant participant : participants) {
            if (participant.getId().equals(participantId)) {
                return Optional.of(participant);
            }
        }
        return Optional.empty();
    }
    
    public Optional<SharedMeasurement> findMeasurement(String measurementId) {
        int index = indexOfMeasurement(measurementId);
        return index < 0 ? Optional.empty() : Optional.of(measurements.get(index));
    }
    
    public long activeParticipantCount() {
        return participants.stream().filter(Participant::isActive).count();
    }
    
    /**
     * Whether a participant may take a seat. Participants are never removed,
     * so everyone who ever joined counts, and a returning participant keeps
     * their seat.
     * @param participantId The participant asking to join.
     * @return true if the participant is already listed or the room is below capacity.
     */
    public boolean hasSeatFor(String participantId) {
        return findParticipant(participantId).isPresent()
                || participants.size() < getSettings().getMaxParticipants();
    }
    
    public long hostCount() {
        return participants.stream().filter(p -> p.getRole() == Role.HOST).count();
    }
    
    /**
     * Whether the session's lifetime has run out.
     * @param nowMillis The current time in epoch millis.
     * @return true once createdAt + expiresIn has passed.
     */
    public boolean isExpired(long nowMillis) {
        return nowMillis >= createdAt + getSettings().getExpiresIn() * 60_000L;
    }
    
    /**
     * Creates a detached copy that later mutations of this session do not affect.
     * Collections missing from a deserialized session come back empty.
     * @return The copy.
     */
    public Session copy() {
        return new Session(id, roomCode, hostId,
                participants == null ? new ArrayList<>() : new ArrayList<>(participants),
                measurements == null ? new ArrayList<>() : new ArrayList<>(measurements),
                cursors == null ? new LinkedHashMap<>() : new LinkedHashMap<>(cursors),
                annotations == null ? new ArrayList<>() : new ArrayList<>(annotations),
                createdAt, Math.max(createdAt, updatedAt), getSettings());
    }
    
    // Mutators, used by SessionStateStore only
    
    void putParticipant(Participant participant) {
        for (int i = 0; i < participants.size(); i++) {
            if (participants.get(i).getId().equals(participant.getId())) {
                participants.set(i, participant);
                return;
            }
        }
        participants.add(participant);
    }
    
    void putMeasurement(SharedMeasurement measurement) {
        int index = indexOfMeasurement(measurement.getId());
        if (index >= 0) {
            measurements.set(index, measurement);
        } else {
            measurements.add(measurement);
        }
    }
    
    void putAnnotation(Annotation annotation) {
        for (int i = 0; i < annotations.size(); i++) {
            if (annotations.get(i).getId().equals(annotation.getId())) {
                annotations.set(i, annotation);
                return;
            }
        }
        annotations.add(annotation);
    }
    
    void putCursor(CursorPosition cursor) {
        cursors.put(cursor.getParticipantId(), cursor);
    }
    
    void replaceContent(List<SharedMeasurement> newMeasurements, List<Annotation> newAnnotations) {
        measurements.clear();
        measurements.addAll(newMeasurements);
        annotations.clear();
        annotations.addAll(newAnnotations);
    }
    
    void touch(long nowMillis) {
        updatedAt = Math.max(Math.max(updatedAt, createdAt), nowMillis);
    }
    
    private int indexOfMeasurement(String measurementId) {
        for (int i = 0; i < measurements.size(); i++) {
            if (measurements.get(i).getId().equals(measurementId)) {
                return i;
            }
        }
        return -1;
    }
}
