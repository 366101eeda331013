package com.roomsnap.collab.session;

import com.roomsnap.collab.error.PermissionDeniedException;
import com.roomsnap.collab.model.Annotation;
import com.roomsnap.collab.model.CursorPosition;
import com.roomsnap.collab.model.MeasurementUpdate;
import com.roomsnap.collab.model.Participant;
import com.roomsnap.collab.model.Role;
import com.roomsnap.collab.model.SharedMeasurement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The authoritative in-memory copy of one active session.
 * <p>
 * Every mutation of a {@link Session} goes through this store, under its
 * monitor. A rejected mutation leaves the session untouched. Remote
 * measurements that are not newer than the local copy are parked in a
 * per-entity conflict queue for the {@link ConflictResolver}.
 */
public class SessionStateStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionStateStore.class);
    
    private final Clock clock;
    private final Map<String, List<SharedMeasurement>> conflictQueues = new LinkedHashMap<>();
    private Session session;
    
    public SessionStateStore(Clock clock) {
        this.clock = clock;
    }
    
    /**
     * Makes the given session the active one, replacing any previous state.
     * @param newSession The session to install; the store keeps its own copy.
     */
    public synchronized void install(Session newSession) {
        session = newSession.copy();
        conflictQueues.clear();
    }
    
    public synchronized void clear() {
        session = null;
        conflictQueues.clear();
    }
    
    public synchronized boolean isActive() {
        return session != null;
    }
    
    /**
     * Gets a detached copy of the active session.
     * @return The copy, or empty if no session is active.
     */
    public synchronized Optional<Session> snapshot() {
        return session == null ? Optional.empty() : Optional.of(session.copy());
    }
    
    public synchronized Optional<SharedMeasurement> measurement(String measurementId) {
        return session == null ? Optional.empty() : session.findMeasurement(measurementId);
    }
    
    public synchronized Optional<Participant> participant(String participantId) {
        return session == null ? Optional.empty() : session.findParticipant(participantId);
    }
    
    /**
     * Adds a participant, or refreshes one that is already known.
     * @param participant The participant.
     * @return The participant as stored.
     * @throws IllegalStateException if no session is active, or if the
     *         participant claims the host role while another host exists.
     */
    public synchronized Participant putParticipant(Participant participant) {
        Session active = requireSession();
        for (Participant existing : active.getParticipants()) {
            if (existing.getRole() == Role.HOST
                    && participant.getRole() == Role.HOST
                    && !existing.getId().equals(participant.getId())) {
                throw new IllegalStateException("Session " + active.getId()
                        + " already has host " + existing.getId());
            }
        }
        active.putParticipant(participant);
        active.touch(clock.millis());
        return participant;
    }
    
    /**
     * Marks a participant as gone. Participants are never removed.
     * @param participantId The participant.
     * @return The updated participant, or empty if unknown.
     */
    public synchronized Optional<Participant> markInactive(String participantId) {
        if (session == null) {
            return Optional.empty();
        }
        Optional<Participant> existing = session.findParticipant(participantId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        long now = clock.millis();
        Participant left = existing.get().withPresence(false, now);
        session.putParticipant(left);
        session.touch(now);
        return Optional.of(left);
    }
    
    /**
     * Applies a measurement received from another participant.
     * @param incoming The remote measurement.
     * @return What the store did with it.
     */
    public synchronized MeasurementApplyResult applyRemoteMeasurement(SharedMeasurement incoming) {
        if (session == null) {
            return MeasurementApplyResult.IGNORED;
        }
        Optional<SharedMeasurement> local = session.findMeasurement(incoming.getId());
        if (local.isEmpty()) {
            session.putMeasurement(incoming);
            session.touch(clock.millis());
            return MeasurementApplyResult.ADDED;
        }
        if (local.get().equals(incoming)) {
            return MeasurementApplyResult.DUPLICATE;
        }
        if (incoming.getVersion() <= local.get().getVersion()) {
            conflictQueues.computeIfAbsent(incoming.getId(), id -> new ArrayList<>()).add(incoming);
            LOGGER.debug("Queued conflicting version {} of {} (local version {})",
                    incoming.getVersion(), incoming.getId(), local.get().getVersion());
            return MeasurementApplyResult.CONFLICT_QUEUED;
        }
        session.putMeasurement(incoming);
        session.touch(clock.millis());
        return MeasurementApplyResult.APPLIED;
    }
    
    /**
     * Adds a measurement authored locally.
     * @param measurement The new measurement.
     * @throws IllegalStateException if no session is active.
     */
    public synchronized void addLocalMeasurement(SharedMeasurement measurement) {
        Session active = requireSession();
        active.putMeasurement(measurement);
        active.touch(clock.millis());
    }
    
    /**
     * Applies a local edit to an existing measurement, bumping its version.
     * @param measurementId The measurement.
     * @param update The fields to change.
     * @param callerRole The role of the local participant.
     * @return The measurement at its new version.
     * @throws PermissionDeniedException if the measurement is locked and the caller is not host.
     * @throws IllegalArgumentException if the measurement is unknown.
     */
    public synchronized SharedMeasurement updateLocalMeasurement(String measurementId, MeasurementUpdate update,
                                                                 Role callerRole) throws PermissionDeniedException {
        SharedMeasurement current = requireMeasurement(measurementId);
        if (current.isLocked() && callerRole != Role.HOST) {
            throw new PermissionDeniedException("Measurement " + measurementId + " is locked");
        }
        long now = clock.millis();
        SharedMeasurement updated = current.apply(update, now);
        session.putMeasurement(updated);
        session.touch(now);
        return updated;
    }
    
    /**
     * Sets or clears the host-only lock of a measurement.
     * @param measurementId The measurement.
     * @param locked The new lock state.
     * @param callerRole The role of the local participant.
     * @return The measurement at its new version.
     * @throws PermissionDeniedException if the caller is not host.
     */
    public synchronized SharedMeasurement setLocked(String measurementId, boolean locked, Role callerRole)
            throws PermissionDeniedException {
        SharedMeasurement current = requireMeasurement(measurementId);
        if (callerRole != Role.HOST) {
            throw new PermissionDeniedException("Only the host may lock or unlock measurements");
        }
        long now = clock.millis();
        SharedMeasurement updated = current.withLocked(locked, now);
        session.putMeasurement(updated);
        session.touch(now);
        return updated;
    }
    
    /**
     * Raises a measurement to the given version without changing its content.
     * Lower or equal versions are ignored.
     * @param measurementId The measurement.
     * @param newVersion The new version.
     * @return The measurement as stored, or empty if unknown.
     */
    public synchronized Optional<SharedMeasurement> bumpVersion(String measurementId, long newVersion) {
        if (session == null) {
            return Optional.empty();
        }
        Optional<SharedMeasurement> current = session.findMeasurement(measurementId);
        if (current.isEmpty() || current.get().getVersion() >= newVersion) {
            return current;
        }
        SharedMeasurement bumped = current.get().withVersion(newVersion);
        session.putMeasurement(bumped);
        session.touch(clock.millis());
        return Optional.of(bumped);
    }
    
    public synchronized List<String> conflictedMeasurementIds() {
        return new ArrayList<>(conflictQueues.keySet());
    }
    
    public synchronized List<SharedMeasurement> pendingConflicts(String measurementId) {
        List<SharedMeasurement> queued = conflictQueues.get(measurementId);
        return queued == null ? Collections.emptyList() : new ArrayList<>(queued);
    }
    
    /**
     * Removes and returns the conflict queue of a measurement.
     * @param measurementId The measurement.
     * @return The queued remote values, oldest first.
     */
    public synchronized List<SharedMeasurement> takeConflicts(String measurementId) {
        List<SharedMeasurement> queued = conflictQueues.remove(measurementId);
        return queued == null ? Collections.emptyList() : queued;
    }
    
    /**
     * Adds or replaces an annotation; annotations are not versioned.
     * @param annotation The annotation.
     * @return false if no session is active.
     */
    public synchronized boolean putAnnotation(Annotation annotation) {
        if (session == null) {
            return false;
        }
        session.putAnnotation(annotation);
        session.touch(clock.millis());
        return true;
    }
    
    /**
     * Overwrites the cursor of a participant.
     * @param cursor The cursor.
     * @return false if no session is active.
     */
    public synchronized boolean putCursor(CursorPosition cursor) {
        if (session == null) {
            return false;
        }
        session.putCursor(cursor);
        return true;
    }
    
    /**
     * Blindly overwrites measurements and annotations with a peer's full state.
     * @param measurements The peer's measurements.
     * @param annotations The peer's annotations.
     * @return false if no session is active.
     */
    public synchronized boolean replaceContent(List<SharedMeasurement> measurements, List<Annotation> annotations) {
        if (session == null) {
            return false;
        }
        session.replaceContent(
                measurements == null ? Collections.emptyList() : measurements,
                annotations == null ? Collections.emptyList() : annotations);
        session.touch(clock.millis());
        return true;
    }
    
    private Session requireSession() {
        if (session == null) {
            throw new IllegalStateException("No active session");
        }
        return session;
    }
    
    private SharedMeasurement requireMeasurement(String measurementId) {
        return requireSession().findMeasurement(measurementId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown measurement " + measurementId));
    }
}
