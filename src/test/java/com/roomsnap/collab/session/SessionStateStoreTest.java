package com.roomsnap.collab.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.roomsnap.collab.error.PermissionDeniedException;
import com.roomsnap.collab.model.Annotation;
import com.roomsnap.collab.model.AnnotationStyle;
import com.roomsnap.collab.model.AnnotationType;
import com.roomsnap.collab.model.MeasurementUpdate;
import com.roomsnap.collab.model.Participant;
import com.roomsnap.collab.model.Point3;
import com.roomsnap.collab.model.Role;
import com.roomsnap.collab.model.SessionSettings;
import com.roomsnap.collab.model.SharedMeasurement;
import com.roomsnap.collab.testing.MutableClock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionStateStoreTest {
    private static final long START = 1_700_000_000_000L;

    private MutableClock clock;
    private SessionStateStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new SessionStateStore(clock);
        store.install(new Session("session_1", "ABC123", "alice", START, SessionSettings.defaults()));
        store.putParticipant(participant("alice", Role.HOST));
    }

    @Test
    void installKeepsItsOwnCopy() {
        Session original = new Session("session_2", "XYZ789", "carol", START, SessionSettings.defaults());
        store.install(original);

        original.putParticipant(participant("carol", Role.HOST));

        assertTrue(store.snapshot().get().getParticipants().isEmpty());
    }

    @Test
    void rejectsASecondHostAndLeavesTheRosterAlone() {
        assertThrows(IllegalStateException.class, () -> store.putParticipant(participant("eve", Role.HOST)));

        Session session = store.snapshot().get();
        assertEquals(1, session.getParticipants().size());
        assertEquals(1, session.hostCount());
    }

    @Test
    void rejoiningParticipantIsReplacedNotDuplicated() {
        store.putParticipant(participant("bob", Role.EDITOR));
        store.markInactive("participant_bob");

        store.putParticipant(participant("bob", Role.EDITOR));

        Session session = store.snapshot().get();
        assertEquals(2, session.getParticipants().size());
        assertTrue(session.findParticipant("participant_bob").get().isActive());
    }

    @Test
    void markInactiveKeepsTheParticipant() {
        store.putParticipant(participant("bob", Role.EDITOR));

        Participant left = store.markInactive("participant_bob").get();

        assertFalse(left.isActive());
        assertEquals(2, store.snapshot().get().getParticipants().size());
        assertEquals(1, store.snapshot().get().activeParticipantCount());
    }

    @Test
    void remoteMeasurementOutcomes() {
        assertEquals(MeasurementApplyResult.ADDED, store.applyRemoteMeasurement(measurement(1, 2.0)));
        assertEquals(MeasurementApplyResult.APPLIED, store.applyRemoteMeasurement(measurement(2, 2.5)));
        assertEquals(MeasurementApplyResult.DUPLICATE, store.applyRemoteMeasurement(measurement(2, 2.5)));
        assertEquals(MeasurementApplyResult.CONFLICT_QUEUED, store.applyRemoteMeasurement(measurement(2, 9.0)));
        assertEquals(MeasurementApplyResult.CONFLICT_QUEUED, store.applyRemoteMeasurement(measurement(1, 1.0)));

        SharedMeasurement stored = store.measurement("m1").get();
        assertEquals(2, stored.getVersion());
        assertEquals(2.5, stored.getDistance());
        assertEquals(2, store.pendingConflicts("m1").size());
    }

    @Test
    void replayingTheSameUpdateIsANoOp() {
        store.applyRemoteMeasurement(measurement(1, 2.0));
        store.applyRemoteMeasurement(measurement(2, 2.5));
        Session before = store.snapshot().get();

        store.applyRemoteMeasurement(measurement(2, 2.5));

        assertEquals(before.getMeasurements(), store.snapshot().get().getMeasurements());
        assertTrue(store.conflictedMeasurementIds().isEmpty());
    }

    @Test
    void remoteMeasurementWithoutSessionIsIgnored() {
        store.clear();

        assertEquals(MeasurementApplyResult.IGNORED, store.applyRemoteMeasurement(measurement(1, 2.0)));
    }

    @Test
    void localUpdateBumpsTheVersion() throws PermissionDeniedException {
        store.addLocalMeasurement(measurement(1, 2.0));

        SharedMeasurement updated = store.updateLocalMeasurement("m1",
                MeasurementUpdate.builder().label("Window").build(), Role.EDITOR);

        assertEquals(2, updated.getVersion());
        assertEquals("Window", updated.getLabel());
        assertEquals(2.0, updated.getDistance());
    }

    @Test
    void lockedMeasurementRejectsNonHostEdits() throws PermissionDeniedException {
        store.addLocalMeasurement(measurement(1, 2.0));
        store.setLocked("m1", true, Role.HOST);

        assertThrows(PermissionDeniedException.class, () -> store.updateLocalMeasurement("m1",
                MeasurementUpdate.builder().distance(7.0).build(), Role.EDITOR));

        SharedMeasurement unchanged = store.measurement("m1").get();
        assertEquals(2, unchanged.getVersion());
        assertEquals(2.0, unchanged.getDistance());
        assertEquals(3, store.updateLocalMeasurement("m1",
                MeasurementUpdate.builder().distance(7.0).build(), Role.HOST).getVersion());
    }

    @Test
    void onlyTheHostMayLock() {
        store.addLocalMeasurement(measurement(1, 2.0));

        assertThrows(PermissionDeniedException.class, () -> store.setLocked("m1", true, Role.EDITOR));
        assertFalse(store.measurement("m1").get().isLocked());
    }

    @Test
    void unknownMeasurementUpdateIsAnArgumentError() {
        assertThrows(IllegalArgumentException.class, () -> store.updateLocalMeasurement("missing",
                MeasurementUpdate.builder().label("x").build(), Role.HOST));
    }

    @Test
    void syncReplacesMeasurementsAndAnnotations() {
        store.applyRemoteMeasurement(measurement(5, 2.0));
        Annotation note = new Annotation("a1", "participant_alice", AnnotationType.TEXT, new Point3(0, 1, 0),
                "Door", AnnotationStyle.defaultFor("#FF6B6B"), START);

        store.replaceContent(List.of(measurement(1, 4.0)), List.of(note));

        Session session = store.snapshot().get();
        assertEquals(1, session.getMeasurements().get(0).getVersion());
        assertEquals(List.of(note), session.getAnnotations());
    }

    @Test
    void mutationsAdvanceUpdatedAt() {
        clock.advance(5_000);

        store.applyRemoteMeasurement(measurement(1, 2.0));

        assertEquals(START + 5_000, store.snapshot().get().getUpdatedAt());
    }

    private static Participant participant(String userId, Role role) {
        return new Participant("participant_" + userId, userId, userId, role,
                ParticipantColors.forUser(userId), true, START, START);
    }

    private static SharedMeasurement measurement(long version, double distance) {
        return new SharedMeasurement("m1", "participant_alice",
                List.of(new Point3(0, 0, 0), new Point3(distance, 0, 0)), distance, "m", null, START, version, false);
    }
}
