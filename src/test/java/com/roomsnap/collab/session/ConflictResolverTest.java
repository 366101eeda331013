package com.roomsnap.collab.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.roomsnap.collab.model.Point3;
import com.roomsnap.collab.model.SessionSettings;
import com.roomsnap.collab.model.SharedMeasurement;
import com.roomsnap.collab.testing.MutableClock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConflictResolverTest {
    private SessionStateStore store;
    private ConflictResolver resolver;

    @BeforeEach
    void setUp() {
        store = new SessionStateStore(new MutableClock(1000));
        store.install(new Session("session_1", "ABC123", "alice", 1000, SessionSettings.defaults()));
        resolver = new ConflictResolver(store);
    }

    @Test
    void staleRemoteLosesAndLocalIsRaisedPastIt() {
        store.applyRemoteMeasurement(measurement(3, 2.0));

        store.applyRemoteMeasurement(measurement(2, 8.0));
        assertEquals(3, store.measurement("m1").get().getVersion());

        List<SharedMeasurement> resolved = resolver.resolvePending();

        assertEquals(1, resolved.size());
        assertEquals(4, resolved.get(0).getVersion());
        assertEquals(2.0, resolved.get(0).getDistance());
        assertEquals(4, store.measurement("m1").get().getVersion());
        assertTrue(store.conflictedMeasurementIds().isEmpty());
    }

    @Test
    void equalVersionWithDifferentContentAlsoConflicts() {
        store.applyRemoteMeasurement(measurement(3, 2.0));
        store.applyRemoteMeasurement(measurement(3, 5.0));

        assertEquals(4, resolver.resolvePending().get(0).getVersion());
    }

    @Test
    void nextVersionIsOnePastTheHighest() {
        assertEquals(8, ConflictResolver.nextVersion(3, List.of(measurement(7, 1.0), measurement(2, 1.0))));
        assertEquals(4, ConflictResolver.nextVersion(3, List.of()));
    }

    @Test
    void nothingQueuedResolvesNothing() {
        store.applyRemoteMeasurement(measurement(1, 2.0));

        assertTrue(resolver.resolvePending().isEmpty());
        assertEquals(1, store.measurement("m1").get().getVersion());
    }

    private static SharedMeasurement measurement(long version, double distance) {
        return new SharedMeasurement("m1", "participant_alice",
                List.of(new Point3(0, 0, 0), new Point3(distance, 0, 0)), distance, "m", null, 1000, version, false);
    }
}
