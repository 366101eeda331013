package com.roomsnap.collab.session;

import com.roomsnap.collab.model.SharedMeasurement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Settles the conflict queues of the {@link SessionStateStore}.
 * <p>
 * For each measurement with queued stale updates the local value wins and is
 * raised to {@code max(local, queued...) + 1}, so that re-broadcasting it
 * overrides every copy peers may hold. Divergent edits are not merged: the
 * queued side's changes are dropped.
 */
public class ConflictResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConflictResolver.class);
    
    private final SessionStateStore store;
    
    public ConflictResolver(SessionStateStore store) {
        this.store = store;
    }
    
    /**
     * Computes the version that wins over a set of competing values.
     * @param localVersion The version held locally.
     * @param queued The competing remote values.
     * @return One more than the highest version seen.
     */
    public static long nextVersion(long localVersion, List<SharedMeasurement> queued) {
        long maxVersion = localVersion;
        for (SharedMeasurement remote : queued) {
            maxVersion = Math.max(maxVersion, remote.getVersion());
        }
        return maxVersion + 1;
    }
    
    /**
     * Resolves every pending conflict.
     * @return The local values at their new versions, to be re-broadcast.
     */
    public List<SharedMeasurement> resolvePending() {
        List<SharedMeasurement> resolved = new ArrayList<>();
        synchronized (store) {
            for (String measurementId : store.conflictedMeasurementIds()) {
                List<SharedMeasurement> queued = store.takeConflicts(measurementId);
                store.measurement(measurementId).ifPresent(local -> {
                    long newVersion = nextVersion(local.getVersion(), queued);
                    store.bumpVersion(measurementId, newVersion).ifPresent(resolved::add);
                    LOGGER.info("Resolved {} conflicting update(s) of {} at version {}",
                            queued.size(), measurementId, newVersion);
                });
            }
        }
        return resolved;
    }
}
